/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *    https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package org.apache.bigtop.setup.common.utils;

import org.apache.bigtop.setup.common.exception.TransientApiException;

import org.apache.commons.lang3.Validate;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Bounded retry with a fixed delay between attempts.
 *
 * <p>The wrapped operation is invoked at most {@code attempts} times. A failure matching the
 * retry predicate (by default {@link TransientApiException}) is followed by a sleep of
 * {@code delay} and another attempt; the failure of the last attempt is rethrown unchanged.
 * Any other failure is rethrown immediately.
 *
 * <pre>{@code
 * RetryPolicy.of(20, Duration.ofSeconds(30)).run(() -> checkState(targets));
 * }</pre>
 */
@Slf4j
@Getter
public final class RetryPolicy {

    public static final int DEFAULT_ATTEMPTS = 3;

    public static final Duration DEFAULT_DELAY = Duration.ofSeconds(5);

    private final int attempts;

    private final Duration delay;

    private final Predicate<? super RuntimeException> retryOn;

    private final Sleeper sleeper;

    private RetryPolicy(int attempts, Duration delay, Predicate<? super RuntimeException> retryOn, Sleeper sleeper) {
        Validate.isTrue(attempts > 0, "attempts must be positive, got %d", attempts);
        Validate.notNull(delay, "delay must not be null");
        Validate.isTrue(!delay.isNegative(), "delay must not be negative");
        this.attempts = attempts;
        this.delay = delay;
        this.retryOn = Validate.notNull(retryOn, "retryOn must not be null");
        this.sleeper = Validate.notNull(sleeper, "sleeper must not be null");
    }

    public static RetryPolicy defaults() {
        return of(DEFAULT_ATTEMPTS, DEFAULT_DELAY);
    }

    public static RetryPolicy of(int attempts, Duration delay) {
        return new RetryPolicy(attempts, delay, TransientApiException.class::isInstance, Sleeper.THREAD);
    }

    /**
     * @return a copy of this policy retrying the failures accepted by {@code predicate}
     */
    public RetryPolicy retryOn(Predicate<? super RuntimeException> predicate) {
        return new RetryPolicy(attempts, delay, predicate, sleeper);
    }

    public RetryPolicy withSleeper(Sleeper sleeper) {
        return new RetryPolicy(attempts, delay, retryOn, sleeper);
    }

    public <T> T call(Supplier<T> operation) {
        int attempt = 1;
        while (true) {
            try {
                return operation.get();
            } catch (RuntimeException e) {
                if (!retryOn.test(e) || attempt >= attempts) {
                    throw e;
                }
                log.debug("Attempt {}/{} failed, retrying in {}s: {}", attempt, attempts, delay.toSeconds(), e.getMessage());
                pause(e);
                attempt++;
            }
        }
    }

    public void run(Runnable operation) {
        call(() -> {
            operation.run();
            return null;
        });
    }

    private void pause(RuntimeException lastFailure) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            lastFailure.addSuppressed(ie);
            throw lastFailure;
        }
    }

    @FunctionalInterface
    public interface Sleeper {

        Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

        Sleeper NONE = duration -> {};

        void sleep(Duration duration) throws InterruptedException;
    }
}
