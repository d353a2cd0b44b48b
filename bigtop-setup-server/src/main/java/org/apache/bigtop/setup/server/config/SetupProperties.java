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
package org.apache.bigtop.setup.server.config;

import org.apache.bigtop.setup.common.utils.RetryPolicy;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "bigtop.setup")
public class SetupProperties {

    /**
     * Path of the cluster topology document, overridden by {@code --template=<path>}.
     */
    private String template = "/opt/cluster.yaml";

    /**
     * Where the JSON setup report is written. Only logged when unset.
     */
    private String reportFile;

    private String apiVersion = "v13";

    private int defaultPort = 7180;

    private Duration connectTimeout = Duration.ofSeconds(30);

    private Duration readTimeout = Duration.ofMinutes(5);

    private Duration commandPollInterval = Duration.ofSeconds(2);

    /**
     * Wait bound of cluster wide commands: start, stop, management start, client config deployment.
     */
    private Duration clusterCommandTimeout = Duration.ofMinutes(30);

    private Retry parcelRetry = new Retry(20, Duration.ofSeconds(30));

    private Retry parcelRepoRetry = new Retry(20, Duration.ofSeconds(30));

    private Retry hostInspectionRetry = new Retry(20, Duration.ofSeconds(5));

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Retry {

        private int attempts;

        private Duration delay;

        public RetryPolicy toPolicy(RetryPolicy.Sleeper sleeper) {
            return RetryPolicy.of(attempts, delay).withSleeper(sleeper);
        }
    }
}
