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
package org.apache.bigtop.setup.server.parcel;

import org.apache.bigtop.setup.common.constants.Constants;
import org.apache.bigtop.setup.common.exception.TransientApiException;
import org.apache.bigtop.setup.common.utils.RetryPolicy;
import org.apache.bigtop.setup.server.enums.ParcelStage;
import org.apache.bigtop.setup.server.exception.ConfigurationException;
import org.apache.bigtop.setup.server.exception.ServerException;
import org.apache.bigtop.setup.stack.core.api.ClouderaManagerClient;
import org.apache.bigtop.setup.stack.core.api.model.ApiConfig;
import org.apache.bigtop.setup.stack.core.api.model.ApiParcel;
import org.apache.bigtop.setup.stack.core.api.model.ApiParcelState;

import org.apache.commons.lang3.StringUtils;

import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Moves one parcel of a cluster through download, distribution and activation.
 *
 * <p>Parcel stages only move forward, so each step accepts any stage at or past its own target.
 * This keeps a run that resumes after a partial earlier run from waiting on a stage the parcel
 * has already left.
 */
@Slf4j
public class ParcelLifecycle {

    private final ClouderaManagerClient client;

    private final String clusterName;

    private final String product;

    private final String version;

    private final String repo;

    private final RetryPolicy stateRetry;

    private final RetryPolicy repoRetry;

    ParcelLifecycle(
            ClouderaManagerClient client,
            String clusterName,
            String product,
            String version,
            String repo,
            RetryPolicy stateRetry,
            RetryPolicy repoRetry) {
        this.client = client;
        this.clusterName = clusterName;
        this.product = product;
        this.version = version;
        this.repo = repo;
        this.stateRetry = stateRetry;
        this.repoRetry = repoRetry;
    }

    /**
     * @return a lifecycle for a parcel known to be available to the cluster
     * @throws ConfigurationException when no configured repository hosts the parcel and no repo was given
     */
    public static ParcelLifecycle prepare(
            ClouderaManagerClient client,
            String clusterName,
            String version,
            String repo,
            RetryPolicy stateRetry,
            RetryPolicy repoRetry) {
        ParcelLifecycle lifecycle =
                new ParcelLifecycle(client, clusterName, Constants.CDH_PRODUCT, version, repo, stateRetry, repoRetry);
        lifecycle.validate();
        return lifecycle;
    }

    void validate() {
        Optional<ApiParcel> parcel = findParcel();
        if (parcel.isPresent()) {
            checkError(parcel.get());
            return;
        }
        if (StringUtils.isBlank(repo)) {
            throw new ConfigurationException("None of the existing repos contain the requested parcel version "
                    + version + ". Please specify a parcel repo.");
        }

        addRemoteRepo();
        ApiParcel resolved = repoRetry.call(() -> findParcel()
                .orElseThrow(() -> new TransientApiException("Waiting on parcel " + displayName() + " from " + repo)));
        checkError(resolved);
    }

    private void addRemoteRepo() {
        ApiConfig repoConfig = client.getManagerConfig().get(Constants.REMOTE_PARCEL_REPO_URLS);
        Set<String> urls = new LinkedHashSet<>();
        if (repoConfig != null && StringUtils.isNotBlank(repoConfig.effectiveValue())) {
            Arrays.stream(repoConfig.effectiveValue().split(","))
                    .map(String::trim)
                    .filter(StringUtils::isNotEmpty)
                    .forEach(urls::add);
        }
        if (!urls.add(repo)) {
            log.info("Parcel repo {} is already configured", repo);
            return;
        }
        log.info("Adding parcel repo {}", repo);
        client.updateManagerConfig(Map.of(Constants.REMOTE_PARCEL_REPO_URLS, String.join(",", urls)));
    }

    private Optional<ApiParcel> findParcel() {
        return client.findParcel(clusterName, product, version);
    }

    private void checkError(ApiParcel parcel) {
        ApiParcelState state = parcel.getState();
        if (state != null && state.hasErrors()) {
            throw new ServerException("Parcel " + displayName() + " reported errors: " + String.join(", ", state.getErrors()));
        }
    }

    /**
     * Poll until the parcel reaches one of {@code states}.
     *
     * @throws ServerException as soon as the parcel reports errors
     * @throws TransientApiException when the parcel did not get there within the retry bound
     */
    public void checkState(Set<ParcelStage> states) {
        ParcelStage target = states.iterator().next();
        stateRetry.run(() -> {
            ApiParcel parcel = findParcel()
                    .orElseThrow(() -> new TransientApiException("Parcel " + displayName() + " not found"));
            checkError(parcel);
            if (states.contains(ParcelStage.of(parcel.getStage()))) {
                return;
            }
            ApiParcelState state = parcel.getState() == null ? new ApiParcelState() : parcel.getState();
            log.info("Parcel {} progress: {} / {}", target, state.getProgress(), state.getTotalProgress());
            throw new TransientApiException("Waiting on parcel to get to state " + target);
        });
    }

    /**
     * Download the parcel to the Cloudera Manager server.
     */
    public void download() {
        log.info("Downloading parcel {}", displayName());
        client.startParcelDownload(clusterName, product, version);
        checkState(ParcelStage.DOWNLOAD_DONE);
    }

    /**
     * Distribute the parcel to all the hosts of the cluster.
     */
    public void distribute() {
        log.info("Distributing parcel {}", displayName());
        client.startParcelDistribution(clusterName, product, version);
        checkState(ParcelStage.DISTRIBUTION_DONE);
    }

    public void activate() {
        log.info("Activating parcel {}", displayName());
        client.activateParcel(clusterName, product, version);
        checkState(ParcelStage.ACTIVATION_DONE);
    }

    private String displayName() {
        return product + "-" + version;
    }
}
