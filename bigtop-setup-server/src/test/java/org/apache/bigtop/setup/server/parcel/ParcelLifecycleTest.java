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
import org.apache.bigtop.setup.stack.core.api.InMemoryClouderaManagerClient;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParcelLifecycleTest {

    private static final String VERSION = "5.16.2-1.cdh5.16.2.p0.8";

    private static final String REPO = "https://archive.cloudera.com/cdh5/parcels/5.16.2/";

    private final InMemoryClouderaManagerClient client = new InMemoryClouderaManagerClient();

    private final RetryPolicy retry = RetryPolicy.of(3, Duration.ofSeconds(30)).withSleeper(RetryPolicy.Sleeper.NONE);

    private ParcelLifecycle prepare(String repo) {
        return ParcelLifecycle.prepare(client, "cluster-1", VERSION, repo, retry, retry);
    }

    @Test
    void runsThroughDownloadDistributionAndActivation() {
        client.registerParcel(Constants.CDH_PRODUCT, VERSION, "AVAILABLE_REMOTELY");
        ParcelLifecycle lifecycle = prepare(null);

        lifecycle.download();
        lifecycle.distribute();
        lifecycle.activate();

        assertThat(client.parcel(Constants.CDH_PRODUCT, VERSION).getStage()).isEqualTo("ACTIVATED");
        assertThat(client.callsStartingWith("start")).containsExactly(
                "startParcelDownload:CDH-" + VERSION, "startParcelDistribution:CDH-" + VERSION);
    }

    @Test
    void stepsAcceptAParcelThatIsAlreadyFurtherAlong() {
        client.registerParcel(Constants.CDH_PRODUCT, VERSION, "ACTIVATED");
        ParcelLifecycle lifecycle = prepare(null);

        lifecycle.download();
        lifecycle.distribute();
        lifecycle.activate();

        assertThat(client.parcel(Constants.CDH_PRODUCT, VERSION).getStage()).isEqualTo("ACTIVATED");
    }

    @Test
    void downloadCheckAcceptsDistributedParcel() {
        client.registerParcel(Constants.CDH_PRODUCT, VERSION, "AVAILABLE_REMOTELY");
        ParcelLifecycle lifecycle = prepare(null);
        client.scriptParcelStages("DISTRIBUTED");

        lifecycle.download();

        assertThat(client.callsStartingWith("findParcel:")).hasSize(2);
    }

    @Test
    void pollsUntilTheTargetStageIsReached() {
        client.registerParcel(Constants.CDH_PRODUCT, VERSION, "AVAILABLE_REMOTELY");
        ParcelLifecycle lifecycle = prepare(null);
        client.getCalls().clear();
        client.scriptParcelStages("DOWNLOADING", "DOWNLOADING", "DOWNLOADED");

        lifecycle.checkState(ParcelStage.DOWNLOAD_DONE);

        assertThat(client.callsStartingWith("findParcel:")).hasSize(3);
    }

    @Test
    void neverReachingTheTargetStageExhaustsTheRetries() {
        client.registerParcel(Constants.CDH_PRODUCT, VERSION, "AVAILABLE_REMOTELY");
        ParcelLifecycle lifecycle = prepare(null);
        client.scriptParcelStages("DISTRIBUTING", "DISTRIBUTING", "DISTRIBUTING", "DISTRIBUTING");

        assertThatThrownBy(() -> lifecycle.checkState(ParcelStage.DISTRIBUTION_DONE))
                .isInstanceOf(TransientApiException.class)
                .hasMessageContaining("DISTRIBUTED");
    }

    @Test
    void parcelErrorsAreFatalWithoutRetry() {
        client.registerParcel(Constants.CDH_PRODUCT, VERSION, "DOWNLOADING");
        ParcelLifecycle lifecycle = prepare(null);
        client.parcel(Constants.CDH_PRODUCT, VERSION).getState().getErrors().add("Hash verification failed");
        client.getCalls().clear();

        assertThatThrownBy(() -> lifecycle.checkState(ParcelStage.DOWNLOAD_DONE))
                .isInstanceOf(ServerException.class)
                .hasMessageContaining("Hash verification failed");
        assertThat(client.callsStartingWith("findParcel:")).hasSize(1);
    }

    @Test
    void parcelWithErrorsFailsValidation() {
        client.registerParcel(Constants.CDH_PRODUCT, VERSION, "AVAILABLE_REMOTELY");
        client.parcel(Constants.CDH_PRODUCT, VERSION).getState().getErrors().add("Unsupported OS");

        assertThatThrownBy(() -> prepare(null)).isInstanceOf(ServerException.class);
    }

    @Test
    void missingParcelWithoutRepoIsNotDiscoverable() {
        assertThatThrownBy(() -> prepare(null))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Please specify a parcel repo");

        assertThat(client.callsStartingWith("updateManagerConfig")).isEmpty();
        assertThat(client.callsStartingWith("findParcel:")).hasSize(1);
    }

    @Test
    void missingParcelIsFetchedFromTheSuppliedRepo() {
        client.managerConfig(Constants.REMOTE_PARCEL_REPO_URLS, "https://archive.cloudera.com/cm5/", null)
                .hostParcelInRepo(Constants.CDH_PRODUCT, VERSION, REPO);

        prepare(REPO);

        assertThat(client.managerConfigValue(Constants.REMOTE_PARCEL_REPO_URLS).getValue())
                .isEqualTo("https://archive.cloudera.com/cm5/," + REPO);
        assertThat(client.parcel(Constants.CDH_PRODUCT, VERSION)).isNotNull();
    }

    @Test
    void suppliedRepoExtendsTheDefaultWhenNothingIsSet() {
        client.managerConfig(Constants.REMOTE_PARCEL_REPO_URLS, null, "https://archive.cloudera.com/cdh5/parcels/latest/")
                .hostParcelInRepo(Constants.CDH_PRODUCT, VERSION, REPO);

        prepare(REPO);

        assertThat(client.managerConfigValue(Constants.REMOTE_PARCEL_REPO_URLS).getValue())
                .isEqualTo("https://archive.cloudera.com/cdh5/parcels/latest/," + REPO);
    }

    @Test
    void repoAlreadyConfiguredIsNotAddedTwice() {
        client.managerConfig(Constants.REMOTE_PARCEL_REPO_URLS, "https://archive.cloudera.com/cm5/," + REPO, null);

        assertThatThrownBy(() -> prepare(REPO)).isInstanceOf(TransientApiException.class);

        assertThat(client.callsStartingWith("updateManagerConfig")).isEmpty();
        assertThat(client.callsStartingWith("findParcel:")).hasSize(4);
    }
}
