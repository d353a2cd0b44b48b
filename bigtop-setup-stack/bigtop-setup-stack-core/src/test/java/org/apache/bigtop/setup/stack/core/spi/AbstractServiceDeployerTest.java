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
package org.apache.bigtop.setup.stack.core.spi;

import org.apache.bigtop.setup.stack.core.api.InMemoryClouderaManagerClient;
import org.apache.bigtop.setup.stack.core.api.model.ApiCommand;
import org.apache.bigtop.setup.stack.core.exception.StackException;
import org.apache.bigtop.setup.stack.core.model.RoleSpec;
import org.apache.bigtop.setup.stack.core.model.ServiceConfig;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AbstractServiceDeployerTest {

    private InMemoryClouderaManagerClient client;

    private ServiceContext context;

    @BeforeEach
    void setUp() {
        client = new InMemoryClouderaManagerClient().registerHosts("host-a", "host-b", "host-c");
        context = new ServiceContext(client, "cluster-1");
    }

    @Test
    void roleNamesFollowHostOrderWithinTheGroup() {
        ServiceConfig config = serviceConfig(role("G", List.of("host-a", "host-b", "host-c")));

        new KindDeployer(context, config).deploy();

        assertThat(client.callsStartingWith("createRole:"))
                .containsExactly("createRole:K-G-1@host-a", "createRole:K-G-2@host-b", "createRole:K-G-3@host-c");
    }

    @Test
    void deployCreatesServiceAndPushesServiceAndGroupConfig() {
        RoleSpec worker = role("WORKER", List.of("host-a"));
        worker.setConfig(Map.of("heap", "1g"));
        ServiceConfig config = serviceConfig(worker);
        config.setConfig(Map.of("replication", 3));

        new KindDeployer(context, config).deploy();

        assertThat(client.getServices()).containsKey("K");
        assertThat(client.getServiceConfigs().get("K")).containsEntry("replication", 3);
        assertThat(client.getRoleConfigGroups().get("K-WORKER-BASE")).containsEntry("heap", "1g");
    }

    @Test
    void redeployReusesServiceAndRoles() {
        ServiceConfig config = serviceConfig(role("G", List.of("host-a", "host-b")));
        new KindDeployer(context, config).deploy();
        client.getCalls().clear();

        new KindDeployer(context, config).deploy();

        assertThat(client.callsStartingWith("createService:")).isEmpty();
        assertThat(client.callsStartingWith("createRole:")).isEmpty();
        assertThat(client.callsStartingWith("findRole:")).containsExactly("findRole:K-G-1", "findRole:K-G-2");
        assertThat(client.getRoles()).hasSize(2);
    }

    @Test
    void startedServiceIsLeftUntouched() {
        client.existingService("K", "STARTED");

        new KindDeployer(context, serviceConfig(role("G", List.of("host-a")))).deploy();

        assertThat(client.getCalls()).containsExactly("findService:K");
    }

    @Test
    void emptyRoleListIsRejectedWithoutRoleCalls() {
        ServiceConfig config = new ServiceConfig();

        assertThatThrownBy(() -> new KindDeployer(context, config).deploy())
                .isInstanceOf(StackException.class)
                .hasMessageContaining("At least one role");

        assertThat(client.getCalls()).noneMatch(call -> call.startsWith("updateRoleConfigGroup:")
                || call.startsWith("findRole:")
                || call.startsWith("createRole:"));
    }

    @Test
    void roleWithoutHostsIsRejected() {
        ServiceConfig config = serviceConfig(role("OK", List.of("host-a")), role("EMPTY", List.of()));

        assertThatThrownBy(() -> new KindDeployer(context, config).deploy())
                .isInstanceOf(StackException.class)
                .hasMessageContaining("group and hosts");

        assertThat(client.getRoles()).isEmpty();
        assertThat(client.getRoleConfigGroups()).isEmpty();
    }

    @Test
    void roleWithoutGroupIsRejected() {
        ServiceConfig config = serviceConfig(role(null, List.of("host-a")));

        assertThatThrownBy(() -> new KindDeployer(context, config).deploy()).isInstanceOf(StackException.class);
    }

    @Test
    void failedBootstrapCommandIsReportedAndDoesNotThrow() {
        client.failCommand("kindInit", "already initialized");
        KindDeployer deployer = new KindDeployer(context, serviceConfig(role("G", List.of("host-a"))));

        deployer.preStart();

        assertThat(deployer.outcomes).containsExactly(false);
        assertThat(client.getCalls()).contains("serviceCommand:K:kindInit", "waitCommand:kindInit");
    }

    @Test
    void roleCommandsAreWaitedOnIndividually() {
        KindDeployer deployer = new KindDeployer(context, serviceConfig(role("G", List.of("host-a"))));

        List<ApiCommand> results = deployer.runRoleCommand("restart", List.of("K-G-1", "K-G-2"), Duration.ofSeconds(1));

        assertThat(results).hasSize(2).allMatch(ApiCommand::isSucceeded);
        assertThat(client.callsStartingWith("waitCommand:")).hasSize(2);
    }

    private static ServiceConfig serviceConfig(RoleSpec... roles) {
        ServiceConfig config = new ServiceConfig();
        config.setRoles(new ArrayList<>(List.of(roles)));
        return config;
    }

    private static RoleSpec role(String group, List<String> hosts) {
        RoleSpec role = new RoleSpec();
        role.setGroup(group);
        role.setHosts(hosts);
        return role;
    }

    private static class KindDeployer extends AbstractServiceDeployer {

        private final List<Boolean> outcomes = new ArrayList<>();

        KindDeployer(ServiceContext context, ServiceConfig config) {
            super(context, config);
        }

        @Override
        public String getName() {
            return "K";
        }

        @Override
        public void preStart() {
            outcomes.add(runServiceCommand("kindInit", SETUP_COMMAND_TIMEOUT));
        }
    }
}
