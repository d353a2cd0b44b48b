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
package org.apache.bigtop.setup.server.service.impl;

import org.apache.bigtop.setup.common.constants.Constants;
import org.apache.bigtop.setup.common.exception.TransientApiException;
import org.apache.bigtop.setup.common.utils.RetryPolicy;
import org.apache.bigtop.setup.server.config.SetupProperties;
import org.apache.bigtop.setup.server.enums.ServicePhase;
import org.apache.bigtop.setup.server.enums.SetupStage;
import org.apache.bigtop.setup.server.exception.ConfigurationException;
import org.apache.bigtop.setup.server.exception.ServerException;
import org.apache.bigtop.setup.server.exception.SetupException;
import org.apache.bigtop.setup.server.model.dto.ClusterDTO;
import org.apache.bigtop.setup.server.model.dto.ClusterTopology;
import org.apache.bigtop.setup.server.model.dto.ParcelDTO;
import org.apache.bigtop.setup.server.parcel.ParcelLifecycle;
import org.apache.bigtop.setup.stack.core.api.ClouderaManagerClient;
import org.apache.bigtop.setup.stack.core.api.model.ApiCommand;
import org.apache.bigtop.setup.stack.core.api.model.ApiHost;
import org.apache.bigtop.setup.stack.core.api.model.ApiService;
import org.apache.bigtop.setup.stack.core.model.RoleSpec;
import org.apache.bigtop.setup.stack.core.model.ServiceConfig;
import org.apache.bigtop.setup.stack.core.spi.ServiceContext;
import org.apache.bigtop.setup.stack.core.spi.ServiceDeployer;
import org.apache.bigtop.setup.stack.core.spi.ServiceDeployerRegistry;

import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.collections4.MapUtils;
import org.apache.commons.lang3.StringUtils;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Brings a cluster up from start to finish, assuming the hosts are prepared and Cloudera Manager
 * is installed with its databases.
 *
 * <p>Every step probes for what already exists before creating anything, so a failed run is
 * resumed by simply running {@link #setup()} again.
 */
@Slf4j
public class ClusterController {

    private final ClouderaManagerClient client;

    private final ClusterTopology topology;

    private final ServiceDeployerRegistry registry;

    private final SetupProperties properties;

    private final RetryPolicy.Sleeper sleeper;

    public ClusterController(
            ClouderaManagerClient client,
            ClusterTopology topology,
            ServiceDeployerRegistry registry,
            SetupProperties properties,
            RetryPolicy.Sleeper sleeper) {
        this.client = client;
        this.topology = topology;
        this.registry = registry;
        this.properties = properties;
        this.sleeper = sleeper;
    }

    /**
     * @throws SetupException tagged with the stage that failed
     */
    public void setup() {
        runStage(SetupStage.CREATE_CLUSTER, this::createCluster);
        runStage(SetupStage.PARCELS, this::setupParcels);
        runStage(SetupStage.INSPECT_HOSTS, () -> waitInspectHosts(client.inspectHosts()));
        runStage(SetupStage.MGMT_SERVICES, this::deployMgmtServices);
        runStage(SetupStage.BASE_SERVICES, () -> serviceOrchestrate(ServicePhase.BASE));
        runStage(SetupStage.ADDITIONAL_SERVICES, () -> serviceOrchestrate(ServicePhase.ADDITIONAL));
        runStage(SetupStage.CLIENT_CONFIG, this::deployClientConfig);
        log.info("Cluster {} is set up", clusterName());
    }

    private void runStage(SetupStage stage, Runnable step) {
        log.info("{}...", stage.getDescription());
        try {
            step.run();
        } catch (SetupException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SetupException(stage, e);
        }
    }

    private String clusterName() {
        return topology.getCluster().getName();
    }

    /**
     * Create the cluster unless one with the same name exists, then add the hosts that are not
     * members yet.
     */
    public void createCluster() {
        ClusterDTO cluster = topology.getCluster();
        if (client.findCluster(cluster.getName()).isEmpty()) {
            log.info("Creating Cluster entity: {}", cluster.getName());
            client.createCluster(cluster.getName(), cluster.getVersion(), cluster.getFullVersion());
        }

        Set<String> enrolled = client.listClusterHosts(cluster.getName()).stream()
                .map(ApiHost::getHostname)
                .collect(Collectors.toSet());
        List<String> missing = cluster.getHosts().stream()
                .filter(host -> !enrolled.contains(host))
                .distinct()
                .toList();
        if (missing.isEmpty()) {
            log.info("All {} hosts already belong to cluster {}", cluster.getHosts().size(), cluster.getName());
            return;
        }
        log.info("Adding hosts {} to cluster {}", missing, cluster.getName());
        client.addHosts(cluster.getName(), missing);
    }

    private void setupParcels() {
        ParcelDTO parcel = topology.getParcel();
        ParcelLifecycle lifecycle = ParcelLifecycle.prepare(
                client,
                clusterName(),
                parcel.getVersion(),
                parcel.getRepo(),
                properties.getParcelRetry().toPolicy(sleeper),
                properties.getParcelRepoRetry().toPolicy(sleeper));
        lifecycle.download();
        lifecycle.distribute();
        lifecycle.activate();
    }

    /**
     * Wait until the host inspection behind {@code command} completes on all hosts.
     */
    public void waitInspectHosts(ApiCommand command) {
        properties.getHostInspectionRetry().toPolicy(sleeper).run(() -> {
            log.info("Inspecting hosts...");
            ApiCommand current = client.fetchCommand(command.getId());
            if (current.getSuccess() == null) {
                throw new TransientApiException("Waiting on command " + command.getId() + " to finish");
            }
            if (!current.getSuccess()) {
                throw new ServerException("Host inspection failed: " + current.getResultMessage());
            }
            log.info("Host inspection completed: {}", current.getResultMessage());
        });
    }

    /**
     * Configure, deploy and start the Cloudera Management Services.
     *
     * <p>Roles are not spread over hosts here: each role group gets a single role on its first host.
     */
    public void deployMgmtServices() {
        log.info("[MGMT] Deploying Management Services");
        Optional<ApiService> existing = client.findMgmtService();
        if (existing.map(ApiService::isStarted).orElse(false)) {
            log.info("[MGMT] Management Services already started");
            return;
        }

        List<RoleSpec> roles = mgmtRoles();
        if (existing.isEmpty()) {
            log.warn("[MGMT] Management Services don't exist. Creating...");
            client.createMgmtService();
        }

        for (RoleSpec role : roles) {
            if (client.listMgmtRoles(role.getGroup()).isEmpty()) {
                log.info("[MGMT] Creating role for {}", role.getGroup());
                client.createMgmtRole(role.getGroup() + "-1", role.getGroup(), role.getHosts().get(0));
            }
        }
        for (RoleSpec role : roles) {
            String groupName = "mgmt-" + role.getGroup() + "-" + Constants.ROLE_CONFIG_GROUP_SUFFIX;
            client.updateMgmtRoleConfigGroup(groupName, MapUtils.emptyIfNull(role.getConfig()));
        }

        ApiCommand start = client.waitCommand(client.startMgmtService(), properties.getClusterCommandTimeout());
        if (!client.findMgmtService().map(ApiService::isStarted).orElse(false)) {
            throw new ServerException("[MGMT] Cloudera Management services didn't start up properly: "
                    + start.getResultMessage());
        }
        log.info("[MGMT] Management Services started");
    }

    private List<RoleSpec> mgmtRoles() {
        ServiceConfig mgmt = topology.getServices().get(Constants.MGMT_SERVICE_KEY);
        if (mgmt == null || CollectionUtils.isEmpty(mgmt.getRoles())) {
            throw new ConfigurationException("[MGMT] At least one role should be specified for the management services");
        }
        for (RoleSpec role : mgmt.getRoles()) {
            if (role == null || StringUtils.isBlank(role.getGroup()) || CollectionUtils.isEmpty(role.getHosts())) {
                throw new ConfigurationException("[MGMT] group and hosts should be specified per role");
            }
        }
        return mgmt.getRoles();
    }

    /**
     * Deploy the configured services of {@code phase}, (re)start the cluster, then run the post
     * start actions of those services in deployment order.
     */
    public void serviceOrchestrate(ServicePhase phase) {
        ServiceContext context = new ServiceContext(client, clusterName());
        List<ServiceDeployer> deployers = new ArrayList<>();
        for (String kind : phase.getServices()) {
            ServiceConfig serviceConfig = topology.getServices().get(kind);
            if (!isConfigured(serviceConfig)) {
                log.debug("[{}] Not configured, skipping", kind);
                continue;
            }
            ServiceDeployer deployer = registry.create(kind, context, serviceConfig);
            deployer.deploy();
            deployer.preStart();
            deployers.add(deployer);
        }

        log.info("Starting services: {} on Cluster", phase.getServices());
        if (phase.isStopFirst()) {
            waitClusterCommand("stop", client.stopCluster(clusterName()));
        }
        waitClusterCommand("start", client.startCluster(clusterName()));

        for (ServiceDeployer deployer : deployers) {
            deployer.postStart();
        }
    }

    private static boolean isConfigured(ServiceConfig serviceConfig) {
        return serviceConfig != null
                && (MapUtils.isNotEmpty(serviceConfig.getConfig()) || CollectionUtils.isNotEmpty(serviceConfig.getRoles()));
    }

    /**
     * Push the client configurations of every service to all hosts.
     */
    public void deployClientConfig() {
        waitClusterCommand("client config deployment", client.deployClientConfig(clusterName()));
    }

    private void waitClusterCommand(String action, ApiCommand command) {
        ApiCommand result = client.waitCommand(command, properties.getClusterCommandTimeout());
        if (!result.isSucceeded()) {
            log.warn("Cluster {} {} did not succeed: {}", clusterName(), action, result.getResultMessage());
        }
    }
}
