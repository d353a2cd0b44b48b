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
package org.apache.bigtop.setup.stack.core.api;

import org.apache.bigtop.setup.common.constants.Constants;
import org.apache.bigtop.setup.common.exception.ApiException;
import org.apache.bigtop.setup.stack.core.api.model.ApiCluster;
import org.apache.bigtop.setup.stack.core.api.model.ApiCommand;
import org.apache.bigtop.setup.stack.core.api.model.ApiConfig;
import org.apache.bigtop.setup.stack.core.api.model.ApiHost;
import org.apache.bigtop.setup.stack.core.api.model.ApiHostRef;
import org.apache.bigtop.setup.stack.core.api.model.ApiParcel;
import org.apache.bigtop.setup.stack.core.api.model.ApiRole;
import org.apache.bigtop.setup.stack.core.api.model.ApiService;

import lombok.Getter;
import lombok.Setter;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Stateful stand-in for Cloudera Manager. Every call is appended to {@link #getCalls()} as
 * {@code operation:argument}, e.g. {@code createRole:HDFS-DATANODE-1@host-1}.
 */
public class InMemoryClouderaManagerClient implements ClouderaManagerClient {

    public static final List<String> PARCEL_STAGES = List.of(
            "AVAILABLE_REMOTELY", "DOWNLOADING", "DOWNLOADED", "DISTRIBUTING", "DISTRIBUTED", "ACTIVATING", "ACTIVATED",
            "INUSE");

    @Getter
    private final List<String> calls = new ArrayList<>();

    private final AtomicLong commandIds = new AtomicLong();

    private final Map<Long, ApiCommand> commands = new HashMap<>();

    private final Map<String, String> failingCommands = new HashMap<>();

    private final Map<String, ApiCluster> clusters = new LinkedHashMap<>();

    private final Map<String, String> managerHosts = new LinkedHashMap<>();

    private final Map<String, Set<String>> clusterHosts = new HashMap<>();

    private final Map<String, ApiParcel> parcels = new HashMap<>();

    private final Map<String, String> reposHostingParcel = new HashMap<>();

    private final Deque<String> scriptedParcelStages = new ArrayDeque<>();

    private final Map<String, ApiConfig> managerConfig = new LinkedHashMap<>();

    private final Deque<Boolean> inspectionOutcomes = new LinkedList<>();

    @Getter
    private ApiService mgmtService;

    @Getter
    private final Map<String, ApiRole> mgmtRoles = new LinkedHashMap<>();

    @Getter
    private final Map<String, Map<String, Object>> mgmtRoleConfigGroups = new LinkedHashMap<>();

    @Setter
    private boolean mgmtStartFails;

    @Getter
    private final Map<String, ApiService> services = new LinkedHashMap<>();

    @Getter
    private final Map<String, Map<String, Object>> serviceConfigs = new LinkedHashMap<>();

    @Getter
    private final Map<String, Map<String, Object>> roleConfigGroups = new LinkedHashMap<>();

    @Getter
    private final Map<String, ApiRole> roles = new LinkedHashMap<>();

    @Getter
    private final Map<String, Map<String, Object>> roleConfigs = new LinkedHashMap<>();

    // Setup helpers

    public InMemoryClouderaManagerClient registerHosts(String... hostnames) {
        for (String hostname : hostnames) {
            managerHosts.put(hostname, "id-" + hostname);
        }
        return this;
    }

    public InMemoryClouderaManagerClient registerParcel(String product, String version, String stage) {
        ApiParcel parcel = new ApiParcel();
        parcel.setProduct(product);
        parcel.setVersion(version);
        parcel.setStage(stage);
        parcels.put(parcelKey(product, version), parcel);
        return this;
    }

    /**
     * The parcel becomes visible once {@code repoUrl} is part of the remote parcel repositories.
     */
    public InMemoryClouderaManagerClient hostParcelInRepo(String product, String version, String repoUrl) {
        reposHostingParcel.put(parcelKey(product, version), repoUrl);
        return this;
    }

    /**
     * Stages reported by the next parcel lookups, one per lookup, before regular state applies.
     */
    public InMemoryClouderaManagerClient scriptParcelStages(String... stages) {
        scriptedParcelStages.addAll(Arrays.asList(stages));
        return this;
    }

    public ApiParcel parcel(String product, String version) {
        return parcels.get(parcelKey(product, version));
    }

    public InMemoryClouderaManagerClient managerConfig(String name, String value, String defaultValue) {
        managerConfig.put(name, new ApiConfig(name, value, defaultValue));
        return this;
    }

    public ApiConfig managerConfigValue(String name) {
        return managerConfig.get(name);
    }

    /**
     * Outcomes reported by successive fetches of the host inspection command; {@code null} is pending.
     */
    public InMemoryClouderaManagerClient inspectionOutcomes(Boolean... outcomes) {
        inspectionOutcomes.addAll(Arrays.asList(outcomes));
        return this;
    }

    public InMemoryClouderaManagerClient failCommand(String commandName, String message) {
        failingCommands.put(commandName, message);
        return this;
    }

    public InMemoryClouderaManagerClient existingService(String name, String state) {
        services.put(name, new ApiService(name, name, state));
        return this;
    }

    public Set<String> clusterHostnames(String clusterName) {
        return clusterHosts.getOrDefault(clusterName, Set.of());
    }

    public int clusterCount() {
        return clusters.size();
    }

    public List<String> callsStartingWith(String prefix) {
        return calls.stream().filter(call -> call.startsWith(prefix)).toList();
    }

    // Clusters and hosts

    @Override
    public Optional<ApiCluster> findCluster(String clusterName) {
        calls.add("findCluster:" + clusterName);
        return Optional.ofNullable(clusters.get(clusterName));
    }

    @Override
    public ApiCluster createCluster(String clusterName, String version, String fullVersion) {
        calls.add("createCluster:" + clusterName);
        if (clusters.containsKey(clusterName)) {
            throw new ApiException(400, "Cluster " + clusterName + " already exists");
        }
        ApiCluster cluster = new ApiCluster(clusterName, version, fullVersion);
        clusters.put(clusterName, cluster);
        clusterHosts.put(clusterName, new LinkedHashSet<>());
        return cluster;
    }

    @Override
    public List<ApiHost> listClusterHosts(String clusterName) {
        calls.add("listClusterHosts:" + clusterName);
        return clusterHostnames(clusterName).stream()
                .map(hostname -> new ApiHost(managerHosts.get(hostname), hostname))
                .toList();
    }

    @Override
    public void addHosts(String clusterName, List<String> hostnames) {
        calls.add("addHosts:" + String.join(",", hostnames));
        Set<String> enrolled = clusterHosts.get(clusterName);
        for (String hostname : hostnames) {
            if (!managerHosts.containsKey(hostname)) {
                throw new ApiException(404, "Host " + hostname + " is not managed");
            }
            if (!enrolled.add(hostname)) {
                throw new ApiException(400, "Host " + hostname + " already belongs to " + clusterName);
            }
        }
    }

    @Override
    public ApiCommand startCluster(String clusterName) {
        calls.add("startCluster:" + clusterName);
        services.values().forEach(service -> service.setServiceState(Constants.SERVICE_STATE_STARTED));
        return newCommand("Start");
    }

    @Override
    public ApiCommand stopCluster(String clusterName) {
        calls.add("stopCluster:" + clusterName);
        services.values().forEach(service -> service.setServiceState("STOPPED"));
        return newCommand("Stop");
    }

    @Override
    public ApiCommand deployClientConfig(String clusterName) {
        calls.add("deployClientConfig:" + clusterName);
        return newCommand("DeployClusterClientConfig");
    }

    // Parcels

    @Override
    public Optional<ApiParcel> findParcel(String clusterName, String product, String version) {
        calls.add("findParcel:" + product + "-" + version);
        String key = parcelKey(product, version);
        String repoUrl = reposHostingParcel.get(key);
        if (!parcels.containsKey(key) && repoUrl != null && repoConfigured(repoUrl)) {
            registerParcel(product, version, "AVAILABLE_REMOTELY");
        }
        ApiParcel parcel = parcels.get(key);
        if (parcel != null && !scriptedParcelStages.isEmpty()) {
            parcel.setStage(scriptedParcelStages.poll());
        }
        return Optional.ofNullable(parcel);
    }

    @Override
    public ApiCommand startParcelDownload(String clusterName, String product, String version) {
        calls.add("startParcelDownload:" + product + "-" + version);
        advanceParcel(product, version, "DOWNLOADED");
        return newCommand("StartDownload");
    }

    @Override
    public ApiCommand startParcelDistribution(String clusterName, String product, String version) {
        calls.add("startParcelDistribution:" + product + "-" + version);
        advanceParcel(product, version, "DISTRIBUTED");
        return newCommand("StartDistribution");
    }

    @Override
    public ApiCommand activateParcel(String clusterName, String product, String version) {
        calls.add("activateParcel:" + product + "-" + version);
        advanceParcel(product, version, "ACTIVATED");
        return newCommand("Activate");
    }

    private void advanceParcel(String product, String version, String target) {
        ApiParcel parcel = parcels.get(parcelKey(product, version));
        if (parcel == null) {
            throw new ApiException(404, "Parcel " + product + "-" + version + " not found");
        }
        if (PARCEL_STAGES.indexOf(parcel.getStage()) < PARCEL_STAGES.indexOf(target)) {
            parcel.setStage(target);
        }
    }

    private boolean repoConfigured(String repoUrl) {
        ApiConfig repos = managerConfig.get(Constants.REMOTE_PARCEL_REPO_URLS);
        return repos != null
                && repos.effectiveValue() != null
                && Arrays.asList(repos.effectiveValue().split(",")).contains(repoUrl);
    }

    private static String parcelKey(String product, String version) {
        return product + "-" + version;
    }

    // Cloudera Manager itself

    @Override
    public Map<String, ApiConfig> getManagerConfig() {
        calls.add("getManagerConfig");
        return new LinkedHashMap<>(managerConfig);
    }

    @Override
    public void updateManagerConfig(Map<String, String> values) {
        calls.add("updateManagerConfig:" + String.join(",", values.keySet()));
        values.forEach((name, value) -> {
            ApiConfig current = managerConfig.get(name);
            managerConfig.put(name, new ApiConfig(name, value, current == null ? null : current.getDefaultValue()));
        });
    }

    @Override
    public ApiCommand inspectHosts() {
        calls.add("inspectHosts");
        ApiCommand command = newCommand("InspectHosts");
        ApiCommand stored = commands.get(command.getId());
        stored.setActive(true);
        stored.setSuccess(null);
        stored.setResultMessage(null);
        return copy(stored);
    }

    // Management services

    @Override
    public Optional<ApiService> findMgmtService() {
        calls.add("findMgmtService");
        return Optional.ofNullable(mgmtService);
    }

    @Override
    public ApiService createMgmtService() {
        calls.add("createMgmtService");
        mgmtService = new ApiService("mgmt", "MGMT", "STOPPED");
        return mgmtService;
    }

    @Override
    public List<ApiRole> listMgmtRoles(String roleType) {
        calls.add("listMgmtRoles:" + roleType);
        return mgmtRoles.values().stream().filter(role -> roleType.equals(role.getType())).toList();
    }

    @Override
    public ApiRole createMgmtRole(String roleName, String roleType, String hostname) {
        calls.add("createMgmtRole:" + roleName + "@" + hostname);
        ApiRole role = new ApiRole(roleName, roleType, new ApiHostRef(managerHosts.get(hostname), hostname));
        mgmtRoles.put(roleName, role);
        return role;
    }

    @Override
    public void updateMgmtRoleConfigGroup(String groupName, Map<String, Object> config) {
        calls.add("updateMgmtRoleConfigGroup:" + groupName);
        mgmtRoleConfigGroups.computeIfAbsent(groupName, k -> new LinkedHashMap<>()).putAll(config);
    }

    @Override
    public ApiCommand startMgmtService() {
        calls.add("startMgmtService");
        if (!mgmtStartFails) {
            mgmtService.setServiceState(Constants.SERVICE_STATE_STARTED);
        }
        return newCommand("Start");
    }

    // Cluster services

    @Override
    public Optional<ApiService> findService(String clusterName, String serviceName) {
        calls.add("findService:" + serviceName);
        return Optional.ofNullable(services.get(serviceName));
    }

    @Override
    public ApiService createService(String clusterName, String serviceName, String serviceType) {
        calls.add("createService:" + serviceName);
        if (services.containsKey(serviceName)) {
            throw new ApiException(400, "Service " + serviceName + " already exists");
        }
        ApiService service = new ApiService(serviceName, serviceType, "STOPPED");
        services.put(serviceName, service);
        return service;
    }

    @Override
    public void updateServiceConfig(String clusterName, String serviceName, Map<String, Object> config) {
        calls.add("updateServiceConfig:" + serviceName);
        serviceConfigs.computeIfAbsent(serviceName, k -> new LinkedHashMap<>()).putAll(config);
    }

    @Override
    public void updateRoleConfigGroup(
            String clusterName, String serviceName, String groupName, Map<String, Object> config) {
        calls.add("updateRoleConfigGroup:" + groupName);
        roleConfigGroups.computeIfAbsent(groupName, k -> new LinkedHashMap<>()).putAll(config);
    }

    @Override
    public Optional<ApiRole> findRole(String clusterName, String serviceName, String roleName) {
        calls.add("findRole:" + roleName);
        return Optional.ofNullable(roles.get(roleName));
    }

    @Override
    public ApiRole createRole(String clusterName, String serviceName, String roleName, String roleType, String hostname) {
        calls.add("createRole:" + roleName + "@" + hostname);
        if (roles.containsKey(roleName)) {
            throw new ApiException(400, "Role " + roleName + " already exists");
        }
        ApiRole role = new ApiRole(roleName, roleType, new ApiHostRef(managerHosts.get(hostname), hostname));
        roles.put(roleName, role);
        return role;
    }

    @Override
    public void updateRoleConfig(String clusterName, String serviceName, String roleName, Map<String, Object> config) {
        calls.add("updateRoleConfig:" + roleName);
        roleConfigs.computeIfAbsent(roleName, k -> new LinkedHashMap<>()).putAll(config);
    }

    @Override
    public ApiCommand serviceCommand(String clusterName, String serviceName, String commandName) {
        calls.add("serviceCommand:" + serviceName + ":" + commandName);
        return newCommand(commandName);
    }

    @Override
    public List<ApiCommand> roleCommand(String clusterName, String serviceName, String commandName, List<String> roleNames) {
        calls.add("roleCommand:" + serviceName + ":" + commandName + ":" + String.join(",", roleNames));
        return roleNames.stream().map(roleName -> newCommand(commandName)).toList();
    }

    // Commands

    @Override
    public ApiCommand fetchCommand(long commandId) {
        calls.add("fetchCommand:" + commandId);
        ApiCommand command = commands.get(commandId);
        if (command == null) {
            throw new ApiException(404, "Command " + commandId + " not found");
        }
        if ("InspectHosts".equals(command.getName()) && command.isActive()) {
            Boolean outcome = inspectionOutcomes.isEmpty() ? Boolean.TRUE : inspectionOutcomes.poll();
            command.setSuccess(outcome);
            command.setActive(outcome == null);
            command.setResultMessage(outcome == null ? null : (outcome ? "Inspection passed" : "Inspection failed"));
        }
        return copy(command);
    }

    @Override
    public ApiCommand waitCommand(ApiCommand command, Duration timeout) {
        calls.add("waitCommand:" + command.getName());
        return copy(commands.get(command.getId()));
    }

    private ApiCommand newCommand(String name) {
        long id = commandIds.incrementAndGet();
        String failure = failingCommands.get(name);
        ApiCommand command = new ApiCommand(id, name, false, failure == null, failure == null ? "OK" : failure);
        commands.put(id, command);
        return copy(command);
    }

    private static ApiCommand copy(ApiCommand command) {
        return new ApiCommand(
                command.getId(), command.getName(), command.isActive(), command.getSuccess(), command.getResultMessage());
    }
}
