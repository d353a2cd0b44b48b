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
package org.apache.bigtop.setup.server.client;

import org.apache.bigtop.setup.common.exception.ApiException;
import org.apache.bigtop.setup.common.exception.TransientApiException;
import org.apache.bigtop.setup.common.utils.JsonUtils;
import org.apache.bigtop.setup.common.utils.RetryPolicy;
import org.apache.bigtop.setup.stack.core.api.ClouderaManagerClient;
import org.apache.bigtop.setup.stack.core.api.model.ApiCluster;
import org.apache.bigtop.setup.stack.core.api.model.ApiCommand;
import org.apache.bigtop.setup.stack.core.api.model.ApiConfig;
import org.apache.bigtop.setup.stack.core.api.model.ApiHost;
import org.apache.bigtop.setup.stack.core.api.model.ApiHostRef;
import org.apache.bigtop.setup.stack.core.api.model.ApiParcel;
import org.apache.bigtop.setup.stack.core.api.model.ApiRole;
import org.apache.bigtop.setup.stack.core.api.model.ApiService;

import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link ClouderaManagerClient} over the Cloudera Manager REST API.
 *
 * <p>The {@link RestTemplate} is expected to carry the API root, e.g.
 * {@code http://cm-host:7180/api/v13}, and the credentials.
 */
@Slf4j
public class RestClouderaManagerClient implements ClouderaManagerClient {

    private static final String ITEMS = "items";

    private final RestTemplate restTemplate;

    private final Duration pollInterval;

    private final RetryPolicy.Sleeper sleeper;

    private final Map<String, String> hostIdsByName = new HashMap<>();

    private final Map<String, String> hostNamesById = new HashMap<>();

    public RestClouderaManagerClient(RestTemplate restTemplate, Duration pollInterval, RetryPolicy.Sleeper sleeper) {
        this.restTemplate = restTemplate;
        this.pollInterval = pollInterval;
        this.sleeper = sleeper;
    }

    // Clusters and hosts

    @Override
    public Optional<ApiCluster> findCluster(String clusterName) {
        return find(ApiCluster.class, "/clusters/{cluster}", clusterName);
    }

    @Override
    public ApiCluster createCluster(String clusterName, String version, String fullVersion) {
        Map<String, Object> cluster = Map.of("name", clusterName, "version", version, "fullVersion", fullVersion);
        return first(post(items(List.of(cluster)), "/clusters"), ApiCluster.class);
    }

    @Override
    public List<ApiHost> listClusterHosts(String clusterName) {
        List<ApiHostRef> refs = list(get("/clusters/{cluster}/hosts", clusterName), ApiHostRef.class);
        List<ApiHost> hosts = new ArrayList<>();
        for (ApiHostRef ref : refs) {
            hosts.add(new ApiHost(ref.getHostId(), hostnameOf(ref.getHostId())));
        }
        return hosts;
    }

    @Override
    public void addHosts(String clusterName, List<String> hostnames) {
        List<Map<String, Object>> refs = new ArrayList<>();
        for (String hostname : hostnames) {
            refs.add(Map.of("hostId", hostIdOf(hostname)));
        }
        post(items(refs), "/clusters/{cluster}/hosts", clusterName);
    }

    @Override
    public ApiCommand startCluster(String clusterName) {
        return command("/clusters/{cluster}/commands/start", clusterName);
    }

    @Override
    public ApiCommand stopCluster(String clusterName) {
        return command("/clusters/{cluster}/commands/stop", clusterName);
    }

    @Override
    public ApiCommand deployClientConfig(String clusterName) {
        return command("/clusters/{cluster}/commands/deployClientConfig", clusterName);
    }

    // Parcels

    @Override
    public Optional<ApiParcel> findParcel(String clusterName, String product, String version) {
        return find(ApiParcel.class, "/clusters/{cluster}/parcels/products/{product}/versions/{version}",
                clusterName, product, version);
    }

    @Override
    public ApiCommand startParcelDownload(String clusterName, String product, String version) {
        return command("/clusters/{cluster}/parcels/products/{product}/versions/{version}/commands/startDownload",
                clusterName, product, version);
    }

    @Override
    public ApiCommand startParcelDistribution(String clusterName, String product, String version) {
        return command("/clusters/{cluster}/parcels/products/{product}/versions/{version}/commands/startDistribution",
                clusterName, product, version);
    }

    @Override
    public ApiCommand activateParcel(String clusterName, String product, String version) {
        return command("/clusters/{cluster}/parcels/products/{product}/versions/{version}/commands/activate",
                clusterName, product, version);
    }

    // Cloudera Manager itself

    @Override
    public Map<String, ApiConfig> getManagerConfig() {
        Map<String, ApiConfig> configs = new LinkedHashMap<>();
        for (ApiConfig config : list(get("/cm/config?view=full"), ApiConfig.class)) {
            configs.put(config.getName(), config);
        }
        return configs;
    }

    @Override
    public void updateManagerConfig(Map<String, String> values) {
        put(configItems(values), "/cm/config");
    }

    @Override
    public ApiCommand inspectHosts() {
        return command("/cm/commands/inspectHosts");
    }

    // Management services

    @Override
    public Optional<ApiService> findMgmtService() {
        return find(ApiService.class, "/cm/service");
    }

    @Override
    public ApiService createMgmtService() {
        return convert(put(Map.of("name", "mgmt"), "/cm/service"), ApiService.class);
    }

    @Override
    public List<ApiRole> listMgmtRoles(String roleType) {
        return list(get("/cm/service/roles"), ApiRole.class).stream()
                .filter(role -> roleType.equals(role.getType()))
                .toList();
    }

    @Override
    public ApiRole createMgmtRole(String roleName, String roleType, String hostname) {
        return first(post(items(List.of(role(roleName, roleType, hostname))), "/cm/service/roles"), ApiRole.class);
    }

    @Override
    public void updateMgmtRoleConfigGroup(String groupName, Map<String, Object> config) {
        put(configItems(config), "/cm/service/roleConfigGroups/{group}/config", groupName);
    }

    @Override
    public ApiCommand startMgmtService() {
        return command("/cm/service/commands/start");
    }

    // Cluster services

    @Override
    public Optional<ApiService> findService(String clusterName, String serviceName) {
        return find(ApiService.class, "/clusters/{cluster}/services/{service}", clusterName, serviceName);
    }

    @Override
    public ApiService createService(String clusterName, String serviceName, String serviceType) {
        Map<String, Object> service = Map.of("name", serviceName, "type", serviceType);
        return first(post(items(List.of(service)), "/clusters/{cluster}/services", clusterName), ApiService.class);
    }

    @Override
    public void updateServiceConfig(String clusterName, String serviceName, Map<String, Object> config) {
        put(configItems(config), "/clusters/{cluster}/services/{service}/config", clusterName, serviceName);
    }

    @Override
    public void updateRoleConfigGroup(
            String clusterName, String serviceName, String groupName, Map<String, Object> config) {
        put(configItems(config), "/clusters/{cluster}/services/{service}/roleConfigGroups/{group}/config",
                clusterName, serviceName, groupName);
    }

    @Override
    public Optional<ApiRole> findRole(String clusterName, String serviceName, String roleName) {
        return find(ApiRole.class, "/clusters/{cluster}/services/{service}/roles/{role}",
                clusterName, serviceName, roleName);
    }

    @Override
    public ApiRole createRole(String clusterName, String serviceName, String roleName, String roleType, String hostname) {
        JsonNode created = post(items(List.of(role(roleName, roleType, hostname))),
                "/clusters/{cluster}/services/{service}/roles", clusterName, serviceName);
        return first(created, ApiRole.class);
    }

    @Override
    public void updateRoleConfig(String clusterName, String serviceName, String roleName, Map<String, Object> config) {
        put(configItems(config), "/clusters/{cluster}/services/{service}/roles/{role}/config",
                clusterName, serviceName, roleName);
    }

    @Override
    public ApiCommand serviceCommand(String clusterName, String serviceName, String commandName) {
        return command("/clusters/{cluster}/services/{service}/commands/{command}", clusterName, serviceName, commandName);
    }

    @Override
    public List<ApiCommand> roleCommand(String clusterName, String serviceName, String commandName, List<String> roleNames) {
        JsonNode bulk = post(items(roleNames), "/clusters/{cluster}/services/{service}/roleCommands/{command}",
                clusterName, serviceName, commandName);
        JsonNode errors = bulk == null ? null : bulk.get("errors");
        if (errors != null && errors.isArray() && !errors.isEmpty()) {
            log.warn("[{}] Command {} reported errors: {}", serviceName, commandName, errors);
        }
        return list(bulk, ApiCommand.class);
    }

    // Commands

    @Override
    public ApiCommand fetchCommand(long commandId) {
        return convert(get("/commands/{id}", commandId), ApiCommand.class);
    }

    @Override
    public ApiCommand waitCommand(ApiCommand command, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        ApiCommand current = command;
        while (current.isActive()) {
            if (System.nanoTime() - deadline >= 0) {
                log.warn("Command {} ({}) still running after {}s", current.getName(), current.getId(), timeout.toSeconds());
                return current;
            }
            try {
                sleeper.sleep(pollInterval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ApiException("Interrupted while waiting on command " + current.getId(), e);
            }
            current = fetchCommand(command.getId());
        }
        return current;
    }

    // Hosts

    private String hostIdOf(String hostname) {
        if (!hostIdsByName.containsKey(hostname)) {
            loadHosts();
        }
        String hostId = hostIdsByName.get(hostname);
        if (hostId == null) {
            throw new ApiException(HttpStatus.NOT_FOUND.value(), "Host " + hostname + " is not managed by Cloudera Manager");
        }
        return hostId;
    }

    private String hostnameOf(String hostId) {
        if (!hostNamesById.containsKey(hostId)) {
            loadHosts();
        }
        return hostNamesById.getOrDefault(hostId, hostId);
    }

    private void loadHosts() {
        for (ApiHost host : list(get("/hosts"), ApiHost.class)) {
            hostIdsByName.put(host.getHostname(), host.getHostId());
            hostNamesById.put(host.getHostId(), host.getHostname());
        }
    }

    private Map<String, Object> role(String roleName, String roleType, String hostname) {
        return Map.of("name", roleName, "type", roleType, "hostRef", Map.of("hostId", hostIdOf(hostname)));
    }

    // HTTP plumbing

    private <T> Optional<T> find(Class<T> type, String uri, Object... uriVariables) {
        try {
            return Optional.ofNullable(convert(restTemplate.getForObject(uri, JsonNode.class, uriVariables), type));
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                return Optional.empty();
            }
            throw translate("GET " + uri, e);
        } catch (ResourceAccessException e) {
            throw new ApiException("GET " + uri + " failed: " + e.getMessage(), e);
        }
    }

    private JsonNode get(String uri, Object... uriVariables) {
        return exchange("GET " + uri, () -> restTemplate.getForObject(uri, JsonNode.class, uriVariables));
    }

    private JsonNode post(Object body, String uri, Object... uriVariables) {
        return exchange("POST " + uri, () -> restTemplate.postForObject(uri, body, JsonNode.class, uriVariables));
    }

    private JsonNode put(Object body, String uri, Object... uriVariables) {
        return exchange("PUT " + uri, () -> restTemplate
                .exchange(uri, HttpMethod.PUT, new HttpEntity<>(body), JsonNode.class, uriVariables)
                .getBody());
    }

    private ApiCommand command(String uri, Object... uriVariables) {
        return convert(post(null, uri, uriVariables), ApiCommand.class);
    }

    private JsonNode exchange(String description, Supplier<JsonNode> call) {
        try {
            return call.get();
        } catch (HttpStatusCodeException e) {
            throw translate(description, e);
        } catch (ResourceAccessException e) {
            throw new ApiException(description + " failed: " + e.getMessage(), e);
        }
    }

    private ApiException translate(String description, HttpStatusCodeException e) {
        int status = e.getStatusCode().value();
        String message = description + " failed with " + status + ": " + e.getResponseBodyAsString();
        if (status == HttpStatus.SERVICE_UNAVAILABLE.value()) {
            return new TransientApiException(message, e);
        }
        return new ApiException(status, message, e);
    }

    private static Map<String, Object> items(List<?> items) {
        return Map.of(ITEMS, items);
    }

    private static Map<String, Object> configItems(Map<String, ?> values) {
        List<Map<String, Object>> configs = new ArrayList<>();
        values.forEach((name, value) -> {
            Map<String, Object> config = new LinkedHashMap<>();
            config.put("name", name);
            config.put("value", value == null ? null : String.valueOf(value));
            configs.add(config);
        });
        return items(configs);
    }

    private static <T> List<T> list(JsonNode body, Class<T> type) {
        List<T> result = new ArrayList<>();
        JsonNode items = body == null ? null : body.get(ITEMS);
        if (items != null && items.isArray()) {
            items.forEach(item -> result.add(convert(item, type)));
        }
        return result;
    }

    private static <T> T first(JsonNode body, Class<T> type) {
        List<T> items = list(body, type);
        if (items.isEmpty()) {
            throw new ApiException("Expected one item in response but got none");
        }
        return items.get(0);
    }

    private static <T> T convert(JsonNode node, Class<T> type) {
        return node == null || node.isNull() ? null : JsonUtils.OBJECTMAPPER.convertValue(node, type);
    }
}
