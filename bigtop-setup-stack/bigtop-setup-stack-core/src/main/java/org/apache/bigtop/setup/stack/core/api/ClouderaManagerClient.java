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

import org.apache.bigtop.setup.stack.core.api.model.ApiCluster;
import org.apache.bigtop.setup.stack.core.api.model.ApiCommand;
import org.apache.bigtop.setup.stack.core.api.model.ApiConfig;
import org.apache.bigtop.setup.stack.core.api.model.ApiHost;
import org.apache.bigtop.setup.stack.core.api.model.ApiParcel;
import org.apache.bigtop.setup.stack.core.api.model.ApiRole;
import org.apache.bigtop.setup.stack.core.api.model.ApiService;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Operations of the Cloudera Manager API used to bring up a cluster.
 *
 * <p>Lookups return {@link Optional#empty()} when the entity does not exist. Every other remote
 * failure is raised as {@link org.apache.bigtop.setup.common.exception.ApiException}. Hosts are
 * addressed by hostname; implementations resolve host ids themselves.
 */
public interface ClouderaManagerClient {

    // Clusters and hosts

    Optional<ApiCluster> findCluster(String clusterName);

    ApiCluster createCluster(String clusterName, String version, String fullVersion);

    List<ApiHost> listClusterHosts(String clusterName);

    void addHosts(String clusterName, List<String> hostnames);

    ApiCommand startCluster(String clusterName);

    ApiCommand stopCluster(String clusterName);

    ApiCommand deployClientConfig(String clusterName);

    // Parcels

    Optional<ApiParcel> findParcel(String clusterName, String product, String version);

    ApiCommand startParcelDownload(String clusterName, String product, String version);

    ApiCommand startParcelDistribution(String clusterName, String product, String version);

    ApiCommand activateParcel(String clusterName, String product, String version);

    // Cloudera Manager itself

    /**
     * @return the full view of the manager configuration, keyed by config name
     */
    Map<String, ApiConfig> getManagerConfig();

    void updateManagerConfig(Map<String, String> values);

    ApiCommand inspectHosts();

    // Management services

    Optional<ApiService> findMgmtService();

    ApiService createMgmtService();

    List<ApiRole> listMgmtRoles(String roleType);

    ApiRole createMgmtRole(String roleName, String roleType, String hostname);

    void updateMgmtRoleConfigGroup(String groupName, Map<String, Object> config);

    ApiCommand startMgmtService();

    // Cluster services

    Optional<ApiService> findService(String clusterName, String serviceName);

    ApiService createService(String clusterName, String serviceName, String serviceType);

    void updateServiceConfig(String clusterName, String serviceName, Map<String, Object> config);

    void updateRoleConfigGroup(String clusterName, String serviceName, String groupName, Map<String, Object> config);

    Optional<ApiRole> findRole(String clusterName, String serviceName, String roleName);

    ApiRole createRole(String clusterName, String serviceName, String roleName, String roleType, String hostname);

    void updateRoleConfig(String clusterName, String serviceName, String roleName, Map<String, Object> config);

    ApiCommand serviceCommand(String clusterName, String serviceName, String commandName);

    List<ApiCommand> roleCommand(String clusterName, String serviceName, String commandName, List<String> roleNames);

    // Commands

    ApiCommand fetchCommand(long commandId);

    /**
     * Block until the command finishes or {@code timeout} elapses.
     *
     * @return the last observed state of the command; still active when the timeout was hit
     */
    ApiCommand waitCommand(ApiCommand command, Duration timeout);
}
