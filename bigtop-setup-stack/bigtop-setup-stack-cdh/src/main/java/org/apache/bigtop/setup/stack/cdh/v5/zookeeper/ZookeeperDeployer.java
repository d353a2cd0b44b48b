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
package org.apache.bigtop.setup.stack.cdh.v5.zookeeper;

import org.apache.bigtop.setup.stack.core.api.model.ApiRole;
import org.apache.bigtop.setup.stack.core.model.RoleSpec;
import org.apache.bigtop.setup.stack.core.model.ServiceConfig;
import org.apache.bigtop.setup.stack.core.spi.AbstractServiceDeployer;
import org.apache.bigtop.setup.stack.core.spi.ServiceContext;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Role groups: SERVER.
 */
@Slf4j
public class ZookeeperDeployer extends AbstractServiceDeployer {

    public static final String NAME = "ZOOKEEPER";

    private static final String SERVER_ID = "serverId";

    public ZookeeperDeployer(ServiceContext context, ServiceConfig config) {
        super(context, config);
    }

    @Override
    public String getName() {
        return NAME;
    }

    /**
     * Every ensemble member needs its own {@code serverId}, taken from the role ordinal.
     */
    @Override
    protected void createRoles(RoleSpec role) {
        int ordinal = 0;
        for (String host : role.getHosts()) {
            ordinal++;
            ApiRole created = createOrFetchRole(role.getGroup(), ordinal, host);
            client().updateRoleConfig(clusterName(), getName(), created.getName(), Map.of(SERVER_ID, ordinal));
        }
    }

    /**
     * Fails when the ensemble was initialized by an earlier run, which is expected.
     */
    @Override
    public void preStart() {
        log.info("[{}] Initializing Zookeeper", getName());
        runServiceCommand("zooKeeperInit", SETUP_COMMAND_TIMEOUT);
    }
}
