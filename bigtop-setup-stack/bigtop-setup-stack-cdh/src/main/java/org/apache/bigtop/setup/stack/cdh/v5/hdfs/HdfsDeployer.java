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
package org.apache.bigtop.setup.stack.cdh.v5.hdfs;

import org.apache.bigtop.setup.stack.core.api.model.ApiCommand;
import org.apache.bigtop.setup.stack.core.model.ServiceConfig;
import org.apache.bigtop.setup.stack.core.spi.AbstractServiceDeployer;
import org.apache.bigtop.setup.stack.core.spi.ServiceContext;

import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Role groups: NAMENODE, SECONDARYNAMENODE, DATANODE, GATEWAY.
 */
@Slf4j
public class HdfsDeployer extends AbstractServiceDeployer {

    public static final String NAME = "HDFS";

    private static final String NAMENODE_GROUP = "NAMENODE";

    public HdfsDeployer(ServiceContext context, ServiceConfig config) {
        super(context, config);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void preStart() {
        log.info("[{}] Formatting HDFS Namenode", getName());
        String namenode = roleName(NAMENODE_GROUP, 1);
        for (ApiCommand command : runRoleCommand("hdfsFormat", List.of(namenode), SETUP_COMMAND_TIMEOUT)) {
            if (!command.isSucceeded()) {
                log.warn("[{}] Failed formatting HDFS, continuing with setup. {}", getName(), command.getResultMessage());
            }
        }
    }

    @Override
    public void postStart() {
        runServiceCommand("hdfsCreateTmpDir", SETUP_COMMAND_TIMEOUT);
    }
}
