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

import org.apache.bigtop.setup.common.utils.RetryPolicy;
import org.apache.bigtop.setup.server.client.ClouderaManagerClientFactory;
import org.apache.bigtop.setup.server.config.SetupProperties;
import org.apache.bigtop.setup.server.model.dto.ClusterTopology;
import org.apache.bigtop.setup.server.service.ClusterSetupService;
import org.apache.bigtop.setup.stack.core.api.ClouderaManagerClient;
import org.apache.bigtop.setup.stack.core.spi.ServiceDeployerRegistry;

import org.springframework.stereotype.Service;

import jakarta.annotation.Resource;

@Service
public class ClusterSetupServiceImpl implements ClusterSetupService {

    @Resource
    private ClouderaManagerClientFactory clouderaManagerClientFactory;

    @Resource
    private ServiceDeployerRegistry serviceDeployerRegistry;

    @Resource
    private SetupProperties setupProperties;

    @Override
    public void setup(ClusterTopology topology) {
        ClouderaManagerClient client = clouderaManagerClientFactory.create(topology.getCm());
        new ClusterController(client, topology, serviceDeployerRegistry, setupProperties, RetryPolicy.Sleeper.THREAD)
                .setup();
    }
}
