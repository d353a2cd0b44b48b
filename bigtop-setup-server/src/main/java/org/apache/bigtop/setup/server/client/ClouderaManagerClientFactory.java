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

import org.apache.bigtop.setup.common.utils.RetryPolicy;
import org.apache.bigtop.setup.server.config.SetupProperties;
import org.apache.bigtop.setup.server.model.dto.CmDTO;
import org.apache.bigtop.setup.stack.core.api.ClouderaManagerClient;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.stereotype.Component;

import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;

import java.text.MessageFormat;

@Slf4j
@Component
public class ClouderaManagerClientFactory {

    @Resource
    private RestTemplateBuilder restTemplateBuilder;

    @Resource
    private SetupProperties setupProperties;

    public ClouderaManagerClient create(CmDTO cm) {
        String rootUri = rootUri(cm);
        log.info("Connecting to Cloudera Manager at {} as {}", rootUri, cm.getUsername());
        return new RestClouderaManagerClient(
                restTemplateBuilder
                        .rootUri(rootUri)
                        .basicAuthentication(cm.getUsername(), cm.getPassword())
                        .setConnectTimeout(setupProperties.getConnectTimeout())
                        .setReadTimeout(setupProperties.getReadTimeout())
                        .build(),
                setupProperties.getCommandPollInterval(),
                RetryPolicy.Sleeper.THREAD);
    }

    String rootUri(CmDTO cm) {
        int port = cm.getPort() == null ? setupProperties.getDefaultPort() : cm.getPort();
        return MessageFormat.format("{0}://{1}:{2,number,#}/api/{3}",
                cm.isTls() ? "https" : "http", cm.getHost(), port, setupProperties.getApiVersion());
    }
}
