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
package org.apache.bigtop.setup.stack.cdh.v5.spark;

import org.apache.bigtop.setup.stack.core.model.ServiceConfig;
import org.apache.bigtop.setup.stack.core.spi.AbstractServiceDeployer;
import org.apache.bigtop.setup.stack.core.spi.ServiceContext;

import java.util.List;

/**
 * Spark running on YARN.
 *
 * <p>Role groups: SPARK_YARN_HISTORY_SERVER, GATEWAY.
 */
public class SparkOnYarnDeployer extends AbstractServiceDeployer {

    public static final String NAME = "SPARK_ON_YARN";

    static final List<String> PRE_START_COMMANDS =
            List.of("CreateSparkUserDirCommand", "CreateSparkHistoryDirCommand", "SparkUploadJarServiceCommand");

    public SparkOnYarnDeployer(ServiceContext context, ServiceConfig config) {
        super(context, config);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void preStart() {
        for (String command : PRE_START_COMMANDS) {
            runServiceCommand(command, SETUP_COMMAND_TIMEOUT);
        }
    }
}
