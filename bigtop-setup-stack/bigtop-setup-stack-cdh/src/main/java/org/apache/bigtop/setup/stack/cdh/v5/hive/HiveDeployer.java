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
package org.apache.bigtop.setup.stack.cdh.v5.hive;

import org.apache.bigtop.setup.stack.core.model.ServiceConfig;
import org.apache.bigtop.setup.stack.core.spi.AbstractServiceDeployer;
import org.apache.bigtop.setup.stack.core.spi.ServiceContext;

/**
 * Role groups: HIVEMETASTORE, HIVESERVER2, WEBHCAT, GATEWAY.
 */
public class HiveDeployer extends AbstractServiceDeployer {

    public static final String NAME = "HIVE";

    public HiveDeployer(ServiceContext context, ServiceConfig config) {
        super(context, config);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void preStart() {
        runServiceCommand("hiveCreateHiveWarehouse", SETUP_COMMAND_TIMEOUT);
    }

    /**
     * The metastore schema can only be created once the metastore database host is reachable,
     * so this runs after the cluster has started.
     */
    @Override
    public void postStart() {
        runServiceCommand("hiveCreateMetastoreDatabase", SCHEMA_COMMAND_TIMEOUT);
        runServiceCommand("hiveCreateMetastoreDatabaseTables", SCHEMA_COMMAND_TIMEOUT);
    }
}
