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
package org.apache.bigtop.setup.stack.cdh;

import org.apache.bigtop.setup.stack.cdh.v5.flume.FlumeDeployer;
import org.apache.bigtop.setup.stack.cdh.v5.hbase.HbaseDeployer;
import org.apache.bigtop.setup.stack.cdh.v5.hdfs.HdfsDeployer;
import org.apache.bigtop.setup.stack.cdh.v5.hive.HiveDeployer;
import org.apache.bigtop.setup.stack.cdh.v5.impala.ImpalaDeployer;
import org.apache.bigtop.setup.stack.cdh.v5.oozie.OozieDeployer;
import org.apache.bigtop.setup.stack.cdh.v5.spark.SparkOnYarnDeployer;
import org.apache.bigtop.setup.stack.cdh.v5.sqoop.SqoopDeployer;
import org.apache.bigtop.setup.stack.cdh.v5.yarn.YarnDeployer;
import org.apache.bigtop.setup.stack.cdh.v5.zookeeper.ZookeeperDeployer;
import org.apache.bigtop.setup.stack.core.spi.ServiceDeployerRegistry;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Service kinds of a CDH 5 cluster and the order they are brought up in.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class CdhServiceCatalog {

    /**
     * Started first. Later services rely on directories these create once running.
     */
    public static final List<String> BASE_SERVICES =
            List.of(ZookeeperDeployer.NAME, HdfsDeployer.NAME, YarnDeployer.NAME);

    public static final List<String> ADDITIONAL_SERVICES = List.of(
            SparkOnYarnDeployer.NAME,
            HbaseDeployer.NAME,
            HiveDeployer.NAME,
            ImpalaDeployer.NAME,
            FlumeDeployer.NAME,
            OozieDeployer.NAME,
            SqoopDeployer.NAME);

    public static ServiceDeployerRegistry registry() {
        return ServiceDeployerRegistry.builder()
                .register(ZookeeperDeployer.NAME, ZookeeperDeployer::new)
                .register(HdfsDeployer.NAME, HdfsDeployer::new)
                .register(YarnDeployer.NAME, YarnDeployer::new)
                .register(SparkOnYarnDeployer.NAME, SparkOnYarnDeployer::new)
                .register(HbaseDeployer.NAME, HbaseDeployer::new)
                .register(HiveDeployer.NAME, HiveDeployer::new)
                .register(ImpalaDeployer.NAME, ImpalaDeployer::new)
                .register(FlumeDeployer.NAME, FlumeDeployer::new)
                .register(OozieDeployer.NAME, OozieDeployer::new)
                .register(SqoopDeployer.NAME, SqoopDeployer::new)
                .build();
    }
}
