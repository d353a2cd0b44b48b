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
package org.apache.bigtop.setup.stack.core.spi;

/**
 * Deploys one service of a cluster. The cluster is started between {@link #preStart()} and
 * {@link #postStart()}.
 */
public interface ServiceDeployer {

    /**
     * @return name of the service entity, the upper-cased service kind
     */
    String getName();

    /**
     * Create the service when missing, push its configuration and create its roles.
     */
    void deploy();

    void preStart();

    void postStart();
}
