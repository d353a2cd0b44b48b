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
package org.apache.bigtop.setup.common.constants;

public final class Constants {

    private Constants() {}

    /**
     * Product name of the parcel distributed to every host.
     */
    public static final String CDH_PRODUCT = "CDH";

    /**
     * Cloudera Manager config key holding the comma separated list of remote parcel repositories.
     */
    public static final String REMOTE_PARCEL_REPO_URLS = "REMOTE_PARCEL_REPO_URLS";

    /**
     * Reserved key of the management services in the topology document.
     */
    public static final String MGMT_SERVICE_KEY = "MGMT";

    public static final String SERVICE_STATE_STARTED = "STARTED";

    public static final String ROLE_CONFIG_GROUP_SUFFIX = "BASE";

    public static final String MASKED_VALUE = "******";
}
