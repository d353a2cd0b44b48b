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
package org.apache.bigtop.setup.server.model.dto;

import org.apache.bigtop.setup.stack.core.model.ServiceConfig;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The cluster topology document, usually {@code cluster.yaml}.
 */
@Data
public class ClusterTopology {

    @NotNull
    @Valid
    private CmDTO cm;

    @NotNull
    @Valid
    private ClusterDTO cluster;

    @NotNull
    @Valid
    @JsonAlias("bundle")
    private ParcelDTO parcel;

    /**
     * Service configurations keyed by upper-cased service kind, plus {@code MGMT}.
     */
    @NotNull
    private Map<String, ServiceConfig> services = new LinkedHashMap<>();
}
