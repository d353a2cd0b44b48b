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
package org.apache.bigtop.setup.server.loader;

import org.apache.bigtop.setup.common.constants.Constants;
import org.apache.bigtop.setup.common.utils.YamlUtils;
import org.apache.bigtop.setup.server.exception.ConfigurationException;
import org.apache.bigtop.setup.server.model.dto.ClusterTopology;
import org.apache.bigtop.setup.stack.core.model.ServiceConfig;
import org.apache.bigtop.setup.stack.core.spi.ServiceDeployerRegistry;

import org.apache.commons.collections4.MapUtils;

import org.springframework.stereotype.Component;

import jakarta.annotation.Resource;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads and validates the cluster topology document.
 */
@Slf4j
@Component
public class TopologyLoader {

    @Resource
    private Validator validator;

    @Resource
    private ServiceDeployerRegistry serviceDeployerRegistry;

    public ClusterTopology load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("The cluster configuration template is not available: " + path);
        }

        ClusterTopology topology;
        try {
            topology = YamlUtils.readYaml(path, ClusterTopology.class);
        } catch (UncheckedIOException e) {
            throw new ConfigurationException("Error loading cluster yaml config " + path + ": " + e.getCause().getMessage(), e);
        }
        if (topology == null) {
            throw new ConfigurationException("Cluster yaml config " + path + " is empty");
        }

        topology.setServices(normalizeServices(topology.getServices()));
        validate(topology);
        log.debug("Loaded cluster topology from {}: {}", path, topology);
        return topology;
    }

    private Map<String, ServiceConfig> normalizeServices(Map<String, ServiceConfig> services) {
        Map<String, ServiceConfig> normalized = new LinkedHashMap<>();
        for (Map.Entry<String, ServiceConfig> e : MapUtils.emptyIfNull(services).entrySet()) {
            String kind = e.getKey().toUpperCase(Locale.ROOT);
            if (normalized.containsKey(kind)) {
                throw new ConfigurationException("Service " + kind + " is configured more than once");
            }
            normalized.put(kind, e.getValue());
        }
        return normalized;
    }

    private void validate(ClusterTopology topology) {
        Set<ConstraintViolation<ClusterTopology>> violations = validator.validate(topology);
        if (!violations.isEmpty()) {
            String message = violations.stream()
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining(", "));
            throw new ConfigurationException("Invalid cluster yaml config: " + message);
        }

        for (String kind : topology.getServices().keySet()) {
            if (!Constants.MGMT_SERVICE_KEY.equals(kind) && !serviceDeployerRegistry.contains(kind)) {
                throw new ConfigurationException("Unknown service " + kind + ", supported services are "
                        + serviceDeployerRegistry.kinds() + " and " + Constants.MGMT_SERVICE_KEY);
            }
        }
    }
}
