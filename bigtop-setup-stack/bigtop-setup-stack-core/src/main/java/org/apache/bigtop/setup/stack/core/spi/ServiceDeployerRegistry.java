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

import org.apache.bigtop.setup.stack.core.exception.StackException;
import org.apache.bigtop.setup.stack.core.model.ServiceConfig;

import org.apache.commons.lang3.StringUtils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Service kinds known to the setup, keyed by upper-cased kind name.
 */
public final class ServiceDeployerRegistry {

    private final Map<String, ServiceDeployerFactory> factories;

    private ServiceDeployerRegistry(Map<String, ServiceDeployerFactory> factories) {
        this.factories = Collections.unmodifiableMap(new LinkedHashMap<>(factories));
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean contains(String kind) {
        return kind != null && factories.containsKey(kind.toUpperCase(Locale.ROOT));
    }

    public Set<String> kinds() {
        return factories.keySet();
    }

    public ServiceDeployer create(String kind, ServiceContext context, ServiceConfig config) {
        if (!contains(kind)) {
            throw new StackException("Unknown service kind: " + kind + ", known kinds are " + factories.keySet());
        }
        return factories.get(kind.toUpperCase(Locale.ROOT)).create(context, config);
    }

    public static final class Builder {

        private final Map<String, ServiceDeployerFactory> factories = new LinkedHashMap<>();

        private Builder() {}

        public Builder register(String kind, ServiceDeployerFactory factory) {
            if (StringUtils.isBlank(kind)) {
                throw new IllegalArgumentException("kind must not be blank");
            }
            String key = kind.toUpperCase(Locale.ROOT);
            if (factories.putIfAbsent(key, factory) != null) {
                throw new IllegalArgumentException("Service kind registered twice: " + key);
            }
            return this;
        }

        public ServiceDeployerRegistry build() {
            return new ServiceDeployerRegistry(factories);
        }
    }
}
