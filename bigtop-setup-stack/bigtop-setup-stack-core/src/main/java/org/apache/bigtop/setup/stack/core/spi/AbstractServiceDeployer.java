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

import org.apache.bigtop.setup.common.constants.Constants;
import org.apache.bigtop.setup.stack.core.api.ClouderaManagerClient;
import org.apache.bigtop.setup.stack.core.api.model.ApiCommand;
import org.apache.bigtop.setup.stack.core.api.model.ApiRole;
import org.apache.bigtop.setup.stack.core.api.model.ApiService;
import org.apache.bigtop.setup.stack.core.exception.StackException;
import org.apache.bigtop.setup.stack.core.model.RoleSpec;
import org.apache.bigtop.setup.stack.core.model.ServiceConfig;

import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.collections4.MapUtils;
import org.apache.commons.lang3.StringUtils;

import lombok.extern.slf4j.Slf4j;

import java.text.MessageFormat;
import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;

/**
 * Deployment steps shared by every service kind.
 *
 * <p>Every step first probes the control plane for what already exists, so running the
 * deployment again after a partial run only creates what is missing. Subclasses hook into
 * {@link #preStart()}, {@link #postStart()} and {@link #createRoles(RoleSpec)}.
 */
@Slf4j
public abstract class AbstractServiceDeployer implements ServiceDeployer {

    /**
     * Wait bound of lightweight setup commands, e.g. creating a directory.
     */
    protected static final Duration SETUP_COMMAND_TIMEOUT = Duration.ofSeconds(60);

    /**
     * Wait bound of commands bootstrapping a schema or database.
     */
    protected static final Duration SCHEMA_COMMAND_TIMEOUT = Duration.ofSeconds(300);

    protected final ServiceContext context;

    protected final ServiceConfig config;

    private ApiService service;

    protected AbstractServiceDeployer(ServiceContext context, ServiceConfig config) {
        this.context = context;
        this.config = config == null ? new ServiceConfig() : config;
    }

    /**
     * @return service type as known by Cloudera Manager
     */
    public String getServiceType() {
        return getName();
    }

    protected ClouderaManagerClient client() {
        return context.getClient();
    }

    protected String clusterName() {
        return context.getClusterName();
    }

    /**
     * @return the service entity, created within the cluster on first access when it does not exist
     */
    protected ApiService service() {
        if (service == null) {
            service = client().findService(clusterName(), getName()).orElseGet(() -> {
                log.info("[{}] Creating service", getName());
                return client().createService(clusterName(), getName(), getServiceType());
            });
        }
        return service;
    }

    public boolean started() {
        return Constants.SERVICE_STATE_STARTED.equals(service().getServiceState());
    }

    @Override
    public void deploy() {
        log.info("[{}] Deploying service", getName());
        validateRoles();
        if (started()) {
            log.info("[{}] Service already started, skipping deployment", getName());
            return;
        }

        client().updateServiceConfig(clusterName(), getName(), MapUtils.emptyIfNull(config.getConfig()));
        for (RoleSpec role : config.getRoles()) {
            String groupName = roleConfigGroupName(role.getGroup());
            client().updateRoleConfigGroup(clusterName(), getName(), groupName, MapUtils.emptyIfNull(role.getConfig()));
            createRoles(role);
        }
    }

    private void validateRoles() {
        if (CollectionUtils.isEmpty(config.getRoles())) {
            throw new StackException(MessageFormat.format("[{0}] At least one role should be specified per service", getName()));
        }
        for (RoleSpec role : config.getRoles()) {
            if (role == null || StringUtils.isBlank(role.getGroup()) || CollectionUtils.isEmpty(role.getHosts())) {
                throw new StackException(MessageFormat.format("[{0}] group and hosts should be specified per role", getName()));
            }
        }
    }

    /**
     * Create one role instance per host of {@code role}, skipping the ones that already exist.
     */
    protected void createRoles(RoleSpec role) {
        int ordinal = 0;
        for (String host : role.getHosts()) {
            ordinal++;
            createOrFetchRole(role.getGroup(), ordinal, host);
        }
    }

    protected ApiRole createOrFetchRole(String group, int ordinal, String host) {
        String roleName = roleName(group, ordinal);
        return client().findRole(clusterName(), getName(), roleName).orElseGet(() -> {
            log.info("[{}] Creating role {} on {}", getName(), roleName, host);
            return client().createRole(clusterName(), getName(), roleName, group, host);
        });
    }

    public String roleName(String group, int ordinal) {
        return getName() + "-" + group + "-" + ordinal;
    }

    public String roleConfigGroupName(String group) {
        return getName() + "-" + group + "-" + Constants.ROLE_CONFIG_GROUP_SUFFIX;
    }

    @Override
    public void preStart() {}

    @Override
    public void postStart() {}

    /**
     * Issue a bootstrap command and wait for it. A failed or timed out command is logged and
     * the setup carries on, since these commands may have already run in an earlier attempt.
     *
     * @return whether the command succeeded
     */
    protected boolean runCommand(String commandLabel, Duration timeout, Supplier<ApiCommand> issuer) {
        log.info("[{}] Running command {}", getName(), commandLabel);
        ApiCommand command = client().waitCommand(issuer.get(), timeout);
        if (!command.isSucceeded()) {
            log.error("[{}] Command {} failed. {}", getName(), commandLabel, command.getResultMessage());
            return false;
        }
        return true;
    }

    protected boolean runServiceCommand(String commandName, Duration timeout) {
        return runCommand(commandName, timeout, () -> client().serviceCommand(clusterName(), getName(), commandName));
    }

    protected List<ApiCommand> runRoleCommand(String commandName, List<String> roleNames, Duration timeout) {
        List<ApiCommand> commands = client().roleCommand(clusterName(), getName(), commandName, roleNames);
        return commands.stream().map(command -> client().waitCommand(command, timeout)).toList();
    }
}
