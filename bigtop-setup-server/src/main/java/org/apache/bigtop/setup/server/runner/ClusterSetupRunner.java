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
package org.apache.bigtop.setup.server.runner;

import org.apache.bigtop.setup.common.utils.JsonUtils;
import org.apache.bigtop.setup.server.config.SetupProperties;
import org.apache.bigtop.setup.server.enums.SetupStage;
import org.apache.bigtop.setup.server.exception.SetupException;
import org.apache.bigtop.setup.server.loader.TopologyLoader;
import org.apache.bigtop.setup.server.model.dto.ClusterTopology;
import org.apache.bigtop.setup.server.model.vo.SetupReport;
import org.apache.bigtop.setup.server.service.ClusterSetupService;

import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Runs the cluster setup once on startup and turns its outcome into a report and exit code.
 */
@Slf4j
@Component
public class ClusterSetupRunner implements ApplicationRunner, ExitCodeGenerator {

    static final String TEMPLATE_OPTION = "template";

    @Resource
    private TopologyLoader topologyLoader;

    @Resource
    private ClusterSetupService clusterSetupService;

    @Resource
    private SetupProperties setupProperties;

    private int exitCode;

    @Override
    public void run(ApplicationArguments args) {
        String template = template(args);
        long startTime = System.currentTimeMillis();
        SetupReport report;
        String cluster = null;
        try {
            ClusterTopology topology = topologyLoader.load(Path.of(template));
            cluster = topology.getCluster().getName();
            clusterSetupService.setup(topology);
            report = SetupReport.builder()
                    .status(SetupReport.SUCCEEDED)
                    .cluster(cluster)
                    .message("Cluster " + cluster + " is set up")
                    .build();
        } catch (SetupException e) {
            log.error("Cluster setup failed while {}", e.getStage().getDescription().toLowerCase(Locale.ROOT), e);
            report = failure(cluster, e.getStage(), e);
        } catch (RuntimeException e) {
            SetupStage stage = cluster == null ? SetupStage.LOAD_TOPOLOGY : null;
            log.error("Cluster setup failed", e);
            report = failure(cluster, stage, e);
        }
        report.setElapsedMillis(System.currentTimeMillis() - startTime);
        exitCode = SetupReport.SUCCEEDED.equals(report.getStatus()) ? 0 : 1;
        publish(report);
    }

    private String template(ApplicationArguments args) {
        List<String> values = args.getOptionValues(TEMPLATE_OPTION);
        return CollectionUtils.isEmpty(values) ? setupProperties.getTemplate() : values.get(0);
    }

    private SetupReport failure(String cluster, SetupStage stage, RuntimeException e) {
        return SetupReport.builder()
                .status(SetupReport.FAILED)
                .cluster(cluster)
                .stage(stage == null ? null : stage.name())
                .message(e.getMessage())
                .error(ExceptionUtils.getRootCauseMessage(e))
                .build();
    }

    private void publish(SetupReport report) {
        String json = JsonUtils.writeAsString(report);
        log.info("Setup report: {}", json);
        if (StringUtils.isBlank(setupProperties.getReportFile())) {
            return;
        }
        try {
            Files.writeString(Path.of(setupProperties.getReportFile()), json, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Unable to write setup report to {}", setupProperties.getReportFile(), e);
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
