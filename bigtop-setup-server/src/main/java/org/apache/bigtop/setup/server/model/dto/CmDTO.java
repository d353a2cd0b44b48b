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

import org.apache.bigtop.setup.common.constants.Constants;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.ToString;

/**
 * Cloudera Manager endpoint and credentials.
 */
@Data
public class CmDTO {

    @NotBlank
    private String host;

    @Min(1)
    @Max(65535)
    private Integer port;

    @NotBlank
    private String username;

    @NotBlank
    @ToString.Exclude
    private String password;

    private boolean tls;

    @ToString.Include(name = "password")
    private String maskedPassword() {
        return password == null ? null : Constants.MASKED_VALUE;
    }
}
