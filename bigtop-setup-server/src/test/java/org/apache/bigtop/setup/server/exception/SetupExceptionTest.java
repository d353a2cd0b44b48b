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
package org.apache.bigtop.setup.server.exception;

import org.apache.bigtop.setup.server.enums.SetupStage;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SetupExceptionTest {

    @Test
    void messageCarriesTheStageAndTheCause() {
        SetupException e = new SetupException(SetupStage.PARCELS, new ServerException("Parcel CDH reported errors"));

        assertThat(e.getMessage()).isEqualTo("Setting up parcels failed: Parcel CDH reported errors");
        assertThat(e.getStage()).isEqualTo(SetupStage.PARCELS);
    }

    @Test
    void causeWithoutMessageIsNamedByItsType() {
        SetupException e = new SetupException(SetupStage.MGMT_SERVICES, new NullPointerException());

        assertThat(e.getMessage()).isEqualTo("Deploying management services failed: NullPointerException");
        assertThat(e.getCause()).isInstanceOf(NullPointerException.class);
    }
}
