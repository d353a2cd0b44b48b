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
package org.apache.bigtop.setup.server.enums;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Parcel stages in the order a parcel moves through them.
 */
public enum ParcelStage {
    AVAILABLE_REMOTELY,
    DOWNLOADING,
    DOWNLOADED,
    DISTRIBUTING,
    DISTRIBUTED,
    UNDISTRIBUTING,
    ACTIVATING,
    ACTIVATED,
    INUSE,
    UNKNOWN;

    public static final Set<ParcelStage> DOWNLOAD_DONE =
            Collections.unmodifiableSet(EnumSet.of(DOWNLOADED, DISTRIBUTED, ACTIVATED, INUSE));

    public static final Set<ParcelStage> DISTRIBUTION_DONE =
            Collections.unmodifiableSet(EnumSet.of(DISTRIBUTED, ACTIVATED, INUSE));

    public static final Set<ParcelStage> ACTIVATION_DONE = Collections.unmodifiableSet(EnumSet.of(ACTIVATED, INUSE));

    public static ParcelStage of(String stage) {
        return Arrays.stream(values())
                .filter(value -> value.name().equalsIgnoreCase(stage))
                .findFirst()
                .orElse(UNKNOWN);
    }
}
