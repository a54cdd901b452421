/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.tabletrebalancer.exception;

import org.tabletrebalancer.annotation.PublicEvolving;

/**
 * Thrown when a replica move was submitted against an expected consensus configuration version,
 * but the tablet's configuration has changed since.
 */
@PublicEvolving
public class ConfigVersionMismatchException extends ReplicaMoveException {

    private static final long serialVersionUID = 1L;

    private final long expectedVersion;
    private final long actualVersion;

    public ConfigVersionMismatchException(
            String tabletId, long expectedVersion, long actualVersion) {
        super(
                String.format(
                        "Tablet %s: consensus config version mismatch, expected %s but was %s.",
                        tabletId, expectedVersion, actualVersion));
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}
