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

package org.tabletrebalancer.rebalance.health;

import javax.annotation.Nullable;

import java.util.Objects;
import java.util.Optional;

import static org.tabletrebalancer.utils.Preconditions.checkNotNull;

/** Summary of one replica of a tablet, as seen in the tablet's consensus configuration. */
public class ReplicaSummary {
    private final String serverUuid;
    private final @Nullable String serverAddress;
    private final boolean serverHealthy;
    private final boolean leader;

    public ReplicaSummary(
            String serverUuid,
            @Nullable String serverAddress,
            boolean serverHealthy,
            boolean leader) {
        this.serverUuid = checkNotNull(serverUuid);
        this.serverAddress = serverAddress;
        this.serverHealthy = serverHealthy;
        this.leader = leader;
    }

    public String getServerUuid() {
        return serverUuid;
    }

    /** The address of the hosting server, absent if the server is unknown to the masters. */
    public Optional<String> getServerAddress() {
        return Optional.ofNullable(serverAddress);
    }

    public boolean isServerHealthy() {
        return serverHealthy;
    }

    public boolean isLeader() {
        return leader;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ReplicaSummary that = (ReplicaSummary) o;
        return serverHealthy == that.serverHealthy
                && leader == that.leader
                && serverUuid.equals(that.serverUuid)
                && Objects.equals(serverAddress, that.serverAddress);
    }

    @Override
    public int hashCode() {
        return Objects.hash(serverUuid, serverAddress, serverHealthy, leader);
    }

    @Override
    public String toString() {
        return "ReplicaSummary{server="
                + serverUuid
                + ", healthy="
                + serverHealthy
                + ", leader="
                + leader
                + '}';
    }
}
