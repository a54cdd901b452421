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

import java.util.Objects;

import static org.tabletrebalancer.utils.Preconditions.checkNotNull;

/** Summary of a tablet server: identity, RPC address and health. */
public class ServerHealthSummary {
    private final String uuid;
    private final String address;
    private final ServerHealth health;

    public ServerHealthSummary(String uuid, String address, ServerHealth health) {
        this.uuid = checkNotNull(uuid, "server uuid must not be null");
        this.address = checkNotNull(address, "server address must not be null");
        this.health = checkNotNull(health, "server health must not be null");
    }

    public String getUuid() {
        return uuid;
    }

    public String getAddress() {
        return address;
    }

    public ServerHealth getHealth() {
        return health;
    }

    public boolean isHealthy() {
        return health == ServerHealth.HEALTHY;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ServerHealthSummary that = (ServerHealthSummary) o;
        return uuid.equals(that.uuid) && address.equals(that.address) && health == that.health;
    }

    @Override
    public int hashCode() {
        return Objects.hash(uuid, address, health);
    }

    @Override
    public String toString() {
        return "ServerHealthSummary{"
                + "uuid='"
                + uuid
                + '\''
                + ", address='"
                + address
                + '\''
                + ", health="
                + health
                + '}';
    }
}
