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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

import static org.tabletrebalancer.utils.Preconditions.checkNotNull;

/**
 * Summary of a tablet: the table it belongs to, its health and the placement of its replicas. The
 * committed consensus configuration version is present if the scan could read it from the tablet's
 * leader.
 */
public class TabletSummary {
    private final String id;
    private final String tableId;
    private final String tableName;
    private final TabletHealth health;
    private final List<ReplicaSummary> replicas;
    private final @Nullable Long configVersion;

    public TabletSummary(
            String id,
            String tableId,
            String tableName,
            TabletHealth health,
            List<ReplicaSummary> replicas,
            @Nullable Long configVersion) {
        this.id = checkNotNull(id);
        this.tableId = checkNotNull(tableId);
        this.tableName = checkNotNull(tableName);
        this.health = checkNotNull(health);
        this.replicas = Collections.unmodifiableList(new ArrayList<>(replicas));
        this.configVersion = configVersion;
    }

    public String getId() {
        return id;
    }

    public String getTableId() {
        return tableId;
    }

    public String getTableName() {
        return tableName;
    }

    public TabletHealth getHealth() {
        return health;
    }

    public List<ReplicaSummary> getReplicas() {
        return replicas;
    }

    public OptionalLong getConfigVersion() {
        return configVersion == null ? OptionalLong.empty() : OptionalLong.of(configVersion);
    }

    public boolean hasReplicaAt(String serverUuid) {
        for (ReplicaSummary replica : replicas) {
            if (replica.getServerUuid().equals(serverUuid)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TabletSummary that = (TabletSummary) o;
        return id.equals(that.id)
                && tableId.equals(that.tableId)
                && tableName.equals(that.tableName)
                && health == that.health
                && replicas.equals(that.replicas)
                && Objects.equals(configVersion, that.configVersion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, tableId, tableName, health, replicas, configVersion);
    }

    @Override
    public String toString() {
        return "TabletSummary{id='"
                + id
                + "', table='"
                + tableName
                + "', health="
                + health
                + ", replicas="
                + replicas
                + ", configVersion="
                + configVersion
                + '}';
    }
}
