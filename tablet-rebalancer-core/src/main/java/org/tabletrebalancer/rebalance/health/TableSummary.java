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

import static org.tabletrebalancer.utils.Preconditions.checkArgument;
import static org.tabletrebalancer.utils.Preconditions.checkNotNull;

/** Summary of a table: identity and replication factor. */
public class TableSummary {
    private final String id;
    private final String name;
    private final int replicationFactor;

    public TableSummary(String id, String name, int replicationFactor) {
        checkArgument(
                replicationFactor > 0,
                "replication factor of table %s must be positive, but was %s",
                name,
                replicationFactor);
        this.id = checkNotNull(id);
        this.name = checkNotNull(name);
        this.replicationFactor = replicationFactor;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public int getReplicationFactor() {
        return replicationFactor;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TableSummary that = (TableSummary) o;
        return replicationFactor == that.replicationFactor
                && id.equals(that.id)
                && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, replicationFactor);
    }

    @Override
    public String toString() {
        return "TableSummary{id='"
                + id
                + "', name='"
                + name
                + "', replicationFactor="
                + replicationFactor
                + '}';
    }
}
