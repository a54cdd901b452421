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

package org.tabletrebalancer.rebalance.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import static org.tabletrebalancer.utils.Preconditions.checkArgument;
import static org.tabletrebalancer.utils.Preconditions.checkNotNull;

/**
 * The balance model handed to a rebalancing algorithm: how many replicas of each table every
 * tablet server hosts, and how many replicas every tablet server hosts in total. Every table has
 * an entry for every server, servers hosting no replica of the table count zero.
 */
public class ClusterInfo {

    private final SortedSet<String> servers;
    private final SortedMap<String, SortedMap<String, Integer>> replicaCountsByTable;
    private final Map<String, String> tableNames;

    private ClusterInfo(
            SortedSet<String> servers,
            SortedMap<String, SortedMap<String, Integer>> replicaCountsByTable,
            Map<String, String> tableNames) {
        this.servers = servers;
        this.replicaCountsByTable = replicaCountsByTable;
        this.tableNames = tableNames;
    }

    public static Builder builder() {
        return new Builder();
    }

    public SortedSet<String> servers() {
        return Collections.unmodifiableSortedSet(servers);
    }

    public SortedSet<String> tables() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(replicaCountsByTable.keySet()));
    }

    /** Returns the table's name, or its id if the name is unknown. */
    public String tableName(String tableId) {
        return tableNames.getOrDefault(tableId, tableId);
    }

    /** Replica count of the table per server. */
    public SortedMap<String, Integer> replicaCounts(String tableId) {
        SortedMap<String, Integer> counts = replicaCountsByTable.get(tableId);
        checkArgument(counts != null, "table %s is not in the cluster info", tableId);
        return Collections.unmodifiableSortedMap(counts);
    }

    public int replicaCount(String tableId, String server) {
        return replicaCounts(tableId).getOrDefault(server, 0);
    }

    /** Total replica count per server. */
    public SortedMap<String, Integer> totalReplicaCounts() {
        SortedMap<String, Integer> totals = new TreeMap<>();
        for (String server : servers) {
            totals.put(server, 0);
        }
        for (Map<String, Integer> counts : replicaCountsByTable.values()) {
            counts.forEach((server, count) -> totals.merge(server, count, Integer::sum));
        }
        return totals;
    }

    /** The difference between the highest and the lowest replica count of the table. */
    public int tableSkew(String tableId) {
        return skew(replicaCounts(tableId));
    }

    /** The difference between the highest and the lowest total replica count of the servers. */
    public int clusterSkew() {
        return skew(totalReplicaCounts());
    }

    public int numReplicas() {
        int numReplicas = 0;
        for (Map<String, Integer> counts : replicaCountsByTable.values()) {
            for (int count : counts.values()) {
                numReplicas += count;
            }
        }
        return numReplicas;
    }

    static int skew(Map<String, Integer> counts) {
        if (counts.isEmpty()) {
            return 0;
        }
        int min = Integer.MAX_VALUE;
        int max = Integer.MIN_VALUE;
        for (int count : counts.values()) {
            min = Math.min(min, count);
            max = Math.max(max, count);
        }
        return max - min;
    }

    @Override
    public String toString() {
        return String.format(
                "ClusterInfo[serverCount=%s,tableCount=%s,replicaCount=%s]",
                servers.size(), replicaCountsByTable.size(), numReplicas());
    }

    /** Builder of {@link ClusterInfo}. Servers must be added before replicas placed on them. */
    public static class Builder {
        private final SortedSet<String> servers = new TreeSet<>();
        private final SortedMap<String, SortedMap<String, Integer>> replicaCountsByTable =
                new TreeMap<>();
        private final Map<String, String> tableNames = new HashMap<>();

        public Builder addServer(String server) {
            servers.add(checkNotNull(server));
            return this;
        }

        public Builder addTable(String tableId, String tableName) {
            replicaCountsByTable.computeIfAbsent(checkNotNull(tableId), k -> new TreeMap<>());
            tableNames.put(tableId, checkNotNull(tableName));
            return this;
        }

        public Builder addReplica(String tableId, String server) {
            checkArgument(servers.contains(server), "server %s is not in the cluster", server);
            replicaCountsByTable
                    .computeIfAbsent(tableId, k -> new TreeMap<>())
                    .merge(server, 1, Integer::sum);
            return this;
        }

        public boolean hasServer(String server) {
            return servers.contains(server);
        }

        public ClusterInfo build() {
            SortedMap<String, SortedMap<String, Integer>> counts = new TreeMap<>();
            replicaCountsByTable.forEach(
                    (table, tableCounts) -> {
                        SortedMap<String, Integer> complete = new TreeMap<>();
                        for (String server : servers) {
                            complete.put(server, tableCounts.getOrDefault(server, 0));
                        }
                        counts.put(table, complete);
                    });
            return new ClusterInfo(new TreeSet<>(servers), counts, new HashMap<>(tableNames));
        }
    }
}
