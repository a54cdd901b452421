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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A snapshot of the cluster as captured by the health scan: the tablet servers, tables and
 * tablets relevant to rebalancing. A snapshot is immutable and is replaced as a whole whenever the
 * cluster state is refreshed.
 */
public class ClusterRawInfo {

    private final List<ServerHealthSummary> serverSummaries;
    private final List<TableSummary> tableSummaries;
    private final List<TabletSummary> tabletSummaries;

    public ClusterRawInfo(
            List<ServerHealthSummary> serverSummaries,
            List<TableSummary> tableSummaries,
            List<TabletSummary> tabletSummaries) {
        this.serverSummaries = Collections.unmodifiableList(new ArrayList<>(serverSummaries));
        this.tableSummaries = Collections.unmodifiableList(new ArrayList<>(tableSummaries));
        this.tabletSummaries = Collections.unmodifiableList(new ArrayList<>(tabletSummaries));
    }

    public static ClusterRawInfo empty() {
        return new ClusterRawInfo(
                Collections.emptyList(), Collections.emptyList(), Collections.emptyList());
    }

    public List<ServerHealthSummary> getServerSummaries() {
        return serverSummaries;
    }

    public List<TableSummary> getTableSummaries() {
        return tableSummaries;
    }

    public List<TabletSummary> getTabletSummaries() {
        return tabletSummaries;
    }

    /**
     * Returns a snapshot which only contains the given tables and their tablets. Tables are matched
     * by name or by id. An empty filter keeps the whole cluster. Server summaries are always kept.
     */
    public ClusterRawInfo filterByTables(Collection<String> tableFilters) {
        if (tableFilters.isEmpty()) {
            return this;
        }
        Set<String> filters = new HashSet<>(tableFilters);
        List<TableSummary> tables =
                tableSummaries.stream()
                        .filter(t -> filters.contains(t.getName()) || filters.contains(t.getId()))
                        .collect(Collectors.toList());
        Set<String> tableIds = tables.stream().map(TableSummary::getId).collect(Collectors.toSet());
        List<TabletSummary> tablets =
                tabletSummaries.stream()
                        .filter(t -> tableIds.contains(t.getTableId()))
                        .collect(Collectors.toList());
        return new ClusterRawInfo(serverSummaries, tables, tablets);
    }

    @Override
    public String toString() {
        return String.format(
                "ClusterRawInfo[serverCount=%s,tableCount=%s,tabletCount=%s]",
                serverSummaries.size(), tableSummaries.size(), tabletSummaries.size());
    }
}
