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

import org.tabletrebalancer.exception.IllegalClusterStateException;
import org.tabletrebalancer.rebalance.health.ClusterRawInfo;
import org.tabletrebalancer.rebalance.health.ReplicaSummary;
import org.tabletrebalancer.rebalance.health.ServerHealthSummary;
import org.tabletrebalancer.rebalance.health.TableSummary;
import org.tabletrebalancer.rebalance.health.TabletHealth;
import org.tabletrebalancer.rebalance.health.TabletSummary;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.OptionalLong;
import java.util.Set;

import static org.tabletrebalancer.utils.Preconditions.checkNotNull;

/**
 * Translates cluster snapshots into the input of a rebalancing algorithm, and move intents of the
 * algorithm back into concrete tablet replica moves.
 */
public class SnapshotTranslator {
    private static final Logger LOG = LoggerFactory.getLogger(SnapshotTranslator.class);

    private final boolean moveRf1Replicas;
    private final List<String> tableFilters;

    public SnapshotTranslator(boolean moveRf1Replicas, List<String> tableFilters) {
        this.moveRf1Replicas = moveRf1Replicas;
        this.tableFilters = checkNotNull(tableFilters);
    }

    /**
     * Builds the balance model of the snapshot.
     *
     * <p>The moves in progress are interpreted as if they had already completed: the source
     * replica of such a move is counted at the destination server. Otherwise the algorithm would
     * propose the same moves again while they are still executing.
     *
     * <p>Tablet servers which are not healthy are left out of the model, as are the tablets of
     * tables with a replication factor of one unless moving those is enabled, and the tables which
     * do not pass the table filters.
     *
     * @throws IllegalClusterStateException if a tablet has a replica on a server the snapshot does
     *     not know about
     */
    public ClusterInfo buildClusterInfo(ClusterRawInfo rawInfo, MovesInProgress movesInProgress)
            throws IllegalClusterStateException {
        ClusterRawInfo filtered = rawInfo.filterByTables(tableFilters);
        Set<String> rf1Tables = rf1Tables(filtered);

        ClusterInfo.Builder builder = ClusterInfo.builder();
        Set<String> knownServers = new HashSet<>();
        for (ServerHealthSummary server : filtered.getServerSummaries()) {
            knownServers.add(server.getUuid());
            if (!server.isHealthy()) {
                LOG.info(
                        "Skipping tablet server {} ({}) because of its non-HEALTHY status ({}).",
                        server.getUuid(),
                        server.getAddress(),
                        server.getHealth());
                continue;
            }
            builder.addServer(server.getUuid());
        }
        for (TableSummary table : filtered.getTableSummaries()) {
            if (!rf1Tables.contains(table.getId())) {
                builder.addTable(table.getId(), table.getName());
            }
        }

        for (TabletSummary tablet : filtered.getTabletSummaries()) {
            if (rf1Tables.contains(tablet.getTableId())) {
                LOG.debug(
                        "Tablet {} of table '{}' has a single replica, skipping.",
                        tablet.getId(),
                        tablet.getTableName());
                continue;
            }
            ReplicaMove pendingMove = movesInProgress.get(tablet.getId());
            for (ReplicaSummary replica : tablet.getReplicas()) {
                String server = replica.getServerUuid();
                if (!knownServers.contains(server)) {
                    throw new IllegalClusterStateException(
                            String.format(
                                    "Tablet %s of table '%s' has a replica at tablet server %s%s "
                                            + "which is not reported among known tablet servers.",
                                    tablet.getId(),
                                    tablet.getTableName(),
                                    server,
                                    replica.getServerAddress()
                                            .map(a -> " (" + a + ")")
                                            .orElse("")));
                }
                String countedAt = countedAt(tablet, server, pendingMove);
                if (countedAt == null || !builder.hasServer(countedAt)) {
                    LOG.debug("Not counting replica of tablet {} at {}.", tablet.getId(), server);
                    continue;
                }
                builder.addReplica(tablet.getTableId(), countedAt);
            }
        }
        return builder.build();
    }

    /**
     * Finds the tablets of the intent's table which can move a replica from the intent's source to
     * its destination server. A tablet is a candidate if it is healthy (in particular not in the
     * middle of a configuration change), has a replica on the healthy source server, has no
     * replica on the destination server yet, and has more than one replica unless moving those is
     * enabled.
     *
     * @return the candidate tablet ids in ascending order, an empty list if there are none
     */
    public List<String> findReplicas(TableReplicaMove move, ClusterRawInfo rawInfo) {
        String tableId = move.getTableId();
        if (!moveRf1Replicas && rf1Tables(rawInfo).contains(tableId)) {
            return Collections.emptyList();
        }
        for (ServerHealthSummary server : rawInfo.getServerSummaries()) {
            if (server.getUuid().equals(move.getDestinationServer()) && !server.isHealthy()) {
                LOG.debug(
                        "Table {}: not considering moves to server {} since it is {}.",
                        tableId,
                        server.getUuid(),
                        server.getHealth());
                return Collections.emptyList();
            }
        }

        List<String> tabletIds = new ArrayList<>();
        for (TabletSummary tablet : rawInfo.getTabletSummaries()) {
            if (!tablet.getTableId().equals(tableId)) {
                continue;
            }
            if (tablet.getHealth() != TabletHealth.HEALTHY) {
                LOG.debug(
                        "Table {}: not considering replicas of tablet {} as candidates for "
                                + "movement since the tablet's status is {}.",
                        tableId,
                        tablet.getId(),
                        tablet.getHealth());
                continue;
            }
            if (tablet.hasReplicaAt(move.getDestinationServer())) {
                continue;
            }
            for (ReplicaSummary replica : tablet.getReplicas()) {
                if (replica.getServerUuid().equals(move.getSourceServer())) {
                    if (replica.isServerHealthy()) {
                        tabletIds.add(tablet.getId());
                    }
                    break;
                }
            }
        }
        Collections.sort(tabletIds);
        return tabletIds;
    }

    /**
     * Makes a concrete move of the tablet's replica for the intent. The move is guarded by the
     * tablet's consensus configuration version if the snapshot carries one.
     */
    public ReplicaMove toReplicaMove(
            TableReplicaMove move, String tabletId, ClusterRawInfo rawInfo) {
        OptionalLong configVersion = OptionalLong.empty();
        for (TabletSummary tablet : rawInfo.getTabletSummaries()) {
            if (tablet.getId().equals(tabletId)) {
                configVersion = tablet.getConfigVersion();
                break;
            }
        }
        ConfigVersionCheck versionCheck =
                configVersion.isPresent()
                        ? ConfigVersionCheck.expected(configVersion.getAsLong())
                        : ConfigVersionCheck.none();
        return new ReplicaMove(
                tabletId, move.getSourceServer(), move.getDestinationServer(), versionCheck);
    }

    /**
     * Removes the moves of tablets which already have a move in progress, so a tablet never has
     * more than one move in progress.
     */
    public static void filterMoves(MovesInProgress scheduledMoves, List<ReplicaMove> replicaMoves) {
        replicaMoves.removeIf(move -> scheduledMoves.contains(move.getTabletId()));
    }

    private Set<String> rf1Tables(ClusterRawInfo rawInfo) {
        Set<String> rf1Tables = new HashSet<>();
        if (!moveRf1Replicas) {
            for (TableSummary table : rawInfo.getTableSummaries()) {
                if (table.getReplicationFactor() == 1) {
                    rf1Tables.add(table.getId());
                }
            }
        }
        return rf1Tables;
    }

    /**
     * Returns the server the replica counts at, or null if the replica should not count: when both
     * the source and the destination replica of a pending move are present, the move is regarded
     * as completed and only the destination replica counts.
     */
    private static @Nullable String countedAt(
            TabletSummary tablet, String server, @Nullable ReplicaMove pendingMove) {
        if (pendingMove == null || !pendingMove.getSourceServer().equals(server)) {
            return server;
        }
        if (tablet.hasReplicaAt(pendingMove.getDestinationServer())) {
            return null;
        }
        return pendingMove.getDestinationServer();
    }
}
