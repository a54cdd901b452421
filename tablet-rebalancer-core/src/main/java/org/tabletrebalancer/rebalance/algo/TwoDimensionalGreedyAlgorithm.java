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

package org.tabletrebalancer.rebalance.algo;

import org.tabletrebalancer.rebalance.model.ClusterInfo;
import org.tabletrebalancer.rebalance.model.TableReplicaMove;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.function.ToIntFunction;

import static org.tabletrebalancer.utils.Preconditions.checkArgument;
import static org.tabletrebalancer.utils.Preconditions.checkNotNull;
import static org.tabletrebalancer.utils.Preconditions.checkState;

/**
 * A greedy algorithm balancing replicas in two dimensions: the replica count of every table across
 * the tablet servers (table skew), and the total replica count across the tablet servers (cluster
 * skew).
 *
 * <ul>
 *   <li>The most skewed table is balanced first, by moving one of its replicas from a server
 *       hosting the most replicas of the table to a server hosting the fewest. Among such servers
 *       the ones with the highest, respectively lowest, total replica count are preferred.
 *   <li>Once no table has a skew above one, replicas are moved only if this lowers the cluster
 *       skew without raising any table skew above one.
 * </ul>
 *
 * <p>Ties are broken with the given random source.
 */
public class TwoDimensionalGreedyAlgorithm implements RebalancingAlgorithm {
    private static final Logger LOG = LoggerFactory.getLogger(TwoDimensionalGreedyAlgorithm.class);

    private final Random random;
    private @Nullable ClusterInfo clusterInfo;

    public TwoDimensionalGreedyAlgorithm(Random random) {
        this.random = checkNotNull(random);
    }

    @Override
    public void refresh(ClusterInfo clusterInfo) {
        this.clusterInfo = checkNotNull(clusterInfo);
    }

    @Override
    public List<TableReplicaMove> nextMoves(int maxMovesNum) {
        checkArgument(maxMovesNum >= 0, "maximum number of moves must not be negative");
        BalanceState state = new BalanceState(currentClusterInfo());
        List<TableReplicaMove> moves = new ArrayList<>();
        while (moves.size() < maxMovesNum) {
            Optional<TableReplicaMove> move = findNextMove(state);
            if (!move.isPresent()) {
                break;
            }
            state.apply(move.get());
            moves.add(move.get());
        }
        LOG.debug("Proposed {} moves for {}.", moves.size(), clusterInfo);
        return moves;
    }

    @Override
    public boolean isBalanced() {
        return !findNextMove(new BalanceState(currentClusterInfo())).isPresent();
    }

    @Override
    public String name() {
        return "TwoDimensionalGreedy";
    }

    private ClusterInfo currentClusterInfo() {
        checkState(clusterInfo != null, "the algorithm has not been refreshed with cluster info");
        return clusterInfo;
    }

    private Optional<TableReplicaMove> findNextMove(BalanceState state) {
        int clusterSkew = skew(state.totals);

        List<String> tables = new ArrayList<>(state.countsByTable.keySet());
        // shuffling before the stable sort randomizes the order among equally skewed tables
        Collections.shuffle(tables, random);
        tables.sort(
                Comparator.comparingInt((String t) -> skew(state.countsByTable.get(t)))
                        .reversed());

        for (String table : tables) {
            Map<String, Integer> counts = state.countsByTable.get(table);
            int tableSkew = skew(counts);
            if (tableSkew == 0 || (tableSkew == 1 && clusterSkew <= 1)) {
                // tables are sorted by skew, none of the remaining ones needs a move
                break;
            }
            int maxCount = Collections.max(counts.values());
            int minCount = Collections.min(counts.values());
            String source =
                    pick(serversWithCount(counts, maxCount), server -> -state.totals.get(server));
            String destination =
                    pick(serversWithCount(counts, minCount), state.totals::get);
            if (tableSkew > 1 || state.totals.get(source) - state.totals.get(destination) > 1) {
                return Optional.of(new TableReplicaMove(table, source, destination));
            }
        }
        return Optional.empty();
    }

    /** Picks the server with the lowest key, ties broken randomly. */
    private String pick(List<String> servers, ToIntFunction<String> key) {
        int best = Integer.MAX_VALUE;
        List<String> candidates = new ArrayList<>();
        for (String server : servers) {
            int value = key.applyAsInt(server);
            if (value < best) {
                best = value;
                candidates.clear();
            }
            if (value == best) {
                candidates.add(server);
            }
        }
        return candidates.get(random.nextInt(candidates.size()));
    }

    private static List<String> serversWithCount(Map<String, Integer> counts, int count) {
        List<String> servers = new ArrayList<>();
        counts.forEach(
                (server, c) -> {
                    if (c == count) {
                        servers.add(server);
                    }
                });
        Collections.sort(servers);
        return servers;
    }

    private static int skew(Map<String, Integer> counts) {
        if (counts.isEmpty()) {
            return 0;
        }
        return Collections.max(counts.values()) - Collections.min(counts.values());
    }

    /** A mutable copy of the balance model, moves are applied to it while computing a batch. */
    private static final class BalanceState {
        private final Map<String, Map<String, Integer>> countsByTable = new HashMap<>();
        private final Map<String, Integer> totals;

        private BalanceState(ClusterInfo clusterInfo) {
            for (String table : clusterInfo.tables()) {
                countsByTable.put(table, new HashMap<>(clusterInfo.replicaCounts(table)));
            }
            this.totals = new HashMap<>(clusterInfo.totalReplicaCounts());
        }

        private void apply(TableReplicaMove move) {
            Map<String, Integer> counts = countsByTable.get(move.getTableId());
            counts.merge(move.getSourceServer(), -1, Integer::sum);
            counts.merge(move.getDestinationServer(), 1, Integer::sum);
            totals.merge(move.getSourceServer(), -1, Integer::sum);
            totals.merge(move.getDestinationServer(), 1, Integer::sum);
        }
    }
}
