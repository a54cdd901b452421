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

package org.tabletrebalancer.rebalance.runner;

import org.tabletrebalancer.exception.IllegalClusterStateException;
import org.tabletrebalancer.exception.RebalanceException;
import org.tabletrebalancer.exception.ReplicaMoveException;
import org.tabletrebalancer.rebalance.algo.RebalancingAlgorithm;
import org.tabletrebalancer.rebalance.client.ClusterClient;
import org.tabletrebalancer.rebalance.client.ClusterClientFactory;
import org.tabletrebalancer.rebalance.client.MoveStatus;
import org.tabletrebalancer.rebalance.health.ClusterRawInfo;
import org.tabletrebalancer.rebalance.health.ClusterSnapshotSource;
import org.tabletrebalancer.rebalance.health.ServerHealthSummary;
import org.tabletrebalancer.rebalance.model.ClusterInfo;
import org.tabletrebalancer.rebalance.model.ConfigVersionCheck;
import org.tabletrebalancer.rebalance.model.ReplicaMove;
import org.tabletrebalancer.rebalance.model.SnapshotTranslator;
import org.tabletrebalancer.rebalance.model.TableReplicaMove;
import org.tabletrebalancer.utils.clock.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Random;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import static org.tabletrebalancer.utils.Preconditions.checkNotNull;

/**
 * A runner which obtains its moves from a {@link RebalancingAlgorithm}. The algorithm proposes
 * per-table intents; the runner picks a concrete tablet for every intent and schedules the
 * resulting moves, spreading them over the least loaded tablet servers first.
 */
public abstract class AlgoBasedRunner extends BaseRunner {
    private static final Logger LOG = LoggerFactory.getLogger(AlgoBasedRunner.class);

    private final ClusterSnapshotSource snapshotSource;
    private final SnapshotTranslator translator;
    private final Random random;

    /** The queue of moves of the current batch, submitted moves are left in place. */
    private List<ReplicaMove> replicaMoves = new ArrayList<>();

    /** Indices of the queued moves per source tablet server. */
    private final Map<String, SortedSet<Integer>> srcOpIndices = new HashMap<>();

    /** Indices of the queued moves per destination tablet server. */
    private final Map<String, SortedSet<Integer>> dstOpIndices = new HashMap<>();

    protected AlgoBasedRunner(
            ClusterClientFactory clientFactory,
            ClusterSnapshotSource snapshotSource,
            SnapshotTranslator translator,
            int maxMovesPerServer,
            @Nullable Long deadlineNanos,
            Clock clock,
            Random random) {
        super(clientFactory, maxMovesPerServer, deadlineNanos, clock);
        this.snapshotSource = checkNotNull(snapshotSource);
        this.translator = checkNotNull(translator);
        this.random = checkNotNull(random);
    }

    /** The algorithm proposing the moves. */
    protected abstract RebalancingAlgorithm algorithm();

    @Override
    public void loadMoves(List<ReplicaMove> replicaMoves) {
        this.replicaMoves = new ArrayList<>(replicaMoves);
        srcOpIndices.clear();
        dstOpIndices.clear();

        Map<String, Integer> counts = new HashMap<>();
        for (ReplicaMove move : scheduledMoves) {
            counts.merge(move.getSourceServer(), 1, Integer::sum);
            counts.merge(move.getDestinationServer(), 1, Integer::sum);
        }
        for (int i = 0; i < this.replicaMoves.size(); i++) {
            ReplicaMove move = this.replicaMoves.get(i);
            srcOpIndices.computeIfAbsent(move.getSourceServer(), s -> new TreeSet<>()).add(i);
            dstOpIndices.computeIfAbsent(move.getDestinationServer(), s -> new TreeSet<>()).add(i);
            counts.putIfAbsent(move.getSourceServer(), 0);
            counts.putIfAbsent(move.getDestinationServer(), 0);
        }
        opCounts.clear();
        counts.forEach(opCounts::insert);
    }

    @Override
    public ScheduleResult scheduleNextMove() {
        if (isDeadlinePassed()) {
            return ScheduleResult.timedOut();
        }
        OptionalInt opIndex = findNextMove();
        if (!opIndex.isPresent()) {
            return ScheduleResult.nothingSchedulable();
        }
        ReplicaMove move = replicaMoves.get(opIndex.getAsInt());
        srcOpIndices.get(move.getSourceServer()).remove(opIndex.getAsInt());
        dstOpIndices.get(move.getDestinationServer()).remove(opIndex.getAsInt());
        // account before submitting, so a server never gets oversubscribed
        updateOnMoveScheduled(move.getSourceServer());
        updateOnMoveScheduled(move.getDestinationServer());
        try {
            submit(move);
        } catch (ReplicaMoveException e) {
            LOG.warn("{}: {} move ignored.", e.getMessage(), move, e);
            updateOnMoveCompleted(move.getSourceServer());
            updateOnMoveCompleted(move.getDestinationServer());
            return ScheduleResult.failed();
        }
        scheduledMoves.add(move);
        LOG.info("{} move scheduled.", move);
        return ScheduleResult.scheduled();
    }

    @Override
    public PollResult updateMovesInProgressStatus() {
        boolean hasUpdates = false;
        boolean hasErrors = false;
        boolean timedOut = false;
        for (ReplicaMove move : scheduledMoves.moves()) {
            if (isDeadlinePassed()) {
                timedOut = true;
                break;
            }
            MoveStatus status;
            try {
                status =
                        client().pollMoveStatus(
                                move.getTabletId(),
                                move.getSourceServer(),
                                move.getDestinationServer());
            } catch (ReplicaMoveException e) {
                LOG.warn(
                        "Error while checking for status of move {}, abandoning it.",
                        move,
                        e);
                hasErrors = true;
                completeMove(move);
                hasUpdates = true;
                continue;
            }
            if (!status.isCompleted()) {
                continue;
            }
            completeMove(move);
            hasUpdates = true;
            if (status.getState() == MoveStatus.State.SUCCEEDED) {
                onMoveSucceeded();
                LOG.info("{} move completed: OK.", move);
            } else {
                LOG.warn(
                        "{} move completed: {}.",
                        move,
                        status.getFailureReason().orElse("unknown failure"));
            }
        }
        return new PollResult(hasUpdates || timedOut, hasErrors, timedOut);
    }

    @Override
    protected boolean getNextMovesImpl(List<ReplicaMove> moves) throws RebalanceException {
        ClusterRawInfo rawInfo = snapshotSource.fetch();
        // moving replicas while servers are unhealthy would race the automatic re-replication
        for (ServerHealthSummary server : rawInfo.getServerSummaries()) {
            if (!server.isHealthy()) {
                throw new IllegalClusterStateException(
                        String.format(
                                "tablet server %s (%s): unacceptable health status %s",
                                server.getUuid(), server.getAddress(), server.getHealth()));
            }
        }

        ClusterInfo clusterInfo = translator.buildClusterInfo(rawInfo, scheduledMoves);
        RebalancingAlgorithm algorithm = algorithm();
        algorithm.refresh(clusterInfo);
        int maxMoves = maxMovesPerServer * clusterInfo.servers().size();
        List<TableReplicaMove> intents = algorithm.nextMoves(maxMoves);
        if (intents.isEmpty()) {
            return algorithm.isBalanced();
        }

        Set<String> tabletsInMove = new HashSet<>(scheduledMoves.tabletIds());
        for (TableReplicaMove intent : intents) {
            List<String> tabletIds = translator.findReplicas(intent, rawInfo);
            if (tabletIds.isEmpty()) {
                LOG.warn("{}: could not find any suitable replica to move.", intent);
                continue;
            }
            // spreads the moves over the tablets of a table
            Collections.shuffle(tabletIds, random);
            String moveTabletId = null;
            for (String tabletId : tabletIds) {
                if (!tabletsInMove.contains(tabletId)) {
                    moveTabletId = tabletId;
                    break;
                }
            }
            if (moveTabletId == null) {
                LOG.warn("{}: all suitable tablets are already moving a replica.", intent);
                continue;
            }
            tabletsInMove.add(moveTabletId);
            moves.add(translator.toReplicaMove(intent, moveTabletId, rawInfo));
        }
        LOG.info(
                "{}: {} intents proposed, {} moves found.",
                algorithm.name(),
                intents.size(),
                moves.size());
        return false;
    }

    /**
     * Finds a queued move whose tablet servers are both under the per-server limit. Pairs of the
     * least loaded servers are tried first.
     */
    private OptionalInt findNextMove() {
        List<String> servers = opCounts.serversUnderLimit(maxMovesPerServer, random);
        for (int i = 0; i < servers.size(); i++) {
            for (int j = i + 1; j < servers.size(); j++) {
                OptionalInt index = firstCommon(servers.get(i), servers.get(j));
                if (!index.isPresent()) {
                    index = firstCommon(servers.get(j), servers.get(i));
                }
                if (index.isPresent()) {
                    return index;
                }
            }
        }
        return OptionalInt.empty();
    }

    private OptionalInt firstCommon(String source, String destination) {
        SortedSet<Integer> srcIndices = srcOpIndices.get(source);
        SortedSet<Integer> dstIndices = dstOpIndices.get(destination);
        if (srcIndices == null || dstIndices == null) {
            return OptionalInt.empty();
        }
        for (int index : srcIndices) {
            if (dstIndices.contains(index)) {
                return OptionalInt.of(index);
            }
        }
        return OptionalInt.empty();
    }

    private void submit(ReplicaMove move) throws ReplicaMoveException {
        ClusterClient client = client();
        move.getVersionCheck()
                .accept(
                        new ConfigVersionCheck.Visitor<Void, ReplicaMoveException>() {
                            @Override
                            public Void visitNoVersionCheck() throws ReplicaMoveException {
                                client.submitReplicaMove(
                                        move.getTabletId(),
                                        move.getSourceServer(),
                                        move.getDestinationServer());
                                return null;
                            }

                            @Override
                            public Void visitExpectedVersion(long version)
                                    throws ReplicaMoveException {
                                client.submitReplicaMove(
                                        move.getTabletId(),
                                        move.getSourceServer(),
                                        move.getDestinationServer(),
                                        version);
                                return null;
                            }
                        });
    }

    private void completeMove(ReplicaMove move) {
        scheduledMoves.remove(move.getTabletId());
        updateOnMoveCompleted(move.getSourceServer());
        updateOnMoveCompleted(move.getDestinationServer());
    }
}
