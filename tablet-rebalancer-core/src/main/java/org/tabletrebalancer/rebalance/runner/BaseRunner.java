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

import org.tabletrebalancer.exception.ClusterConnectionException;
import org.tabletrebalancer.exception.RebalanceException;
import org.tabletrebalancer.rebalance.client.ClusterClient;
import org.tabletrebalancer.rebalance.client.ClusterClientFactory;
import org.tabletrebalancer.rebalance.model.MovesInProgress;
import org.tabletrebalancer.rebalance.model.ReplicaMove;
import org.tabletrebalancer.rebalance.model.ServerOpCounts;
import org.tabletrebalancer.rebalance.model.SnapshotTranslator;
import org.tabletrebalancer.utils.clock.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.util.ArrayList;
import java.util.List;

import static org.tabletrebalancer.utils.Preconditions.checkArgument;
import static org.tabletrebalancer.utils.Preconditions.checkNotNull;
import static org.tabletrebalancer.utils.Preconditions.checkState;

/**
 * Base of the runners: connection handling, batch computation and the accounting of the
 * operations in flight per tablet server.
 */
public abstract class BaseRunner implements Runner {
    private static final Logger LOG = LoggerFactory.getLogger(BaseRunner.class);

    private final ClusterClientFactory clientFactory;

    protected final int maxMovesPerServer;

    /** Deadline of the run in clock nanoseconds, null if the run is not bounded. */
    protected final @Nullable Long deadlineNanos;

    protected final Clock clock;

    protected final MovesInProgress scheduledMoves = new MovesInProgress();

    /** The number of operations in flight or queued per tablet server. */
    protected final ServerOpCounts opCounts = new ServerOpCounts();

    private @Nullable ClusterClient client;
    private int movesCount;

    protected BaseRunner(
            ClusterClientFactory clientFactory,
            int maxMovesPerServer,
            @Nullable Long deadlineNanos,
            Clock clock) {
        checkArgument(maxMovesPerServer > 0, "maxMovesPerServer must be positive");
        this.clientFactory = checkNotNull(clientFactory);
        this.maxMovesPerServer = maxMovesPerServer;
        this.deadlineNanos = deadlineNanos;
        this.clock = checkNotNull(clock);
    }

    @Override
    public void init(List<String> masterAddresses) throws ClusterConnectionException {
        checkState(client == null, "runner is already initialized");
        checkArgument(!masterAddresses.isEmpty(), "no master addresses given");
        client = clientFactory.connect(masterAddresses);
        LOG.info("Connected to cluster at {}.", masterAddresses);
    }

    @Override
    public boolean getNextMoves() throws RebalanceException {
        List<ReplicaMove> replicaMoves = new ArrayList<>();
        boolean balanced = getNextMovesImpl(replicaMoves);
        if (replicaMoves.isEmpty() && scheduledMoves.isEmpty()) {
            if (balanced) {
                return false;
            }
            LOG.warn("The cluster is not balanced, but none of the proposed moves can be made.");
        }
        // the moves in progress are accounted for already, they must not be submitted twice
        SnapshotTranslator.filterMoves(scheduledMoves, replicaMoves);
        LOG.info(
                "Loading {} moves, {} moves in progress.",
                replicaMoves.size(),
                scheduledMoves.size());
        loadMoves(replicaMoves);
        return true;
    }

    /**
     * Computes the next batch of moves and adds them to the given list.
     *
     * @return whether the algorithm considers the cluster balanced
     */
    protected abstract boolean getNextMovesImpl(List<ReplicaMove> replicaMoves)
            throws RebalanceException;

    /** Releases an operation of the tablet server once a move touching it has completed. */
    protected void updateOnMoveCompleted(String server) {
        opCounts.decrement(server);
    }

    /** Accounts an operation of the tablet server once a move touching it has been submitted. */
    protected void updateOnMoveScheduled(String server) {
        opCounts.increment(server);
    }

    protected void onMoveSucceeded() {
        movesCount++;
    }

    protected boolean isDeadlinePassed() {
        return deadlineNanos != null && clock.nanoseconds() >= deadlineNanos;
    }

    protected ClusterClient client() {
        checkState(client != null, "runner is not initialized");
        return client;
    }

    @Override
    public int movesCount() {
        return movesCount;
    }

    @Override
    public MovesInProgress scheduledMoves() {
        return scheduledMoves;
    }

    @Override
    public boolean hasMovesInProgress() {
        return !scheduledMoves.isEmpty();
    }

    @Override
    public int forgetMovesInProgress() {
        int forgotten = scheduledMoves.size();
        if (forgotten > 0) {
            LOG.warn("Forgetting {} moves in progress: {}.", forgotten, scheduledMoves);
        }
        scheduledMoves.clear();
        // queued moves are accounted with the ones in progress, start over from the next batch
        loadMoves(new ArrayList<>());
        return forgotten;
    }

    @Override
    public void close() {
        if (client != null) {
            client.close();
            client = null;
        }
    }
}
