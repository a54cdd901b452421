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
import org.tabletrebalancer.rebalance.model.MovesInProgress;
import org.tabletrebalancer.rebalance.model.ReplicaMove;

import java.util.List;

/**
 * Schedules and tracks the replica moves of a rebalancing run. The runner owns the connection to
 * the cluster and the accounting of the operations in flight per tablet server; it never lets more
 * than the configured number of moves touch a tablet server at the same time.
 *
 * <p>A runner is driven by a single thread.
 */
public interface Runner extends AutoCloseable {

    /**
     * Connects to the cluster.
     *
     * @throws ClusterConnectionException if the cluster cannot be reached
     */
    void init(List<String> masterAddresses) throws ClusterConnectionException;

    /**
     * Replaces the queue of moves waiting to be submitted and rebuilds the per-server accounting
     * from the moves in progress and the new queue.
     */
    void loadMoves(List<ReplicaMove> replicaMoves);

    /**
     * Submits at most one queued move. A move is only submitted if both of its tablet servers are
     * under the per-server limit; among those moves the ones touching the least loaded servers
     * are preferred.
     */
    ScheduleResult scheduleNextMove();

    /** Polls the moves in progress and releases the accounting of the completed ones. */
    PollResult updateMovesInProgressStatus();

    /**
     * Computes the next batch of moves against the current state of the cluster and loads it.
     *
     * @return false if there is nothing left to do: the cluster is balanced and no moves are in
     *     progress. An unbalanced cluster for which no move can be made yields true with an empty
     *     batch.
     */
    boolean getNextMoves() throws RebalanceException;

    /** The number of moves which completed successfully. */
    int movesCount();

    MovesInProgress scheduledMoves();

    boolean hasMovesInProgress();

    /**
     * Stops tracking the moves in progress. The moves keep running on the cluster; their outcome
     * is picked up by the next snapshot of the cluster.
     *
     * @return the number of moves no longer tracked
     */
    int forgetMovesInProgress();

    @Override
    void close();
}
