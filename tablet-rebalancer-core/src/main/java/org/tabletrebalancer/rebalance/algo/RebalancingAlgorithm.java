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

import java.util.List;

/**
 * A placement algorithm deciding which replicas to move to balance the cluster. The algorithm
 * works on the balance model only; it proposes per-table intents and leaves the choice of the
 * tablets to the caller.
 */
public interface RebalancingAlgorithm {

    /** Replaces the balance model the algorithm works on. */
    void refresh(ClusterInfo clusterInfo);

    /**
     * Proposes the next batch of move intents for the current balance model. The intents of one
     * batch are consistent with each other: they are computed as if the preceding intents of the
     * batch had been applied.
     *
     * @param maxMovesNum the maximum number of intents to return
     * @return the intents, an empty list if the cluster is balanced
     */
    List<TableReplicaMove> nextMoves(int maxMovesNum);

    /** Whether the current balance model needs no further moves. */
    boolean isBalanced();

    /** The name of the algorithm, in human readable form. */
    String name();
}
