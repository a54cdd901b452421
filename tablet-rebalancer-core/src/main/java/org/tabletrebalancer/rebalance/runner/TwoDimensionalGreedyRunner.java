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

import org.tabletrebalancer.rebalance.algo.RebalancingAlgorithm;
import org.tabletrebalancer.rebalance.algo.TwoDimensionalGreedyAlgorithm;
import org.tabletrebalancer.rebalance.client.ClusterClientFactory;
import org.tabletrebalancer.rebalance.health.ClusterSnapshotSource;
import org.tabletrebalancer.rebalance.model.SnapshotTranslator;
import org.tabletrebalancer.utils.clock.Clock;

import javax.annotation.Nullable;

import java.util.Random;

/** A runner balancing the cluster with the {@link TwoDimensionalGreedyAlgorithm}. */
public class TwoDimensionalGreedyRunner extends AlgoBasedRunner {

    private final TwoDimensionalGreedyAlgorithm algorithm;

    public TwoDimensionalGreedyRunner(
            ClusterClientFactory clientFactory,
            ClusterSnapshotSource snapshotSource,
            SnapshotTranslator translator,
            int maxMovesPerServer,
            @Nullable Long deadlineNanos,
            Clock clock,
            Random random) {
        super(
                clientFactory,
                snapshotSource,
                translator,
                maxMovesPerServer,
                deadlineNanos,
                clock,
                random);
        this.algorithm = new TwoDimensionalGreedyAlgorithm(random);
    }

    @Override
    protected RebalancingAlgorithm algorithm() {
        return algorithm;
    }
}
