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
import org.tabletrebalancer.exception.IllegalClusterStateException;
import org.tabletrebalancer.rebalance.health.ServerHealth;
import org.tabletrebalancer.rebalance.health.TabletHealth;
import org.tabletrebalancer.rebalance.model.ConfigVersionCheck;
import org.tabletrebalancer.rebalance.model.ReplicaMove;
import org.tabletrebalancer.rebalance.model.SnapshotTranslator;
import org.tabletrebalancer.rebalance.testutils.SimulatedCluster;
import org.tabletrebalancer.utils.clock.ManualClock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.annotation.Nullable;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Test for {@link AlgoBasedRunner}, through the {@link TwoDimensionalGreedyRunner}. */
class AlgoBasedRunnerTest {
    private static final List<String> MASTERS = Collections.singletonList("master-1:7051");

    private ManualClock clock;
    private SimulatedCluster cluster;

    @BeforeEach
    void setup() {
        clock = new ManualClock();
        cluster =
                new SimulatedCluster(clock)
                        .addServers("A", "B", "C", "D")
                        .addTable("T", "table_t", 2)
                        .addTablet("t1", "T", "A", "B")
                        .addTablet("t2", "T", "A", "B")
                        .addTablet("t3", "T", "A", "B")
                        .addTablet("t4", "T", "A", "B");
    }

    @Test
    void testMovesPerServerNeverExceedLimit() throws Exception {
        try (Runner runner = createRunner(cluster, 2, null, new Random(0))) {
            runner.init(MASTERS);
            runner.loadMoves(
                    Arrays.asList(
                            new ReplicaMove("t1", "A", "C"),
                            new ReplicaMove("t2", "A", "D"),
                            new ReplicaMove("t3", "A", "C")));

            assertThat(runner.scheduleNextMove().isScheduled()).isTrue();
            assertThat(runner.scheduleNextMove().isScheduled()).isTrue();
            Set<String> scheduled = new HashSet<>(runner.scheduledMoves().tabletIds());
            ScheduleResult blocked = runner.scheduleNextMove();
            assertThat(blocked.isScheduled()).isFalse();
            assertThat(blocked.hasErrors()).isFalse();
            assertThat(blocked.isTimedOut()).isFalse();
            assertThat(runner.scheduledMoves().size()).isEqualTo(2);
            assertThat(cluster.getMaxInFlightPerServer()).isEqualTo(2);

            PollResult pollResult = runner.updateMovesInProgressStatus();
            assertThat(pollResult.hasUpdates()).isTrue();
            assertThat(pollResult.hasErrors()).isFalse();
            assertThat(runner.movesCount()).isEqualTo(2);
            assertThat(runner.hasMovesInProgress()).isFalse();

            assertThat(runner.scheduleNextMove().isScheduled()).isTrue();
            scheduled.addAll(runner.scheduledMoves().tabletIds());
            assertThat(runner.scheduledMoves().size()).isEqualTo(1);
            assertThat(scheduled).containsExactlyInAnyOrder("t1", "t2", "t3");
            assertThat(runner.scheduleNextMove().isScheduled()).isFalse();
        }
        assertThat(cluster.getMaxInFlightPerServer()).isLessThanOrEqualTo(2);
        assertThat(cluster.isClosed()).isTrue();
    }

    @Test
    void testEquallyLoadedServersAreChosenUniformly() throws Exception {
        int trials = 2000;
        int firstPairChosen = 0;
        for (int seed = 0; seed < trials; seed++) {
            SimulatedCluster simulated =
                    new SimulatedCluster(new ManualClock())
                            .addServers("A", "B", "C", "D")
                            .addTable("T", "table_t", 2)
                            .addTablet("t1", "T", "A", "B")
                            .addTablet("t2", "T", "B", "A");
            try (Runner runner = createRunner(simulated, 1, null, new Random(seed))) {
                runner.init(MASTERS);
                runner.loadMoves(
                        Arrays.asList(
                                new ReplicaMove("t1", "A", "C"), new ReplicaMove("t2", "B", "D")));
                assertThat(runner.scheduleNextMove().isScheduled()).isTrue();
                if (runner.scheduledMoves().contains("t1")) {
                    firstPairChosen++;
                }
            }
        }
        assertThat(firstPairChosen).isBetween(trials * 4 / 10, trials * 6 / 10);
    }

    @Test
    void testDeadline() throws Exception {
        long deadlineNanos = clock.nanoseconds() + TimeUnit.SECONDS.toNanos(1);
        try (Runner runner = createRunner(cluster, 2, deadlineNanos, new Random(0))) {
            runner.init(MASTERS);
            cluster.setMoveBehavior(SimulatedCluster.MoveBehavior.STAY_PENDING);
            runner.loadMoves(Collections.singletonList(new ReplicaMove("t1", "A", "C")));
            assertThat(runner.scheduleNextMove().isScheduled()).isTrue();

            clock.advanceTime(2, TimeUnit.SECONDS);
            PollResult pollResult = runner.updateMovesInProgressStatus();
            assertThat(pollResult.isTimedOut()).isTrue();
            assertThat(pollResult.hasUpdates()).isTrue();
            assertThat(runner.hasMovesInProgress()).isTrue();

            runner.loadMoves(Collections.singletonList(new ReplicaMove("t2", "A", "D")));
            assertThat(runner.scheduleNextMove().isTimedOut()).isTrue();
            assertThat(runner.scheduledMoves().tabletIds()).containsExactly("t1");
        }
    }

    @Test
    void testRejectedSubmissionIsDropped() throws Exception {
        cluster.setConfigVersion("t1", 2L);
        try (Runner runner = createRunner(cluster, 1, null, new Random(0))) {
            runner.init(MASTERS);
            runner.loadMoves(
                    Collections.singletonList(
                            new ReplicaMove("t1", "A", "C", ConfigVersionCheck.expected(1))));
            ScheduleResult result = runner.scheduleNextMove();
            assertThat(result.isScheduled()).isFalse();
            assertThat(result.hasErrors()).isTrue();
            assertThat(runner.hasMovesInProgress()).isFalse();
            assertThat(runner.scheduleNextMove()).isSameAs(ScheduleResult.nothingSchedulable());

            // both moves share server A, the rejected one must release it
            runner.loadMoves(
                    Arrays.asList(
                            new ReplicaMove("t1", "A", "C", ConfigVersionCheck.expected(1)),
                            new ReplicaMove("t2", "A", "D")));
            int failures = 0;
            while (true) {
                ScheduleResult next = runner.scheduleNextMove();
                if (next.hasErrors()) {
                    failures++;
                } else if (!next.isScheduled()) {
                    if (!runner.hasMovesInProgress()) {
                        break;
                    }
                    runner.updateMovesInProgressStatus();
                }
            }
            assertThat(failures).isEqualTo(1);
            assertThat(runner.movesCount()).isEqualTo(1);
            assertThat(cluster.replicasOf("t2")).containsExactly("D", "B");
            assertThat(cluster.getSubmissions()).isEqualTo(3);
        }
        assertThat(cluster.getMaxInFlightPerServer()).isEqualTo(1);
    }

    @Test
    void testCompletedAndAbandonedMoves() throws Exception {
        try (Runner runner = createRunner(cluster, 5, null, new Random(0))) {
            runner.init(MASTERS);
            cluster.setMoveBehavior(SimulatedCluster.MoveBehavior.FAIL);
            runner.loadMoves(Collections.singletonList(new ReplicaMove("t1", "A", "C")));
            assertThat(runner.scheduleNextMove().isScheduled()).isTrue();
            PollResult failed = runner.updateMovesInProgressStatus();
            assertThat(failed.hasUpdates()).isTrue();
            assertThat(failed.hasErrors()).isFalse();
            assertThat(runner.movesCount()).isEqualTo(0);
            assertThat(runner.hasMovesInProgress()).isFalse();

            cluster.setMoveBehavior(SimulatedCluster.MoveBehavior.STAY_PENDING);
            runner.loadMoves(Collections.singletonList(new ReplicaMove("t2", "A", "C")));
            assertThat(runner.scheduleNextMove().isScheduled()).isTrue();
            PollResult pending = runner.updateMovesInProgressStatus();
            assertThat(pending.hasUpdates()).isFalse();
            assertThat(runner.hasMovesInProgress()).isTrue();

            cluster.setFailPolls(true);
            PollResult abandoned = runner.updateMovesInProgressStatus();
            assertThat(abandoned.hasUpdates()).isTrue();
            assertThat(abandoned.hasErrors()).isTrue();
            assertThat(runner.hasMovesInProgress()).isFalse();
            assertThat(runner.movesCount()).isEqualTo(0);
        }
    }

    @Test
    void testGetNextMovesBalancesCluster() throws Exception {
        cluster.setPollsToComplete(3);
        try (Runner runner = createRunner(cluster, 2, null, new Random(11))) {
            runner.init(MASTERS);
            assertThat(runner.getNextMoves()).isTrue();
            while (runner.scheduleNextMove().isScheduled()) {
                assertThat(cluster.getMaxInFlightPerServer()).isLessThanOrEqualTo(2);
            }
            assertThat(runner.scheduledMoves().size()).isEqualTo(4);

            // the moves in progress are accounted for, nothing new is proposed
            assertThat(runner.getNextMoves()).isTrue();
            assertThat(runner.scheduleNextMove().isScheduled()).isFalse();
            assertThat(cluster.getDuplicateTabletMoves()).isEqualTo(0);

            while (runner.hasMovesInProgress()) {
                runner.updateMovesInProgressStatus();
            }
            assertThat(runner.movesCount()).isEqualTo(4);
            assertThat(cluster.replicaCounts())
                    .containsEntry("A", 2)
                    .containsEntry("B", 2)
                    .containsEntry("C", 2)
                    .containsEntry("D", 2);
            assertThat(runner.getNextMoves()).isFalse();
        }
    }

    @Test
    void testGetNextMovesWithoutMovableTablets() throws Exception {
        for (String tabletId : Arrays.asList("t1", "t2", "t3", "t4")) {
            cluster.setTabletHealth(tabletId, TabletHealth.RECOVERING);
        }
        try (Runner runner = createRunner(cluster, 2, null, new Random(0))) {
            runner.init(MASTERS);
            // not balanced, although nothing can be moved right now
            assertThat(runner.getNextMoves()).isTrue();
            ScheduleResult result = runner.scheduleNextMove();
            assertThat(result.isScheduled()).isFalse();
            assertThat(result.hasErrors()).isFalse();
            assertThat(runner.hasMovesInProgress()).isFalse();
            assertThat(cluster.getSubmissions()).isEqualTo(0);

            for (String tabletId : Arrays.asList("t1", "t2", "t3", "t4")) {
                cluster.setTabletHealth(tabletId, TabletHealth.HEALTHY);
            }
            assertThat(runner.getNextMoves()).isTrue();
            assertThat(runner.scheduleNextMove().isScheduled()).isTrue();
        }
    }

    @Test
    void testGetNextMovesRejectsUnhealthyServers() throws Exception {
        cluster.setServerHealth("C", ServerHealth.UNAVAILABLE);
        try (Runner runner = createRunner(cluster, 2, null, new Random(0))) {
            runner.init(MASTERS);
            assertThatThrownBy(runner::getNextMoves)
                    .isInstanceOf(IllegalClusterStateException.class)
                    .hasMessageContaining("tablet server C")
                    .hasMessageContaining("unacceptable health status UNAVAILABLE");
        }
    }

    @Test
    void testForgetMovesInProgress() throws Exception {
        cluster.setMoveBehavior(SimulatedCluster.MoveBehavior.STAY_PENDING);
        try (Runner runner = createRunner(cluster, 1, null, new Random(0))) {
            runner.init(MASTERS);
            runner.loadMoves(
                    Arrays.asList(
                            new ReplicaMove("t1", "A", "C"), new ReplicaMove("t2", "B", "D")));
            assertThat(runner.scheduleNextMove().isScheduled()).isTrue();
            assertThat(runner.scheduleNextMove().isScheduled()).isTrue();

            assertThat(runner.forgetMovesInProgress()).isEqualTo(2);
            assertThat(runner.hasMovesInProgress()).isFalse();
            assertThat(runner.scheduleNextMove().isScheduled()).isFalse();
            assertThat(runner.forgetMovesInProgress()).isEqualTo(0);
        }
    }

    @Test
    void testInit() {
        cluster.setUnreachable(true);
        Runner runner = createRunner(cluster, 1, null, new Random(0));
        assertThatThrownBy(() -> runner.init(MASTERS))
                .isInstanceOf(ClusterConnectionException.class)
                .hasMessageContaining("master-1:7051");
        runner.close();
        assertThat(cluster.isClosed()).isFalse();
    }

    private TwoDimensionalGreedyRunner createRunner(
            SimulatedCluster cluster,
            int maxMovesPerServer,
            @Nullable Long deadlineNanos,
            Random random) {
        return new TwoDimensionalGreedyRunner(
                cluster,
                () -> cluster.scan(Collections.emptyList()),
                new SnapshotTranslator(false, Collections.emptyList()),
                maxMovesPerServer,
                deadlineNanos,
                clock,
                random);
    }
}
