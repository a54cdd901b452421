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

package org.tabletrebalancer.rebalance;

import org.tabletrebalancer.exception.ClusterConnectionException;
import org.tabletrebalancer.exception.IllegalClusterStateException;
import org.tabletrebalancer.exception.RebalanceStalledException;
import org.tabletrebalancer.rebalance.health.ServerHealth;
import org.tabletrebalancer.rebalance.health.TabletHealth;
import org.tabletrebalancer.rebalance.testutils.SimulatedCluster;
import org.tabletrebalancer.utils.clock.ManualClock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Collections;
import java.util.Random;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Test for {@link Rebalancer}, run against a {@link SimulatedCluster}. */
class RebalancerTest {

    private ManualClock clock;
    private SimulatedCluster cluster;

    @BeforeEach
    void setup() {
        clock = new ManualClock();
        cluster =
                new SimulatedCluster(clock)
                        .addServers("A", "B", "C", "D")
                        .addTable("T", "table_t", 2);
        for (int i = 0; i < 8; i++) {
            cluster.addTablet("t" + i, "T", "A", "B");
        }
    }

    @Test
    void testBalancedClusterNeedsNoMoves() throws Exception {
        SimulatedCluster balanced =
                new SimulatedCluster(clock)
                        .addServers("A", "B", "C")
                        .addTable("T", "table_t", 3)
                        .addTablet("t1", "T", "A", "B", "C")
                        .addTablet("t2", "T", "C", "A", "B");
        Rebalancer rebalancer = createRebalancer(balanced, configBuilder().build());
        assertThat(rebalancer.getRunStatus()).isEqualTo(RunStatus.UNKNOWN);

        RunResult result = rebalancer.run();
        assertThat(result).isEqualTo(new RunResult(RunStatus.CLUSTER_IS_BALANCED, 0));
        assertThat(rebalancer.getRunStatus()).isEqualTo(RunStatus.CLUSTER_IS_BALANCED);
        assertThat(balanced.getSubmissions()).isEqualTo(0);
        assertThat(balanced.isConnected()).isTrue();
        assertThat(balanced.isClosed()).isTrue();

        assertThatThrownBy(rebalancer::run)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already been run");
    }

    @Test
    void testRunBalancesCluster() throws Exception {
        cluster.setPollsToComplete(2);
        Rebalancer rebalancer =
                createRebalancer(cluster, configBuilder().maxMovesPerServer(2).build());

        RunResult result = rebalancer.run();
        assertThat(result).isEqualTo(new RunResult(RunStatus.CLUSTER_IS_BALANCED, 8));
        assertThat(cluster.replicaCounts())
                .containsEntry("A", 4)
                .containsEntry("B", 4)
                .containsEntry("C", 4)
                .containsEntry("D", 4);
        assertThat(cluster.getMaxInFlightPerServer()).isLessThanOrEqualTo(2);
        assertThat(cluster.getDuplicateTabletMoves()).isEqualTo(0);
        assertThat(cluster.getPendingMoves()).isEqualTo(0);
    }

    @Test
    void testRunBalancesFilteredTablesOnly() throws Exception {
        cluster.addTable("U", "table_u", 2);
        for (int i = 0; i < 4; i++) {
            cluster.addTablet("u" + i, "U", "C", "D");
        }
        Rebalancer rebalancer =
                createRebalancer(
                        cluster,
                        configBuilder()
                                .tableFilters(Collections.singletonList("table_u"))
                                .build());

        RunResult result = rebalancer.run();
        assertThat(result.getStatus()).isEqualTo(RunStatus.CLUSTER_IS_BALANCED);
        assertThat(result.getMovesCount()).isEqualTo(4);
        assertThat(cluster.replicaCounts("U"))
                .containsEntry("A", 2)
                .containsEntry("B", 2)
                .containsEntry("C", 2)
                .containsEntry("D", 2);
        assertThat(cluster.replicaCounts("T")).containsEntry("A", 8).containsEntry("C", 0);
    }

    @Test
    void testTimesOutWhenMovesNeverComplete() throws Exception {
        cluster.setMoveBehavior(SimulatedCluster.MoveBehavior.STAY_PENDING);
        Rebalancer rebalancer =
                createRebalancer(
                        cluster, configBuilder().maxRunTime(Duration.ofSeconds(5)).build());

        RunResult result = rebalancer.run();
        assertThat(result).isEqualTo(new RunResult(RunStatus.TIMED_OUT, 0));
        assertThat(clock.milliseconds()).isBetween(5000L, 5500L);
        assertThat(cluster.getPendingMoves()).isGreaterThan(0);
        assertThat(cluster.isClosed()).isTrue();
    }

    @Test
    void testTimesOutOnSystemClock() throws Exception {
        cluster.setMoveBehavior(SimulatedCluster.MoveBehavior.STAY_PENDING);
        Rebalancer rebalancer =
                new Rebalancer(
                        configBuilder()
                                .maxRunTime(Duration.ofSeconds(1))
                                .pollInterval(Duration.ofMillis(20))
                                .build(),
                        cluster,
                        cluster);

        long start = System.nanoTime();
        RunResult result = rebalancer.run();
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        assertThat(result.getStatus()).isEqualTo(RunStatus.TIMED_OUT);
        assertThat(elapsedMillis).isGreaterThanOrEqualTo(900L).isLessThan(5000L);
    }

    @Test
    void testUnbalancedClusterWithoutMovableTabletsTimesOut() throws Exception {
        for (int i = 0; i < 8; i++) {
            cluster.setTabletHealth("t" + i, TabletHealth.RECOVERING);
        }
        Rebalancer rebalancer =
                createRebalancer(
                        cluster, configBuilder().maxRunTime(Duration.ofSeconds(5)).build());

        RunResult result = rebalancer.run();
        assertThat(result).isEqualTo(new RunResult(RunStatus.TIMED_OUT, 0));
        assertThat(clock.milliseconds()).isBetween(5000L, 5500L);
        assertThat(cluster.getSubmissions()).isEqualTo(0);
        assertThat(cluster.replicaCounts()).containsEntry("A", 8).containsEntry("C", 0);
    }

    @Test
    void testUnbalancedClusterWithoutMovableTabletsStalls() {
        for (int i = 0; i < 8; i++) {
            cluster.setTabletHealth("t" + i, TabletHealth.UNDER_REPLICATED);
        }
        Rebalancer rebalancer =
                createRebalancer(
                        cluster,
                        configBuilder()
                                .maxStalenessInterval(Duration.ofSeconds(1))
                                .maxStalenessResets(1)
                                .build());

        assertThatThrownBy(rebalancer::run).isInstanceOf(RebalanceStalledException.class);
        assertThat(rebalancer.getRunStatus()).isEqualTo(RunStatus.UNKNOWN);
        assertThat(cluster.getSubmissions()).isEqualTo(0);
    }

    @Test
    void testStalledRunWithRunTimeTimesOut() throws Exception {
        cluster.setRejectSubmissions(true);
        Rebalancer rebalancer =
                createRebalancer(
                        cluster,
                        configBuilder()
                                .maxStalenessInterval(Duration.ofSeconds(2))
                                .maxStalenessResets(1)
                                .maxRunTime(Duration.ofSeconds(60))
                                .build());

        // the run starts over after every staleness period until it times out
        RunResult result = rebalancer.run();
        assertThat(result).isEqualTo(new RunResult(RunStatus.TIMED_OUT, 0));
        assertThat(clock.milliseconds()).isBetween(60000L, 61000L);
        assertThat(cluster.getSubmissions()).isGreaterThan(0);
        assertThat(cluster.isClosed()).isTrue();
    }

    @Test
    void testRunFailsWhenStalled() {
        cluster.setRejectSubmissions(true);
        // without a maximum run time the staleness resets are bounded
        Rebalancer rebalancer =
                createRebalancer(
                        cluster,
                        configBuilder()
                                .maxStalenessInterval(Duration.ofSeconds(2))
                                .maxStalenessResets(1)
                                .build());

        assertThatThrownBy(rebalancer::run)
                .isInstanceOf(RebalanceStalledException.class)
                .hasMessageContaining("Stalled with no progress");
        assertThat(rebalancer.getRunStatus()).isEqualTo(RunStatus.UNKNOWN);
        assertThat(cluster.getSubmissions()).isGreaterThan(0);
        assertThat(clock.milliseconds()).isGreaterThan(4000L);
        assertThat(cluster.isClosed()).isTrue();
    }

    @Test
    void testStaleMovesAreForgotten() {
        cluster.setMoveBehavior(SimulatedCluster.MoveBehavior.STAY_PENDING);
        Rebalancer rebalancer =
                createRebalancer(
                        cluster,
                        configBuilder()
                                .maxMovesPerServer(1)
                                .maxStalenessInterval(Duration.ofSeconds(1))
                                .maxStalenessResets(2)
                                .build());

        assertThatThrownBy(rebalancer::run).isInstanceOf(RebalanceStalledException.class);
        // every batch after a reset submits moves again
        assertThat(cluster.getSubmissions()).isGreaterThanOrEqualTo(3);
        assertThat(cluster.getPendingMoves()).isGreaterThan(0);
    }

    @Test
    void testUnreachableCluster() {
        cluster.setUnreachable(true);
        Rebalancer rebalancer = createRebalancer(cluster, configBuilder().build());
        assertThatThrownBy(rebalancer::run).isInstanceOf(ClusterConnectionException.class);
        assertThat(cluster.getScans()).isEqualTo(0);
    }

    @Test
    void testUnhealthyServerFailsRun() {
        cluster.setServerHealth("C", ServerHealth.WRONG_SERVER_UUID);
        Rebalancer rebalancer = createRebalancer(cluster, configBuilder().build());
        assertThatThrownBy(rebalancer::run)
                .isInstanceOf(IllegalClusterStateException.class)
                .hasMessageContaining("WRONG_SERVER_UUID");
        assertThat(cluster.getSubmissions()).isEqualTo(0);
    }

    @Test
    void testPrintStats() throws Exception {
        Rebalancer rebalancer = createRebalancer(cluster, configBuilder().build());
        StringBuilder out = new StringBuilder();
        rebalancer.printStats(out);

        assertThat(out.toString())
                .contains("Per-server replica distribution summary:")
                .contains("Minimum Replica Count | 0")
                .contains("Maximum Replica Count | 8")
                .contains("Average Replica Count | 4.000000")
                .contains("Per-table replica distribution summary:")
                .contains("Maximum      | 8")
                .doesNotContain("details");
        assertThat(cluster.getSubmissions()).isEqualTo(0);
    }

    @Test
    void testPrintStatsWithDetails() throws Exception {
        Rebalancer rebalancer =
                createRebalancer(
                        cluster, configBuilder().outputReplicaDistributionDetails(true).build());
        StringBuilder out = new StringBuilder();
        rebalancer.printStats(out);

        assertThat(out.toString())
                .contains("Per-server replica distribution details:")
                .contains("c.example.com:7050")
                .contains("Per-table replica distribution details:")
                .contains("Table: T (table_t), skew 8");
    }

    private Rebalancer createRebalancer(SimulatedCluster cluster, RebalancerConfig config) {
        return new Rebalancer(config, cluster, cluster, clock, new Random(17));
    }

    private static RebalancerConfig.Builder configBuilder() {
        return RebalancerConfig.builder()
                .masterAddresses(Collections.singletonList("master-1:7051"))
                .pollInterval(Duration.ZERO);
    }
}
