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
import org.tabletrebalancer.rebalance.health.ServerHealth;
import org.tabletrebalancer.rebalance.health.TabletHealth;
import org.tabletrebalancer.rebalance.testutils.SimulatedCluster;
import org.tabletrebalancer.utils.clock.ManualClock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Test for {@link SnapshotTranslator}. */
class SnapshotTranslatorTest {
    private SimulatedCluster cluster;
    private SnapshotTranslator translator;

    @BeforeEach
    void setup() {
        cluster =
                new SimulatedCluster(new ManualClock())
                        .addServers("A", "B", "C", "D")
                        .addTable("T", "table_t", 3)
                        .addTablet("t1", "T", "A", "C", "D")
                        .addTablet("t2", "T", "B", "C", "D");
        translator = new SnapshotTranslator(false, Collections.emptyList());
    }

    @Test
    void testFindReplicasAndFilterMoves() {
        ClusterRawInfo rawInfo = cluster.snapshot();
        TableReplicaMove intent = new TableReplicaMove("T", "A", "B");
        List<String> tabletIds = translator.findReplicas(intent, rawInfo);
        assertThat(tabletIds).containsExactly("t1");

        ReplicaMove move = translator.toReplicaMove(intent, "t1", rawInfo);
        assertThat(move)
                .isEqualTo(new ReplicaMove("t1", "A", "B", ConfigVersionCheck.expected(1)));

        MovesInProgress movesInProgress = new MovesInProgress();
        movesInProgress.add(move);
        List<ReplicaMove> candidates =
                new ArrayList<>(
                        Arrays.asList(
                                translator.toReplicaMove(intent, "t1", rawInfo),
                                new ReplicaMove("t2", "B", "A")));
        SnapshotTranslator.filterMoves(movesInProgress, candidates);
        assertThat(candidates).containsExactly(new ReplicaMove("t2", "B", "A"));

        // filtering again changes nothing
        SnapshotTranslator.filterMoves(movesInProgress, candidates);
        assertThat(candidates).containsExactly(new ReplicaMove("t2", "B", "A"));
    }

    @Test
    void testFindReplicasSkipsIneligibleTablets() {
        // t1 already has a replica at D
        assertThat(translator.findReplicas(new TableReplicaMove("T", "A", "D"), cluster.snapshot()))
                .isEmpty();

        cluster.setTabletHealth("t1", TabletHealth.UNDER_REPLICATED);
        assertThat(translator.findReplicas(new TableReplicaMove("T", "A", "B"), cluster.snapshot()))
                .isEmpty();

        cluster.setTabletHealth("t1", TabletHealth.HEALTHY);
        cluster.setServerHealth("B", ServerHealth.UNAVAILABLE);
        assertThat(translator.findReplicas(new TableReplicaMove("T", "A", "B"), cluster.snapshot()))
                .isEmpty();

        cluster.setServerHealth("B", ServerHealth.HEALTHY);
        cluster.setServerHealth("A", ServerHealth.UNAUTHORIZED);
        assertThat(translator.findReplicas(new TableReplicaMove("T", "A", "B"), cluster.snapshot()))
                .isEmpty();
    }

    @Test
    void testFindReplicasReturnsAllCandidatesSorted() {
        cluster.addTablet("t0", "T", "A", "B", "C").addTablet("t3", "T", "A", "C", "D");
        assertThat(translator.findReplicas(new TableReplicaMove("T", "A", "B"), cluster.snapshot()))
                .containsExactly("t1", "t3");
        assertThat(translator.findReplicas(new TableReplicaMove("T", "C", "A"), cluster.snapshot()))
                .containsExactly("t2");
    }

    @Test
    void testBuildClusterInfoCountsMovesInProgressAtDestination() throws Exception {
        ClusterRawInfo rawInfo = cluster.snapshot();
        ClusterInfo before = translator.buildClusterInfo(rawInfo, new MovesInProgress());
        assertThat(before.replicaCounts("T")).containsEntry("A", 1).containsEntry("B", 1);

        MovesInProgress movesInProgress = new MovesInProgress();
        movesInProgress.add(new ReplicaMove("t1", "A", "B"));
        ClusterInfo clusterInfo = translator.buildClusterInfo(rawInfo, movesInProgress);
        assertThat(clusterInfo.replicaCount("T", "A")).isEqualTo(0);
        assertThat(clusterInfo.replicaCount("T", "B")).isEqualTo(2);
        assertThat(clusterInfo.replicaCount("T", "C")).isEqualTo(2);
        assertThat(clusterInfo.replicaCount("T", "D")).isEqualTo(2);
        assertThat(clusterInfo.numReplicas()).isEqualTo(6);
        assertThat(clusterInfo.tableName("T")).isEqualTo("table_t");
    }

    @Test
    void testBuildClusterInfoWithMoveAlreadyAddedAtDestination() throws Exception {
        cluster.addTablet("t3", "T", "A", "B", "C", "D");
        MovesInProgress movesInProgress = new MovesInProgress();
        movesInProgress.add(new ReplicaMove("t3", "A", "B"));

        ClusterInfo clusterInfo = translator.buildClusterInfo(cluster.snapshot(), movesInProgress);
        assertThat(clusterInfo.replicaCount("T", "A")).isEqualTo(1);
        assertThat(clusterInfo.replicaCount("T", "B")).isEqualTo(2);
        assertThat(clusterInfo.numReplicas()).isEqualTo(9);
    }

    @Test
    void testBuildClusterInfoSkipsUnhealthyServers() throws Exception {
        cluster.setServerHealth("D", ServerHealth.UNAVAILABLE);
        ClusterInfo clusterInfo =
                translator.buildClusterInfo(cluster.snapshot(), new MovesInProgress());
        assertThat(clusterInfo.servers()).containsExactly("A", "B", "C");
        assertThat(clusterInfo.replicaCounts("T"))
                .containsOnlyKeys("A", "B", "C")
                .containsEntry("C", 2);
    }

    @Test
    void testBuildClusterInfoFailsOnUnknownServer() {
        cluster.addTablet("t3", "T", "A", "B", "X");
        ClusterRawInfo rawInfo = cluster.snapshot();
        assertThatThrownBy(() -> translator.buildClusterInfo(rawInfo, new MovesInProgress()))
                .isInstanceOf(IllegalClusterStateException.class)
                .hasMessageContaining("Tablet t3 of table 'table_t'")
                .hasMessageContaining("replica at tablet server X");
    }

    @Test
    void testSingleReplicaTables() throws Exception {
        cluster.addTable("R", "table_r", 1).addTablet("r1", "R", "A");
        TableReplicaMove intent = new TableReplicaMove("R", "A", "B");

        ClusterInfo clusterInfo =
                translator.buildClusterInfo(cluster.snapshot(), new MovesInProgress());
        assertThat(clusterInfo.tables()).containsExactly("T");
        assertThat(translator.findReplicas(intent, cluster.snapshot())).isEmpty();

        SnapshotTranslator rf1Translator = new SnapshotTranslator(true, Collections.emptyList());
        clusterInfo = rf1Translator.buildClusterInfo(cluster.snapshot(), new MovesInProgress());
        assertThat(clusterInfo.tables()).containsExactly("R", "T");
        assertThat(clusterInfo.replicaCount("R", "A")).isEqualTo(1);
        assertThat(rf1Translator.findReplicas(intent, cluster.snapshot())).containsExactly("r1");
    }

    @Test
    void testTableFilters() throws Exception {
        cluster.addTable("U", "table_u", 3).addTablet("u1", "U", "A", "B", "C");

        SnapshotTranslator byName =
                new SnapshotTranslator(false, Collections.singletonList("table_u"));
        assertThat(byName.buildClusterInfo(cluster.snapshot(), new MovesInProgress()).tables())
                .containsExactly("U");

        SnapshotTranslator byId = new SnapshotTranslator(false, Collections.singletonList("T"));
        ClusterInfo clusterInfo = byId.buildClusterInfo(cluster.snapshot(), new MovesInProgress());
        assertThat(clusterInfo.tables()).containsExactly("T");
        assertThat(clusterInfo.numReplicas()).isEqualTo(6);
    }

    @Test
    void testToReplicaMoveWithoutConfigVersion() {
        cluster.setConfigVersion("t1", null).setConfigVersion("t2", 5L);
        ClusterRawInfo rawInfo = cluster.snapshot();

        assertThat(
                        translator
                                .toReplicaMove(new TableReplicaMove("T", "A", "B"), "t1", rawInfo)
                                .getVersionCheck())
                .isSameAs(ConfigVersionCheck.none());
        assertThat(
                        translator
                                .toReplicaMove(new TableReplicaMove("T", "B", "A"), "t2", rawInfo)
                                .getVersionCheck())
                .isEqualTo(ConfigVersionCheck.expected(5));
    }
}
