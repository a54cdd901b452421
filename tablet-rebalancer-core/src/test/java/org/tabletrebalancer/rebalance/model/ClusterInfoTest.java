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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Test for {@link ClusterInfo}. */
class ClusterInfoTest {

    @Test
    void testReplicaCountsAndSkew() {
        ClusterInfo clusterInfo =
                ClusterInfo.builder()
                        .addServer("A")
                        .addServer("B")
                        .addServer("C")
                        .addTable("T1", "first")
                        .addTable("T2", "second")
                        .addReplica("T1", "A")
                        .addReplica("T1", "A")
                        .addReplica("T1", "B")
                        .addReplica("T2", "C")
                        .build();

        assertThat(clusterInfo.servers()).containsExactly("A", "B", "C");
        assertThat(clusterInfo.tables()).containsExactly("T1", "T2");
        assertThat(clusterInfo.replicaCounts("T1"))
                .containsEntry("A", 2)
                .containsEntry("B", 1)
                .containsEntry("C", 0);
        assertThat(clusterInfo.totalReplicaCounts())
                .containsEntry("A", 2)
                .containsEntry("B", 1)
                .containsEntry("C", 1);
        assertThat(clusterInfo.tableSkew("T1")).isEqualTo(2);
        assertThat(clusterInfo.tableSkew("T2")).isEqualTo(1);
        assertThat(clusterInfo.clusterSkew()).isEqualTo(1);
        assertThat(clusterInfo.numReplicas()).isEqualTo(4);
        assertThat(clusterInfo.tableName("T2")).isEqualTo("second");
        assertThat(clusterInfo)
                .hasToString("ClusterInfo[serverCount=3,tableCount=2,replicaCount=4]");
    }

    @Test
    void testEmptyCluster() {
        ClusterInfo clusterInfo = ClusterInfo.builder().build();
        assertThat(clusterInfo.clusterSkew()).isEqualTo(0);
        assertThat(clusterInfo.numReplicas()).isEqualTo(0);
        assertThatThrownBy(() -> clusterInfo.replicaCounts("T"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testReplicaAtUnknownServer() {
        assertThatThrownBy(() -> ClusterInfo.builder().addServer("A").addReplica("T", "B"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("server B is not in the cluster");
    }
}
