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

package org.tabletrebalancer.rebalance.health;

import org.tabletrebalancer.exception.ClusterScanException;

import java.util.List;

/**
 * Inspects the cluster and reports the placement and consensus state of every tablet replica. The
 * scan is the only source of truth the rebalancer has about the cluster; it is run again before
 * each batch of moves is computed.
 */
public interface HealthScanner {

    /**
     * Scans the cluster.
     *
     * @param tableFilters names of the tables to report, an empty list reports every table
     * @return the snapshot of the cluster
     * @throws ClusterScanException if the cluster could not be scanned
     */
    ClusterRawInfo scan(List<String> tableFilters) throws ClusterScanException;
}
