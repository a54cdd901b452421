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

package org.tabletrebalancer.rebalance.client;

import org.tabletrebalancer.exception.ConfigVersionMismatchException;
import org.tabletrebalancer.exception.ReplicaMoveException;

/**
 * Client of the cluster's consensus layer used to move tablet replicas. A replica move is
 * asynchronous: submitting it only starts the configuration change, its outcome is observed by
 * polling.
 */
public interface ClusterClient extends AutoCloseable {

    /**
     * Starts moving the tablet's replica from the source to the destination server,
     * unconditionally.
     *
     * @throws ReplicaMoveException if the move was rejected or could not be submitted
     */
    void submitReplicaMove(String tabletId, String sourceServer, String destinationServer)
            throws ReplicaMoveException;

    /**
     * Starts moving the tablet's replica from the source to the destination server, provided the
     * tablet's consensus configuration is still at the expected version.
     *
     * @throws ConfigVersionMismatchException if the configuration has changed in the meantime
     * @throws ReplicaMoveException if the move was rejected or could not be submitted
     */
    void submitReplicaMove(
            String tabletId,
            String sourceServer,
            String destinationServer,
            long expectedConfigVersion)
            throws ReplicaMoveException;

    /**
     * Checks how far a previously submitted move has got.
     *
     * @throws ReplicaMoveException if the status could not be determined
     */
    MoveStatus pollMoveStatus(String tabletId, String sourceServer, String destinationServer)
            throws ReplicaMoveException;

    @Override
    void close();
}
