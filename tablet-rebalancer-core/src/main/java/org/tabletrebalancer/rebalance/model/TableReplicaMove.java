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

import java.util.Objects;

import static org.tabletrebalancer.utils.Preconditions.checkArgument;
import static org.tabletrebalancer.utils.Preconditions.checkNotNull;

/**
 * A move intent produced by a rebalancing algorithm: move a replica of some tablet of the table
 * from one tablet server to another. The tablet to move is chosen later.
 */
public class TableReplicaMove {
    private final String tableId;
    private final String sourceServer;
    private final String destinationServer;

    public TableReplicaMove(String tableId, String sourceServer, String destinationServer) {
        this.tableId = checkNotNull(tableId);
        this.sourceServer = checkNotNull(sourceServer);
        this.destinationServer = checkNotNull(destinationServer);
        checkArgument(
                !sourceServer.equals(destinationServer),
                "source and destination of a move must differ, both are %s",
                sourceServer);
    }

    public String getTableId() {
        return tableId;
    }

    public String getSourceServer() {
        return sourceServer;
    }

    public String getDestinationServer() {
        return destinationServer;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TableReplicaMove that = (TableReplicaMove) o;
        return tableId.equals(that.tableId)
                && sourceServer.equals(that.sourceServer)
                && destinationServer.equals(that.destinationServer);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tableId, sourceServer, destinationServer);
    }

    @Override
    public String toString() {
        return "TableReplicaMove{table="
                + tableId
                + ", "
                + sourceServer
                + " -> "
                + destinationServer
                + '}';
    }
}
