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

/** A concrete move of a tablet replica from one tablet server to another. */
public class ReplicaMove {
    private final String tabletId;
    private final String sourceServer;
    private final String destinationServer;
    private final ConfigVersionCheck versionCheck;

    public ReplicaMove(String tabletId, String sourceServer, String destinationServer) {
        this(tabletId, sourceServer, destinationServer, ConfigVersionCheck.none());
    }

    public ReplicaMove(
            String tabletId,
            String sourceServer,
            String destinationServer,
            ConfigVersionCheck versionCheck) {
        this.tabletId = checkNotNull(tabletId);
        this.sourceServer = checkNotNull(sourceServer);
        this.destinationServer = checkNotNull(destinationServer);
        this.versionCheck = checkNotNull(versionCheck);
        checkArgument(
                !sourceServer.equals(destinationServer),
                "tablet %s: source and destination of a move must differ, both are %s",
                tabletId,
                sourceServer);
    }

    public String getTabletId() {
        return tabletId;
    }

    public String getSourceServer() {
        return sourceServer;
    }

    public String getDestinationServer() {
        return destinationServer;
    }

    public ConfigVersionCheck getVersionCheck() {
        return versionCheck;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ReplicaMove that = (ReplicaMove) o;
        return tabletId.equals(that.tabletId)
                && sourceServer.equals(that.sourceServer)
                && destinationServer.equals(that.destinationServer)
                && versionCheck.equals(that.versionCheck);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tabletId, sourceServer, destinationServer, versionCheck);
    }

    @Override
    public String toString() {
        return "tablet " + tabletId + ": " + sourceServer + " -> " + destinationServer;
    }
}
