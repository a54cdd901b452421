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

import javax.annotation.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static org.tabletrebalancer.utils.Preconditions.checkState;

/**
 * Replica moves which have been submitted to the cluster and have not completed yet, keyed by
 * tablet id. A tablet has at most one move in progress.
 */
public class MovesInProgress implements Iterable<ReplicaMove> {

    private final Map<String, ReplicaMove> movesByTablet = new LinkedHashMap<>();

    public void add(ReplicaMove move) {
        ReplicaMove previous = movesByTablet.putIfAbsent(move.getTabletId(), move);
        checkState(
                previous == null,
                "tablet %s already has a move in progress: %s",
                move.getTabletId(),
                previous);
    }

    public @Nullable ReplicaMove remove(String tabletId) {
        return movesByTablet.remove(tabletId);
    }

    public @Nullable ReplicaMove get(String tabletId) {
        return movesByTablet.get(tabletId);
    }

    public boolean contains(String tabletId) {
        return movesByTablet.containsKey(tabletId);
    }

    public Set<String> tabletIds() {
        return Collections.unmodifiableSet(movesByTablet.keySet());
    }

    /** A copy of the moves in progress, in the order they were added. */
    public Collection<ReplicaMove> moves() {
        return new ArrayList<>(movesByTablet.values());
    }

    public int size() {
        return movesByTablet.size();
    }

    public boolean isEmpty() {
        return movesByTablet.isEmpty();
    }

    public void clear() {
        movesByTablet.clear();
    }

    @Override
    public Iterator<ReplicaMove> iterator() {
        return Collections.unmodifiableCollection(movesByTablet.values()).iterator();
    }

    @Override
    public String toString() {
        return "MovesInProgress" + movesByTablet.values();
    }
}
