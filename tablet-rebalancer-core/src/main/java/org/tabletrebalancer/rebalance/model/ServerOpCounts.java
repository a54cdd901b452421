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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Random;
import java.util.Set;
import java.util.TreeMap;

import static org.tabletrebalancer.utils.Preconditions.checkArgument;
import static org.tabletrebalancer.utils.Preconditions.checkState;

/**
 * Number of in-flight move operations per tablet server. A move counts once at its source and once
 * at its destination server.
 *
 * <p>The counts are indexed both ways: server to count, and count to the servers having that
 * count, the latter ordered by count to list the least loaded servers first. The two sides are
 * only changed together, by {@link #insert(String, int)} and {@link #remove(String)}; {@link
 * #increment(String)}, {@link #decrement(String)} and {@link #clear()} are compositions of these
 * two and never touch either side directly.
 */
public class ServerOpCounts {

    private final Map<String, Integer> opCountByServer = new HashMap<>();
    private final NavigableMap<Integer, Set<String>> serversByOpCount = new TreeMap<>();

    /** Registers the server with the given count, the server must not be registered yet. */
    public void insert(String server, int opCount) {
        checkArgument(opCount >= 0, "op count of server %s must not be negative", server);
        Integer previous = opCountByServer.putIfAbsent(server, opCount);
        checkState(previous == null, "server %s is already registered", server);
        serversByOpCount.computeIfAbsent(opCount, k -> new LinkedHashSet<>()).add(server);
    }

    /**
     * Unregisters the server.
     *
     * @return the op count the server had, or -1 if the server was not registered
     */
    public int remove(String server) {
        Integer opCount = opCountByServer.remove(server);
        if (opCount == null) {
            return -1;
        }
        Set<String> servers = serversByOpCount.get(opCount);
        servers.remove(server);
        if (servers.isEmpty()) {
            serversByOpCount.remove(opCount);
        }
        return opCount;
    }

    /** Adds an operation to the server, registering it if needed: a remove and an insert. */
    public int increment(String server) {
        int opCount = Math.max(remove(server), 0) + 1;
        insert(server, opCount);
        return opCount;
    }

    /** Takes an operation from the server, which must have one: a remove and an insert. */
    public int decrement(String server) {
        checkState(opCount(server) > 0, "server %s has no operations in flight", server);
        int opCount = remove(server);
        insert(server, opCount - 1);
        return opCount - 1;
    }

    public boolean contains(String server) {
        return opCountByServer.containsKey(server);
    }

    /** Returns the op count of the server, 0 if the server is not registered. */
    public int opCount(String server) {
        return opCountByServer.getOrDefault(server, 0);
    }

    /**
     * Returns the servers with fewer than {@code maxOpCount} operations in flight, the least loaded
     * first. Servers with the same count are shuffled with the given random source.
     */
    public List<String> serversUnderLimit(int maxOpCount, Random random) {
        List<String> result = new ArrayList<>();
        for (Set<String> servers : serversByOpCount.headMap(maxOpCount, false).values()) {
            List<String> sameCount = new ArrayList<>(servers);
            Collections.shuffle(sameCount, random);
            result.addAll(sameCount);
        }
        return result;
    }

    public int size() {
        return opCountByServer.size();
    }

    /** Removes all servers. */
    public void clear() {
        for (String server : new ArrayList<>(opCountByServer.keySet())) {
            remove(server);
        }
    }

    @Override
    public String toString() {
        return "ServerOpCounts" + serversByOpCount;
    }
}
