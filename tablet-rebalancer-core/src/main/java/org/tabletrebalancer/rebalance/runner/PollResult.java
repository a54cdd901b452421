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

/** Outcome of polling the replica moves in progress. */
public final class PollResult {
    private final boolean hasUpdates;
    private final boolean hasErrors;
    private final boolean timedOut;

    public PollResult(boolean hasUpdates, boolean hasErrors, boolean timedOut) {
        this.hasUpdates = hasUpdates;
        this.hasErrors = hasErrors;
        this.timedOut = timedOut;
    }

    /**
     * Whether some moves have completed since the previous poll. Also set when the deadline has
     * passed, since the moves still in progress should no longer be waited for.
     */
    public boolean hasUpdates() {
        return hasUpdates;
    }

    public boolean hasErrors() {
        return hasErrors;
    }

    public boolean isTimedOut() {
        return timedOut;
    }

    @Override
    public String toString() {
        return String.format(
                "PollResult[hasUpdates=%s, hasErrors=%s, timedOut=%s]",
                hasUpdates, hasErrors, timedOut);
    }
}
