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

import org.tabletrebalancer.annotation.PublicEvolving;

import java.util.Objects;

import static org.tabletrebalancer.utils.Preconditions.checkNotNull;

/** The outcome of a rebalancing run: its status and the number of replicas moved. */
@PublicEvolving
public final class RunResult {
    private final RunStatus status;
    private final int movesCount;

    public RunResult(RunStatus status, int movesCount) {
        this.status = checkNotNull(status);
        this.movesCount = movesCount;
    }

    public RunStatus getStatus() {
        return status;
    }

    /** The number of replica moves which completed successfully. */
    public int getMovesCount() {
        return movesCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        RunResult that = (RunResult) o;
        return movesCount == that.movesCount && status == that.status;
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, movesCount);
    }

    @Override
    public String toString() {
        return String.format("RunResult[status=%s, movesCount=%d]", status, movesCount);
    }
}
