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

import javax.annotation.Nullable;

import java.util.Objects;
import java.util.Optional;

import static org.tabletrebalancer.utils.Preconditions.checkNotNull;

/** Status of a submitted replica move. */
public final class MoveStatus {

    /** State of a replica move. */
    public enum State {
        PENDING,
        SUCCEEDED,
        FAILED
    }

    private static final MoveStatus PENDING = new MoveStatus(State.PENDING, null);
    private static final MoveStatus SUCCEEDED = new MoveStatus(State.SUCCEEDED, null);

    private final State state;
    private final @Nullable String failureReason;

    private MoveStatus(State state, @Nullable String failureReason) {
        this.state = state;
        this.failureReason = failureReason;
    }

    public static MoveStatus pending() {
        return PENDING;
    }

    public static MoveStatus succeeded() {
        return SUCCEEDED;
    }

    public static MoveStatus failed(String reason) {
        return new MoveStatus(State.FAILED, checkNotNull(reason));
    }

    public State getState() {
        return state;
    }

    /** Whether the move has completed, successfully or not. */
    public boolean isCompleted() {
        return state != State.PENDING;
    }

    public Optional<String> getFailureReason() {
        return Optional.ofNullable(failureReason);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        MoveStatus that = (MoveStatus) o;
        return state == that.state && Objects.equals(failureReason, that.failureReason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(state, failureReason);
    }

    @Override
    public String toString() {
        return failureReason == null ? state.name() : state + ": " + failureReason;
    }
}
