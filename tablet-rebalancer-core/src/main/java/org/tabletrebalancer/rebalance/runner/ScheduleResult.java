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

/** Outcome of an attempt to submit the next queued replica move. */
public final class ScheduleResult {
    private static final ScheduleResult SCHEDULED = new ScheduleResult(true, false, false);
    private static final ScheduleResult NOTHING_SCHEDULABLE =
            new ScheduleResult(false, false, false);
    private static final ScheduleResult FAILED = new ScheduleResult(false, true, false);
    private static final ScheduleResult TIMED_OUT = new ScheduleResult(false, false, true);

    private final boolean scheduled;
    private final boolean hasErrors;
    private final boolean timedOut;

    private ScheduleResult(boolean scheduled, boolean hasErrors, boolean timedOut) {
        this.scheduled = scheduled;
        this.hasErrors = hasErrors;
        this.timedOut = timedOut;
    }

    public static ScheduleResult scheduled() {
        return SCHEDULED;
    }

    /** No queued move can be submitted without exceeding the per-server limit. */
    public static ScheduleResult nothingSchedulable() {
        return NOTHING_SCHEDULABLE;
    }

    /** The submission of the chosen move failed, the move has been dropped. */
    public static ScheduleResult failed() {
        return FAILED;
    }

    public static ScheduleResult timedOut() {
        return TIMED_OUT;
    }

    public boolean isScheduled() {
        return scheduled;
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
                "ScheduleResult[scheduled=%s, hasErrors=%s, timedOut=%s]",
                scheduled, hasErrors, timedOut);
    }
}
