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
import org.tabletrebalancer.annotation.VisibleForTesting;
import org.tabletrebalancer.exception.ClusterScanException;
import org.tabletrebalancer.exception.RebalanceException;
import org.tabletrebalancer.exception.RebalanceRuntimeException;
import org.tabletrebalancer.exception.RebalanceStalledException;
import org.tabletrebalancer.rebalance.client.ClusterClientFactory;
import org.tabletrebalancer.rebalance.health.ClusterRawInfo;
import org.tabletrebalancer.rebalance.health.HealthScanner;
import org.tabletrebalancer.rebalance.health.ServerHealthSummary;
import org.tabletrebalancer.rebalance.model.ClusterInfo;
import org.tabletrebalancer.rebalance.model.MovesInProgress;
import org.tabletrebalancer.rebalance.model.SnapshotTranslator;
import org.tabletrebalancer.rebalance.runner.PollResult;
import org.tabletrebalancer.rebalance.runner.Runner;
import org.tabletrebalancer.rebalance.runner.ScheduleResult;
import org.tabletrebalancer.rebalance.runner.TwoDimensionalGreedyRunner;
import org.tabletrebalancer.rebalance.stats.ReplicaDistributionPrinter;
import org.tabletrebalancer.utils.TimeUtils;
import org.tabletrebalancer.utils.clock.Clock;
import org.tabletrebalancer.utils.clock.SystemClock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.io.IOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Random;

import static org.tabletrebalancer.utils.Preconditions.checkNotNull;
import static org.tabletrebalancer.utils.Preconditions.checkState;

/**
 * Drives a rebalancing run: it repeatedly takes a snapshot of the cluster, lets the runner compute
 * a batch of replica moves for it, and schedules the batch while keeping the number of moves per
 * tablet server under the configured limit. The run ends once the cluster is balanced or the
 * maximum run time has elapsed.
 *
 * <p>If no move is scheduled or completed for longer than the maximum staleness interval, the moves
 * in progress are assumed to be lost to some external interference: they are forgotten and the run
 * starts over from a fresh snapshot. A run bounded by a maximum run time starts over as often as
 * needed until it times out; an unbounded run fails with a {@link RebalanceStalledException} after
 * the configured number of such resets.
 *
 * <p>A rebalancer runs only once.
 */
@PublicEvolving
public class Rebalancer {
    private static final Logger LOG = LoggerFactory.getLogger(Rebalancer.class);

    private final RebalancerConfig config;
    private final HealthScanner healthScanner;
    private final ClusterClientFactory clientFactory;
    private final Clock clock;
    private final Random random;
    private final SnapshotTranslator translator;

    private boolean started;
    private RunStatus runStatus = RunStatus.UNKNOWN;

    public Rebalancer(
            RebalancerConfig config,
            HealthScanner healthScanner,
            ClusterClientFactory clientFactory) {
        this(config, healthScanner, clientFactory, SystemClock.getInstance(), new Random());
    }

    @VisibleForTesting
    Rebalancer(
            RebalancerConfig config,
            HealthScanner healthScanner,
            ClusterClientFactory clientFactory,
            Clock clock,
            Random random) {
        this.config = checkNotNull(config);
        this.healthScanner = checkNotNull(healthScanner);
        this.clientFactory = checkNotNull(clientFactory);
        this.clock = checkNotNull(clock);
        this.random = checkNotNull(random);
        this.translator =
                new SnapshotTranslator(config.isMoveRf1Replicas(), config.getTableFilters());
    }

    /**
     * Runs the rebalancing.
     *
     * @return the status of the run and the number of replicas moved
     * @throws RebalanceStalledException if an unbounded run made no progress for too long
     * @throws RebalanceException if the cluster cannot be reached or is in a state which does not
     *     allow rebalancing
     */
    public RunResult run() throws RebalanceException {
        checkState(!started, "the rebalancer has already been run");
        started = true;

        Long deadlineNanos =
                config.getMaxRunTime()
                        .map(maxRunTime -> clock.nanoseconds() + maxRunTime.toNanos())
                        .orElse(null);
        LOG.info("Starting rebalancing with {}.", config);
        try (Runner runner = createRunner(deadlineNanos)) {
            runner.init(config.getMasterAddresses());
            runStatus = runWith(runner, deadlineNanos);
            RunResult result = new RunResult(runStatus, runner.movesCount());
            if (runStatus == RunStatus.TIMED_OUT && runner.hasMovesInProgress()) {
                LOG.info(
                        "Not waiting for {} moves in progress: {}.",
                        runner.scheduledMoves().size(),
                        runner.scheduledMoves());
            }
            LOG.info("Rebalancing finished: {}.", result);
            return result;
        }
    }

    private RunStatus runWith(Runner runner, @Nullable Long deadlineNanos)
            throws RebalanceException {
        Duration maxStaleness = config.getMaxStalenessInterval();
        long stalenessStart = clock.nanoseconds();
        int resets = 0;
        boolean resync = false;

        while (true) {
            if (isDeadlinePassed(deadlineNanos)) {
                return RunStatus.TIMED_OUT;
            }
            long staleness = clock.nanoseconds() - stalenessStart;
            if (staleness > maxStaleness.toNanos()) {
                // a bounded run keeps starting over until its deadline
                if (deadlineNanos == null && resets >= config.getMaxStalenessResets()) {
                    throw new RebalanceStalledException(maxStaleness, resets);
                }
                resets++;
                LOG.warn(
                        "Detected a staleness period of {}, starting over (reset {}).",
                        TimeUtils.formatWithHighestUnit(Duration.ofNanos(staleness)),
                        resets);
                runner.forgetMovesInProgress();
                stalenessStart = clock.nanoseconds();
            }
            if (resync) {
                // the fresh snapshot is taken by the runner while computing the next batch
                LOG.info("Re-synchronizing cluster state.");
            }
            resync = true;

            if (!runner.getNextMoves()) {
                return RunStatus.CLUSTER_IS_BALANCED;
            }

            boolean progress = false;
            while (true) {
                ScheduleResult scheduleResult = runner.scheduleNextMove();
                if (scheduleResult.isTimedOut()) {
                    return RunStatus.TIMED_OUT;
                }
                if (scheduleResult.isScheduled()) {
                    stalenessStart = clock.nanoseconds();
                    progress = true;
                    continue;
                }
                if (scheduleResult.hasErrors()) {
                    // the failed move has been dropped, others may still be schedulable
                    continue;
                }

                PollResult pollResult = runner.updateMovesInProgressStatus();
                if (pollResult.isTimedOut()) {
                    return RunStatus.TIMED_OUT;
                }
                if (pollResult.hasUpdates()) {
                    stalenessStart = clock.nanoseconds();
                    progress = true;
                    continue;
                }
                if (!runner.hasMovesInProgress()
                        || clock.nanoseconds() - stalenessStart > maxStaleness.toNanos()) {
                    break;
                }
                sleep(config.getPollInterval());
            }
            if (!progress) {
                sleep(config.getPollInterval());
            }
        }
    }

    /** Creates the runner of a run. */
    protected Runner createRunner(@Nullable Long deadlineNanos) {
        return new TwoDimensionalGreedyRunner(
                clientFactory,
                this::getClusterRawInfo,
                translator,
                config.getMaxMovesPerServer(),
                deadlineNanos,
                clock,
                random);
    }

    /** Scans the cluster, restricted to the configured tables. */
    public ClusterRawInfo getClusterRawInfo() throws ClusterScanException {
        return healthScanner
                .scan(config.getTableFilters())
                .filterByTables(config.getTableFilters());
    }

    /** Prints the current replica distribution of the cluster. */
    public void printStats(Appendable out) throws RebalanceException, IOException {
        ClusterRawInfo rawInfo = getClusterRawInfo();
        ClusterInfo clusterInfo = translator.buildClusterInfo(rawInfo, new MovesInProgress());
        Map<String, String> addresses = new HashMap<>();
        for (ServerHealthSummary server : rawInfo.getServerSummaries()) {
            addresses.put(server.getUuid(), server.getAddress());
        }
        new ReplicaDistributionPrinter(config.isOutputReplicaDistributionDetails())
                .print(clusterInfo, addresses, out);
    }

    /** The status of the run, {@link RunStatus#UNKNOWN} until the run has completed. */
    public RunStatus getRunStatus() {
        return runStatus;
    }

    private boolean isDeadlinePassed(@Nullable Long deadlineNanos) {
        return deadlineNanos != null && clock.nanoseconds() >= deadlineNanos;
    }

    private static void sleep(Duration interval) {
        if (interval.isZero()) {
            return;
        }
        try {
            Thread.sleep(interval.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RebalanceRuntimeException("Interrupted while waiting for replica moves.", e);
        }
    }
}
