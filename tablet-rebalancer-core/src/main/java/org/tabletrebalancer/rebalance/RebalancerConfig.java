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
import org.tabletrebalancer.config.Configuration;
import org.tabletrebalancer.exception.IllegalConfigurationException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.tabletrebalancer.utils.Preconditions.checkNotNull;

/** Immutable run parameters of a {@link Rebalancer}. */
@PublicEvolving
public class RebalancerConfig {

    private final List<String> masterAddresses;
    private final List<String> tableFilters;
    private final int maxMovesPerServer;
    private final Duration maxStalenessInterval;
    private final int maxStalenessResets;
    private final Duration maxRunTime;
    private final boolean moveRf1Replicas;
    private final boolean outputReplicaDistributionDetails;
    private final Duration pollInterval;

    private RebalancerConfig(Builder builder) {
        this.masterAddresses =
                Collections.unmodifiableList(new ArrayList<>(builder.masterAddresses));
        this.tableFilters = Collections.unmodifiableList(new ArrayList<>(builder.tableFilters));
        this.maxMovesPerServer = builder.maxMovesPerServer;
        this.maxStalenessInterval = builder.maxStalenessInterval;
        this.maxStalenessResets = builder.maxStalenessResets;
        this.maxRunTime = builder.maxRunTime;
        this.moveRf1Replicas = builder.moveRf1Replicas;
        this.outputReplicaDistributionDetails = builder.outputReplicaDistributionDetails;
        this.pollInterval = builder.pollInterval;
    }

    /**
     * Reads the rebalancer config from the given configuration.
     *
     * @throws IllegalConfigurationException if an option is missing or has an invalid value
     */
    public static RebalancerConfig fromConfiguration(Configuration conf) {
        return builder()
                .masterAddresses(
                        conf.getOptional(RebalancerOptions.MASTER_ADDRESSES)
                                .orElse(Collections.emptyList()))
                .tableFilters(conf.get(RebalancerOptions.TABLES))
                .maxMovesPerServer(conf.get(RebalancerOptions.MAX_MOVES_PER_SERVER))
                .maxStalenessInterval(conf.get(RebalancerOptions.MAX_STALENESS_INTERVAL))
                .maxStalenessResets(conf.get(RebalancerOptions.MAX_STALENESS_RESETS))
                .maxRunTime(conf.get(RebalancerOptions.MAX_RUN_TIME))
                .moveRf1Replicas(conf.get(RebalancerOptions.MOVE_RF1_REPLICAS))
                .outputReplicaDistributionDetails(
                        conf.get(RebalancerOptions.OUTPUT_REPLICA_DISTRIBUTION_DETAILS))
                .pollInterval(conf.get(RebalancerOptions.POLL_INTERVAL))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> getMasterAddresses() {
        return masterAddresses;
    }

    public List<String> getTableFilters() {
        return tableFilters;
    }

    public int getMaxMovesPerServer() {
        return maxMovesPerServer;
    }

    public Duration getMaxStalenessInterval() {
        return maxStalenessInterval;
    }

    public int getMaxStalenessResets() {
        return maxStalenessResets;
    }

    /** The maximum run time, empty if the run time is unbounded. */
    public Optional<Duration> getMaxRunTime() {
        return maxRunTime.isZero() ? Optional.empty() : Optional.of(maxRunTime);
    }

    public boolean isMoveRf1Replicas() {
        return moveRf1Replicas;
    }

    public boolean isOutputReplicaDistributionDetails() {
        return outputReplicaDistributionDetails;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    @Override
    public String toString() {
        return "RebalancerConfig{"
                + "masterAddresses="
                + masterAddresses
                + ", tableFilters="
                + tableFilters
                + ", maxMovesPerServer="
                + maxMovesPerServer
                + ", maxStalenessInterval="
                + maxStalenessInterval
                + ", maxStalenessResets="
                + maxStalenessResets
                + ", maxRunTime="
                + maxRunTime
                + ", moveRf1Replicas="
                + moveRf1Replicas
                + ", outputReplicaDistributionDetails="
                + outputReplicaDistributionDetails
                + ", pollInterval="
                + pollInterval
                + '}';
    }

    /** Builder of {@link RebalancerConfig}, initialized with the defaults of the options. */
    public static class Builder {
        private List<String> masterAddresses = Collections.emptyList();
        private List<String> tableFilters = Collections.emptyList();
        private int maxMovesPerServer = RebalancerOptions.MAX_MOVES_PER_SERVER.defaultValue();
        private Duration maxStalenessInterval =
                RebalancerOptions.MAX_STALENESS_INTERVAL.defaultValue();
        private int maxStalenessResets = RebalancerOptions.MAX_STALENESS_RESETS.defaultValue();
        private Duration maxRunTime = RebalancerOptions.MAX_RUN_TIME.defaultValue();
        private boolean moveRf1Replicas = RebalancerOptions.MOVE_RF1_REPLICAS.defaultValue();
        private boolean outputReplicaDistributionDetails =
                RebalancerOptions.OUTPUT_REPLICA_DISTRIBUTION_DETAILS.defaultValue();
        private Duration pollInterval = RebalancerOptions.POLL_INTERVAL.defaultValue();

        public Builder masterAddresses(List<String> masterAddresses) {
            this.masterAddresses = checkNotNull(masterAddresses);
            return this;
        }

        public Builder tableFilters(List<String> tableFilters) {
            this.tableFilters = checkNotNull(tableFilters);
            return this;
        }

        public Builder maxMovesPerServer(int maxMovesPerServer) {
            this.maxMovesPerServer = maxMovesPerServer;
            return this;
        }

        public Builder maxStalenessInterval(Duration maxStalenessInterval) {
            this.maxStalenessInterval = checkNotNull(maxStalenessInterval);
            return this;
        }

        public Builder maxStalenessResets(int maxStalenessResets) {
            this.maxStalenessResets = maxStalenessResets;
            return this;
        }

        public Builder maxRunTime(Duration maxRunTime) {
            this.maxRunTime = checkNotNull(maxRunTime);
            return this;
        }

        public Builder moveRf1Replicas(boolean moveRf1Replicas) {
            this.moveRf1Replicas = moveRf1Replicas;
            return this;
        }

        public Builder outputReplicaDistributionDetails(boolean outputReplicaDistributionDetails) {
            this.outputReplicaDistributionDetails = outputReplicaDistributionDetails;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = checkNotNull(pollInterval);
            return this;
        }

        public RebalancerConfig build() {
            if (masterAddresses.isEmpty()) {
                throw new IllegalConfigurationException(
                        String.format(
                                "'%s' must not be empty.",
                                RebalancerOptions.MASTER_ADDRESSES.key()));
            }
            if (maxMovesPerServer < 1) {
                throw new IllegalConfigurationException(
                        String.format(
                                "'%s' must be at least 1, but was %s.",
                                RebalancerOptions.MAX_MOVES_PER_SERVER.key(),
                                maxMovesPerServer));
            }
            if (maxStalenessResets < 0) {
                throw new IllegalConfigurationException(
                        String.format(
                                "'%s' must not be negative, but was %s.",
                                RebalancerOptions.MAX_STALENESS_RESETS.key(),
                                maxStalenessResets));
            }
            checkNotNegative(maxStalenessInterval, RebalancerOptions.MAX_STALENESS_INTERVAL.key());
            checkNotNegative(maxRunTime, RebalancerOptions.MAX_RUN_TIME.key());
            checkNotNegative(pollInterval, RebalancerOptions.POLL_INTERVAL.key());
            return new RebalancerConfig(this);
        }

        private static void checkNotNegative(Duration duration, String key) {
            if (duration.isNegative()) {
                throw new IllegalConfigurationException(
                        String.format("'%s' must not be negative, but was %s.", key, duration));
            }
        }
    }
}
