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
import org.tabletrebalancer.config.ConfigOption;
import org.tabletrebalancer.config.ConfigOptions;

import java.time.Duration;
import java.util.List;

/** Config options of the rebalancer. */
@PublicEvolving
public class RebalancerOptions {

    public static final ConfigOption<List<String>> MASTER_ADDRESSES =
            ConfigOptions.key("rebalancer.master-addresses")
                    .stringType()
                    .asList()
                    .noDefaultValue()
                    .withDescription(
                            "The RPC endpoints of the cluster's masters, in the form "
                                    + "host1:port1,host2:port2,....");

    public static final ConfigOption<List<String>> TABLES =
            ConfigOptions.key("rebalancer.tables")
                    .stringType()
                    .asList()
                    .defaultValues()
                    .withDescription(
                            "Names of the tables to rebalance. If empty, every table and the "
                                    + "whole cluster is rebalanced.");

    public static final ConfigOption<Integer> MAX_MOVES_PER_SERVER =
            ConfigOptions.key("rebalancer.max-moves-per-server")
                    .intType()
                    .defaultValue(5)
                    .withDescription(
                            "Maximum number of replica moves to run concurrently on one tablet "
                                    + "server. A move counts at both its source and its "
                                    + "destination server.");

    public static final ConfigOption<Duration> MAX_STALENESS_INTERVAL =
            ConfigOptions.key("rebalancer.max-staleness-interval")
                    .durationType()
                    .defaultValue(Duration.ofSeconds(300))
                    .withDescription(
                            "Maximum duration of the 'staleness' interval, when the rebalancer "
                                    + "can neither schedule new moves nor observe the completion "
                                    + "of scheduled ones. Staleness usually comes from a "
                                    + "persistent problem with the cluster or from concurrent "
                                    + "activity such as automatic re-replication.");

    public static final ConfigOption<Integer> MAX_STALENESS_RESETS =
            ConfigOptions.key("rebalancer.max-staleness-resets")
                    .intType()
                    .defaultValue(1)
                    .withDescription(
                            "How many times a staleness interval is survived by forgetting the "
                                    + "moves in flight and re-synchronizing with the cluster. "
                                    + "Once exceeded the run fails. Only applies when the run "
                                    + "time is unbounded; a bounded run starts over until it "
                                    + "times out.");

    public static final ConfigOption<Duration> MAX_RUN_TIME =
            ConfigOptions.key("rebalancer.max-run-time")
                    .durationType()
                    .defaultValue(Duration.ZERO)
                    .withDescription("Maximum run time of the rebalancer, 0 means unbounded.");

    public static final ConfigOption<Boolean> MOVE_RF1_REPLICAS =
            ConfigOptions.key("rebalancer.move-rf1-replicas")
                    .booleanType()
                    .defaultValue(false)
                    .withDescription(
                            "Whether to move replicas of tablets with a replication factor of one.");

    public static final ConfigOption<Boolean> OUTPUT_REPLICA_DISTRIBUTION_DETAILS =
            ConfigOptions.key("rebalancer.output-replica-distribution-details")
                    .booleanType()
                    .defaultValue(false)
                    .withDescription(
                            "Whether the statistics report includes per-table and per-server "
                                    + "replica distribution details.");

    public static final ConfigOption<Duration> POLL_INTERVAL =
            ConfigOptions.key("rebalancer.poll-interval")
                    .durationType()
                    .defaultValue(Duration.ofMillis(200))
                    .withDescription(
                            "Pause between two polls of the moves in flight when no progress "
                                    + "was observed.");

    private RebalancerOptions() {}
}
