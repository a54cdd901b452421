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

package org.tabletrebalancer.rebalance.stats;

import org.tabletrebalancer.rebalance.model.ClusterInfo;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.tabletrebalancer.utils.Preconditions.checkNotNull;

/** Prints the distribution of the replicas over the tablet servers in human readable form. */
public class ReplicaDistributionPrinter {

    private final boolean printDetails;

    public ReplicaDistributionPrinter(boolean printDetails) {
        this.printDetails = printDetails;
    }

    /**
     * Prints the replica distribution of the balance model.
     *
     * @param addresses addresses of the tablet servers by uuid, servers without an address are
     *     printed with an empty one
     */
    public void print(ClusterInfo clusterInfo, Map<String, String> addresses, Appendable out)
            throws IOException {
        checkNotNull(clusterInfo);
        printServerSummary(clusterInfo, addresses, out);
        out.append(System.lineSeparator());
        printTableSummary(clusterInfo, out);
    }

    private void printServerSummary(
            ClusterInfo clusterInfo, Map<String, String> addresses, Appendable out)
            throws IOException {
        Collection<Integer> totals = clusterInfo.totalReplicaCounts().values();
        out.append("Per-server replica distribution summary:").append(System.lineSeparator());
        printTable(
                Arrays.asList("Statistic", "Value"),
                Arrays.asList(
                        Arrays.asList("Minimum Replica Count", String.valueOf(min(totals))),
                        Arrays.asList("Maximum Replica Count", String.valueOf(max(totals))),
                        Arrays.asList(
                                "Average Replica Count",
                                String.format(Locale.ROOT, "%.6f", average(totals)))),
                out);

        if (printDetails) {
            out.append(System.lineSeparator())
                    .append("Per-server replica distribution details:")
                    .append(System.lineSeparator());
            List<List<String>> rows = new ArrayList<>();
            clusterInfo
                    .totalReplicaCounts()
                    .forEach(
                            (server, count) ->
                                    rows.add(
                                            Arrays.asList(
                                                    server,
                                                    addresses.getOrDefault(server, ""),
                                                    String.valueOf(count))));
            printTable(Arrays.asList("UUID", "Address", "Replica Count"), rows, out);
        }
    }

    private void printTableSummary(ClusterInfo clusterInfo, Appendable out) throws IOException {
        List<Integer> skews = new ArrayList<>();
        for (String table : clusterInfo.tables()) {
            skews.add(clusterInfo.tableSkew(table));
        }
        out.append("Per-table replica distribution summary:").append(System.lineSeparator());
        printTable(
                Arrays.asList("Replica Skew", "Value"),
                Arrays.asList(
                        Arrays.asList("Minimum", String.valueOf(min(skews))),
                        Arrays.asList("Maximum", String.valueOf(max(skews))),
                        Arrays.asList(
                                "Average", String.format(Locale.ROOT, "%.6f", average(skews)))),
                out);

        if (printDetails) {
            out.append(System.lineSeparator())
                    .append("Per-table replica distribution details:")
                    .append(System.lineSeparator());
            for (String table : clusterInfo.tables()) {
                out.append(
                                String.format(
                                        "Table: %s (%s), skew %d",
                                        table,
                                        clusterInfo.tableName(table),
                                        clusterInfo.tableSkew(table)))
                        .append(System.lineSeparator());
                List<List<String>> rows = new ArrayList<>();
                clusterInfo
                        .replicaCounts(table)
                        .forEach(
                                (server, count) ->
                                        rows.add(Arrays.asList(server, String.valueOf(count))));
                printTable(Arrays.asList("UUID", "Replica Count"), rows, out);
            }
        }
    }

    /** Prints the rows as a table with left aligned, padded columns. */
    private static void printTable(List<String> header, List<List<String>> rows, Appendable out)
            throws IOException {
        int[] widths = new int[header.size()];
        for (int i = 0; i < header.size(); i++) {
            widths[i] = header.get(i).length();
            for (List<String> row : rows) {
                widths[i] = Math.max(widths[i], row.get(i).length());
            }
        }
        printRow(header, widths, out);
        StringBuilder separator = new StringBuilder();
        for (int i = 0; i < widths.length; i++) {
            if (i > 0) {
                separator.append('+');
            }
            separator.append(String.join("", Collections.nCopies(widths[i] + 2, "-")));
        }
        out.append(separator).append(System.lineSeparator());
        for (List<String> row : rows) {
            printRow(row, widths, out);
        }
    }

    private static void printRow(List<String> cells, int[] widths, Appendable out)
            throws IOException {
        StringBuilder line = new StringBuilder();
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) {
                line.append('|');
            }
            line.append(' ')
                    .append(String.format("%-" + widths[i] + "s", cells.get(i)))
                    .append(' ');
        }
        out.append(line.toString().replaceAll("\\s+$", "")).append(System.lineSeparator());
    }

    private static int min(Collection<Integer> values) {
        return values.isEmpty() ? 0 : Collections.min(values);
    }

    private static int max(Collection<Integer> values) {
        return values.isEmpty() ? 0 : Collections.max(values);
    }

    private static double average(Collection<Integer> values) {
        return values.stream().mapToInt(Integer::intValue).average().orElse(0);
    }
}
