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

/**
 * The consensus configuration precondition of a replica move. A move is either submitted
 * unconditionally ({@link #none()}), or as a compare-and-swap against the configuration version
 * the move was computed from ({@link #expected(long)}), so it is rejected rather than racing a
 * concurrent configuration change.
 *
 * <p>Both shapes are handled through a {@link Visitor}, so a caller can not mistake one for the
 * other.
 */
public abstract class ConfigVersionCheck {

    private static final ConfigVersionCheck NO_VERSION_CHECK = new NoVersionCheck();

    public static ConfigVersionCheck none() {
        return NO_VERSION_CHECK;
    }

    public static ConfigVersionCheck expected(long version) {
        return new ExpectedVersion(version);
    }

    public abstract <R, E extends Exception> R accept(Visitor<R, E> visitor) throws E;

    /**
     * Visitor over the shapes of a {@link ConfigVersionCheck}.
     *
     * @param <R> result type
     * @param <E> exception the visitor may throw
     */
    public interface Visitor<R, E extends Exception> {
        R visitNoVersionCheck() throws E;

        R visitExpectedVersion(long version) throws E;
    }

    private ConfigVersionCheck() {}

    private static final class NoVersionCheck extends ConfigVersionCheck {
        @Override
        public <R, E extends Exception> R accept(Visitor<R, E> visitor) throws E {
            return visitor.visitNoVersionCheck();
        }

        @Override
        public String toString() {
            return "NoVersionCheck";
        }
    }

    private static final class ExpectedVersion extends ConfigVersionCheck {
        private final long version;

        private ExpectedVersion(long version) {
            this.version = version;
        }

        @Override
        public <R, E extends Exception> R accept(Visitor<R, E> visitor) throws E {
            return visitor.visitExpectedVersion(version);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            return version == ((ExpectedVersion) o).version;
        }

        @Override
        public int hashCode() {
            return Long.hashCode(version);
        }

        @Override
        public String toString() {
            return "ExpectedVersion(" + version + ")";
        }
    }
}
