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

package org.tabletrebalancer.rebalance.health;

/** Health of a tablet server as reported by the health scan. */
public enum ServerHealth {
    /** The server is reachable and reports the expected identity. */
    HEALTHY,
    /** The server rejected the scan because of missing privileges. */
    UNAUTHORIZED,
    /** The server did not respond. */
    UNAVAILABLE,
    /** The server responded with another UUID than the one registered at the masters. */
    WRONG_SERVER_UUID
}
