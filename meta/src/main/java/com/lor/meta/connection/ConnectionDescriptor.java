/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements. See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License. You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.lor.meta.connection;

import lombok.Builder;
import lombok.Singular;
import lombok.ToString;
import lombok.Value;

import java.util.List;

/**
 * Fully resolved connection parameters, produced by {@link ConnectionSettings#resolve()}.
 */
@Value
@Builder
@ToString(exclude = "password")
public class ConnectionDescriptor {

    public static final int MIN_PORT = 1;

    public static final int MAX_PORT = 65535;

    @Singular
    List<HostEntry> hosts;

    int port;

    String virtualHost;

    String username;

    String password;

    /**
     * Reported to the broker as the client product and connection name
     */
    String productId;

    TlsOptions tls;

    public boolean isUseTls() {
        return tls != null && tls.isEnabled();
    }

    /**
     * Checks the descriptor before a connection attempt.
     *
     * @throws IllegalArgumentException if no host is given, a host name is blank,
     *                                  the port is out of range or TLS is not resolved
     */
    public void validate() {
        if (hosts.isEmpty()) {
            throw new IllegalArgumentException("at least one host is required");
        }
        if (port < MIN_PORT || port > MAX_PORT) {
            throw new IllegalArgumentException("port " + port + " is out of range");
        }
        for (HostEntry entry : hosts) {
            if (entry.getHost() == null || entry.getHost().isBlank()) {
                throw new IllegalArgumentException("host name must not be blank");
            }
            if (entry.getPort() < MIN_PORT || entry.getPort() > MAX_PORT) {
                throw new IllegalArgumentException("port " + entry.getPort() + " of host " + entry.getHost() + " is out of range");
            }
            if (isUseTls()) {
                TlsOptions hostTls = entry.getTls();
                if (hostTls == null || !hostTls.isEnabled() || hostTls.getServerName() == null || hostTls.getServerName().isEmpty()) {
                    throw new IllegalArgumentException("TLS options of host " + entry.getHost() + " are not resolved");
                }
            }
        }
    }
}
