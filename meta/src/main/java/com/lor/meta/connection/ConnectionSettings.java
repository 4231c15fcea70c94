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

import lombok.Getter;
import lombok.ToString;

/**
 * Connection settings as configured, before host splitting and validation.
 * <p>
 * The builder merges incrementally: configuration sources may pass nulls for
 * values they do not define, so writes that carry no value keep the prior one.
 */
@Getter
@ToString(exclude = "password")
public final class ConnectionSettings {

    public static final String DEFAULT_HOST_NAME = "localhost";

    public static final String DEFAULT_VIRTUAL_HOST = "/";

    public static final String DEFAULT_USERNAME = "guest";

    public static final String DEFAULT_PASSWORD = "guest";

    public static final int DEFAULT_PORT = 5672;

    private final String hostName;

    private final int port;

    private final String virtualHost;

    private final String username;

    private final String password;

    private final String productId;

    private final TlsOptions tls;

    private ConnectionSettings(Builder builder) {
        this.hostName = builder.hostName;
        this.port = builder.port;
        this.virtualHost = builder.virtualHost;
        this.username = builder.username;
        this.password = builder.password;
        this.productId = builder.productId;
        this.tls = builder.tls;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .hostName(hostName)
            .port(port)
            .virtualHost(virtualHost)
            .username(username)
            .password(password)
            .productId(productId)
            .tls(tls);
    }

    /**
     * Splits the comma separated host name into one entry per host, each sharing
     * the port and TLS options, and validates the result.
     *
     * @return the resolved descriptor
     * @throws IllegalArgumentException if the settings cannot describe a connection
     */
    public ConnectionDescriptor resolve() {
        ConnectionDescriptor.ConnectionDescriptorBuilder descriptor = ConnectionDescriptor.builder()
            .port(port)
            .virtualHost(virtualHost)
            .username(username)
            .password(password)
            .productId(productId)
            .tls(tls);
        for (String host : hostName.split(",")) {
            String trimmed = host.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            descriptor.host(new HostEntry(trimmed, port, tls.resolveFor(trimmed)));
        }
        ConnectionDescriptor resolved = descriptor.build();
        resolved.validate();
        return resolved;
    }

    public static final class Builder {

        private String hostName = DEFAULT_HOST_NAME;

        private int port = DEFAULT_PORT;

        private String virtualHost = DEFAULT_VIRTUAL_HOST;

        private String username = DEFAULT_USERNAME;

        private String password = DEFAULT_PASSWORD;

        private String productId;

        private TlsOptions tls = TlsOptions.disabled();

        private Builder() {
        }

        /**
         * Sets one or more comma separated broker host names; null or empty is ignored.
         */
        public Builder hostName(String hostName) {
            if (hostName != null && !hostName.isEmpty()) {
                this.hostName = hostName;
            }
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        /**
         * Sets the virtual host; null or empty is ignored.
         */
        public Builder virtualHost(String virtualHost) {
            if (virtualHost != null && !virtualHost.isEmpty()) {
                this.virtualHost = virtualHost;
            }
            return this;
        }

        public Builder username(String username) {
            if (username != null) {
                this.username = username;
            }
            return this;
        }

        public Builder password(String password) {
            if (password != null) {
                this.password = password;
            }
            return this;
        }

        public Builder productId(String productId) {
            this.productId = productId;
            return this;
        }

        public Builder tls(TlsOptions tls) {
            if (tls != null) {
                this.tls = tls;
            }
            return this;
        }

        public ConnectionSettings build() {
            return new ConnectionSettings(this);
        }
    }
}
