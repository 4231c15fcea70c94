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
package com.lor.core.client.rabbit;

import com.lor.core.client.BrokerClient;
import com.lor.core.client.BrokerConnection;
import com.lor.meta.connection.ConnectionDescriptor;
import com.lor.meta.connection.HostEntry;
import com.lor.meta.connection.PolicyError;
import com.lor.meta.connection.TlsOptions;
import com.rabbitmq.client.Address;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.SocketConfigurator;
import com.rabbitmq.client.SocketConfigurators;

import javax.net.ssl.SNIHostName;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLSocket;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;

/**
 * Connects through the RabbitMQ Java client. Hosts are tried in order, the
 * client recovers the connection on its own after a network failure.
 */
public class RabbitBrokerClient implements BrokerClient {

    static final String PRODUCT_PROPERTY = "product";

    private final TlsContextFactory tlsContextFactory;

    public RabbitBrokerClient() {
        this(new TlsContextFactory());
    }

    public RabbitBrokerClient(TlsContextFactory tlsContextFactory) {
        this.tlsContextFactory = tlsContextFactory;
    }

    @Override
    public BrokerConnection connect(ConnectionDescriptor descriptor) throws Exception {
        descriptor.validate();
        ConnectionFactory factory = createConnectionFactory(descriptor);
        Connection connection = factory.newConnection(addresses(descriptor), descriptor.getProductId());
        return new RabbitBrokerConnection(connection);
    }

    ConnectionFactory createConnectionFactory(ConnectionDescriptor descriptor) throws Exception {
        ConnectionFactory factory = new ConnectionFactory();
        factory.setPort(descriptor.getPort());
        factory.setVirtualHost(descriptor.getVirtualHost());
        factory.setUsername(descriptor.getUsername());
        factory.setPassword(descriptor.getPassword());
        factory.setAutomaticRecoveryEnabled(true);
        factory.setThreadFactory(daemonThreadFactory());
        if (descriptor.getProductId() != null) {
            Map<String, Object> clientProperties = new HashMap<>(factory.getClientProperties());
            clientProperties.put(PRODUCT_PROPERTY, descriptor.getProductId());
            factory.setClientProperties(clientProperties);
        }
        if (descriptor.isUseTls()) {
            TlsOptions tls = descriptor.getTls();
            factory.useSslProtocol(tlsContextFactory.createContext(tls));
            boolean verifyHostName = !tls.isAcceptable(PolicyError.REMOTE_CERTIFICATE_NAME_MISMATCH);
            if (tls.getServerName() != null && !tls.getServerName().isEmpty()) {
                factory.setSocketConfigurator(SocketConfigurators.defaultConfigurator()
                    .andThen(serverIdentity(tls.getServerName(), verifyHostName)));
            } else if (verifyHostName) {
                factory.enableHostnameVerification();
            }
        }
        return factory;
    }

    static List<Address> addresses(ConnectionDescriptor descriptor) {
        List<Address> addresses = new ArrayList<>();
        for (HostEntry host : descriptor.getHosts()) {
            addresses.add(new Address(host.getHost(), host.getPort()));
        }
        return addresses;
    }

    /**
     * Sends the server name as SNI; with verification on, the certificate is checked
     * against that name instead of the address connected to.
     */
    static SocketConfigurator serverIdentity(String serverName, boolean verifyHostName) {
        return socket -> {
            if (socket instanceof SSLSocket) {
                SSLSocket sslSocket = (SSLSocket) socket;
                SSLParameters parameters = sslSocket.getSSLParameters();
                parameters.setServerNames(Collections.singletonList(new SNIHostName(serverName)));
                if (verifyHostName) {
                    parameters.setEndpointIdentificationAlgorithm("HTTPS");
                }
                sslSocket.setSSLParameters(parameters);
            }
        };
    }

    private static ThreadFactory daemonThreadFactory() {
        ThreadFactory delegate = Executors.defaultThreadFactory();
        return runnable -> {
            Thread thread = delegate.newThread(runnable);
            thread.setDaemon(true);
            return thread;
        };
    }
}
