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
package com.lor.core.client;

import com.lor.core.message.OutboundMessage;
import com.lor.meta.Exchange;

import java.io.IOException;

/**
 * An established broker connection, owned by whoever called
 * {@link BrokerClient#connect}.
 */
public interface BrokerConnection {

    /**
     * Whether the connection can currently carry publishes
     */
    boolean isConnected();

    /**
     * Declares an exchange
     *
     * @param exchange the exchange name, type, durability and auto-delete flag
     * @throws IOException if the broker rejects the declaration
     */
    void declareExchange(Exchange exchange) throws IOException;

    /**
     * Binds the source exchange to a destination exchange
     *
     * @param source the source exchange name
     * @param destination the destination exchange name
     * @param routingPattern the binding pattern
     * @throws IOException if the broker rejects the binding
     */
    void bind(String source, String destination, String routingPattern) throws IOException;

    /**
     * Publishes a message without waiting for a broker acknowledgement
     *
     * @param exchange the exchange name
     * @param mandatory whether unroutable messages should be returned
     * @param message the message, carrying its routing key
     * @throws IOException if the message could not be written
     */
    void publish(String exchange, boolean mandatory, OutboundMessage message) throws IOException;

    /**
     * Closes the connection
     *
     * @throws IOException if closing fails
     */
    void dispose() throws IOException;
}
