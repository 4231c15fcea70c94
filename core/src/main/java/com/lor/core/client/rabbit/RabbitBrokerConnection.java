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

import com.lor.core.client.BrokerConnection;
import com.lor.core.message.OutboundMessage;
import com.lor.meta.Exchange;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;

import java.io.IOException;
import java.util.Date;
import java.util.concurrent.TimeoutException;

/**
 * A RabbitMQ connection. Topology operations each use their own short-lived
 * channel, since a rejected declaration closes the channel it ran on.
 * Publishes share one channel and are serialised on it.
 */
public class RabbitBrokerConnection implements BrokerConnection {

    private final Connection connection;

    private final Object publishLock = new Object();

    private Channel publishChannel;

    public RabbitBrokerConnection(Connection connection) {
        this.connection = connection;
    }

    @Override
    public boolean isConnected() {
        return connection.isOpen();
    }

    @Override
    public void declareExchange(Exchange exchange) throws IOException {
        try (Channel channel = connection.createChannel()) {
            channel.exchangeDeclare(exchange.getName(), exchange.getType().value(),
                exchange.getDurable(), exchange.getAutoDelete(), null);
        } catch (TimeoutException e) {
            throw new IOException("timed out closing the channel of exchange " + exchange.getName(), e);
        }
    }

    @Override
    public void bind(String source, String destination, String routingPattern) throws IOException {
        try (Channel channel = connection.createChannel()) {
            channel.exchangeBind(destination, source, routingPattern);
        } catch (TimeoutException e) {
            throw new IOException("timed out closing the channel of binding " + source + " -> " + destination, e);
        }
    }

    @Override
    public void publish(String exchange, boolean mandatory, OutboundMessage message) throws IOException {
        AMQP.BasicProperties properties = toBasicProperties(message);
        synchronized (publishLock) {
            if (publishChannel == null || !publishChannel.isOpen()) {
                publishChannel = connection.createChannel();
            }
            publishChannel.basicPublish(exchange, message.getRoutingKey(), mandatory, properties, message.getBody());
        }
    }

    @Override
    public void dispose() throws IOException {
        connection.close();
    }

    static AMQP.BasicProperties toBasicProperties(OutboundMessage message) {
        return new AMQP.BasicProperties.Builder()
            .contentType(message.getContentType())
            .contentEncoding(message.getContentEncoding())
            .appId(message.getAppId())
            .deliveryMode(message.getDeliveryMode())
            .priority(message.getPriority())
            .timestamp(new Date(message.getTimestampSeconds() * 1000))
            .userId(message.getUserId())
            .headers(message.getHeaders())
            .build();
    }
}
