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
package com.lor.core;

import com.lor.core.client.InMemoryBrokerClient;
import com.lor.core.client.InMemoryBrokerConnection;
import com.lor.core.config.ExchangeProperties;
import com.lor.core.config.MessageProperties;
import com.lor.core.config.SslProperties;
import com.lor.core.lifecycle.ConnectionLifecycle;
import com.lor.core.lifecycle.ConnectionState;
import com.lor.core.message.OutboundMessage;
import com.lor.meta.connection.PolicyError;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.appender.AppenderLoggingException;
import org.apache.logging.log4j.core.impl.Log4jLogEvent;
import org.apache.logging.log4j.core.layout.PatternLayout;
import org.apache.logging.log4j.message.SimpleMessage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class AmqpAppenderTest {

    private InMemoryBrokerClient client;

    private InMemoryBrokerConnection connection;

    private RecordingErrorHandler errors;

    private AmqpAppender appender;

    @BeforeEach
    void setUp() {
        client = new InMemoryBrokerClient();
        connection = client.getConnection();
        errors = new RecordingErrorHandler();
    }

    @AfterEach
    void tearDown() {
        if (appender != null && !appender.isStopped()) {
            appender.stop();
        }
    }

    private AmqpAppender.Builder<?> builder() {
        return AmqpAppender.newBuilder()
            .setName("amqp")
            .setLayout(PatternLayout.newBuilder().withPattern("%m").build())
            .setBrokerClient(client)
            .setStartupExecutor(Runnable::run);
    }

    private AmqpAppender start(AmqpAppender created) {
        appender = created;
        appender.setHandler(errors);
        appender.start();
        return appender;
    }

    private static LogEvent event(Level level, String message) {
        return Log4jLogEvent.newBuilder()
            .setLoggerName("com.example.OrderService")
            .setLevel(level)
            .setMessage(new SimpleMessage(message))
            .setTimeMillis(1_700_000_000_000L)
            .build();
    }

    @Test
    void testBuilderDefaults() {
        AmqpAppender created = builder().build();

        assertEquals("localhost", created.getSettings().getHostName());
        assertEquals(5672, created.getSettings().getPort());
        assertEquals("/", created.getSettings().getVirtualHost());
        assertEquals("guest", created.getSettings().getUsername());
        assertEquals("guest", created.getSettings().getPassword());
        assertFalse(created.getSettings().getTls().isEnabled());
        assertEquals("app-logging", created.getExchangeProperties().getName());
        assertEquals("{0}", created.getTranslator().getTopicPattern());
    }

    @Test
    void testBuilderIgnoresMissingValues() {
        AmqpAppender created = builder()
            .setHostName("rabbit-1")
            .setVirtualHost("logs")
            .setExchange("audit-logging")
            .setHostName(null)
            .setHostName("")
            .setVirtualHost(null)
            .setExchange(null)
            .build();

        assertEquals("rabbit-1", created.getSettings().getHostName());
        assertEquals("logs", created.getSettings().getVirtualHost());
        assertEquals("audit-logging", created.getExchangeProperties().getName());
    }

    @Test
    void testTopLevelAttributesOverrideNestedProperties() {
        ExchangeProperties exchange = new ExchangeProperties();
        exchange.setName("nested");
        MessageProperties message = new MessageProperties();
        message.setAppId("nested-app");

        AmqpAppender created = builder()
            .setExchangeProperties(exchange)
            .setMessageProperties(message)
            .setExchange("top-level")
            .setAppId("billing")
            .setExtendedData(true)
            .build();

        assertEquals("top-level", created.getExchangeProperties().getName());
        assertEquals("billing", created.getTranslator().getMessageProperties().getAppId());
        assertTrue(created.getTranslator().getMessageProperties().isExtendedData());
        assertEquals("billing", created.getSettings().getProductId());
    }

    @Test
    void testSslIsPassedToSettings() {
        SslProperties ssl = SslProperties.createSsl(true, "rabbit.example.com", null, null,
            "RemoteCertificateNameMismatch", "TLSv1.3", null);

        AmqpAppender created = builder().setSsl(ssl).setPort(5671).build();

        assertTrue(created.getSettings().getTls().isEnabled());
        assertEquals("rabbit.example.com", created.getSettings().getTls().getServerName());
        assertTrue(created.getSettings().getTls().isAcceptable(PolicyError.REMOTE_CERTIFICATE_NAME_MISMATCH));
        assertEquals("TLSv1.3", created.getSettings().getTls().getVersion());
    }

    @Test
    void testStartDeclaresTopology() {
        ExchangeProperties exchange = ExchangeProperties.createExchangeProperties(
            "app-logging", "topic", true, false, null).addBinding("audit", "error.#");

        start(builder().setExchangeProperties(exchange).build());

        assertTrue(appender.isStarted());
        assertEquals(List.of(
            "declare app-logging topic durable=true autoDelete=false",
            "bind app-logging -> audit error.#"
        ), connection.getOperations());
        assertTrue(errors.getReported().isEmpty());
    }

    @Test
    void testUnknownExchangeTypeIsReportedAtStartup() {
        ExchangeProperties exchange = ExchangeProperties.createExchangeProperties(
            "app-logging", "x-consistent-hash-typo", true, false, null);

        start(builder().setExchangeProperties(exchange).build());

        assertTrue(appender.isStarted());
        assertEquals(List.of(ConnectionLifecycle.DECLARE_FAILED), errors.getMessages());
    }

    @Test
    void testAppendPublishesToExchange() {
        MessageProperties message = new MessageProperties();
        message.setPersistent(true);
        start(builder().setExchange("app-logging").setTopic("app.{0}").setMessageProperties(message).build());

        appender.append(event(Level.ERROR, "order failed"));

        assertEquals(1, connection.getPublished().size());
        InMemoryBrokerConnection.Published published = connection.getPublished().get(0);
        assertEquals("app-logging", published.getExchange());
        assertFalse(published.isMandatory());
        OutboundMessage outbound = published.getMessage();
        assertEquals("app.ERROR", outbound.getRoutingKey());
        assertEquals("order failed", outbound.getBodyAsString());
        assertEquals(2, outbound.getDeliveryMode());
        assertEquals("guest", outbound.getUserId());
        assertEquals(1_700_000_000L, outbound.getTimestampSeconds());
    }

    @Test
    void testAppendBeforeConnectIsDropped() {
        CountDownLatch gate = new CountDownLatch(1);
        client.setGate(gate);
        start(builder().setStartupExecutor(ConnectionLifecycle.daemonThreadExecutor("appender-test")).build());

        assertDoesNotThrow(() -> appender.append(event(Level.ERROR, "too early")));

        assertEquals(ConnectionState.CONNECTING, appender.getLifecycle().getState());
        assertTrue(connection.getPublished().isEmpty());
        assertTrue(errors.getReported().isEmpty());
        gate.countDown();
    }

    @Test
    void testAppendAfterConnectFailureIsDropped() {
        client.setConnectFailure(new IOException("Connection refused"));
        start(builder().build());

        assertDoesNotThrow(() -> appender.append(event(Level.ERROR, "lost")));

        assertTrue(connection.getPublished().isEmpty());
        assertEquals(List.of(ConnectionLifecycle.CONNECT_FAILED), errors.getMessages());
    }

    @Test
    void testAppendWhileDisconnectedIsDropped() {
        start(builder().build());
        connection.setConnected(false);

        appender.append(event(Level.ERROR, "lost"));

        assertTrue(connection.getPublished().isEmpty());
        assertTrue(errors.getReported().isEmpty());
    }

    @Test
    void testPublishFailurePropagates() {
        start(builder().build());
        IOException failure = new IOException("channel closed");
        connection.setPublishFailure(failure);

        AppenderLoggingException thrown = assertThrows(AppenderLoggingException.class,
            () -> appender.append(event(Level.ERROR, "x")));

        assertSame(failure, thrown.getCause());
    }

    @Test
    void testStopDisposesConnection() {
        start(builder().build());

        assertTrue(appender.stop(1, TimeUnit.SECONDS));

        assertTrue(appender.isStopped());
        assertEquals(1, connection.getDisposeCount());
        assertEquals(ConnectionState.DISPOSED, appender.getLifecycle().getState());
    }

    @Test
    void testStopTwiceDisposesOnce() {
        start(builder().build());

        appender.stop(1, TimeUnit.SECONDS);
        assertDoesNotThrow(() -> appender.stop(1, TimeUnit.SECONDS));

        assertEquals(1, connection.getDisposeCount());
        assertTrue(errors.getReported().isEmpty());
    }

    @Test
    void testAppendAfterStopIsDropped() {
        start(builder().build());
        appender.stop(1, TimeUnit.SECONDS);

        appender.append(event(Level.ERROR, "late"));

        assertTrue(connection.getPublished().isEmpty());
    }
}
