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
package com.lor.core.config;

import com.lor.meta.Binding;
import com.lor.meta.ExchangeTopology;
import com.lor.meta.ExchangeType;
import com.lor.meta.connection.PolicyError;
import com.lor.meta.connection.TlsOptions;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.impl.Log4jLogEvent;
import org.apache.logging.log4j.message.SimpleMessage;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PluginPropertiesTest {

    private static LogEvent event(Level level) {
        return Log4jLogEvent.newBuilder()
            .setLoggerName("com.example.OrderService")
            .setLevel(level)
            .setMessage(new SimpleMessage("x"))
            .build();
    }

    @Test
    void testExchangePropertiesDefaults() {
        ExchangeTopology topology = new ExchangeProperties().toTopology();

        assertEquals("app-logging", topology.getName());
        assertEquals(ExchangeType.Topic, topology.getExchange().getType());
        assertTrue(topology.getExchange().getDurable());
        assertFalse(topology.getExchange().getAutoDelete());
    }

    @Test
    void testExchangePropertiesFactory() {
        ExchangeProperties properties = ExchangeProperties.createExchangeProperties("events", "FANOUT", false, true,
            new BindingProperties[] {
                BindingProperties.createBinding("audit", "error.#"),
                BindingProperties.createBinding("archive", null)
            });

        ExchangeTopology topology = properties.toTopology();

        assertEquals("events", topology.getName());
        assertEquals(ExchangeType.Fanout, topology.getExchange().getType());
        assertFalse(topology.getExchange().getDurable());
        assertTrue(topology.getExchange().getAutoDelete());
        assertEquals(List.of(
            new Binding("events", "audit", "error.#"),
            new Binding("events", "archive", "")
        ), topology.getBindings());
    }

    @Test
    void testExchangePropertiesKeepsNameOnNull() {
        ExchangeProperties properties = ExchangeProperties.createExchangeProperties(null, "topic", true, false, null);

        assertEquals("app-logging", properties.getName());
    }

    @Test
    void testUnknownExchangeTypeFailsOnlyWhenDeclaring() {
        ExchangeProperties properties = assertDoesNotThrow(
            () -> ExchangeProperties.createExchangeProperties("events", "nope", true, false, null));

        assertThrows(IllegalArgumentException.class, properties::toTopology);
    }

    @Test
    void testMessagePropertiesFactory() {
        MessageProperties properties = MessageProperties.createMessageProperties(
            "billing", true, "%m", "app.%p", "text/%p", true, null);

        assertEquals("billing", properties.getAppId());
        assertTrue(properties.isPersistent());
        assertTrue(properties.isExtendedData());
        assertEquals("x", properties.getPriority().format(event(Level.INFO)));
        assertEquals("app.WARN", properties.getTopic().format(event(Level.WARN)));
        assertEquals("text/ERROR", properties.getContentType().format(event(Level.ERROR)));
    }

    @Test
    void testMessagePropertiesWithoutExpressions() {
        MessageProperties properties = MessageProperties.createMessageProperties(
            null, false, null, null, null, false, null);

        assertNull(properties.getAppId());
        assertNull(properties.getPriority());
        assertNull(properties.getTopic());
        assertEquals("text/plain", properties.getContentType().format(event(Level.INFO)));
    }

    @Test
    void testSslPolicyErrorNames() {
        assertEquals(EnumSet.of(PolicyError.REMOTE_CERTIFICATE_NAME_MISMATCH, PolicyError.REMOTE_CERTIFICATE_CHAIN_ERRORS),
            SslProperties.parsePolicyErrors("RemoteCertificateNameMismatch, REMOTE_CERTIFICATE_CHAIN_ERRORS"));
        assertEquals(EnumSet.of(PolicyError.REMOTE_CERTIFICATE_NOT_AVAILABLE),
            SslProperties.parsePolicyErrors("remote_certificate_not_available,Bogus"));
        assertTrue(SslProperties.parsePolicyErrors(null).isEmpty());
    }

    @Test
    void testSslToTlsOptions() {
        SslProperties ssl = SslProperties.createSsl(true, "rabbit.example.com", "client.p12", "changeit",
            "RemoteCertificateChainErrors", "TLSv1.3", "ca.pem, intermediate.pem");

        TlsOptions tls = ssl.toTlsOptions();

        assertTrue(tls.isEnabled());
        assertEquals("rabbit.example.com", tls.getServerName());
        assertEquals("client.p12", tls.getCertPath());
        assertEquals("changeit", tls.getCertPassphrase());
        assertTrue(tls.isAcceptable(PolicyError.REMOTE_CERTIFICATE_CHAIN_ERRORS));
        assertEquals("TLSv1.3", tls.getVersion());
        assertEquals(List.of("ca.pem", "intermediate.pem"), tls.getCertificatePaths());
    }

    @Test
    void testDisabledSsl() {
        SslProperties ssl = SslProperties.createSsl(false, "rabbit.example.com", null, null, null, null, null);

        assertFalse(ssl.toTlsOptions().isEnabled());
    }
}
