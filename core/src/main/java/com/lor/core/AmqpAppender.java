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

import com.lor.core.client.BrokerClient;
import com.lor.core.client.rabbit.RabbitBrokerClient;
import com.lor.core.config.ExchangeProperties;
import com.lor.core.config.MessageProperties;
import com.lor.core.config.SslProperties;
import com.lor.core.format.LayoutRecordFormatter;
import com.lor.core.lifecycle.ConnectionLifecycle;
import com.lor.core.message.MessageTranslator;
import com.lor.meta.connection.ConnectionSettings;
import lombok.AccessLevel;
import lombok.Getter;
import org.apache.logging.log4j.core.Appender;
import org.apache.logging.log4j.core.Core;
import org.apache.logging.log4j.core.Filter;
import org.apache.logging.log4j.core.Layout;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.appender.AppenderLoggingException;
import org.apache.logging.log4j.core.config.Property;
import org.apache.logging.log4j.core.config.plugins.Plugin;
import org.apache.logging.log4j.core.config.plugins.PluginAliases;
import org.apache.logging.log4j.core.config.plugins.PluginBuilderAttribute;
import org.apache.logging.log4j.core.config.plugins.PluginBuilderFactory;
import org.apache.logging.log4j.core.config.plugins.PluginElement;

import java.io.IOException;
import java.io.Serializable;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Publishes log events to an AMQP exchange.
 * <p>
 * Starting the appender returns at once: the connection is opened and the
 * exchange declared in the background. Events logged while there is no open
 * connection are dropped.
 * <pre>
 * &lt;RabbitMQ name="amqp" hostName="rabbit-1,rabbit-2" virtualHost="/" username="guest" password="guest"
 *           topic="app.{0}" exchange="app-logging"&gt;
 *     &lt;PatternLayout pattern="%m%n"/&gt;
 *     &lt;ExchangeProperties type="topic" durable="true"&gt;
 *         &lt;Binding destination="audit" topic="ERROR.#"/&gt;
 *     &lt;/ExchangeProperties&gt;
 *     &lt;MessageProperties persistent="true" priority="%X{priority}"/&gt;
 * &lt;/RabbitMQ&gt;
 * </pre>
 */
@Plugin(name = AmqpAppender.PLUGIN_NAME, category = Core.CATEGORY_NAME, elementType = Appender.ELEMENT_TYPE, printObject = true)
public final class AmqpAppender extends AbstractAppender {

    public static final String PLUGIN_NAME = "RabbitMQ";

    @Getter
    private final ConnectionSettings settings;

    @Getter
    private final ExchangeProperties exchangeProperties;

    @Getter
    private final MessageTranslator translator;

    @Getter(AccessLevel.PACKAGE)
    private final ConnectionLifecycle lifecycle;

    private AmqpAppender(String name, Filter filter, Layout<? extends Serializable> layout, boolean ignoreExceptions,
                         Property[] properties, ConnectionSettings settings, ExchangeProperties exchangeProperties,
                         MessageTranslator translator, BrokerClient brokerClient, Executor startupExecutor) {
        super(name, filter, layout, ignoreExceptions, properties);
        this.settings = settings;
        this.exchangeProperties = exchangeProperties;
        this.translator = translator;
        this.lifecycle = new ConnectionLifecycle(brokerClient, startupExecutor, this::getHandler);
    }

    @PluginBuilderFactory
    public static <B extends Builder<B>> B newBuilder() {
        return new Builder<B>().asBuilder();
    }

    @Override
    public void start() {
        lifecycle.activate(settings, exchangeProperties::toTopology);
        super.start();
    }

    @Override
    public void append(LogEvent event) {
        String exchange = exchangeProperties.getName();
        try {
            lifecycle.withConnection(connection -> connection.publish(exchange, false, translator.translate(event)));
        } catch (IOException e) {
            throw new AppenderLoggingException("could not publish to exchange " + exchange, e);
        }
    }

    @Override
    public boolean stop(long timeout, TimeUnit timeUnit) {
        setStopping();
        boolean stopped = super.stop(timeout, timeUnit, false);
        lifecycle.shutdown();
        setStopped();
        return stopped;
    }

    public static class Builder<B extends Builder<B>> extends AbstractAppender.Builder<B>
        implements org.apache.logging.log4j.core.util.Builder<AmqpAppender> {

        @PluginBuilderAttribute
        private String hostName = ConnectionSettings.DEFAULT_HOST_NAME;

        @PluginBuilderAttribute
        private int port = ConnectionSettings.DEFAULT_PORT;

        @PluginBuilderAttribute
        @PluginAliases("vHost")
        private String virtualHost = ConnectionSettings.DEFAULT_VIRTUAL_HOST;

        @PluginBuilderAttribute
        private String username = ConnectionSettings.DEFAULT_USERNAME;

        @PluginBuilderAttribute(sensitive = true)
        private String password = ConnectionSettings.DEFAULT_PASSWORD;

        @PluginBuilderAttribute
        private String topic = MessageTranslator.DEFAULT_TOPIC_PATTERN;

        @PluginBuilderAttribute
        private String exchange;

        @PluginBuilderAttribute
        private String appId;

        @PluginBuilderAttribute
        private Boolean extendedData;

        @PluginBuilderAttribute
        private boolean layoutRendersException = true;

        @PluginElement("ExchangeProperties")
        private ExchangeProperties exchangeProperties;

        @PluginElement("MessageProperties")
        private MessageProperties messageProperties;

        @PluginElement("AmqpSsl")
        private SslProperties ssl;

        private BrokerClient brokerClient;

        private Executor startupExecutor;

        /**
         * One or more comma separated broker hosts; null or empty keeps the current value.
         */
        public B setHostName(String hostName) {
            if (hostName != null && !hostName.isEmpty()) {
                this.hostName = hostName;
            }
            return asBuilder();
        }

        public B setPort(int port) {
            this.port = port;
            return asBuilder();
        }

        /**
         * The virtual host; null or empty keeps the current value.
         */
        public B setVirtualHost(String virtualHost) {
            if (virtualHost != null && !virtualHost.isEmpty()) {
                this.virtualHost = virtualHost;
            }
            return asBuilder();
        }

        public B setUsername(String username) {
            this.username = username;
            return asBuilder();
        }

        public B setPassword(String password) {
            this.password = password;
            return asBuilder();
        }

        /**
         * Routing key pattern used when no topic expression yields a value, {0} is the level name.
         */
        public B setTopic(String topic) {
            this.topic = topic;
            return asBuilder();
        }

        /**
         * Exchange name, overrides the one of the exchange properties; null is ignored.
         */
        public B setExchange(String exchange) {
            if (exchange != null) {
                this.exchange = exchange;
            }
            return asBuilder();
        }

        public B setAppId(String appId) {
            this.appId = appId;
            return asBuilder();
        }

        public B setExtendedData(boolean extendedData) {
            this.extendedData = extendedData;
            return asBuilder();
        }

        /**
         * Whether the layout writes the event's throwable. When it does not, the
         * throwable is appended to the message body.
         */
        public B setLayoutRendersException(boolean layoutRendersException) {
            this.layoutRendersException = layoutRendersException;
            return asBuilder();
        }

        public B setExchangeProperties(ExchangeProperties exchangeProperties) {
            this.exchangeProperties = exchangeProperties;
            return asBuilder();
        }

        public B setMessageProperties(MessageProperties messageProperties) {
            this.messageProperties = messageProperties;
            return asBuilder();
        }

        public B setSsl(SslProperties ssl) {
            this.ssl = ssl;
            return asBuilder();
        }

        public B setBrokerClient(BrokerClient brokerClient) {
            this.brokerClient = brokerClient;
            return asBuilder();
        }

        /**
         * Runs the connection startup; defaults to a new daemon thread.
         */
        public B setStartupExecutor(Executor startupExecutor) {
            this.startupExecutor = startupExecutor;
            return asBuilder();
        }

        @Override
        public AmqpAppender build() {
            ExchangeProperties exchangeConfig = exchangeProperties != null ? exchangeProperties : new ExchangeProperties();
            exchangeConfig.setName(exchange);
            MessageProperties messageConfig = messageProperties != null ? messageProperties : new MessageProperties();
            if (appId != null) {
                messageConfig.setAppId(appId);
            }
            if (extendedData != null) {
                messageConfig.setExtendedData(extendedData);
            }
            ConnectionSettings settings = ConnectionSettings.builder()
                .hostName(hostName)
                .port(port)
                .virtualHost(virtualHost)
                .username(username)
                .password(password)
                .productId(messageConfig.getAppId())
                .tls(ssl == null ? null : ssl.toTlsOptions())
                .build();
            Layout<? extends Serializable> layout = getOrCreateLayout();
            MessageTranslator translator = new MessageTranslator(
                new LayoutRecordFormatter(layout, layoutRendersException), messageConfig, topic, settings.getUsername());
            return new AmqpAppender(
                getName(),
                getFilter(),
                layout,
                isIgnoreExceptions(),
                getPropertyArray(),
                settings,
                exchangeConfig,
                translator,
                brokerClient != null ? brokerClient : new RabbitBrokerClient(),
                startupExecutor != null ? startupExecutor : ConnectionLifecycle.daemonThreadExecutor("amqp-appender-startup-" + getName())
            );
        }
    }
}
