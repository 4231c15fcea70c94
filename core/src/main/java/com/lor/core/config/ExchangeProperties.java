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

import com.lor.meta.ExchangeTopology;
import com.lor.meta.ExchangeType;
import lombok.Data;
import org.apache.logging.log4j.core.config.Node;
import org.apache.logging.log4j.core.config.plugins.Plugin;
import org.apache.logging.log4j.core.config.plugins.PluginAttribute;
import org.apache.logging.log4j.core.config.plugins.PluginElement;
import org.apache.logging.log4j.core.config.plugins.PluginFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * The exchange the appender declares and publishes to.
 * <pre>
 * &lt;ExchangeProperties name="app-logging" type="topic" durable="true" autoDelete="false"&gt;
 *     &lt;Binding destination="audit" topic="error.#"/&gt;
 * &lt;/ExchangeProperties&gt;
 * </pre>
 */
@Data
@Plugin(name = "ExchangeProperties", category = Node.CATEGORY, printObject = true)
public class ExchangeProperties {

    private String name = ExchangeTopology.DEFAULT_EXCHANGE_NAME;

    private String type = ExchangeType.Topic.value();

    private boolean durable = true;

    private boolean autoDelete;

    private List<BindingProperties> bindings = new ArrayList<>();

    @PluginFactory
    public static ExchangeProperties createExchangeProperties(
        @PluginAttribute("name") String name,
        @PluginAttribute(value = "type", defaultString = "topic") String type,
        @PluginAttribute(value = "durable", defaultBoolean = true) boolean durable,
        @PluginAttribute("autoDelete") boolean autoDelete,
        @PluginElement("Bindings") BindingProperties[] bindings
    ) {
        ExchangeProperties properties = new ExchangeProperties();
        properties.setName(name);
        properties.setType(type);
        properties.setDurable(durable);
        properties.setAutoDelete(autoDelete);
        if (bindings != null) {
            properties.setBindings(new ArrayList<>(Arrays.asList(bindings)));
        }
        return properties;
    }

    /**
     * Sets the exchange name; null is ignored.
     */
    public void setName(String name) {
        if (name != null) {
            this.name = name;
        }
    }

    public ExchangeProperties addBinding(String destination, String topic) {
        bindings.add(new BindingProperties(destination, topic));
        return this;
    }

    /**
     * Builds the topology to declare.
     *
     * @throws IllegalArgumentException if the exchange type is unknown
     */
    public ExchangeTopology toTopology() {
        ExchangeTopology topology = new ExchangeTopology(name, ExchangeType.value(type), durable, autoDelete);
        for (BindingProperties binding : bindings) {
            topology.bindTo(binding.getDestination(), binding.getTopic());
        }
        return topology;
    }
}
