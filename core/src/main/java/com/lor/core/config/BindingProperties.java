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

import lombok.Getter;
import lombok.ToString;
import org.apache.logging.log4j.core.config.Node;
import org.apache.logging.log4j.core.config.plugins.Plugin;
import org.apache.logging.log4j.core.config.plugins.PluginAttribute;
import org.apache.logging.log4j.core.config.plugins.PluginFactory;

/**
 * Binds the appender's exchange to another exchange.
 * <pre>
 * &lt;Binding destination="audit" topic="error.#"/&gt;
 * </pre>
 */
@Getter
@ToString
@Plugin(name = "Binding", category = Node.CATEGORY, printObject = true)
public class BindingProperties {

    private final String destination;

    private final String topic;

    public BindingProperties(String destination, String topic) {
        this.destination = destination;
        this.topic = topic == null ? "" : topic;
    }

    @PluginFactory
    public static BindingProperties createBinding(
        @PluginAttribute("destination") String destination,
        @PluginAttribute("topic") String topic
    ) {
        return new BindingProperties(destination, topic);
    }
}
