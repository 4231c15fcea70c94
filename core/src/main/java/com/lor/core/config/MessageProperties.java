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

import com.lor.core.format.PatternRecordFormatter;
import com.lor.core.format.RecordFormatter;
import com.lor.core.format.StaticRecordFormatter;
import lombok.Data;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.Node;
import org.apache.logging.log4j.core.config.plugins.Plugin;
import org.apache.logging.log4j.core.config.plugins.PluginAttribute;
import org.apache.logging.log4j.core.config.plugins.PluginConfiguration;
import org.apache.logging.log4j.core.config.plugins.PluginFactory;

/**
 * Properties stamped on every published message. The priority, topic and
 * content type are Log4j patterns evaluated per event.
 * <pre>
 * &lt;MessageProperties persistent="true" priority="%X{priority}" topic="app.%c.%p" contentType="text/plain"/&gt;
 * </pre>
 */
@Data
@Plugin(name = "MessageProperties", category = Node.CATEGORY, printObject = true)
public class MessageProperties {

    public static final String DEFAULT_CONTENT_TYPE = "text/plain";

    /**
     * Application id of the messages, the logger name when null
     */
    private String appId;

    private boolean persistent;

    private RecordFormatter priority;

    private RecordFormatter topic;

    private RecordFormatter contentType = new StaticRecordFormatter(DEFAULT_CONTENT_TYPE);

    /**
     * Whether the caller location is sent as message headers
     */
    private boolean extendedData;

    @PluginFactory
    public static MessageProperties createMessageProperties(
        @PluginAttribute("appId") String appId,
        @PluginAttribute("persistent") boolean persistent,
        @PluginAttribute("priority") String priority,
        @PluginAttribute("topic") String topic,
        @PluginAttribute("contentType") String contentType,
        @PluginAttribute("extendedData") boolean extendedData,
        @PluginConfiguration Configuration configuration
    ) {
        MessageProperties properties = new MessageProperties();
        properties.setAppId(appId);
        properties.setPersistent(persistent);
        properties.setPriority(PatternRecordFormatter.of(priority, configuration));
        properties.setTopic(PatternRecordFormatter.of(topic, configuration));
        if (contentType != null) {
            properties.setContentType(new PatternRecordFormatter(contentType, configuration));
        }
        properties.setExtendedData(extendedData);
        return properties;
    }

    public void setContentType(RecordFormatter contentType) {
        this.contentType = contentType == null ? new StaticRecordFormatter(DEFAULT_CONTENT_TYPE) : contentType;
    }
}
