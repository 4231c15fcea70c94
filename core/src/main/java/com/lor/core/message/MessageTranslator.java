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
package com.lor.core.message;

import com.lor.core.config.MessageProperties;
import com.lor.core.format.RecordFormatter;
import lombok.Getter;
import org.apache.logging.log4j.core.LogEvent;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns a log event into the message published for it.
 */
public class MessageTranslator {

    public static final String LEVEL_PLACEHOLDER = "{0}";

    public static final String DEFAULT_TOPIC_PATTERN = LEVEL_PLACEHOLDER;

    public static final String HEADER_CLASS_NAME = "ClassName";

    public static final String HEADER_FILE_NAME = "FileName";

    public static final String HEADER_METHOD_NAME = "MethodName";

    public static final String HEADER_LINE_NUMBER = "LineNumber";

    static final String NOT_AVAILABLE = "?";

    static final int MIN_PRIORITY = 0;

    static final int MAX_PRIORITY = 9;

    private static final Pattern PRIORITY_TEXT = Pattern.compile("[+-]?[0-9]+");

    private final RecordFormatter bodyFormatter;

    @Getter
    private final MessageProperties messageProperties;

    @Getter
    private final String topicPattern;

    private final String[] topicParts;

    private final String userId;

    /**
     * @param bodyFormatter renders the message body
     * @param messageProperties per-message settings and expressions
     * @param topicPattern routing key pattern, its {0} placeholder receives the level name
     * @param userId user id stamped on every message, the broker validates it against the connection user
     */
    public MessageTranslator(RecordFormatter bodyFormatter, MessageProperties messageProperties, String topicPattern, String userId) {
        this.bodyFormatter = bodyFormatter;
        this.messageProperties = messageProperties;
        this.topicPattern = topicPattern == null ? DEFAULT_TOPIC_PATTERN : topicPattern;
        this.topicParts = this.topicPattern.split(Pattern.quote(LEVEL_PLACEHOLDER), -1);
        this.userId = userId;
    }

    public OutboundMessage translate(LogEvent event) {
        return OutboundMessage.builder()
            .body(formatBody(event))
            .contentType(messageProperties.getContentType().format(event))
            .appId(messageProperties.getAppId() != null ? messageProperties.getAppId() : event.getLoggerName())
            .deliveryMode(messageProperties.isPersistent() ? OutboundMessage.PERSISTENT : OutboundMessage.NON_PERSISTENT)
            .priority(resolvePriority(event))
            .timestampSeconds(event.getTimeMillis() / 1000)
            .userId(userId)
            .headers(messageProperties.isExtendedData() ? locationHeaders(event) : null)
            .routingKey(resolveRoutingKey(event))
            .build();
    }

    private byte[] formatBody(LogEvent event) {
        StringBuilder body = new StringBuilder(bodyFormatter.format(event));
        Throwable thrown = event.getThrown();
        if (!bodyFormatter.rendersException() && thrown != null) {
            StringWriter trace = new StringWriter();
            thrown.printStackTrace(new PrintWriter(trace));
            body.append(trace);
        }
        return body.toString().getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Evaluates the priority expression. Anything that is not an integer from 0 to 9
     * leaves the priority unset.
     */
    Integer resolvePriority(LogEvent event) {
        RecordFormatter priority = messageProperties.getPriority();
        if (priority == null) {
            return null;
        }
        String text = priority.format(event);
        if (text == null) {
            return null;
        }
        String digits = text.trim();
        if (!PRIORITY_TEXT.matcher(digits).matches()) {
            return null;
        }
        int value;
        try {
            value = Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return null;
        }
        return value >= MIN_PRIORITY && value <= MAX_PRIORITY ? value : null;
    }

    String resolveRoutingKey(LogEvent event) {
        RecordFormatter topic = messageProperties.getTopic();
        String routingKey = topic == null ? null : topic.format(event);
        if (routingKey == null || routingKey.isEmpty()) {
            routingKey = String.join(event.getLevel().name(), topicParts);
        }
        return routingKey;
    }

    private static Map<String, Object> locationHeaders(LogEvent event) {
        StackTraceElement source = event.getSource();
        Map<String, Object> headers = new LinkedHashMap<>();
        if (source == null) {
            headers.put(HEADER_CLASS_NAME, NOT_AVAILABLE);
            headers.put(HEADER_FILE_NAME, NOT_AVAILABLE);
            headers.put(HEADER_METHOD_NAME, NOT_AVAILABLE);
            headers.put(HEADER_LINE_NUMBER, 0);
        } else {
            headers.put(HEADER_CLASS_NAME, orNotAvailable(source.getClassName()));
            headers.put(HEADER_FILE_NAME, orNotAvailable(source.getFileName()));
            headers.put(HEADER_METHOD_NAME, orNotAvailable(source.getMethodName()));
            headers.put(HEADER_LINE_NUMBER, Math.max(source.getLineNumber(), 0));
        }
        return Collections.unmodifiableMap(headers);
    }

    private static String orNotAvailable(String value) {
        return value == null ? NOT_AVAILABLE : value;
    }
}
