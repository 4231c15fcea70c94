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

import lombok.Builder;
import lombok.Value;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * A log event translated into a broker message. Built once per event.
 */
@Value
@Builder
public class OutboundMessage {

    public static final String CONTENT_ENCODING = "utf8";

    public static final int NON_PERSISTENT = 1;

    public static final int PERSISTENT = 2;

    byte[] body;

    String contentType;

    @Builder.Default
    String contentEncoding = CONTENT_ENCODING;

    String appId;

    int deliveryMode;

    // null leaves the broker default
    Integer priority;

    long timestampSeconds;

    String userId;

    // null unless extended data is enabled
    Map<String, Object> headers;

    String routingKey;

    public String getBodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }
}
