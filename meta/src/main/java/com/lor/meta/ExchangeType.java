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
package com.lor.meta;

import java.util.Locale;

public enum ExchangeType {

    Direct("direct"),

    Fanout("fanout"),

    Topic("topic"),

    Headers("headers");

    private final String value;

    ExchangeType(String value) {
        this.value = value;
    }

    /**
     * The exchange type name as it goes on the wire in exchange.declare
     */
    public String value() {
        return value;
    }

    /**
     * Parses an exchange type name, ignoring case.
     *
     * @param type the type name, e.g. "topic"
     * @return the matching exchange type
     * @throws IllegalArgumentException if the name is not a known exchange type
     */
    public static ExchangeType value(String type) {
        if (type == null) {
            throw new IllegalArgumentException("exchange type must not be null");
        }
        String normalized = type.trim().toLowerCase(Locale.ROOT);
        for (ExchangeType exchangeType : values()) {
            if (exchangeType.value.equals(normalized)) {
                return exchangeType;
            }
        }
        throw new IllegalArgumentException("unknown exchange type: " + type);
    }
}
