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

import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The exchange the appender publishes to, together with the bindings that
 * forward its messages to other exchanges. Bindings keep declaration order.
 */
@Getter
@ToString
public class ExchangeTopology {

    public static final String DEFAULT_EXCHANGE_NAME = "app-logging";

    private final Exchange exchange;

    private final List<Binding> bindings = new ArrayList<>();

    public ExchangeTopology(String name, ExchangeType type, boolean durable, boolean autoDelete) {
        this.exchange = new Exchange(name, type, durable, autoDelete);
    }

    /**
     * A durable, non auto-delete topic exchange named "app-logging".
     */
    public static ExchangeTopology defaults() {
        return new ExchangeTopology(DEFAULT_EXCHANGE_NAME, ExchangeType.Topic, true, false);
    }

    /**
     * Adds a binding from this topology's exchange to {@code destination}.
     *
     * @param destination the destination exchange name
     * @param routingPattern the routing pattern of the binding
     * @return this topology
     */
    public ExchangeTopology bindTo(String destination, String routingPattern) {
        bindings.add(new Binding(exchange.getName(), destination, routingPattern));
        return this;
    }

    public String getName() {
        return exchange.getName();
    }

    public List<Binding> getBindings() {
        return Collections.unmodifiableList(bindings);
    }

    /**
     * Checks the topology can be declared.
     *
     * @throws IllegalArgumentException if the exchange name is empty or a binding has no destination
     */
    public void validate() {
        if (exchange.getName() == null || exchange.getName().isEmpty()) {
            throw new IllegalArgumentException("exchange name must not be empty");
        }
        if (exchange.getType() == null) {
            throw new IllegalArgumentException("exchange type must be set for exchange " + exchange.getName());
        }
        for (Binding binding : bindings) {
            if (binding.getDestination() == null || binding.getDestination().isEmpty()) {
                throw new IllegalArgumentException("binding of exchange " + exchange.getName() + " has no destination");
            }
        }
    }
}
