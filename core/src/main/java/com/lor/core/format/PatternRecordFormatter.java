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
package com.lor.core.format;

import lombok.Getter;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.layout.PatternLayout;

/**
 * Renders a Log4j pattern against the event, e.g. {@code app.%c.%p} or
 * {@code %X{priority}}. Throwables are never appended.
 */
public final class PatternRecordFormatter implements RecordFormatter {

    @Getter
    private final String pattern;

    private final PatternLayout layout;

    public PatternRecordFormatter(String pattern) {
        this(pattern, null);
    }

    public PatternRecordFormatter(String pattern, Configuration configuration) {
        this.pattern = pattern;
        this.layout = PatternLayout.newBuilder()
            .withPattern(pattern)
            .withConfiguration(configuration)
            .withAlwaysWriteExceptions(false)
            .build();
    }

    /**
     * Creates a formatter for the pattern, or returns null when no pattern is given.
     */
    public static RecordFormatter of(String pattern, Configuration configuration) {
        return pattern == null ? null : new PatternRecordFormatter(pattern, configuration);
    }

    @Override
    public String format(LogEvent event) {
        return layout.toSerializable(event);
    }

    @Override
    public String toString() {
        return "PatternRecordFormatter[" + pattern + "]";
    }
}
