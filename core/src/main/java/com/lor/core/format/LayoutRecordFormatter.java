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

import org.apache.logging.log4j.core.Layout;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.StringLayout;

import java.io.Serializable;
import java.nio.charset.StandardCharsets;

/**
 * Renders an event through the appender's layout.
 */
public final class LayoutRecordFormatter implements RecordFormatter {

    private final Layout<? extends Serializable> layout;

    private final boolean rendersException;

    /**
     * @param layout the appender layout
     * @param rendersException whether the layout writes the event's throwable itself
     */
    public LayoutRecordFormatter(Layout<? extends Serializable> layout, boolean rendersException) {
        this.layout = layout;
        this.rendersException = rendersException;
    }

    @Override
    public String format(LogEvent event) {
        if (layout instanceof StringLayout) {
            return ((StringLayout) layout).toSerializable(event);
        }
        return new String(layout.toByteArray(event), StandardCharsets.UTF_8);
    }

    @Override
    public boolean rendersException() {
        return rendersException;
    }
}
