package com.lor.core.format;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.apache.logging.log4j.core.LogEvent;

/**
 * Renders the same text for every event.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class StaticRecordFormatter implements RecordFormatter {

    private final String text;

    public StaticRecordFormatter(String text) {
        this.text = text;
    }

    @Override
    public String format(LogEvent event) {
        return text;
    }
}
