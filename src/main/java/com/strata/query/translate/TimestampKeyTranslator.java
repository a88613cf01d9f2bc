package com.strata.query.translate;

import com.strata.query.error.UnexpectedResponseException;
import com.strata.query.time.WireTimestamps;

import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;

/**
 * Reverse-only: replaces a wire timestamp string in a result row with Unix
 * epoch seconds.
 */
public class TimestampKeyTranslator implements KeyTranslator {

    private final String column;

    public TimestampKeyTranslator(String column) {
        this.column = column;
    }

    @Override
    public Map<String, List<Object>> applyForward(Map<String, List<Object>> filterKeys) {
        return filterKeys;
    }

    @Override
    public Map<String, Object> applyReverse(Map<String, Object> row) {
        Object value = row.get(column);
        if (value instanceof String) {
            try {
                row.put(column, WireTimestamps.toEpochSeconds((String) value));
            } catch (DateTimeParseException e) {
                throw new UnexpectedResponseException(
                    "Unparseable timestamp in column " + column + ": " + value, 200);
            }
        }
        return row;
    }
}
