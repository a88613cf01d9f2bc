package com.strata.query.translate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Translates entity ids of one column to a stored attribute (environment name,
 * release version) and back.
 */
public class ModelKeyTranslator implements KeyTranslator {

    private final String column;
    private final Map<Long, Object> forward;
    private final Map<Object, Long> reverse;

    /**
     * @param column  the filter key and result column
     * @param storage id to stored value; a null stored value is allowed
     */
    public ModelKeyTranslator(String column, Map<Long, ?> storage) {
        this.column = column;
        this.forward = new HashMap<>(storage);
        this.reverse = new HashMap<>();
        storage.forEach((id, value) -> reverse.put(value, id));
    }

    public String getColumn() {
        return column;
    }

    @Override
    public Map<String, List<Object>> applyForward(Map<String, List<Object>> filterKeys) {
        List<Object> ids = filterKeys.get(column);
        if (ids == null) {
            return filterKeys;
        }
        List<Object> translated = new ArrayList<>(ids.size());
        for (Object id : ids) {
            Long key = Identifiers.toLong(id);
            if (key == null || key == 0L || !forward.containsKey(key)) {
                continue;
            }
            translated.add(forward.get(key));
        }
        filterKeys.put(column, translated);
        return filterKeys;
    }

    @Override
    public Map<String, Object> applyReverse(Map<String, Object> row) {
        if (row.containsKey(column)) {
            Object stored = row.get(column);
            if (reverse.containsKey(stored)) {
                row.put(column, reverse.get(stored));
            }
        }
        return row;
    }

    @Override
    public String toString() {
        return "ModelKeyTranslator{column='" + column + "', keys=" + forward.size() + "}";
    }
}
