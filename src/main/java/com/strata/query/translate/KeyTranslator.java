package com.strata.query.translate;

import java.util.List;
import java.util.Map;

/**
 * Converts one column between caller identifiers and the values the backend
 * stores. Forward works on filter keys before the query is sent; reverse works
 * on each result row. Both mutate and return their argument.
 *
 * <p>Reverse translation restores entity ids as {@code Long}, whatever numeric
 * type the caller used in its filter keys.
 */
public interface KeyTranslator {

    Map<String, List<Object>> applyForward(Map<String, List<Object>> filterKeys);

    Map<String, Object> applyReverse(Map<String, Object> row);
}
