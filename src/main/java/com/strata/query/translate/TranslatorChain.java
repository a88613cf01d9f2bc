package com.strata.query.translate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered list of translators for one query. Both directions apply the
 * translators in insertion order.
 */
public class TranslatorChain {

    private static final TranslatorChain IDENTITY = new TranslatorChain(Collections.emptyList());

    private final List<KeyTranslator> translators;

    public TranslatorChain(List<KeyTranslator> translators) {
        this.translators = List.copyOf(translators);
    }

    /**
     * A chain that changes nothing, used for pre-built requests.
     */
    public static TranslatorChain identity() {
        return IDENTITY;
    }

    public List<KeyTranslator> getTranslators() {
        return translators;
    }

    /**
     * Applies every forward step to a copy of {@code filterKeys}; the lists
     * are copied too so the caller's intent is left untouched.
     */
    public Map<String, List<Object>> forward(Map<String, List<Object>> filterKeys) {
        Map<String, List<Object>> copy = new LinkedHashMap<>();
        filterKeys.forEach((column, keys) -> copy.put(column, keys != null ? new ArrayList<>(keys) : null));
        Map<String, List<Object>> translated = copy;
        for (KeyTranslator translator : translators) {
            translated = translator.applyForward(translated);
        }
        return translated;
    }

    public Map<String, Object> reverse(Map<String, Object> row) {
        Map<String, Object> result = row;
        for (KeyTranslator translator : translators) {
            result = translator.applyReverse(result);
        }
        return result;
    }
}
