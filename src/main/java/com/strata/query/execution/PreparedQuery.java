package com.strata.query.execution;

import com.strata.query.translate.TranslatorChain;

/**
 * A request ready to dispatch, paired with the translators to run on its result rows.
 */
public final class PreparedQuery {

    private final BackendRequest request;
    private final TranslatorChain translators;

    public PreparedQuery(BackendRequest request, TranslatorChain translators) {
        this.request = request;
        this.translators = translators;
    }

    public static PreparedQuery untranslated(BackendRequest request) {
        return new PreparedQuery(request, TranslatorChain.identity());
    }

    public BackendRequest getRequest() {
        return request;
    }

    public TranslatorChain getTranslators() {
        return translators;
    }
}
