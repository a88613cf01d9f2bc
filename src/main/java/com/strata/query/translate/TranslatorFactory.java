package com.strata.query.translate;

import com.strata.domain.GroupReleaseRef;
import com.strata.storage.EntityCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the translator chain for a set of filter keys, with one catalog
 * lookup per translated column.
 */
@Component
public class TranslatorFactory {

    private static final Logger log = LoggerFactory.getLogger(TranslatorFactory.class);

    public static final String ENVIRONMENT = "environment";
    public static final String RELEASE_TAG = "tags[sentry:release]";
    public static final String RELEASE = "release";

    private final EntityCatalog catalog;

    public TranslatorFactory(EntityCatalog catalog) {
        this.catalog = catalog;
    }

    public TranslatorChain build(Map<String, List<Object>> filterKeys, boolean isGroupRelease) {
        List<KeyTranslator> translators = new ArrayList<>();

        for (String column : List.of(ENVIRONMENT, RELEASE_TAG, RELEASE)) {
            List<Object> keys = filterKeys.get(column);
            if (keys == null || keys.isEmpty()) {
                continue;
            }
            // Keys that are not ids still get a translator, which drops them.
            Set<Long> ids = ids(keys);
            if (ENVIRONMENT.equals(column)) {
                Map<Long, String> names = ids.isEmpty() ? new HashMap<>() : new HashMap<>(catalog.environmentNames(ids));
                // The default environment is stored without a name.
                names.replaceAll((id, name) -> name == null || name.isEmpty() ? null : name);
                translators.add(new ModelKeyTranslator(column, names));
            } else if (isGroupRelease) {
                Map<Long, GroupReleaseRef> releases = ids.isEmpty() ? new HashMap<>() : catalog.groupReleases(ids);
                translators.add(new GroupReleaseKeyTranslator(column, releases));
            } else {
                Map<Long, String> versions = ids.isEmpty() ? new HashMap<>() : catalog.releaseVersions(ids);
                translators.add(new ModelKeyTranslator(column, versions));
            }
            log.debug("Translating {} with {} ids", column, ids.size());
        }

        translators.add(new TimestampKeyTranslator("time"));
        translators.add(new TimestampKeyTranslator("bucketed_end"));
        return new TranslatorChain(translators);
    }

    private static Set<Long> ids(List<Object> keys) {
        Set<Long> ids = new LinkedHashSet<>();
        if (keys == null) {
            return ids;
        }
        for (Object key : keys) {
            Long id = Identifiers.toLong(key);
            if (id != null) {
                ids.add(id);
            }
        }
        return ids;
    }
}
