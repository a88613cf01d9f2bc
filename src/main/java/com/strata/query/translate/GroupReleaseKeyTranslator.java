package com.strata.query.translate;

import com.strata.domain.GroupReleaseRef;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Translates group-release ids to release versions. A version alone is
 * ambiguous across groups, so rows are mapped back through the
 * {@code (group_id, version)} pair.
 */
public class GroupReleaseKeyTranslator implements KeyTranslator {

    static final String GROUP_COLUMN = "group_id";

    private final String column;
    private final Map<Long, GroupReleaseRef> forward;
    private final Map<GroupReleaseRef, Long> reverse;

    public GroupReleaseKeyTranslator(String column, Map<Long, GroupReleaseRef> groupReleases) {
        this.column = column;
        this.forward = new HashMap<>(groupReleases);
        this.reverse = new HashMap<>();
        groupReleases.forEach((id, ref) -> reverse.put(ref, id));
    }

    @Override
    public Map<String, List<Object>> applyForward(Map<String, List<Object>> filterKeys) {
        List<Object> ids = filterKeys.get(column);
        if (ids == null) {
            return filterKeys;
        }
        List<Object> versions = new ArrayList<>(ids.size());
        for (Object id : ids) {
            GroupReleaseRef ref = forward.get(Identifiers.toLong(id));
            if (ref != null) {
                versions.add(ref.getVersion());
            }
        }
        filterKeys.put(column, versions);
        return filterKeys;
    }

    @Override
    public Map<String, Object> applyReverse(Map<String, Object> row) {
        Long groupId = Identifiers.toLong(row.get(GROUP_COLUMN));
        Object version = row.get(column);
        if (groupId == null || !(version instanceof String)) {
            return row;
        }
        Long id = reverse.get(new GroupReleaseRef(groupId, (String) version));
        if (id != null) {
            row.put(column, id);
        }
        return row;
    }
}
