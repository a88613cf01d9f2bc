package com.strata.domain;

import java.util.Objects;

/**
 * An issue/release pairing as stored by the backend: the owning group and the
 * release version string.
 */
public final class GroupReleaseRef {

    private final long groupId;
    private final String version;

    public GroupReleaseRef(long groupId, String version) {
        this.groupId = groupId;
        this.version = version;
    }

    public long getGroupId() {
        return groupId;
    }

    public String getVersion() {
        return version;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GroupReleaseRef)) return false;
        GroupReleaseRef that = (GroupReleaseRef) o;
        return groupId == that.groupId && Objects.equals(version, that.version);
    }

    @Override
    public int hashCode() {
        return Objects.hash(groupId, version);
    }

    @Override
    public String toString() {
        return "GroupReleaseRef{groupId=" + groupId + ", version='" + version + "'}";
    }
}
