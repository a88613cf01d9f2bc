package com.strata.storage;

import com.strata.domain.GroupReleaseRef;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.Map;
import java.util.Set;

/**
 * Read-only lookups against the relational entity store (projects,
 * environments, releases, groups and project keys).
 *
 * Every bulk method issues a single round trip for the whole id collection.
 * Missing entities are absent from the returned maps and sets.
 */
public interface EntityCatalog {

    /**
     * Organization of a project, served from cache where possible.
     *
     * @return the organization id, or null when the project does not exist
     */
    Long organizationIdForProject(long projectId);

    /**
     * Organization of the first non-deleted project among {@code projectIds}.
     *
     * @return the organization id, or null when none of the projects exist
     */
    Long firstOrganizationIdForProjects(Collection<Long> projectIds);

    /**
     * Organization owning the project of a project key, or null.
     */
    Long organizationIdForProjectKey(long keyId);

    /**
     * Environment id to environment name.
     */
    Map<Long, String> environmentNames(Collection<Long> environmentIds);

    /**
     * Release id to release version.
     */
    Map<Long, String> releaseVersions(Collection<Long> releaseIds);

    /**
     * Group-release id to its group and release version.
     */
    Map<Long, GroupReleaseRef> groupReleases(Collection<Long> groupReleaseIds);

    Set<Long> projectIdsForGroups(Collection<Long> groupIds);

    Set<Long> projectIdsForReleases(Collection<Long> releaseIds);

    /**
     * First time the group was seen, or null when the group does not exist.
     */
    OffsetDateTime groupFirstSeen(long groupId);
}
