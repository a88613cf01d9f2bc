package com.strata.storage;

/**
 * Maximum age of queryable data per organization.
 */
public interface RetentionPolicy {

    /**
     * @return retention in days, or null when the organization's data never expires
     */
    Integer retentionDays(long organizationId);
}
