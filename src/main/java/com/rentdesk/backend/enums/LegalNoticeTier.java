package com.rentdesk.backend.enums;

/**
 * Ontario Landlord and Tenant Board forms a late payment can qualify for.
 */
public enum LegalNoticeTier {
    /** Notice to end a tenancy early for non-payment of rent. */
    N4,
    /** Application to evict a tenant for non-payment of rent. */
    L1
}
