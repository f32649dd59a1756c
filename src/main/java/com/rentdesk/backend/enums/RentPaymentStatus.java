package com.rentdesk.backend.enums;

public enum RentPaymentStatus {
    PENDING,
    LATE,
    PARTIAL,
    PAID;

    /**
     * Statuses that only an external payment recording may set.
     */
    public boolean isSettlement() {
        return this == PARTIAL || this == PAID;
    }

    /**
     * Lateness only moves forward: nothing returns to PENDING, LATE is reachable only from PENDING and a
     * fully paid obligation is final. PARTIAL may be recorded again for a further instalment.
     */
    public boolean canTransitionTo(RentPaymentStatus target) {
        return switch (this) {
            case PENDING -> target == LATE || target.isSettlement();
            case LATE -> target.isSettlement();
            case PARTIAL -> target.isSettlement();
            case PAID -> false;
        };
    }
}
