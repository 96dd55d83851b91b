package com.gocomet.tripsafety.sos.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * TRIGGERED → PERSISTED → NOTIFYING → (ACKNOWLEDGED | ESCALATED) → RESOLVED
 * ESCALATED may still be acknowledged. RESOLVED is entered from ACKNOWLEDGED or ESCALATED.
 */
public enum SosState {
    TRIGGERED,
    PERSISTED,
    NOTIFYING,
    ACKNOWLEDGED,
    ESCALATED,
    RESOLVED;

    public static final Set<SosState> AWAITING_ACK = EnumSet.of(PERSISTED, NOTIFYING);
    public static final Set<SosState> ACKNOWLEDGEABLE = EnumSet.of(PERSISTED, NOTIFYING, ESCALATED);
    public static final Set<SosState> OPEN = EnumSet.of(TRIGGERED, PERSISTED, NOTIFYING, ACKNOWLEDGED, ESCALATED);
}
