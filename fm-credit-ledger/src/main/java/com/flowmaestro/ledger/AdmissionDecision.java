package com.flowmaestro.ledger;

/**
 * Result of a pre-flight credit check.
 */
public final class AdmissionDecision {

    private static final AdmissionDecision ALLOW = new AdmissionDecision(true, null);

    private final boolean allowed;
    private final String reason;

    private AdmissionDecision(boolean allowed, String reason) {
        this.allowed = allowed;
        this.reason = reason;
    }

    public static AdmissionDecision allow() {
        return ALLOW;
    }

    public static AdmissionDecision deny(String reason) {
        return new AdmissionDecision(false, reason);
    }

    public boolean isAllowed() {
        return allowed;
    }

    /** Why admission was denied; null when allowed. */
    public String getReason() {
        return reason;
    }
}
