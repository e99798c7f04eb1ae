package com.sketchmath.server.pipeline;

public final class ValidationVerdict {

    private static final ValidationVerdict VALID = new ValidationVerdict(true, "Valid expression");

    private final boolean ok;
    private final String reason;

    private ValidationVerdict(boolean ok, String reason) {
        this.ok = ok;
        this.reason = reason;
    }

    public static ValidationVerdict valid() {
        return VALID;
    }

    public static ValidationVerdict rejected(String reason) {
        return new ValidationVerdict(false, reason);
    }

    public boolean isOk() {
        return ok;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return (ok ? "ok: " : "rejected: ") + reason;
    }
}
