package com.nchat.webhooks.security;

/** Outcome of a signature check. {@code error} is {@code null} when valid. */
public final class VerificationResult {

    private static final VerificationResult VALID = new VerificationResult(true, null);

    private final boolean valid;
    private final String  error;

    private VerificationResult(boolean valid, String error) {
        this.valid = valid;
        this.error = error;
    }

    public static VerificationResult valid() {
        return VALID;
    }

    public static VerificationResult invalid(String error) {
        return new VerificationResult(false, error);
    }

    public boolean isValid() { return valid; }
    public String  getError() { return error; }

    @Override
    public String toString() {
        return valid ? "VerificationResult{valid}" : "VerificationResult{invalid, error='" + error + "'}";
    }
}
