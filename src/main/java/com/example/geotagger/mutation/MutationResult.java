package com.example.geotagger.mutation;

public class MutationResult {
    private final boolean success;
    private final String reason;

    private MutationResult(boolean success, String reason) {
        this.success = success;
        this.reason = reason;
    }

    public static MutationResult success(String reason) {
        return new MutationResult(true, reason);
    }

    public static MutationResult failure(String reason) {
        return new MutationResult(false, reason);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getReason() {
        return reason;
    }
}
