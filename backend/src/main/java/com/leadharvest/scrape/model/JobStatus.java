package com.leadharvest.scrape.model;

public enum JobStatus {
    PENDING,
    RUNNING,
    PAUSED,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean isResumable() {
        return this == PENDING || this == PAUSED;
    }

    public static JobStatus parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return JobStatus.valueOf(raw.trim().toUpperCase(java.util.Locale.ROOT));
    }
}
