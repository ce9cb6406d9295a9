package com.taggernews.ingest.model;

import java.util.Locale;

public enum ProposalStatus {
    PROPOSED("proposed"),
    AUTO_APPROVED("auto-approved"),
    PENDING_APPROVAL("pending-approval");

    private final String dbValue;

    ProposalStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }

    public static ProposalStatus fromDb(String value) {
        if (value == null) {
            throw new IllegalArgumentException("proposal status is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (ProposalStatus status : values()) {
            if (status.dbValue.equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("unknown proposal status: " + value);
    }
}
