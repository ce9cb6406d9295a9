package com.taggernews.ingest.model;

public enum ProposalAction {
    MERGE("merge"),
    RENAME("rename"),
    RETIRE("retire");

    private final String dbValue;

    ProposalAction(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }

    public static ProposalAction fromDb(String value) {
        for (ProposalAction action : values()) {
            if (action.dbValue.equals(value)) {
                return action;
            }
        }
        throw new IllegalArgumentException("unknown proposal action: " + value);
    }
}
