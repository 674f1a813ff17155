package com.example.examSchedulerBackend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Session {
    FORENOON("forenoon"),
    AFTERNOON("afternoon");

    private final String label;

    Session(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static Session fromLabel(String label) {
        for (Session session : values()) {
            if (session.label.equalsIgnoreCase(label)) {
                return session;
            }
        }
        throw new IllegalArgumentException("Unknown session: " + label);
    }
}
