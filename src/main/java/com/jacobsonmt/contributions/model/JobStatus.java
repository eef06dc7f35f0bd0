package com.jacobsonmt.contributions.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum JobStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    ERROR;

    public boolean isTerminal() {
        return this == COMPLETED || this == ERROR;
    }

    @JsonValue
    public String getLabel() {
        return name().toLowerCase( Locale.ROOT );
    }
}
