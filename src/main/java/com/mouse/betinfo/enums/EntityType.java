package com.mouse.betinfo.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum EntityType {
    SNAPSHOT("snapshot", "info_snapshot"),

    ANALYSIS("analysis", "analysis"),

    OUTCOME("outcome", "outcome"),

    EVALUATION("evaluation", "evaluation"),

    PROPOSAL("improvement_proposal", "improvement_proposal");

    private final String value;
    private final String tableName;

    @Override
    public String toString() {
        return value;
    }
}
