package org.omniroute.gig.engine.domain.model;

import java.util.Locale;

public enum TaskType {
    DELIVERY,
    COLLECTION,
    SURVEY,
    MERCHANDISING;

    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TaskType fromCode(String code) {
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
