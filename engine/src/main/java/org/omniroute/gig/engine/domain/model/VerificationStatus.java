package org.omniroute.gig.engine.domain.model;

import java.util.Locale;

public enum VerificationStatus {
    PENDING,
    APPROVED,
    REJECTED;

    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static VerificationStatus fromCode(String code) {
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
