package org.omniroute.gig.engine.domain.model;

import java.util.Locale;

/**
 * Offer status. Every status other than PENDING is terminal.
 */
public enum OfferStatus {
    PENDING,
    ACCEPTED,
    DECLINED,
    EXPIRED,
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING;
    }

    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static OfferStatus fromCode(String code) {
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
