package org.omniroute.gig.engine.domain.model;

/**
 * Why an allocation attempt produced no offer.
 */
public enum FailureReason {
    NO_ELIGIBLE_WORKERS,
    OFFER_CREATION_FAILED
}
