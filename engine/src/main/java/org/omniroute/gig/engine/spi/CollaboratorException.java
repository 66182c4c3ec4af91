package org.omniroute.gig.engine.spi;

/**
 * Unchecked failure reported by a collaborator: repository, geo, pricing or notifier.
 */
public class CollaboratorException extends RuntimeException {

    public CollaboratorException(String message) {
        super(message);
    }

    public CollaboratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
