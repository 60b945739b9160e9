package org.error;

/**
 * An element, pair or value is outside the set it has to belong to.
 */
public class DomainException extends ModalLogicException {

    public DomainException(String message) {
        super(message);
    }

    public DomainException(String message, Throwable cause) {
        super(message, cause);
    }
}
