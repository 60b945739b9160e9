package org.error;

/**
 * Base type for every failure raised by the lattice, Kripke and formula layers.
 * Unchecked: callers decide where a failure stops a user action.
 */
public class ModalLogicException extends RuntimeException {

    public ModalLogicException(String message) {
        super(message);
    }

    public ModalLogicException(String message, Throwable cause) {
        super(message, cause);
    }
}
