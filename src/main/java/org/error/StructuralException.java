package org.error;

/**
 * The order relation has no unique meet or join for some pair, so the structure is not a lattice.
 */
public class StructuralException extends ModalLogicException {

    public StructuralException(String message) {
        super(message);
    }

    public StructuralException(String message, Throwable cause) {
        super(message, cause);
    }
}
