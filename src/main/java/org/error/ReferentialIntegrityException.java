package org.error;

/**
 * A reference between objects is missing, duplicated or still in use.
 */
public class ReferentialIntegrityException extends ModalLogicException {

    public ReferentialIntegrityException(String message) {
        super(message);
    }
}
