package org.error;

/**
 * A formula refers to a proposition that the evaluated world does not assign.
 */
public class SemanticException extends ModalLogicException {

    public SemanticException(String message) {
        super(message);
    }
}
