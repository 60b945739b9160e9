package org.error;

/**
 * Formula text could not be tokenized or parsed.
 */
public class FormulaSyntaxException extends ModalLogicException {

    private final int position;

    public FormulaSyntaxException(String message, int position) {
        super(message + " (at position " + position + ")");
        this.position = position;
    }

    /** @return zero-based character offset where the problem was detected */
    public int getPosition() {
        return position;
    }
}
