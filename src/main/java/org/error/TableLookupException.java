package org.error;

/**
 * A negation or implication table has no entry for a value an evaluation needs.
 */
public class TableLookupException extends ModalLogicException {

    public TableLookupException(String message) {
        super(message);
    }
}
