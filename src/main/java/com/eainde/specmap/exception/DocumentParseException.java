package com.eainde.specmap.exception;

/**
 * A source document could not be turned into fragments. The file is skipped.
 */
public class DocumentParseException extends SpecMapException {

    public DocumentParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
