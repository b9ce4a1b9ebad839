package com.acme.grc.extract;

/** Raised when a document yields no requirement statements. */
public class ExtractionEmptyException extends Exception {
    public ExtractionEmptyException(String message) { super(message); }
}
