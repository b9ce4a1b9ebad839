package com.acme.grc.graph;

public class GraphReadException extends Exception {
    public GraphReadException(String message) { super(message); }
    public GraphReadException(String message, Throwable cause) { super(message, cause); }
}
