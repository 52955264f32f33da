package com.kg.core.service.graph;

/**
 * Exception thrown when a graph store operation cannot be completed.
 *
 * The error code identifies the failure kind, e.g. {@link #GRAPH_NOT_LOADED}
 * for reads against a store that was never loaded or initialized.
 */
public class GraphStoreException extends RuntimeException {

    public static final String GRAPH_NOT_LOADED = "GRAPH_NOT_LOADED";
    public static final String NOT_IMPLEMENTED = "NOT_IMPLEMENTED";
    public static final String NOT_FOUND = "NOT_FOUND";
    public static final String TYPE_MISMATCH = "TYPE_MISMATCH";
    public static final String INVALID_GRAPH = "INVALID_GRAPH";
    public static final String IO_ERROR = "IO_ERROR";
    public static final String PARSE_ERROR = "PARSE_ERROR";
    public static final String ENCODE_ERROR = "ENCODE_ERROR";

    private final String path;
    private final String errorCode;

    public GraphStoreException(String message, String path, String errorCode) {
        super(message);
        this.path = path;
        this.errorCode = errorCode;
    }

    public GraphStoreException(String message, String path, String errorCode, Throwable cause) {
        super(message, cause);
        this.path = path;
        this.errorCode = errorCode;
    }

    public static GraphStoreException notLoaded() {
        return new GraphStoreException("Knowledge graph not loaded", null, GRAPH_NOT_LOADED);
    }

    /**
     * Node path or file path the failure refers to, if any.
     */
    public String getPath() {
        return path;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
