package org.hexabets.exception;

/**
 * The secure random source or a digest provider failed. Fatal: without it the server
 * would either keep a revealed seed or issue draws nobody can verify.
 */
public class FairnessUnavailableException extends RuntimeException {
    public FairnessUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
