package de.uos.ikw.izpb.lookup;

/**
 * Knowledge base could not be queried (network failure, HTTP error status, timeout).
 */
public class LookupException extends Exception {

    public LookupException(String message) {
        super(message);
    }

    public LookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
