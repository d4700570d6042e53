package com.eainde.extraction.adapter;

/**
 * The extraction service answered, but not with the expected structure.
 */
public class MalformedResponseException extends Exception {

    public MalformedResponseException(String message) {
        super(message);
    }

    public MalformedResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
