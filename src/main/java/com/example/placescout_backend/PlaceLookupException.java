package com.example.placescout_backend;

/**
 * Transport failure while talking to the places provider.
 */
public class PlaceLookupException extends RuntimeException {

    public PlaceLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
