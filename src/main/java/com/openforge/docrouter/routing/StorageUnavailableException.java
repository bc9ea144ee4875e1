package com.openforge.docrouter.routing;

/** The knowledge stores could not be read or written for this request. */
public class StorageUnavailableException extends RuntimeException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
