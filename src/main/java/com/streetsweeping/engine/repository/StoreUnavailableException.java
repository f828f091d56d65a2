package com.streetsweeping.engine.repository;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * The persistent store could not be read or written, even after a retry.
 */
@ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
