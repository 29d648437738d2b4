package com.transmuter.common;

import lombok.Getter;

/**
 * Aborts a quote, a settlement or an administrative update. Nothing is persisted when it is thrown.
 */
@Getter
public class TransmuterException extends RuntimeException {

    private final TransmuterError error;

    public TransmuterException(TransmuterError error, String message) {
        super(message);
        this.error = error;
    }
}
