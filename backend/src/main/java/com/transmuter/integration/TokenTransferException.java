package com.transmuter.integration;

/**
 * A token movement could not be carried out (e.g. insufficient balance).
 */
public class TokenTransferException extends RuntimeException {

    public TokenTransferException(String message) {
        super(message);
    }
}
