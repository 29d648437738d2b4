package com.transmuter.api.controller;

import com.transmuter.api.dto.ErrorBody;
import com.transmuter.common.TransmuterError;
import com.transmuter.common.TransmuterException;
import com.transmuter.integration.TokenTransferException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps domain failures to HTTP statuses with ErrorBody (error, message, timestamp).
 */
@RestControllerAdvice
@Slf4j
public class TransmuterExceptionHandler {

    @ExceptionHandler(TransmuterException.class)
    public ResponseEntity<ErrorBody> handleTransmuter(TransmuterException ex) {
        return ResponseEntity.status(statusOf(ex.getError()))
                .body(ErrorBody.of(ex.getError().name(), ex.getMessage()));
    }

    @ExceptionHandler(TokenTransferException.class)
    public ResponseEntity<ErrorBody> handleTransfer(TokenTransferException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("TRANSFER_FAILED", ex.getMessage()));
    }

    /** Overflow or underflow in fixed-point math: the request cannot be settled with these amounts. */
    @ExceptionHandler(ArithmeticException.class)
    public ResponseEntity<ErrorBody> handleArithmetic(ArithmeticException ex) {
        log.warn("Arithmetic failure: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(ErrorBody.of("ARITHMETIC_ERROR", ex.getMessage()));
    }

    static HttpStatus statusOf(TransmuterError error) {
        return switch (error) {
            case NOT_COLLATERAL -> HttpStatus.NOT_FOUND;
            case NOT_TRUSTED -> HttpStatus.FORBIDDEN;
            case ALREADY_ADDED, COLLATERAL_BACKED -> HttpStatus.CONFLICT;
            default -> HttpStatus.BAD_REQUEST;
        };
    }
}
