package com.example.clinic.service;

/**
 * The billing ledger could not be read. No partial statement is produced when this is thrown.
 */
public class LedgerReadException extends RuntimeException {

    public LedgerReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
