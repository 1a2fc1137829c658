package com.example.clinic.service;

/**
 * Thrown when a statement is requested for a month or year that cannot exist.
 * Raised before anything is read from the ledger.
 */
public class InvalidStatementScopeException extends IllegalArgumentException {

    public InvalidStatementScopeException(String message) {
        super(message);
    }
}
