package com.ekslens.leadmaster.lead.persistence;

public class LeadPersistenceException extends RuntimeException {
    public LeadPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
