package com.ekslens.leadmaster.lead.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class ActiveLeadRunException extends RuntimeException {
    public ActiveLeadRunException(String message) {
        super(message);
    }
}
