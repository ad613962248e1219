package com.delta.jobingest.ingest.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class ActivePipelinePassException extends RuntimeException {
    public ActivePipelinePassException(String message) {
        super(message);
    }
}
