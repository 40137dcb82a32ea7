package com.bridgeai.server.controller;

import com.bridgeai.server.error.BridgeException;
import com.bridgeai.server.error.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(BridgeException.class)
    public ResponseEntity<Map<String, Object>> bridgeError(BridgeException ex) {
        HttpStatus status = statusFor(ex.getCode());
        if (status.is5xxServerError()) {
            logger.error("Request failed: {}", ex.toString(), ex);
        }
        return ResponseEntity.status(status)
                .body(Map.of("error", String.valueOf(ex.getMessage()), "code", ex.getCode().name()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", String.valueOf(ex.getMessage()), "code", ErrorCode.INVALID_ARGUMENT.name()));
    }

    static HttpStatus statusFor(ErrorCode code) {
        switch (code) {
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case CAPACITY_EXCEEDED:
                return HttpStatus.TOO_MANY_REQUESTS;
            case INVALID_ARGUMENT:
                return HttpStatus.BAD_REQUEST;
            case NOT_INITIALIZED:
                return HttpStatus.SERVICE_UNAVAILABLE;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }
}
