package com.chainrouter.api.controller;

import com.chainrouter.api.dto.ErrorBody;
import com.chainrouter.rpc.registry.ProviderConfigurationException;
import com.chainrouter.rpc.registry.UnknownProviderException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps router configuration failures to ErrorBody: unknown provider 404, other configuration errors 400.
 */
@RestControllerAdvice
public class RouterExceptionHandler {

    @ExceptionHandler(UnknownProviderException.class)
    public ResponseEntity<ErrorBody> handleUnknownProvider(UnknownProviderException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorBody.of("PROVIDER_NOT_FOUND", ex.getMessage()));
    }

    @ExceptionHandler(ProviderConfigurationException.class)
    public ResponseEntity<ErrorBody> handleConfiguration(ProviderConfigurationException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", ex.getMessage()));
    }
}
