package com.fintech.settlement.controller;

import com.fintech.settlement.dto.ErrorResponse;
import com.fintech.settlement.exception.GatewayException;
import com.fintech.settlement.exception.InvalidStateException;
import com.fintech.settlement.exception.ResourceNotFoundException;
import com.fintech.settlement.exception.SettlementConflictException;
import com.fintech.settlement.exception.SettlementException;
import com.fintech.settlement.exception.SystemException;
import com.fintech.settlement.exception.TransferAuthorizationException;
import com.fintech.settlement.exception.ValidationException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.stream.Collectors;

/**
 * Maps the settlement exception hierarchy to HTTP responses.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException e, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", e.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException e, HttpServletRequest request) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", message, request);
    }

    @ExceptionHandler(SettlementConflictException.class)
    public ResponseEntity<ErrorResponse> handleConflict(SettlementConflictException e, HttpServletRequest request) {
        return build(HttpStatus.CONFLICT, "SETTLEMENT_EXISTS", e.getMessage(), request);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ResourceNotFoundException e, HttpServletRequest request) {
        return build(HttpStatus.NOT_FOUND, "NOT_FOUND", e.getMessage(), request);
    }

    @ExceptionHandler(InvalidStateException.class)
    public ResponseEntity<ErrorResponse> handleInvalidState(InvalidStateException e, HttpServletRequest request) {
        return build(HttpStatus.CONFLICT, "INVALID_STATE", e.getMessage(), request);
    }

    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleConcurrentUpdate(ObjectOptimisticLockingFailureException e,
                                                                HttpServletRequest request) {
        return build(HttpStatus.CONFLICT, "CONCURRENT_UPDATE", "The record was modified concurrently, retry the request", request);
    }

    @ExceptionHandler(TransferAuthorizationException.class)
    public ResponseEntity<ErrorResponse> handleAuthorization(TransferAuthorizationException e, HttpServletRequest request) {
        return build(HttpStatus.UNAUTHORIZED, "TRANSFER_NOT_AUTHORIZED", e.getMessage(), request);
    }

    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<ErrorResponse> handleGateway(GatewayException e, HttpServletRequest request) {
        log.warn("Gateway {} error for reference {}: {}", e.getGatewayName(), e.getReference(), e.getMessage());
        return build(HttpStatus.BAD_GATEWAY, "GATEWAY_ERROR", e.getMessage(), request);
    }

    @ExceptionHandler(SystemException.class)
    public ResponseEntity<ErrorResponse> handleSystem(SystemException e, HttpServletRequest request) {
        log.error("System error on {}: {}", request.getRequestURI(), e.getMessage(), e);
        return build(HttpStatus.SERVICE_UNAVAILABLE, "SYSTEM_ERROR", e.getMessage(), request);
    }

    @ExceptionHandler(SettlementException.class)
    public ResponseEntity<ErrorResponse> handleSettlement(SettlementException e, HttpServletRequest request) {
        log.error("Unhandled settlement error on {}", request.getRequestURI(), e);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "SETTLEMENT_ERROR", e.getMessage(), request);
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String code, String message,
                                                HttpServletRequest request) {
        return ResponseEntity.status(status).body(ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(status.value())
                .error(status.getReasonPhrase())
                .code(code)
                .message(message)
                .path(request.getRequestURI())
                .build());
    }
}
