package com.tony.auctionDraft.controller;

import com.tony.auctionDraft.exception.DraftRuleViolationException;
import com.tony.auctionDraft.exception.DraftTransactionConflictException;
import com.tony.auctionDraft.exception.LeagueConfigurationException;
import com.tony.auctionDraft.exception.ValuationNotReadyException;
import jakarta.persistence.EntityNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;
import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    // Configuration invalide : message remonté tel quel
    @ExceptionHandler(LeagueConfigurationException.class)
    public ResponseEntity<Map<String, String>> handleConfiguration(LeagueConfigurationException e) {
        log.error("❌ Paramètres de ligue invalides : {}", e.getMessage());
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    @ExceptionHandler(DraftRuleViolationException.class)
    public ResponseEntity<Map<String, String>> handleRuleViolation(DraftRuleViolationException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(EntityNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(EntityNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, e.getMessage());
    }

    // Conflit de transaction : signal de retry pour le client
    @ExceptionHandler(DraftTransactionConflictException.class)
    public ResponseEntity<Map<String, String>> handleConflict(DraftTransactionConflictException e) {
        log.warn("⚠️ {}", e.getMessage());
        return error(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<Map<String, String>> handleConcurrentTransaction(OptimisticLockingFailureException e) {
        log.warn("⚠️ Transaction de draft concurrente rejetée", e);
        return error(HttpStatus.CONFLICT, "Une autre transaction de draft a été commitée entre-temps. Réessayez.");
    }

    @ExceptionHandler(ValuationNotReadyException.class)
    public ResponseEntity<Map<String, String>> handleNotReady(ValuationNotReadyException e) {
        return error(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleInvalidRequest(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(err -> err.getField() + " " + err.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return error(HttpStatus.BAD_REQUEST, message);
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message));
    }
}
