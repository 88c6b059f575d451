package com.example.rentalrepairs.controller;

import com.example.rentalrepairs.exception.AggregateNotFoundException;
import com.example.rentalrepairs.exception.AuthorizationException;
import com.example.rentalrepairs.exception.ConcurrencyConflictException;
import com.example.rentalrepairs.exception.DomainException;
import com.example.rentalrepairs.exception.DomainValidationException;
import com.example.rentalrepairs.exception.InvariantViolationException;
import com.example.rentalrepairs.exception.UnsupportedSpecificationException;
import com.example.rentalrepairs.exception.WorkerAssignmentException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

/**
 * Maps domain rejections to RFC 7807 problem responses. Bean validation and malformed requests
 * are answered by the base class.
 */
@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(DomainValidationException.class)
    public ResponseEntity<ProblemDetail> handleValidation(DomainValidationException ex) {
        log.warn("Validation failed: field={}, reason={}", ex.getField(), ex.getMessage());
        ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, "Invalid input", ex);
        problem.setProperty("field", ex.getField());
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(AggregateNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleNotFound(AggregateNotFoundException ex) {
        log.warn("Not found: {} {}", ex.getAggregateType(), ex.getAggregateId());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(problem(HttpStatus.NOT_FOUND, "Not found", ex));
    }

    @ExceptionHandler(AuthorizationException.class)
    public ResponseEntity<ProblemDetail> handleForbidden(AuthorizationException ex, HttpServletRequest request) {
        log.warn("Forbidden: path={}, method={}, user={}, action={}",
                request.getRequestURI(), request.getMethod(), ex.getUserId(), ex.getAction());
        ProblemDetail problem = problem(HttpStatus.FORBIDDEN, "Access denied", ex);
        problem.setProperty("action", ex.getAction());
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(problem);
    }

    @ExceptionHandler(InvariantViolationException.class)
    public ResponseEntity<ProblemDetail> handleInvariantViolation(InvariantViolationException ex) {
        log.warn("Rejected: rule={}, {} {}: {}", ex.getRule(), ex.getAggregateType(), ex.getAggregateId(),
                ex.getMessage());
        ProblemDetail problem = problem(HttpStatus.CONFLICT, "Operation not allowed", ex);
        problem.setProperty("rule", ex.getRule());
        if (ex instanceof WorkerAssignmentException assignment) {
            problem.setProperty("reason", assignment.getReason());
            problem.setProperty("workerId", assignment.getWorkerId());
        }
        return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
    }

    @ExceptionHandler(ConcurrencyConflictException.class)
    public ResponseEntity<ProblemDetail> handleConcurrencyConflict(ConcurrencyConflictException ex) {
        log.warn("Concurrent modification: {} {}", ex.getAggregateType(), ex.getAggregateId());
        ProblemDetail problem = problem(HttpStatus.CONFLICT, "Concurrent modification", ex);
        problem.setDetail("Resource was modified concurrently. Please retry.");
        return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
    }

    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<ProblemDetail> handleOptimisticLock(ObjectOptimisticLockingFailureException ex) {
        log.warn("Optimistic locking failure at commit: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
        problem.setTitle("Concurrent modification");
        problem.setDetail("Resource was modified concurrently. Please retry.");
        return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ProblemDetail> handleDataIntegrity(DataIntegrityViolationException ex) {
        log.warn("Constraint violation at commit: {}", ex.getMostSpecificCause().getMessage());
        ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
        problem.setTitle("Conflicting data");
        problem.setDetail("The change conflicts with data stored concurrently. Please retry.");
        return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
    }

    @ExceptionHandler(UnsupportedSpecificationException.class)
    public ResponseEntity<ProblemDetail> handleUnsupportedSpecification(UnsupportedSpecificationException ex) {
        log.warn("Query not translatable: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
        problem.setTitle("Unsupported query");
        problem.setDetail(ex.getMessage());
        return ResponseEntity.badRequest().body(problem);
    }

    private static ProblemDetail problem(HttpStatus status, String title, DomainException ex) {
        ProblemDetail problem = ProblemDetail.forStatus(status);
        problem.setTitle(title);
        problem.setDetail(ex.getMessage());
        if (ex.getAggregateType() != null) {
            problem.setProperty("aggregateType", ex.getAggregateType());
            problem.setProperty("aggregateId", String.valueOf(ex.getAggregateId()));
        }
        return problem;
    }
}
