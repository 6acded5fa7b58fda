package com.csd.formulary.exception;

import com.csd.formulary.model.Dependency;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps package-operation failures to JSON error bodies. Collision and resolution
 * errors carry their structured payload so a client can retry with aliases.
 */
@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(FunctionCollisionException.class)
    public ResponseEntity<ErrorResponse> handleCollision(FunctionCollisionException ex) {
        ErrorResponse error = new ErrorResponse("FUNCTION_COLLISION", ex.getMessage(), ex.getReport().getConflicts());
        return new ResponseEntity<>(error, HttpStatus.CONFLICT);
    }

    @ExceptionHandler(UnsatisfiableRequirementsException.class)
    public ResponseEntity<ErrorResponse> handleUnsatisfiable(UnsatisfiableRequirementsException ex) {
        Map<String, String> details = new LinkedHashMap<>();
        for (Dependency d : ex.getRequirements()) {
            details.merge(d.getName(), d.getSpecifier(), (a, b) -> a.isEmpty() ? b : b.isEmpty() ? a : a + "," + b);
        }
        ErrorResponse error = new ErrorResponse("UNSATISFIABLE_REQUIREMENTS", ex.getMessage(), details);
        return new ResponseEntity<>(error, HttpStatus.UNPROCESSABLE_ENTITY);
    }

    @ExceptionHandler({PackageNotFoundException.class, VersionNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(FormularyException ex) {
        return new ResponseEntity<>(new ErrorResponse("NOT_FOUND", ex.getMessage()), HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(NotInstalledException.class)
    public ResponseEntity<ErrorResponse> handleNotInstalled(NotInstalledException ex) {
        return new ResponseEntity<>(new ErrorResponse("NOT_INSTALLED", ex.getMessage()), HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(LocalPackageMissingException.class)
    public ResponseEntity<ErrorResponse> handleLocalMissing(LocalPackageMissingException ex) {
        return new ResponseEntity<>(new ErrorResponse("LOCAL_PACKAGE_MISSING", ex.getMessage()), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(ArchiveCorruptException.class)
    public ResponseEntity<ErrorResponse> handleCorrupt(ArchiveCorruptException ex) {
        return new ResponseEntity<>(new ErrorResponse("ARCHIVE_CORRUPT", ex.getMessage()), HttpStatus.UNPROCESSABLE_ENTITY);
    }

    @ExceptionHandler({IllegalArgumentException.class, IllegalStateException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(RuntimeException ex) {
        return new ResponseEntity<>(new ErrorResponse("BAD_REQUEST", ex.getMessage()), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleGeneric(RuntimeException ex) {
        log.error("Unhandled failure", ex);
        return new ResponseEntity<>(new ErrorResponse("SERVER_ERROR", ex.getMessage()), HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
