package com.sandy.aiot.rack.control.controller;

import com.sandy.aiot.rack.control.service.CommandRejectedException;
import com.sandy.aiot.rack.control.service.RackNotFoundException;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(CommandRejectedException.class)
    public ResponseEntity<ErrorResp> rejected(CommandRejectedException e) {
        ErrorResp r = ErrorResp.of(HttpStatus.CONFLICT, e.getMessage());
        r.setBlockingCommandId(e.getBlockingCommandId());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(r);
    }

    @ExceptionHandler(RackNotFoundException.class)
    public ResponseEntity<ErrorResp> notFound(RackNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResp.of(HttpStatus.NOT_FOUND, e.getMessage()));
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResp> badRequest(Exception e) {
        log.debug("Bad request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(ErrorResp.of(HttpStatus.BAD_REQUEST, e.getMessage()));
    }

    @Data
    public static class ErrorResp {
        private int status;
        private String error;
        private String message;
        private String blockingCommandId;

        static ErrorResp of(HttpStatus status, String message) {
            ErrorResp r = new ErrorResp();
            r.status = status.value();
            r.error = status.getReasonPhrase();
            r.message = message;
            return r;
        }
    }
}
