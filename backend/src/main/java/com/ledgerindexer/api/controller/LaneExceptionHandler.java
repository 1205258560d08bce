package com.ledgerindexer.api.controller;

import com.ledgerindexer.api.dto.ErrorBody;
import com.ledgerindexer.ingestion.pipeline.LaneNotRestartableException;
import com.ledgerindexer.ingestion.pipeline.UnknownLaneException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps lane lookup and restart failures to 404 / 409 with ErrorBody.
 */
@RestControllerAdvice
public class LaneExceptionHandler {

    @ExceptionHandler(UnknownLaneException.class)
    public ResponseEntity<ErrorBody> handleUnknownLane(UnknownLaneException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorBody.of("LANE_NOT_FOUND", ex.getMessage()));
    }

    @ExceptionHandler(LaneNotRestartableException.class)
    public ResponseEntity<ErrorBody> handleNotRestartable(LaneNotRestartableException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ErrorBody.of("LANE_NOT_RESTARTABLE", ex.getMessage()));
    }
}
