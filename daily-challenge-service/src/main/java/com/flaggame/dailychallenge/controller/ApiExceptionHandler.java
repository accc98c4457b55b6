package com.flaggame.dailychallenge.controller;

import com.flaggame.dailychallenge.dto.ApiErrorResponse;
import com.flaggame.dailychallenge.exception.AlreadyAnsweredCorrectlyException;
import com.flaggame.dailychallenge.exception.AttemptsExhaustedException;
import com.flaggame.dailychallenge.exception.ChallengeUnavailableException;
import com.flaggame.dailychallenge.exception.ConcurrentSubmissionException;
import com.flaggame.dailychallenge.exception.InvalidAuthorizationException;
import com.flaggame.dailychallenge.exception.MalformedAnswerPayloadException;
import com.flaggame.dailychallenge.exception.NoEligibleItemsException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(AlreadyAnsweredCorrectlyException.class)
    public ResponseEntity<ApiErrorResponse> handleAlreadyAnswered(AlreadyAnsweredCorrectlyException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ApiErrorResponse("ALREADY_ANSWERED_CORRECTLY", ex.getMessage()));
    }

    @ExceptionHandler(AttemptsExhaustedException.class)
    public ResponseEntity<ApiErrorResponse> handleAttemptsExhausted(AttemptsExhaustedException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ApiErrorResponse("ATTEMPTS_EXHAUSTED", ex.getMessage()));
    }

    @ExceptionHandler(MalformedAnswerPayloadException.class)
    public ResponseEntity<ApiErrorResponse> handleMalformed(MalformedAnswerPayloadException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ApiErrorResponse("MALFORMED_ANSWER_PAYLOAD", ex.getMessage()));
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ApiErrorResponse> handleValidation(Exception ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ApiErrorResponse("MALFORMED_ANSWER_PAYLOAD", "request validation failed"));
    }

    @ExceptionHandler(ConcurrentSubmissionException.class)
    public ResponseEntity<ApiErrorResponse> handleConcurrentSubmission(ConcurrentSubmissionException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ApiErrorResponse("CONCURRENT_SUBMISSION", ex.getMessage()));
    }

    @ExceptionHandler(InvalidAuthorizationException.class)
    public ResponseEntity<ApiErrorResponse> handleUnauthorized(InvalidAuthorizationException ex) {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(new ApiErrorResponse("UNAUTHORIZED", ex.getMessage()));
    }

    @ExceptionHandler(NoEligibleItemsException.class)
    public ResponseEntity<ApiErrorResponse> handleNoEligibleItems(NoEligibleItemsException ex) {
        log.error("Cannot select a challenge: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ApiErrorResponse("NO_ELIGIBLE_ITEMS", "No challenge is available right now."));
    }

    @ExceptionHandler(ChallengeUnavailableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnavailable(ChallengeUnavailableException ex) {
        log.error("Challenge storage unavailable", ex);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ApiErrorResponse("CHALLENGE_UNAVAILABLE", "Could not retrieve today's challenge."));
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
        log.error("Unhandled error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ApiErrorResponse("INTERNAL_ERROR", "Unexpected error"));
    }
}
