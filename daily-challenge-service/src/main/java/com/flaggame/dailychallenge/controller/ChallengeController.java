package com.flaggame.dailychallenge.controller;

import com.flaggame.dailychallenge.dto.AnswerSubmissionRequest;
import com.flaggame.dailychallenge.dto.AttemptResult;
import com.flaggame.dailychallenge.dto.ChallengeHistoryPage;
import com.flaggame.dailychallenge.dto.ChallengePublicView;
import com.flaggame.dailychallenge.dto.UserStatsResponse;
import com.flaggame.dailychallenge.exception.InvalidAuthorizationException;
import com.flaggame.dailychallenge.security.JwtUtil;
import com.flaggame.dailychallenge.service.ChallengeService;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;

@RestController
@RequestMapping("/api/challenges")
@CrossOrigin(origins = "${cors.allowed.origins}")
public class ChallengeController {

    private static final String BEARER_PREFIX = "Bearer ";

    private final ChallengeService challengeService;
    private final JwtUtil jwtUtil;

    public ChallengeController(ChallengeService challengeService, JwtUtil jwtUtil) {
        this.challengeService = challengeService;
        this.jwtUtil = jwtUtil;
    }

    /**
     * GET /api/challenges/today
     * Today's flag with the caller's progress; never the country name
     */
    @GetMapping("/today")
    public ResponseEntity<ChallengePublicView> getTodaysChallenge(
            @RequestHeader(value = "Authorization", required = false) String authHeader) {

        Long userId = extractUserId(authHeader);
        return ResponseEntity.ok(challengeService.getTodaysChallenge(userId));
    }

    /**
     * POST /api/challenges/today/answer
     * Submit a guess for today's challenge
     */
    @PostMapping("/today/answer")
    public ResponseEntity<AttemptResult> submitAnswer(
            @RequestHeader(value = "Authorization", required = false) String authHeader,
            @Valid @RequestBody AnswerSubmissionRequest request) {

        Long userId = extractUserId(authHeader);
        return ResponseEntity.ok(challengeService.submitAnswer(userId, request));
    }

    /**
     * GET /api/challenges/history?before=2024-05-01&page=0
     * Past challenges; includes the caller's own attempts when authenticated
     */
    @GetMapping("/history")
    public ResponseEntity<ChallengeHistoryPage> getHistory(
            @RequestHeader(value = "Authorization", required = false) String authHeader,
            @RequestParam(value = "before", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate before,
            @RequestParam(value = "page", defaultValue = "0") int page) {

        Long userId = authHeader == null ? null : extractUserId(authHeader);
        return ResponseEntity.ok(challengeService.getHistory(userId, before, page));
    }

    /**
     * GET /api/challenges/stats/me
     * Get current user's streak statistics
     */
    @GetMapping("/stats/me")
    public ResponseEntity<UserStatsResponse> getMyStats(
            @RequestHeader(value = "Authorization", required = false) String authHeader) {

        Long userId = extractUserId(authHeader);
        return ResponseEntity.ok(challengeService.getUserStats(userId));
    }

    private Long extractUserId(String authHeader) {
        if (authHeader == null || !authHeader.startsWith(BEARER_PREFIX)) {
            throw new InvalidAuthorizationException("Missing or invalid authorization header");
        }
        return jwtUtil.extractUserId(authHeader.substring(BEARER_PREFIX.length()));
    }
}
