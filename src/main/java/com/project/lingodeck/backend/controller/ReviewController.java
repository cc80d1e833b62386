package com.project.lingodeck.backend.controller;

import com.project.lingodeck.backend.algorithm.Grade;
import com.project.lingodeck.backend.dto.ReportOutcomeRequestDto;
import com.project.lingodeck.backend.dto.ReviewStepDto;
import com.project.lingodeck.backend.exception.ExceptionMessage;
import com.project.lingodeck.backend.exception.InvalidArgumentException;
import com.project.lingodeck.backend.response.ApiResponse;
import com.project.lingodeck.backend.response.ResponseMessage;
import com.project.lingodeck.backend.service.ReviewSessionService;
import com.project.lingodeck.backend.session.ReviewStep;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * HTTP face of the review session API, used by the chat bot front end.
 */
@Slf4j
@RestController
@RequestMapping("/api/review/{ownerId}")
public class ReviewController {

    private final ReviewSessionService reviewSessionService;

    public ReviewController(ReviewSessionService reviewSessionService) {
        this.reviewSessionService = reviewSessionService;
    }

    @PostMapping("/start")
    public ResponseEntity<ApiResponse> startReview(@PathVariable String ownerId) {
        ReviewStep step = reviewSessionService.startReview(ownerId);
        ResponseMessage message = step.isNothingDue() ? ResponseMessage.NOTHING_DUE : ResponseMessage.REVIEW_STARTED;
        return ResponseEntity.ok(new ApiResponse(message, toDto(step)));
    }

    @PostMapping("/outcome")
    public ResponseEntity<ApiResponse> reportOutcome(@PathVariable String ownerId,
                                                     @Valid @RequestBody ReportOutcomeRequestDto request) {
        ReviewStep step = reviewSessionService.reportOutcome(ownerId, request.getCardId(),
                toGrade(request.getGrade()), request.getSubmissionToken());
        ResponseMessage message = step.isFinished() ? ResponseMessage.SESSION_FINISHED : ResponseMessage.NEXT_CARD;
        return ResponseEntity.ok(new ApiResponse(message, toDto(step)));
    }

    @PostMapping("/edit/{cardId}")
    public ResponseEntity<ApiResponse> startEdit(@PathVariable String ownerId, @PathVariable String cardId) {
        reviewSessionService.startEdit(ownerId, cardId);
        return ResponseEntity.ok(new ApiResponse(ResponseMessage.EDIT_STARTED, reviewSessionService.getSessionState(ownerId)));
    }

    @PostMapping("/edit/finish")
    public ResponseEntity<ApiResponse> finishEdit(@PathVariable String ownerId) {
        reviewSessionService.finishEdit(ownerId);
        return ResponseEntity.ok(new ApiResponse(ResponseMessage.EDIT_FINISHED, reviewSessionService.getSessionState(ownerId)));
    }

    @PostMapping("/cancel")
    public ResponseEntity<ApiResponse> cancel(@PathVariable String ownerId) {
        reviewSessionService.cancel(ownerId);
        return ResponseEntity.ok(new ApiResponse(ResponseMessage.SESSION_CANCELLED));
    }

    @GetMapping
    public ResponseEntity<ApiResponse> getSessionState(@PathVariable String ownerId) {
        return ResponseEntity.ok(new ApiResponse(ResponseMessage.SUCCESS, reviewSessionService.getSessionState(ownerId)));
    }

    private static Grade toGrade(int value) {
        try {
            return Grade.fromValue(value);
        } catch (IllegalArgumentException e) {
            throw new InvalidArgumentException(ExceptionMessage.INVALID_GRADE + ": " + value);
        }
    }

    private ReviewStepDto toDto(ReviewStep step) {
        return ReviewStepDto.from(step,
                step.hasCard() ? reviewSessionService.previewDueDates(step.getCard()) : Map.of());
    }
}
