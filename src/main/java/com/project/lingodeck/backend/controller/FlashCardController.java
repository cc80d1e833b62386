package com.project.lingodeck.backend.controller;

import com.project.lingodeck.backend.algorithm.FlashCard;
import com.project.lingodeck.backend.dto.FlashCardRequestDto;
import com.project.lingodeck.backend.dto.FlashCardDto;
import com.project.lingodeck.backend.response.ApiResponse;
import com.project.lingodeck.backend.response.ResponseMessage;
import com.project.lingodeck.backend.service.FlashCardService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/cards/{ownerId}")
public class FlashCardController {

    private final FlashCardService flashCardService;

    public FlashCardController(FlashCardService flashCardService) {
        this.flashCardService = flashCardService;
    }

    @PostMapping
    public ResponseEntity<ApiResponse> createCard(@PathVariable String ownerId,
                                                  @Valid @RequestBody FlashCardRequestDto request) {
        FlashCard card = flashCardService.createCard(ownerId, request.toContent());
        return new ResponseEntity<>(new ApiResponse(ResponseMessage.CARD_CREATED, FlashCardDto.from(card)), HttpStatus.CREATED);
    }

    @GetMapping("/stats")
    public ResponseEntity<ApiResponse> getStatistics(@PathVariable String ownerId) {
        return ResponseEntity.ok(new ApiResponse(ResponseMessage.SUCCESS, flashCardService.getStatistics(ownerId)));
    }

    @GetMapping("/{cardId}")
    public ResponseEntity<ApiResponse> getCard(@PathVariable String ownerId, @PathVariable String cardId) {
        return ResponseEntity.ok(new ApiResponse(ResponseMessage.SUCCESS, FlashCardDto.from(flashCardService.getCard(ownerId, cardId))));
    }

    @PutMapping("/{cardId}")
    public ResponseEntity<ApiResponse> updateCard(@PathVariable String ownerId, @PathVariable String cardId,
                                                  @Valid @RequestBody FlashCardRequestDto request) {
        FlashCard card = flashCardService.updateCard(ownerId, cardId, request.toContent());
        return ResponseEntity.ok(new ApiResponse(ResponseMessage.CARD_UPDATED, FlashCardDto.from(card)));
    }

    @DeleteMapping("/{cardId}")
    public ResponseEntity<ApiResponse> deleteCard(@PathVariable String ownerId, @PathVariable String cardId) {
        flashCardService.deleteCard(ownerId, cardId);
        return ResponseEntity.ok(new ApiResponse(ResponseMessage.CARD_DELETED));
    }
}
