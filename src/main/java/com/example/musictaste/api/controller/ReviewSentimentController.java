package com.example.musictaste.api.controller;

import com.example.musictaste.api.response.ApiResponse;
import com.example.musictaste.api.response.SentimentResponse;
import com.example.musictaste.application.service.SentimentAnnotationService;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/reviews")
public class ReviewSentimentController {

    private final SentimentAnnotationService sentimentAnnotationService;

    public ReviewSentimentController(SentimentAnnotationService sentimentAnnotationService) {
        this.sentimentAnnotationService = sentimentAnnotationService;
    }

    @PostMapping("/{reviewId}/sentiment")
    public ApiResponse<SentimentResponse> annotate(@PathVariable("reviewId") Long reviewId) {
        return ApiResponse.success(SentimentResponse.from(reviewId, sentimentAnnotationService.annotate(reviewId)));
    }
}
