package com.example.musictaste.api.controller;

import com.example.musictaste.api.response.ApiResponse;
import com.example.musictaste.api.response.RecommendationResponse;
import com.example.musictaste.api.response.TrendingSongResponse;
import com.example.musictaste.application.service.RecommendationService;
import com.example.musictaste.application.service.TrendingService;
import com.example.musictaste.domain.model.TrendingSong;
import java.util.ArrayList;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Personalized and trending song lists.
 *
 * <pre>
 *   GET /api/v1/users/{userId}/recommendations?limit=20
 *   GET /api/v1/songs/trending?limit=20
 * </pre>
 */
@RestController
@RequestMapping("/api/v1")
public class RecommendationController {

    private final RecommendationService recommendationService;
    private final TrendingService trendingService;

    public RecommendationController(RecommendationService recommendationService, TrendingService trendingService) {
        this.recommendationService = recommendationService;
        this.trendingService = trendingService;
    }

    @GetMapping("/users/{userId}/recommendations")
    public ApiResponse<RecommendationResponse> recommend(@PathVariable("userId") Long userId,
                                                         @RequestParam(value = "limit", defaultValue = "20") int limit) {
        return ApiResponse.success(RecommendationResponse.from(recommendationService.recommend(userId, limit)));
    }

    @GetMapping("/songs/trending")
    public ApiResponse<List<TrendingSongResponse>> trending(
            @RequestParam(value = "limit", defaultValue = "20") int limit) {
        List<TrendingSong> songs = trendingService.trending(limit);
        List<TrendingSongResponse> response = new ArrayList<>(songs.size());
        for (int i = 0; i < songs.size(); i++) {
            response.add(TrendingSongResponse.from(i + 1, songs.get(i)));
        }
        return ApiResponse.success(response);
    }
}
