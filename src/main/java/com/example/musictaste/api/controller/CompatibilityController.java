package com.example.musictaste.api.controller;

import com.example.musictaste.api.response.ApiResponse;
import com.example.musictaste.api.response.CompatibilityResponse;
import com.example.musictaste.application.service.TasteCompatibilityService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/users")
public class CompatibilityController {

    private final TasteCompatibilityService compatibilityService;

    public CompatibilityController(TasteCompatibilityService compatibilityService) {
        this.compatibilityService = compatibilityService;
    }

    @GetMapping("/{userId}/compatibility/{otherUserId}")
    public ApiResponse<CompatibilityResponse> compatibility(@PathVariable("userId") Long userId,
                                                            @PathVariable("otherUserId") Long otherUserId) {
        return ApiResponse.success(CompatibilityResponse.from(compatibilityService.compatibility(userId, otherUserId)));
    }
}
