package com.example.musictaste.common.exception;

public final class ErrorCodes {

    public static final String BAD_REQUEST = "400";
    public static final String NOT_FOUND = "404";
    public static final String RECOMMENDATION_UNAVAILABLE = "RECOMMENDATION_UNAVAILABLE";
    public static final String COMPATIBILITY_UNAVAILABLE = "COMPATIBILITY_UNAVAILABLE";
    public static final String SENTIMENT_UNAVAILABLE = "SENTIMENT_UNAVAILABLE";

    public static final String RETRY_LATER = "请稍后重试";

    private ErrorCodes() {
    }
}
