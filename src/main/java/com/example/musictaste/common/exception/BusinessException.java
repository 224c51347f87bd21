package com.example.musictaste.common.exception;

/**
 * Failure reported to API callers with a machine-readable code and an
 * optional hint on what the user can do about it.
 */
public class BusinessException extends RuntimeException {

    private final String code;
    private final String userAction;

    public BusinessException(String code, String message) {
        this(code, message, null, null);
    }

    public BusinessException(String code, String message, String userAction) {
        this(code, message, userAction, null);
    }

    public BusinessException(String code, String message, String userAction, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.userAction = userAction;
    }

    public String getCode() {
        return code;
    }

    public String getUserAction() {
        return userAction;
    }
}
