package com.platform.releasecontroller.error;

/**
 * Base exception for all release controller exceptions.
 * Carries an ErrorCode for standardized error handling.
 */
public abstract class ReleaseControllerException extends RuntimeException {
    
    private final ErrorCode errorCode;
    
    protected ReleaseControllerException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    protected ReleaseControllerException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public ErrorCode getErrorCode() {
        return errorCode;
    }
    
    public boolean isRetryable() {
        return errorCode.isRetryable();
    }
    
    public boolean isFatal() {
        return errorCode.isFatal();
    }
}
