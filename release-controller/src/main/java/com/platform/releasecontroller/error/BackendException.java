package com.platform.releasecontroller.error;

/**
 * Failure reported by the release backend.
 */
public class BackendException extends ReleaseControllerException {
    
    private final String releaseKey;
    
    public BackendException(ErrorCode errorCode, String releaseKey, String message) {
        super(errorCode, message);
        this.releaseKey = releaseKey;
    }
    
    public BackendException(ErrorCode errorCode, String releaseKey, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.releaseKey = releaseKey;
    }
    
    public static BackendException notFound(String releaseKey) {
        return new BackendException(ErrorCode.RELEASE_NOT_FOUND, releaseKey,
            String.format("Release not found: %s", releaseKey));
    }
    
    public static BackendException conflict(String releaseKey, long expected, long actual) {
        return new BackendException(ErrorCode.BACKEND_CONFLICT, releaseKey,
            String.format("Release %s was modified (resourceVersion %d, stored %d)", releaseKey, expected, actual));
    }
    
    public boolean isNotFound() {
        return getErrorCode() == ErrorCode.RELEASE_NOT_FOUND;
    }
    
    public String getReleaseKey() {
        return releaseKey;
    }
}
