package com.platform.releasecontroller.error;

/**
 * A release could not be driven to its desired state during this attempt.
 */
public class ConvergenceException extends ReleaseControllerException {
    
    private final String releaseKey;
    
    public ConvergenceException(ErrorCode errorCode, String releaseKey, String message) {
        super(errorCode, message);
        this.releaseKey = releaseKey;
    }
    
    public ConvergenceException(ErrorCode errorCode, String releaseKey, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.releaseKey = releaseKey;
    }
    
    public static ConvergenceException render(String releaseKey, Throwable cause) {
        return new ConvergenceException(ErrorCode.RENDER_FAILED, releaseKey,
            String.format("Can't render release %s: %s", releaseKey, cause.getMessage()), cause);
    }
    
    public static ConvergenceException missingSpec(String releaseKey) {
        return new ConvergenceException(ErrorCode.RENDER_FAILED, releaseKey,
            String.format("Can't render release %s: it has no spec", releaseKey));
    }
    
    public static ConvergenceException apply(String releaseKey, Throwable cause) {
        return new ConvergenceException(ErrorCode.APPLY_FAILED, releaseKey,
            String.format("Can't apply resources of release %s: %s", releaseKey, cause.getMessage()), cause);
    }
    
    public static ConvergenceException delete(String releaseKey, Throwable cause) {
        return new ConvergenceException(ErrorCode.DELETE_FAILED, releaseKey,
            String.format("Can't delete resources of release %s: %s", releaseKey, cause.getMessage()), cause);
    }
    
    public static ConvergenceException historyNotFound(String releaseKey, int version) {
        return new ConvergenceException(ErrorCode.HISTORY_NOT_FOUND, releaseKey,
            String.format("Release %s has no history version %d", releaseKey, version));
    }
    
    public String getReleaseKey() {
        return releaseKey;
    }
}
