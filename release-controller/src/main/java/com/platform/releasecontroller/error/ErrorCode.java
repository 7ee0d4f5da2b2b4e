package com.platform.releasecontroller.error;

/**
 * Standardized error codes for the release controller.
 * 
 * Format: RC-{CATEGORY}{NUMBER}
 * Categories:
 * - 1xx: Invalid input (keys, specs)
 * - 3xx: Release and history lookups
 * - 4xx: Cache, backend and resource failures
 * - 9xx: Controller-level failures
 */
public enum ErrorCode {
    
    // ==================== Input Errors (1xx) ====================
    
    INVALID_RELEASE_KEY("RC-100", "Malformed release key", ErrorCategory.TERMINAL),
    INVALID_RELEASE_SPEC("RC-101", "Invalid release spec", ErrorCategory.TERMINAL),
    
    // ==================== Lookup Errors (3xx) ====================
    
    RELEASE_NOT_FOUND("RC-300", "Release not found", ErrorCategory.TERMINAL),
    HISTORY_NOT_FOUND("RC-301", "Release history not found", ErrorCategory.RETRYABLE),
    BACKEND_CONFLICT("RC-310", "Release was modified concurrently", ErrorCategory.RETRYABLE),
    
    // ==================== Convergence Errors (4xx) ====================
    
    CACHE_LOOKUP_FAILED("RC-400", "Release cache lookup failed", ErrorCategory.RETRYABLE),
    BACKEND_ERROR("RC-401", "Release backend error", ErrorCategory.RETRYABLE),
    RENDER_FAILED("RC-410", "Manifest rendering failed", ErrorCategory.RETRYABLE),
    APPLY_FAILED("RC-411", "Applying resources failed", ErrorCategory.RETRYABLE),
    DELETE_FAILED("RC-412", "Deleting resources failed", ErrorCategory.RETRYABLE),
    SWEEP_FAILED("RC-421", "Consistency sweep failed", ErrorCategory.RETRYABLE),
    
    // ==================== Controller Errors (9xx) ====================
    
    STARTUP_SYNC_FAILED("RC-900", "Release cache never synced", ErrorCategory.FATAL),
    INTERNAL_ERROR("RC-901", "Internal error", ErrorCategory.FATAL);
    
    private final String code;
    private final String defaultMessage;
    private final ErrorCategory category;
    
    ErrorCode(String code, String defaultMessage, ErrorCategory category) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.category = category;
    }
    
    public String getCode() {
        return code;
    }
    
    public String getDefaultMessage() {
        return defaultMessage;
    }
    
    public ErrorCategory getCategory() {
        return category;
    }
    
    public boolean isFatal() {
        return category == ErrorCategory.FATAL;
    }
    
    public boolean isRetryable() {
        return category == ErrorCategory.RETRYABLE;
    }
    
    public enum ErrorCategory {
        /**
         * Transient; the item is requeued with backoff.
         */
        RETRYABLE,
        
        /**
         * Retrying cannot help; the item is dropped.
         */
        TERMINAL,
        
        /**
         * The controller run cannot continue.
         */
        FATAL
    }
}
