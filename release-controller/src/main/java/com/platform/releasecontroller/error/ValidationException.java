package com.platform.releasecontroller.error;

/**
 * Rejected release spec submitted through the API.
 */
public class ValidationException extends ReleaseControllerException {
    
    private final String field;
    private final Object rejectedValue;
    
    public ValidationException(String field, Object rejectedValue, String message) {
        super(ErrorCode.INVALID_RELEASE_SPEC, 
            String.format("Invalid value '%s' for field '%s': %s", rejectedValue, field, message));
        this.field = field;
        this.rejectedValue = rejectedValue;
    }
    
    public String getField() {
        return field;
    }
    
    public Object getRejectedValue() {
        return rejectedValue;
    }
}
