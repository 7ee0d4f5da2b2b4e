package com.platform.releasecontroller.error;

/**
 * A release key or object could not be turned into a namespace/name pair.
 */
public class KeyDecodeException extends ReleaseControllerException {
    
    private final String key;
    
    public KeyDecodeException(String key, String message) {
        super(ErrorCode.INVALID_RELEASE_KEY, String.format("Invalid release key '%s': %s", key, message));
        this.key = key;
    }
    
    public String getKey() {
        return key;
    }
}
