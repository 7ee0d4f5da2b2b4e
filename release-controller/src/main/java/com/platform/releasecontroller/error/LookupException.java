package com.platform.releasecontroller.error;

/**
 * The release cache failed for a reason other than "not found".
 */
public class LookupException extends ReleaseControllerException {
    
    public LookupException(String namespace, String name, Throwable cause) {
        super(ErrorCode.CACHE_LOOKUP_FAILED, 
            String.format("Can't get release %s/%s from cache", namespace, name), cause);
    }
}
