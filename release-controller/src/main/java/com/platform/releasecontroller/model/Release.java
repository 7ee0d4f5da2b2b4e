package com.platform.releasecontroller.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The watched resource: a named, namespaced desired deployment plus its observed status.
 * 
 * Instances handed out by the cache are copies; callers never mutate the stored object.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Release {
    
    private String namespace;
    
    private String name;
    
    /**
     * Incremented by the backend whenever the spec changes.
     */
    private long generation;
    
    /**
     * Incremented by the backend on every write; stale writes are rejected.
     */
    private long resourceVersion;
    
    private ReleaseSpec spec;
    
    @Builder.Default
    private ReleaseStatus status = new ReleaseStatus();
    
    public static Release of(String namespace, String name, ReleaseSpec spec) {
        return Release.builder()
            .namespace(namespace)
            .name(name)
            .spec(spec)
            .build();
    }
    
    public Release copy() {
        return toBuilder()
            .status(status != null ? status.copy() : new ReleaseStatus())
            .build();
    }
    
    public String describe() {
        return String.format("%s/%s (generation=%d, version=%d)", 
            namespace, name, generation, status != null ? status.getVersion() : 0);
    }
}
