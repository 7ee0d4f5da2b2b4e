package com.platform.releasecontroller.model;

/**
 * A deployed artifact owned by a release.
 * 
 * @param owner key of the owning release ({@code namespace/name})
 */
public record LiveResource(
    String namespace,
    String kind,
    String name,
    String owner,
    String body
) {
    
    public String ref() {
        return namespace + "/" + kind + "/" + name;
    }
}
