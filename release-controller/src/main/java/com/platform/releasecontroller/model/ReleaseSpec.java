package com.platform.releasecontroller.model;

/**
 * Desired state of a release.
 * 
 * @param description free text shown alongside the release
 * @param template    multi-document YAML manifest to deploy
 * @param rollbackTo  history version to roll back to, or null
 */
public record ReleaseSpec(
    String description,
    String template,
    Integer rollbackTo
) {
    
    public static ReleaseSpec of(String template) {
        return new ReleaseSpec(null, template, null);
    }
    
    public boolean hasRollback() {
        return rollbackTo != null;
    }
    
    public ReleaseSpec withoutRollback() {
        return new ReleaseSpec(description, template, null);
    }
}
