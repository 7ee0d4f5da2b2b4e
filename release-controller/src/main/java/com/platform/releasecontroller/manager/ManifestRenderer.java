package com.platform.releasecontroller.manager;

import com.platform.releasecontroller.model.Release;
import com.platform.releasecontroller.model.RenderedResource;

import java.util.List;

/**
 * Turns a release spec into deployable resources.
 */
public interface ManifestRenderer {
    
    /**
     * @throws IllegalArgumentException if the template cannot be rendered
     */
    List<RenderedResource> render(Release release);
}
