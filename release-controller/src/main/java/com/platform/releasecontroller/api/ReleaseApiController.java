package com.platform.releasecontroller.api;

import com.platform.releasecontroller.cache.ReleaseKey;
import com.platform.releasecontroller.error.BackendException;
import com.platform.releasecontroller.error.ValidationException;
import com.platform.releasecontroller.manager.ManifestRenderer;
import com.platform.releasecontroller.model.Release;
import com.platform.releasecontroller.model.ReleaseHistory;
import com.platform.releasecontroller.model.ReleaseSpec;
import com.platform.releasecontroller.store.InMemoryReleaseStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API for declaring releases. Writes only touch desired state; the controller
 * picks the change up through the store's notifications.
 */
@Slf4j
@RestController
@RequestMapping("/api/releases")
public class ReleaseApiController {
    
    private final InMemoryReleaseStore store;
    private final ManifestRenderer renderer;
    
    public ReleaseApiController(InMemoryReleaseStore store, ManifestRenderer renderer) {
        this.store = store;
        this.renderer = renderer;
    }
    
    @GetMapping
    public List<Release> listReleases() {
        return store.list();
    }
    
    @GetMapping("/{namespace}/{name}")
    public Release getRelease(@PathVariable String namespace, @PathVariable String name) {
        ReleaseKey key = new ReleaseKey(namespace, name);
        return store.get(key.namespace(), key.name())
            .orElseThrow(() -> BackendException.notFound(key.encode()));
    }
    
    @PutMapping("/{namespace}/{name}")
    public Release applyRelease(
            @PathVariable String namespace,
            @PathVariable String name,
            @RequestBody ReleaseSpec spec) {
        ReleaseKey key = new ReleaseKey(namespace, name);
        validate(key, spec);
        return store.apply(key.namespace(), key.name(), spec);
    }
    
    /**
     * Roll back to a recorded version by setting {@code rollbackTo} on the current spec.
     */
    @PostMapping("/{namespace}/{name}/rollback")
    public Release rollbackRelease(
            @PathVariable String namespace,
            @PathVariable String name,
            @RequestParam int version) {
        Release current = getRelease(namespace, name);
        if (version < 1) {
            throw new ValidationException("version", version, "must be at least 1");
        }
        ReleaseSpec spec = current.getSpec();
        log.info("Rollback of {}/{} to version {} requested", namespace, name, version);
        return store.apply(namespace, name, new ReleaseSpec(spec.description(), spec.template(), version));
    }
    
    @DeleteMapping("/{namespace}/{name}")
    public ResponseEntity<Void> deleteRelease(@PathVariable String namespace, @PathVariable String name) {
        ReleaseKey key = new ReleaseKey(namespace, name);
        if (!store.remove(key.namespace(), key.name())) {
            throw BackendException.notFound(key.encode());
        }
        return ResponseEntity.noContent().build();
    }
    
    @GetMapping("/{namespace}/{name}/histories")
    public List<ReleaseHistory> listHistories(@PathVariable String namespace, @PathVariable String name) {
        ReleaseKey key = new ReleaseKey(namespace, name);
        return store.listHistories(key.namespace(), key.name());
    }
    
    private void validate(ReleaseKey key, ReleaseSpec spec) {
        if (spec == null) {
            throw new ValidationException("spec", null, "is required");
        }
        if (spec.rollbackTo() != null && spec.rollbackTo() < 1) {
            throw new ValidationException("rollbackTo", spec.rollbackTo(), "must be at least 1");
        }
        if (spec.hasRollback()) {
            return;
        }
        if (spec.template() == null || spec.template().isBlank()) {
            throw new ValidationException("template", spec.template(), "is required");
        }
        try {
            renderer.render(Release.of(key.namespace(), key.name(), spec));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("template", abbreviate(spec.template()), e.getMessage());
        }
    }
    
    private static String abbreviate(String value) {
        return value.length() <= 64 ? value : value.substring(0, 64) + "...";
    }
}
