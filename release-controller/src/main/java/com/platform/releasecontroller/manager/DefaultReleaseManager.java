package com.platform.releasecontroller.manager;

import com.platform.releasecontroller.cache.ReleaseKey;
import com.platform.releasecontroller.error.BackendException;
import com.platform.releasecontroller.error.ConvergenceException;
import com.platform.releasecontroller.error.ErrorCode;
import com.platform.releasecontroller.error.KeyDecodeException;
import com.platform.releasecontroller.model.ConditionReason;
import com.platform.releasecontroller.model.LiveResource;
import com.platform.releasecontroller.model.Release;
import com.platform.releasecontroller.model.ReleaseCondition;
import com.platform.releasecontroller.model.ReleaseHistory;
import com.platform.releasecontroller.model.ReleaseSpec;
import com.platform.releasecontroller.model.ReleaseStatus;
import com.platform.releasecontroller.model.RenderedResource;
import com.platform.releasecontroller.status.ReleaseConditions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Release manager that renders templates, applies the resulting resources and keeps
 * one history per applied version.
 *
 * Decision order for trigger:
 * 1. spec.rollbackTo set: roll back to that history version
 * 2. never deployed: create
 * 3. generation not yet observed: update
 * 4. otherwise: nothing to do
 */
@Slf4j
@Component
public class DefaultReleaseManager implements ReleaseManager {
    
    private static final String DOCUMENT_SEPARATOR = "---\n";
    
    private final ReleaseBackend backend;
    private final ManifestRenderer renderer;
    private final ResourceClient resourceClient;
    private final ReleaseConditions conditions;
    private final Clock clock;
    
    public DefaultReleaseManager(
            ReleaseBackend backend,
            ManifestRenderer renderer,
            ResourceClient resourceClient,
            ReleaseConditions conditions,
            Clock clock) {
        this.backend = backend;
        this.renderer = renderer;
        this.resourceClient = resourceClient;
        this.conditions = conditions;
        this.clock = clock;
    }
    
    @Override
    public void trigger(Release release) {
        ReleaseSpec spec = release.getSpec();
        ReleaseStatus status = release.getStatus();
        
        if (spec == null) {
            throw fail(release.copy(), ConvergenceException.missingSpec(keyOf(release)));
        }
        if (spec.hasRollback()) {
            rollback(release);
        } else if (status.getVersion() == 0) {
            create(release);
        } else if (status.getObservedGeneration() != release.getGeneration()) {
            update(release);
        } else if (status.hasCondition(ConditionReason.AVAILABLE) && status.getConditions().size() == 1) {
            log.debug("Release {} is up to date", release.describe());
        } else {
            log.info("Release {} is deployed, restoring Available condition", release.describe());
            Release working = release.copy();
            working.getStatus().setCondition(conditions.available());
            writeStatus(working);
        }
    }
    
    private void create(Release release) {
        log.info("Creating release {}", release.describe());
        Release working = transition(release, conditions.creating());
        deploy(working, 1);
    }
    
    private void update(Release release) {
        log.info("Updating release {} to generation {}", release.describe(), release.getGeneration());
        Release working = transition(release, conditions.updating());
        deploy(working, working.getStatus().getVersion() + 1);
    }
    
    private void rollback(Release release) {
        String key = keyOf(release);
        int target = release.getSpec().rollbackTo();
        log.info("Rolling back release {} to version {}", release.describe(), target);
        
        Release working = transition(release, conditions.rollbacking());
        ReleaseHistory history = listHistories(working).stream()
            .filter(h -> h.version() == target)
            .findFirst()
            .orElseThrow(() -> fail(working, ConvergenceException.historyNotFound(key, target)));
        
        working.setSpec(history.spec().withoutRollback());
        Release rolledBack;
        try {
            rolledBack = backend.update(working);
        } catch (BackendException e) {
            throw backendFailure(key, e);
        }
        deploy(rolledBack, rolledBack.getStatus().getVersion() + 1);
    }
    
    /**
     * Render, apply, prune, record history, then mark Available.
     */
    private void deploy(Release working, int version) {
        String key = keyOf(working);
        
        List<RenderedResource> rendered;
        try {
            rendered = renderer.render(working);
        } catch (RuntimeException e) {
            throw fail(working, ConvergenceException.render(key, e));
        }
        
        int changed = 0;
        try {
            for (RenderedResource resource : rendered) {
                if (resourceClient.apply(working.getNamespace(), key, resource)) {
                    changed++;
                }
            }
        } catch (RuntimeException e) {
            throw fail(working, ConvergenceException.apply(key, e));
        }
        
        int pruned = prune(working, rendered);
        String manifest = rendered.stream()
            .map(RenderedResource::body)
            .collect(Collectors.joining(DOCUMENT_SEPARATOR));
        
        try {
            backend.createHistory(new ReleaseHistory(
                working.getNamespace(),
                working.getName(),
                version,
                working.getSpec(),
                manifest,
                clock.instant()
            ));
        } catch (BackendException e) {
            throw fail(working, new ConvergenceException(e.getErrorCode(), key,
                "Can't record history of release " + key + ": " + e.getMessage(), e));
        }
        
        ReleaseStatus status = working.getStatus();
        status.setVersion(version);
        status.setManifest(manifest);
        status.setObservedGeneration(working.getGeneration());
        status.setLastUpdateTime(clock.instant());
        status.setCondition(conditions.available());
        writeStatus(working);
        
        log.info("Release {} available at version {} ({} resources changed, {} pruned)",
            key, version, changed, pruned);
    }
    
    private int prune(Release working, List<RenderedResource> rendered) {
        String key = keyOf(working);
        Set<String> wanted = rendered.stream()
            .map(r -> r.kind() + "/" + r.name())
            .collect(Collectors.toSet());
        
        int pruned = 0;
        try {
            for (LiveResource live : resourceClient.listByOwner(key)) {
                if (!wanted.contains(live.kind() + "/" + live.name())) {
                    resourceClient.delete(live.namespace(), live.kind(), live.name());
                    pruned++;
                }
            }
        } catch (RuntimeException e) {
            throw fail(working, ConvergenceException.delete(key, e));
        }
        return pruned;
    }
    
    @Override
    public void delete(String namespace, String name) {
        String key = new ReleaseKey(namespace, name).encode();
        
        List<LiveResource> live;
        try {
            live = resourceClient.listByOwner(key);
            for (LiveResource resource : live) {
                resourceClient.delete(resource.namespace(), resource.kind(), resource.name());
            }
        } catch (RuntimeException e) {
            throw ConvergenceException.delete(key, e);
        }
        
        int histories;
        try {
            histories = backend.deleteHistories(namespace, name);
        } catch (BackendException e) {
            throw backendFailure(key, e);
        }
        
        if (live.isEmpty() && histories == 0) {
            log.debug("Nothing left to delete for release {}", key);
        } else {
            log.info("Deleted release {}: {} resources, {} histories", key, live.size(), histories);
        }
    }
    
    @Override
    public int run() {
        Set<ReleaseKey> releases;
        Map<ReleaseKey, List<LiveResource>> resourcesByOwner = new TreeMap<>();
        Set<ReleaseKey> historyOwners;
        try {
            releases = backend.listKeys();
            for (LiveResource resource : resourceClient.listAll()) {
                ReleaseKey owner = ownerOf(resource);
                if (owner != null && !releases.contains(owner)) {
                    resourcesByOwner.computeIfAbsent(owner, k -> new ArrayList<>()).add(resource);
                }
            }
            historyOwners = backend.listHistoryOwners();
        } catch (RuntimeException e) {
            throw new ConvergenceException(ErrorCode.SWEEP_FAILED, "*",
                "Can't list objects for consistency sweep: " + e.getMessage(), e);
        }
        
        int repaired = 0;
        for (Map.Entry<ReleaseKey, List<LiveResource>> entry : resourcesByOwner.entrySet()) {
            ReleaseKey owner = entry.getKey();
            if (backend.exists(owner)) {
                // Created after the listing above
                continue;
            }
            log.info("Removing {} resources left behind by deleted release {}", entry.getValue().size(), owner);
            for (LiveResource resource : entry.getValue()) {
                try {
                    if (resourceClient.delete(resource.namespace(), resource.kind(), resource.name())) {
                        repaired++;
                    }
                } catch (RuntimeException e) {
                    throw new ConvergenceException(ErrorCode.SWEEP_FAILED, owner.encode(),
                        "Can't remove orphaned resource " + resource.ref() + ": " + e.getMessage(), e);
                }
            }
        }
        
        for (ReleaseKey owner : historyOwners) {
            if (releases.contains(owner) || backend.exists(owner)) {
                continue;
            }
            try {
                int removed = backend.deleteHistories(owner.namespace(), owner.name());
                log.info("Removed {} histories left behind by deleted release {}", removed, owner);
                repaired += removed;
            } catch (BackendException e) {
                throw new ConvergenceException(ErrorCode.SWEEP_FAILED, owner.encode(),
                    "Can't remove orphaned histories: " + e.getMessage(), e);
            }
        }
        
        if (repaired == 0) {
            log.debug("Consistency sweep found nothing to repair");
        } else {
            log.info("Consistency sweep removed {} orphaned objects", repaired);
        }
        return repaired;
    }
    
    // ==================== Helpers ====================
    
    private Release transition(Release release, ReleaseCondition condition) {
        Release working = release.copy();
        working.getStatus().setCondition(condition);
        return writeStatus(working);
    }
    
    private Release writeStatus(Release working) {
        try {
            Release stored = backend.updateStatus(working);
            working.setResourceVersion(stored.getResourceVersion());
            return working;
        } catch (BackendException e) {
            throw backendFailure(keyOf(working), e);
        }
    }
    
    private List<ReleaseHistory> listHistories(Release working) {
        try {
            return backend.listHistories(working.getNamespace(), working.getName());
        } catch (BackendException e) {
            throw fail(working, new ConvergenceException(e.getErrorCode(), keyOf(working), e.getMessage(), e));
        }
    }
    
    /**
     * Record a Failure condition and hand back the exception for the caller to throw.
     * A release that vanished or moved on cannot take the condition; that is only logged.
     */
    private ConvergenceException fail(Release working, ConvergenceException failure) {
        log.warn("Release {} failed: {}", keyOf(working), failure.getMessage());
        working.getStatus().setCondition(conditions.failure(failure.getMessage()));
        try {
            backend.updateStatus(working);
        } catch (BackendException e) {
            log.warn("Can't record failure of release {}: {}", keyOf(working), e.getMessage());
        }
        return failure;
    }
    
    private ConvergenceException backendFailure(String key, BackendException e) {
        return new ConvergenceException(e.getErrorCode(), key,
            "Can't write release " + key + ": " + e.getMessage(), e);
    }
    
    private ReleaseKey ownerOf(LiveResource resource) {
        try {
            return ReleaseKey.parse(resource.owner());
        } catch (KeyDecodeException e) {
            log.warn("Ignoring resource {} with invalid owner: {}", resource.ref(), e.getMessage());
            return null;
        }
    }
    
    private static String keyOf(Release release) {
        return release.getNamespace() + "/" + release.getName();
    }
}
