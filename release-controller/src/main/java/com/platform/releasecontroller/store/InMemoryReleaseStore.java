package com.platform.releasecontroller.store;

import com.platform.releasecontroller.cache.DeletedFinalStateUnknown;
import com.platform.releasecontroller.cache.ReleaseCache;
import com.platform.releasecontroller.cache.ReleaseEventHandler;
import com.platform.releasecontroller.cache.ReleaseKey;
import com.platform.releasecontroller.error.BackendException;
import com.platform.releasecontroller.manager.ReleaseBackend;
import com.platform.releasecontroller.model.Release;
import com.platform.releasecontroller.model.ReleaseHistory;
import com.platform.releasecontroller.model.ReleaseSpec;
import com.platform.releasecontroller.model.ReleaseStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process release store serving as both the controller's cache and its backend.
 *
 * Every object handed out is a copy. Writes are serialized on the store monitor and
 * notify the registered handlers synchronously, in write order.
 */
@Slf4j
@Component
public class InMemoryReleaseStore implements ReleaseCache, ReleaseBackend {
    
    private final Map<ReleaseKey, Release> releases = new ConcurrentHashMap<>();
    private final Map<ReleaseKey, TreeMap<Integer, ReleaseHistory>> histories = new ConcurrentHashMap<>();
    private final List<ReleaseEventHandler> handlers = new CopyOnWriteArrayList<>();
    
    private volatile boolean synced;
    
    // ==================== Cache ====================
    
    @Override
    public boolean hasSynced() {
        return synced;
    }
    
    /**
     * Nothing is listed from a remote source, so the store is complete once the
     * application has started.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        markSynced();
    }
    
    /**
     * Declare the initial listing delivered.
     */
    public void markSynced() {
        if (!synced) {
            synced = true;
            log.info("Release store synced with {} releases", releases.size());
        }
    }
    
    @Override
    public Optional<Release> lookup(String namespace, String name) {
        return get(namespace, name);
    }
    
    @Override
    public void addEventHandler(ReleaseEventHandler handler) {
        handlers.add(handler);
    }
    
    @Override
    public void removeEventHandler(ReleaseEventHandler handler) {
        handlers.remove(handler);
    }
    
    // ==================== Desired state ====================
    
    /**
     * Create a release or replace its spec. The generation only moves when the spec changes.
     *
     * @return the stored copy
     */
    public synchronized Release apply(String namespace, String name, ReleaseSpec spec) {
        ReleaseKey key = new ReleaseKey(namespace, name);
        Release current = releases.get(key);
        
        if (current == null) {
            Release created = Release.of(namespace, name, spec);
            created.setGeneration(1);
            created.setResourceVersion(1);
            releases.put(key, created);
            log.info("Release {} created", key);
            notify(h -> h.onAdd(created.copy()));
            return created.copy();
        }
        
        if (Objects.equals(current.getSpec(), spec)) {
            return current.copy();
        }
        
        Release updated = current.copy();
        updated.setSpec(spec);
        updated.setGeneration(current.getGeneration() + 1);
        updated.setResourceVersion(current.getResourceVersion() + 1);
        releases.put(key, updated);
        log.info("Release {} spec changed, generation {}", key, updated.getGeneration());
        notify(h -> h.onUpdate(current.copy(), updated.copy()));
        return updated.copy();
    }
    
    /**
     * @return true if the release existed
     */
    public synchronized boolean remove(String namespace, String name) {
        ReleaseKey key = new ReleaseKey(namespace, name);
        Release removed = releases.remove(key);
        if (removed == null) {
            return false;
        }
        log.info("Release {} removed", key);
        notify(h -> h.onDelete(removed.copy()));
        return true;
    }
    
    /**
     * Swap the whole content for a fresh listing, as a relist after a lost watch does.
     * Releases missing from the listing are announced with a tombstone, since their
     * final state is unknown.
     */
    public synchronized void replace(Collection<Release> listing) {
        Map<ReleaseKey, Release> next = new TreeMap<>();
        for (Release release : listing) {
            next.put(ReleaseKey.of(release), release.copy());
        }
        
        for (ReleaseKey key : new TreeSet<>(releases.keySet())) {
            if (!next.containsKey(key)) {
                Release gone = releases.remove(key);
                notify(h -> h.onDelete(new DeletedFinalStateUnknown(key.encode(), gone.copy())));
            }
        }
        
        for (Map.Entry<ReleaseKey, Release> entry : next.entrySet()) {
            Release incoming = entry.getValue();
            Release previous = releases.put(entry.getKey(), incoming);
            if (previous == null) {
                notify(h -> h.onAdd(incoming.copy()));
            } else {
                notify(h -> h.onUpdate(previous.copy(), incoming.copy()));
            }
        }
        log.info("Release store replaced with {} releases", next.size());
    }
    
    public Optional<Release> get(String namespace, String name) {
        Release release = releases.get(new ReleaseKey(namespace, name));
        return Optional.ofNullable(release).map(Release::copy);
    }
    
    public List<Release> list() {
        List<Release> result = new ArrayList<>();
        new TreeMap<>(releases).values().forEach(r -> result.add(r.copy()));
        return result;
    }
    
    // ==================== Backend ====================
    
    @Override
    public synchronized Release updateStatus(Release release) {
        Release current = checkWritable(release);
        
        Release updated = current.copy();
        updated.setStatus(copyOf(release.getStatus()));
        updated.setResourceVersion(current.getResourceVersion() + 1);
        releases.put(ReleaseKey.of(updated), updated);
        notify(h -> h.onUpdate(current.copy(), updated.copy()));
        return updated.copy();
    }
    
    @Override
    public synchronized Release update(Release release) {
        Release current = checkWritable(release);
        
        Release updated = current.copy();
        updated.setSpec(release.getSpec());
        updated.setStatus(copyOf(release.getStatus()));
        if (!Objects.equals(current.getSpec(), release.getSpec())) {
            updated.setGeneration(current.getGeneration() + 1);
        }
        updated.setResourceVersion(current.getResourceVersion() + 1);
        releases.put(ReleaseKey.of(updated), updated);
        notify(h -> h.onUpdate(current.copy(), updated.copy()));
        return updated.copy();
    }
    
    @Override
    public boolean exists(ReleaseKey key) {
        return releases.containsKey(key);
    }
    
    @Override
    public Set<ReleaseKey> listKeys() {
        return new TreeSet<>(releases.keySet());
    }
    
    @Override
    public List<ReleaseHistory> listHistories(String namespace, String name) {
        TreeMap<Integer, ReleaseHistory> versions = histories.get(new ReleaseKey(namespace, name));
        if (versions == null) {
            return List.of();
        }
        synchronized (versions) {
            return List.copyOf(versions.values());
        }
    }
    
    @Override
    public ReleaseHistory createHistory(ReleaseHistory history) {
        TreeMap<Integer, ReleaseHistory> versions = histories.computeIfAbsent(
            new ReleaseKey(history.namespace(), history.name()), k -> new TreeMap<>());
        synchronized (versions) {
            versions.put(history.version(), history);
        }
        log.debug("Stored history {}/{} version {}", history.namespace(), history.name(), history.version());
        return history;
    }
    
    @Override
    public int deleteHistories(String namespace, String name) {
        TreeMap<Integer, ReleaseHistory> removed = histories.remove(new ReleaseKey(namespace, name));
        return removed == null ? 0 : removed.size();
    }
    
    @Override
    public Set<ReleaseKey> listHistoryOwners() {
        return new HashSet<>(histories.keySet());
    }
    
    // ==================== Helpers ====================
    
    private Release checkWritable(Release release) {
        ReleaseKey key = ReleaseKey.of(release);
        Release current = releases.get(key);
        if (current == null) {
            throw BackendException.notFound(key.encode());
        }
        if (current.getResourceVersion() != release.getResourceVersion()) {
            throw BackendException.conflict(key.encode(), release.getResourceVersion(), current.getResourceVersion());
        }
        return current;
    }
    
    private static ReleaseStatus copyOf(ReleaseStatus status) {
        return status != null ? status.copy() : new ReleaseStatus();
    }
    
    private void notify(Consumer<ReleaseEventHandler> event) {
        for (ReleaseEventHandler handler : handlers) {
            try {
                event.accept(handler);
            } catch (RuntimeException e) {
                log.error("Release event handler failed: {}", e.getMessage(), e);
            }
        }
    }
}
