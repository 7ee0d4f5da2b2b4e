package com.platform.releasecontroller.store;

import com.platform.releasecontroller.manager.ResourceClient;
import com.platform.releasecontroller.model.LiveResource;
import com.platform.releasecontroller.model.RenderedResource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Resource client keeping live resources in memory, keyed by {@code namespace/kind/name}.
 */
@Slf4j
@Component
public class InMemoryResourceClient implements ResourceClient {
    
    private final Map<String, LiveResource> resources = new ConcurrentSkipListMap<>();
    
    @Override
    public boolean apply(String namespace, String owner, RenderedResource resource) {
        LiveResource desired = new LiveResource(namespace, resource.kind(), resource.name(), owner, resource.body());
        LiveResource previous = resources.put(desired.ref(), desired);
        
        if (Objects.equals(previous, desired)) {
            return false;
        }
        if (previous != null && !Objects.equals(previous.owner(), owner)) {
            log.warn("Resource {} moved from owner {} to {}", desired.ref(), previous.owner(), owner);
        }
        log.debug("Applied resource {} for {}", desired.ref(), owner);
        return true;
    }
    
    @Override
    public boolean delete(String namespace, String kind, String name) {
        LiveResource removed = resources.remove(namespace + "/" + kind + "/" + name);
        if (removed != null) {
            log.debug("Deleted resource {}", removed.ref());
        }
        return removed != null;
    }
    
    @Override
    public List<LiveResource> listByOwner(String owner) {
        return resources.values().stream()
            .filter(r -> owner.equals(r.owner()))
            .toList();
    }
    
    @Override
    public List<LiveResource> listAll() {
        return List.copyOf(resources.values());
    }
}
