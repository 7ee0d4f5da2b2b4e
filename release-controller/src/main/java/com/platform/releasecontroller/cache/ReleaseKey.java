package com.platform.releasecontroller.cache;

import com.platform.releasecontroller.error.KeyDecodeException;
import com.platform.releasecontroller.model.Release;

import java.util.Comparator;
import java.util.regex.Pattern;

/**
 * Decoded form of a reconcile key. The queue carries the encoded
 * {@code namespace/name} string; two notifications for the same release always
 * encode to the same string.
 */
public record ReleaseKey(String namespace, String name) implements Comparable<ReleaseKey> {
    
    private static final Pattern SEGMENT = Pattern.compile("[a-z0-9]([-a-z0-9.]*[a-z0-9])?");
    private static final int MAX_SEGMENT_LENGTH = 253;
    private static final Comparator<ReleaseKey> ORDER = 
        Comparator.comparing(ReleaseKey::namespace).thenComparing(ReleaseKey::name);
    
    public ReleaseKey {
        String raw = namespace + "/" + name;
        validateSegment(raw, "namespace", namespace);
        validateSegment(raw, "name", name);
    }
    
    /**
     * Decode a queue key.
     * 
     * @throws KeyDecodeException if the key is not exactly {@code namespace/name}
     */
    public static ReleaseKey parse(String key) {
        if (key == null || key.isEmpty()) {
            throw new KeyDecodeException(String.valueOf(key), "empty key");
        }
        int slash = key.indexOf('/');
        if (slash < 0 || slash != key.lastIndexOf('/')) {
            throw new KeyDecodeException(key, "expected exactly one '/'");
        }
        return new ReleaseKey(key.substring(0, slash), key.substring(slash + 1));
    }
    
    public static ReleaseKey of(Release release) {
        return new ReleaseKey(release.getNamespace(), release.getName());
    }
    
    /**
     * Derive the queue key of a watch notification payload: a release or a tombstone.
     * 
     * @throws KeyDecodeException if no valid key can be derived
     */
    public static String keyFor(Object obj) {
        if (obj instanceof DeletedFinalStateUnknown tombstone) {
            return parse(tombstone.key()).encode();
        }
        if (obj instanceof Release release) {
            return of(release).encode();
        }
        throw new KeyDecodeException(String.valueOf(obj), 
            "unsupported object " + (obj == null ? "null" : obj.getClass().getSimpleName()));
    }
    
    public String encode() {
        return namespace + "/" + name;
    }
    
    @Override
    public int compareTo(ReleaseKey other) {
        return ORDER.compare(this, other);
    }
    
    @Override
    public String toString() {
        return encode();
    }
    
    private static void validateSegment(String raw, String field, String value) {
        if (value == null || value.isEmpty()) {
            throw new KeyDecodeException(raw, field + " is empty");
        }
        if (value.length() > MAX_SEGMENT_LENGTH) {
            throw new KeyDecodeException(raw, field + " is longer than " + MAX_SEGMENT_LENGTH);
        }
        if (!SEGMENT.matcher(value).matches()) {
            throw new KeyDecodeException(raw, field + " must be a lowercase RFC 1123 name");
        }
    }
}
