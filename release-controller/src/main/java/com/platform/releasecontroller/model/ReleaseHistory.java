package com.platform.releasecontroller.model;

import java.time.Instant;

/**
 * Immutable record of one applied release version, used for rollback.
 */
public record ReleaseHistory(
    String namespace,
    String name,
    int version,
    ReleaseSpec spec,
    String manifest,
    Instant createTime
) {}
