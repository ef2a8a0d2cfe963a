package com.delta.prospector.company.model;

import java.time.Duration;
import java.time.Instant;

public record CacheEntry(
    String fingerprint,
    QueryKind kind,
    String payloadJson,
    Instant fetchedAt,
    Instant expiresAt
) {
    public boolean isLive(Instant now) {
        return expiresAt != null && now.isBefore(expiresAt);
    }

    public boolean isFreshFor(Instant now, Duration ttl) {
        return fetchedAt != null && now.isBefore(fetchedAt.plus(ttl));
    }
}
