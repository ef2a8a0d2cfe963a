package com.delta.prospector.company.api;

import com.delta.prospector.company.cache.QueryCacheStore;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/cache")
public class CacheController {
    private final QueryCacheStore cacheStore;

    public CacheController(QueryCacheStore cacheStore) {
        this.cacheStore = cacheStore;
    }

    @PostMapping("/clear")
    public Map<String, Integer> clear() {
        return Map.of("removed", cacheStore.clear());
    }

    @DeleteMapping("/{fingerprint}")
    public Map<String, Integer> invalidate(@PathVariable("fingerprint") String fingerprint) {
        return Map.of("removed", cacheStore.invalidate(fingerprint) ? 1 : 0);
    }
}
