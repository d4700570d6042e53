package com.eainde.extraction.adapter;

import com.eainde.extraction.model.ExtractionResult;
import com.eainde.extraction.pass.ExtractionPass;
import com.eainde.extraction.segment.Segment;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Caches successful calls by (pass, instructions, segment text, prior context).
 * Failures are never cached, so a retried job always reaches the service.
 */
@Slf4j
public class CachingExtractionCallAdapter implements ExtractionCallAdapter {

    private final ExtractionCallAdapter delegate;
    private final Cache<String, ExtractionResult> cache;

    public CachingExtractionCallAdapter(ExtractionCallAdapter delegate, Duration ttl, long maximumSize) {
        this.delegate = delegate;
        this.cache = Caffeine.newBuilder()
                .recordStats()
                .expireAfterWrite(ttl)
                .maximumSize(maximumSize)
                .build();
    }

    @Override
    public ExtractionResult call(Segment segment, ExtractionPass pass, Map<String, String> priorContext) {
        String key = keyOf(segment, pass, priorContext);
        ExtractionResult cached = cache.getIfPresent(key);
        if (cached != null) {
            log.debug("Cache hit for {}/{}", segment.id(), pass.name());
            return new ExtractionResult(segment.id(), pass.name(), cached.fields(), cached.status(), 1,
                    Duration.ZERO, cached.truncated(), null, false);
        }

        ExtractionResult result = delegate.call(segment, pass, priorContext);
        if (result.isSuccess()) {
            cache.put(key, result);
        }
        return result;
    }

    public CacheStats stats() {
        return cache.stats();
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    private static String keyOf(Segment segment, ExtractionPass pass, Map<String, String> priorContext) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            update(digest, pass.name());
            update(digest, pass.instructions());
            update(digest, String.join(",", new TreeSet<>(pass.allowedFields())));
            update(digest, segment.text());
            new TreeMap<>(priorContext).forEach((name, value) -> {
                update(digest, name);
                update(digest, value);
            });
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static void update(MessageDigest digest, String value) {
        digest.update(value.getBytes(StandardCharsets.UTF_8));
        digest.update((byte) 0);
    }
}
