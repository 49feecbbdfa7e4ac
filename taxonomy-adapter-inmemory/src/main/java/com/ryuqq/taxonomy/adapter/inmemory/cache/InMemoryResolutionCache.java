package com.ryuqq.taxonomy.adapter.inmemory.cache;

import com.ryuqq.taxonomy.core.model.TargetType;
import com.ryuqq.taxonomy.core.spi.ResolutionCache;
import com.ryuqq.taxonomy.core.spi.TaxonMapper;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link ResolutionCache}.
 *
 * <p>Backed by a {@link ConcurrentHashMap} keyed by {@link TargetType#identity()};
 * {@link ConcurrentHashMap#putIfAbsent} makes the first write per key win, so callers
 * racing on the same unresolved type all end up holding the same mapper.</p>
 *
 * <p><strong>Write-once Guarantee:</strong></p>
 * <ul>
 *   <li>No method removes or replaces an entry</li>
 *   <li>The cache grows monotonically for the life of its owner</li>
 * </ul>
 *
 * @author Taxonomy Team
 * @since 1.0.0
 */
public class InMemoryResolutionCache implements ResolutionCache {

    private static final int DEFAULT_INITIAL_CAPACITY = 64;

    /**
     * Type identity → resolution.
     */
    private final ConcurrentHashMap<String, Resolution> entries;

    private record Resolution(TargetType type, TaxonMapper mapper) {
    }

    /**
     * Creates an empty cache with the default initial capacity.
     */
    public InMemoryResolutionCache() {
        this(DEFAULT_INITIAL_CAPACITY);
    }

    /**
     * Creates an empty cache.
     *
     * @param initialCapacity initial table capacity
     * @throws IllegalArgumentException if initialCapacity is not positive
     */
    public InMemoryResolutionCache(int initialCapacity) {
        if (initialCapacity <= 0) {
            throw new IllegalArgumentException("initialCapacity must be positive (current: " + initialCapacity + ")");
        }
        this.entries = new ConcurrentHashMap<>(initialCapacity);
    }

    @Override
    public TaxonMapper get(TargetType type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        Resolution resolution = entries.get(type.identity());
        return resolution == null ? null : resolution.mapper();
    }

    @Override
    public TaxonMapper putIfAbsent(TargetType type, TaxonMapper mapper) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        Resolution existing = entries.putIfAbsent(type.identity(), new Resolution(type, mapper));
        return existing != null ? existing.mapper() : mapper;
    }

    @Override
    public int size() {
        return entries.size();
    }

    @Override
    public Set<TargetType> resolvedTypes() {
        return entries.values().stream()
            .map(Resolution::type)
            .collect(Collectors.toUnmodifiableSet());
    }
}
