package com.ryuqq.taxonomy.core.spi;

import com.ryuqq.taxonomy.core.model.TargetType;

import java.util.Set;

/**
 * Resolution cache SPI: type identity → resolved mapper.
 *
 * <p>Entries are keyed by {@link TargetType#identity()} and are write-once: once a key
 * holds a mapper it is never evicted or overwritten. Only positive resolutions are
 * stored; the absence of a mapper is never cached.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: concurrent reads and concurrent first writes to the same key</li>
 *   <li>{@link #putIfAbsent} is atomic per key; the first stored value wins</li>
 *   <li>No eviction, no expiry, no removal</li>
 * </ul>
 *
 * @author Taxonomy Team
 * @since 1.0.0
 */
public interface ResolutionCache {

    /**
     * Returns the cached mapper for a type.
     *
     * @param type the target type
     * @return the cached mapper, or null if the type is unresolved
     * @throws IllegalArgumentException if type is null
     */
    TaxonMapper get(TargetType type);

    /**
     * Stores a mapper unless the type identity is already resolved.
     *
     * @param type the target type
     * @param mapper the resolved mapper
     * @return the mapper held by the cache after the call (existing or the given one)
     * @throws IllegalArgumentException if type or mapper is null
     */
    TaxonMapper putIfAbsent(TargetType type, TaxonMapper mapper);

    /**
     * Returns the number of resolved keys.
     *
     * @return resolved key count
     */
    int size();

    /**
     * Returns a snapshot of the resolved types.
     *
     * @return immutable set of resolved target types
     */
    Set<TargetType> resolvedTypes();
}
