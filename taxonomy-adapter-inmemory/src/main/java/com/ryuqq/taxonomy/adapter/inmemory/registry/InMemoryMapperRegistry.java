package com.ryuqq.taxonomy.adapter.inmemory.registry;

import com.ryuqq.taxonomy.core.spi.MapperRegistry;
import com.ryuqq.taxonomy.core.spi.TaxonMapper;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link MapperRegistry}.
 *
 * <p>This implementation keeps mappers in a {@link CopyOnWriteArrayList}, so every
 * scan iterates an immutable snapshot that an in-progress append can neither tear
 * nor block.</p>
 *
 * <p><strong>Thread Safety:</strong></p>
 * <ul>
 *   <li>{@link #register} and {@link #registerAll} are atomic appends</li>
 *   <li>{@link #snapshot()} never observes a partially applied {@code registerAll}</li>
 *   <li>Order among concurrently registered mappers is unspecified</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * MapperRegistry registry = new InMemoryMapperRegistry(List.of(new ChannelMapper()));
 * registry.register(new CampaignMapper());
 *
 * for (TaxonMapper mapper : registry.snapshot()) {
 *     // registration order: ChannelMapper, CampaignMapper
 * }
 * </pre>
 *
 * @author Taxonomy Team
 * @since 1.0.0
 */
public class InMemoryMapperRegistry implements MapperRegistry {

    /**
     * Registered mappers in registration order.
     */
    private final CopyOnWriteArrayList<TaxonMapper> mappers;

    /**
     * Creates an empty registry.
     */
    public InMemoryMapperRegistry() {
        this.mappers = new CopyOnWriteArrayList<>();
    }

    /**
     * Creates a registry pre-populated with the given mappers, in list order.
     *
     * @param mappers initial mappers
     * @throws IllegalArgumentException if mappers is null or contains null
     */
    public InMemoryMapperRegistry(List<? extends TaxonMapper> mappers) {
        this();
        registerAll(mappers);
    }

    @Override
    public void register(TaxonMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        mappers.add(mapper);
    }

    @Override
    public void registerAll(List<? extends TaxonMapper> mappers) {
        if (mappers == null) {
            throw new IllegalArgumentException("mappers cannot be null");
        }
        for (TaxonMapper mapper : mappers) {
            if (mapper == null) {
                throw new IllegalArgumentException("mappers cannot contain null");
            }
        }
        this.mappers.addAll(mappers);
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong> {@code List.copyOf} over a
     * copy-on-write list copies the array captured at call time.</p>
     */
    @Override
    public List<TaxonMapper> snapshot() {
        return List.copyOf(mappers);
    }

    @Override
    public int size() {
        return mappers.size();
    }
}
