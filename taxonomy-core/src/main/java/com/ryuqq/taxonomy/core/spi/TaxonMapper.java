package com.ryuqq.taxonomy.core.spi;

import com.ryuqq.taxonomy.core.model.TaxonEntity;
import com.ryuqq.taxonomy.core.model.TargetType;
import com.ryuqq.taxonomy.core.outcome.MapAttempt;

/**
 * Mapper SPI between {@link TaxonEntity} and one external type.
 *
 * <p>Each implementation declares, through {@link #canHandle(TargetType)}, which
 * target type(s) it converts. The resolver picks the first registered mapper whose
 * predicate matches and caches that choice by {@link TargetType#identity()}.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>{@code canHandle} must be pure: no side effects, same answer on every call</li>
 *   <li>All methods must be safely callable from multiple threads</li>
 *   <li>No mutable state shared between mapper variants</li>
 * </ul>
 *
 * @author Taxonomy Team
 * @since 1.0.0
 */
public interface TaxonMapper {

    /**
     * Returns whether this mapper converts the given target type.
     *
     * @param targetType the target type
     * @return true if this mapper handles targetType
     */
    boolean canHandle(TargetType targetType);

    /**
     * Converts the canonical entity into an instance of the handled type.
     *
     * @param entity the canonical entity
     * @return the converted instance
     * @throws com.ryuqq.taxonomy.core.exception.TaxonMappingException if conversion fails
     */
    Object convertFrom(TaxonEntity entity);

    /**
     * Non-throwing variant of {@link #convertFrom(TaxonEntity)}.
     *
     * <p>The default implementation delegates to {@code convertFrom} and turns any
     * exception into {@link com.ryuqq.taxonomy.core.outcome.Unmapped}.</p>
     *
     * @param entity the canonical entity
     * @return Mapped with the instance, or Unmapped with the failure
     */
    default MapAttempt<Object> tryConvertFrom(TaxonEntity entity) {
        try {
            return MapAttempt.mapped(convertFrom(entity));
        } catch (Exception e) {
            return MapAttempt.unmapped("Conversion failed in " + getClass().getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Converts an instance of the handled type back into the canonical entity.
     *
     * @param instance the instance to convert
     * @return the canonical entity
     * @throws com.ryuqq.taxonomy.core.exception.TaxonMappingException if conversion fails
     */
    TaxonEntity convertTo(Object instance);
}
