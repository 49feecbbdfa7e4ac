/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the contracts the resolver depends on: the mapper
 * capability contract implemented by collaborators, and the storage contracts for
 * the mapper registry and the resolution cache.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.taxonomy.core.spi.TaxonMapper} - Converter between TaxonEntity and one external type</li>
 *   <li>{@link com.ryuqq.taxonomy.core.spi.MapperRegistry} - Ordered, append-only mapper collection</li>
 *   <li>{@link com.ryuqq.taxonomy.core.spi.ResolutionCache} - Write-once type identity → mapper cache</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., taxonomy-adapter-inmemory) provide the registry and cache
 * implementations. Concrete mappers live in the embedding application.</p>
 *
 * @since 1.0.0
 * @author Taxonomy Team
 */
package com.ryuqq.taxonomy.core.spi;
