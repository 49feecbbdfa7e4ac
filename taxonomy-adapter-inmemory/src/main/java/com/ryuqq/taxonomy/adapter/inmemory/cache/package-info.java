/**
 * In-memory {@link com.ryuqq.taxonomy.core.spi.ResolutionCache} implementation.
 *
 * @since 1.0.0
 * @author Taxonomy Team
 */
package com.ryuqq.taxonomy.adapter.inmemory.cache;
