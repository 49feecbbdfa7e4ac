/**
 * In-memory {@link com.ryuqq.taxonomy.core.spi.MapperRegistry} implementation.
 *
 * <p>Copy-on-write backed; suitable for registries that are built at start-up and
 * appended to rarely.</p>
 *
 * @since 1.0.0
 * @author Taxonomy Team
 */
package com.ryuqq.taxonomy.adapter.inmemory.registry;
