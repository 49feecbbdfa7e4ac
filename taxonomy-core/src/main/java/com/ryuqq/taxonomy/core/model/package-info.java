/**
 * Core value objects.
 *
 * <ul>
 *   <li>{@link com.ryuqq.taxonomy.core.model.TaxonEntity} - Canonical taxonomy record read and written by mappers</li>
 *   <li>{@link com.ryuqq.taxonomy.core.model.TargetType} - Type descriptor with a stable identity used as cache key</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Taxonomy Team
 */
package com.ryuqq.taxonomy.core.model;
