/**
 * Mapping attempt outcome package.
 *
 * <p>This package defines the sealed result type returned by the non-throwing
 * {@code tryMap} family and by {@code TaxonMapper#tryConvertFrom}.</p>
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.taxonomy.core.outcome.MapAttempt} - Sealed interface (permits Mapped, Unmapped)</li>
 * </ul>
 *
 * <h2>Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.taxonomy.core.outcome.Mapped} - Conversion succeeded</li>
 *   <li>{@link com.ryuqq.taxonomy.core.outcome.Unmapped} - No mapper found, or the mapper failed</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Taxonomy Team
 */
package com.ryuqq.taxonomy.core.outcome;
