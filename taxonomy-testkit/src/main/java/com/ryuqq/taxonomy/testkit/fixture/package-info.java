/**
 * Test fixtures: sample target types, their mappers, and instrumented mappers.
 *
 * <ul>
 *   <li>{@link com.ryuqq.taxonomy.testkit.fixture.SampleChannelMapper} / {@link com.ryuqq.taxonomy.testkit.fixture.SampleCampaignMapper} - Working mappers</li>
 *   <li>{@link com.ryuqq.taxonomy.testkit.fixture.CountingTaxonMapper} - Call-counting wrapper</li>
 *   <li>{@link com.ryuqq.taxonomy.testkit.fixture.FailingTaxonMapper} - Always-failing mapper</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Taxonomy Team
 */
package com.ryuqq.taxonomy.testkit.fixture;
