/**
 * Contract tests for the registry and cache SPIs.
 *
 * <p>Abstract JUnit 5 test classes; each adapter module extends them with a factory
 * method returning its own implementation.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.taxonomy.testkit.contract.AbstractMapperRegistryContractTest}</li>
 *   <li>{@link com.ryuqq.taxonomy.testkit.contract.AbstractResolutionCacheContractTest}</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Taxonomy Team
 */
package com.ryuqq.taxonomy.testkit.contract;
