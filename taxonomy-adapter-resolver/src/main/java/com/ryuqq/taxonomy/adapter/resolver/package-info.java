/**
 * Taxonomy Adapter Resolver - 매퍼 해석 및 디스패치 구현.
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.taxonomy.adapter.resolver.DefaultTaxonomyTypeMapper} - 선형 스캔 + 해석 캐시 기반 디스패처</li>
 *   <li>{@link com.ryuqq.taxonomy.adapter.resolver.TypeMapperConfig} - 설정 (불변 record)</li>
 *   <li>{@link com.ryuqq.taxonomy.adapter.resolver.DuplicatePolicy} - 겹치는 매퍼 등록 정책</li>
 * </ul>
 *
 * @author Taxonomy Team
 * @since 1.0.0
 */
package com.ryuqq.taxonomy.adapter.resolver;
