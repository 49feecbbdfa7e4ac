/**
 * Taxonomy Application Layer - 타입 기반 매핑 API.
 *
 * <p>이 패키지는 임베딩 애플리케이션에 제공되는 호출 표면을 정의합니다.</p>
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.taxonomy.application.mapper.TaxonomyTypeMapper} - 매퍼 해석 및 디스패치</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 포트(인터페이스)와 어댑터 분리</li>
 *   <li><strong>의존성 역전:</strong> 구현체는 adapter-resolver 모듈에 위치</li>
 * </ul>
 *
 * @author Taxonomy Team
 * @since 1.0.0
 */
package com.ryuqq.taxonomy.application.mapper;
