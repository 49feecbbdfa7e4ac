package com.ryuqq.taxonomy.adapter.resolver;

/**
 * 중복/겹치는 매퍼 등록 처리 정책.
 *
 * <p>해석은 항상 first-match-wins입니다. 이 정책은 그 결과로 가려지는(shadowed) 매퍼를
 * 등록 시점에 어떻게 다룰지만 결정합니다.</p>
 *
 * <p><strong>겹침 판단 기준:</strong></p>
 * <ul>
 *   <li>같은 매퍼 인스턴스를 다시 등록</li>
 *   <li>새 매퍼가 이미 해석된(캐시된) 타입을 처리할 수 있음</li>
 * </ul>
 *
 * @author Taxonomy Team
 * @since 1.0.0
 */
public enum DuplicatePolicy {

    /**
     * 검사 없이 등록.
     *
     * <p>겹치는 매퍼는 조용히 등록 순서에 따라 가려집니다.</p>
     */
    ALLOW,

    /**
     * 경고 로그를 남기고 등록.
     */
    WARN,

    /**
     * 등록 거부.
     *
     * <p>{@link com.ryuqq.taxonomy.core.exception.DuplicateMapperException}을 던지고
     * 레지스트리는 변경하지 않습니다.</p>
     */
    REJECT
}
