package com.ryuqq.taxonomy.adapter.resolver;

/**
 * Type Mapper 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>duplicatePolicy: 겹치는 매퍼 등록 처리 (기본 ALLOW)</li>
 *   <li>initialCacheCapacity: 해석 캐시 초기 용량 (기본 64)</li>
 * </ul>
 *
 * @author Taxonomy Team
 * @since 1.0.0
 * @param duplicatePolicy 중복 등록 정책 (null이 아니어야 함)
 * @param initialCacheCapacity 캐시 초기 용량 (1 이상이어야 함)
 */
public record TypeMapperConfig(
    DuplicatePolicy duplicatePolicy,
    int initialCacheCapacity
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: duplicatePolicy=ALLOW, initialCacheCapacity=64</p>
     */
    public TypeMapperConfig() {
        this(DuplicatePolicy.ALLOW, 64);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public TypeMapperConfig {
        if (duplicatePolicy == null) {
            throw new IllegalArgumentException("duplicatePolicy cannot be null");
        }
        if (initialCacheCapacity <= 0) {
            throw new IllegalArgumentException(
                "initialCacheCapacity must be positive (current: " + initialCacheCapacity + ")"
            );
        }
    }

    /**
     * duplicatePolicy만 변경한 새 인스턴스 생성.
     */
    public TypeMapperConfig withDuplicatePolicy(DuplicatePolicy duplicatePolicy) {
        return new TypeMapperConfig(duplicatePolicy, initialCacheCapacity);
    }

    /**
     * initialCacheCapacity만 변경한 새 인스턴스 생성.
     */
    public TypeMapperConfig withInitialCacheCapacity(int initialCacheCapacity) {
        return new TypeMapperConfig(duplicatePolicy, initialCacheCapacity);
    }
}
