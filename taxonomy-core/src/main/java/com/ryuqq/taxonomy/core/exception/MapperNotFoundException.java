package com.ryuqq.taxonomy.core.exception;

import com.ryuqq.taxonomy.core.model.TargetType;

/**
 * 대상 타입을 처리할 매퍼가 등록되어 있지 않음.
 *
 * <p>레지스트리 전체를 스캔했지만 {@code canHandle}이 true인 매퍼가 없을 때 발생합니다.
 * 이 결과는 캐시되지 않으므로, 이후 매퍼를 등록하면 같은 타입의 다음 해석은 성공합니다.</p>
 *
 * @author Taxonomy Team
 * @since 1.0.0
 */
public class MapperNotFoundException extends RuntimeException {

    private final TargetType targetType;

    /**
     * 생성자.
     *
     * @param targetType 매퍼를 찾지 못한 대상 타입
     */
    public MapperNotFoundException(TargetType targetType) {
        super("No mapper registered for type: " + (targetType == null ? "null" : targetType.identity()));
        this.targetType = targetType;
    }

    /**
     * 매퍼를 찾지 못한 대상 타입.
     *
     * @return 대상 타입
     */
    public TargetType getTargetType() {
        return targetType;
    }
}
