package com.ryuqq.taxonomy.core.outcome;

import java.util.Optional;

/**
 * 예외 없는 매핑 시도의 결과.
 *
 * <p>MapAttempt는 두 가지 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Mapped}: 매핑 성공, 변환된 값 포함</li>
 *   <li>{@link Unmapped}: 매핑 실패, 사유와 원인 포함</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 두 케이스 외의 구현은 허용되지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * MapAttempt&lt;Channel&gt; attempt = typeMapper.tryMap(entity, Channel.class);
 * if (attempt.isMapped()) {
 *     Channel channel = attempt.valueOrNull();
 * }
 * </pre>
 *
 * @param <T> 매핑 대상 타입
 *
 * @author Taxonomy Team
 * @since 1.0.0
 */
public sealed interface MapAttempt<T> permits Mapped, Unmapped {

    /**
     * 성공 결과 생성.
     *
     * @param value 변환된 값 (null 허용)
     * @param <T> 값 타입
     * @return Mapped 인스턴스
     */
    static <T> MapAttempt<T> mapped(T value) {
        return new Mapped<>(value);
    }

    /**
     * 실패 결과 생성.
     *
     * @param reason 실패 사유
     * @param cause 원인 (null 가능)
     * @param <T> 값 타입
     * @return Unmapped 인스턴스
     */
    static <T> MapAttempt<T> unmapped(String reason, Throwable cause) {
        return new Unmapped<>(reason, cause);
    }

    /**
     * 매핑 성공 여부.
     *
     * @return 성공이면 true
     */
    default boolean isMapped() {
        return this instanceof Mapped;
    }

    /**
     * 변환된 값 조회.
     *
     * @return 성공이면 값, 실패면 null
     */
    default T valueOrNull() {
        if (this instanceof Mapped<T> mapped) {
            return mapped.value();
        }
        return null;
    }

    /**
     * 변환된 값을 Optional로 조회.
     *
     * @return 성공이고 값이 있으면 Optional.of(value), 그 외 Optional.empty()
     */
    default Optional<T> toOptional() {
        return Optional.ofNullable(valueOrNull());
    }
}
