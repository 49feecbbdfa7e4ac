package com.ryuqq.taxonomy.core.outcome;

/**
 * 매핑 성공 결과.
 *
 * @param value 매퍼가 반환한 값 (가공 없이 그대로, null 허용)
 * @param <T> 값 타입
 *
 * @author Taxonomy Team
 * @since 1.0.0
 */
public record Mapped<T>(T value) implements MapAttempt<T> {
}
