package com.ryuqq.taxonomy.core.outcome;

/**
 * 매핑 실패 결과.
 *
 * <p>매퍼를 찾지 못했거나 변환 중 예외가 발생한 경우를 모두 나타냅니다.
 * 원인 예외는 호출자에게 던져지지 않고 여기에 보관됩니다.</p>
 *
 * @param reason 실패 사유
 * @param cause 원인 (선택, null 가능)
 * @param <T> 값 타입
 *
 * @author Taxonomy Team
 * @since 1.0.0
 */
public record Unmapped<T>(
    String reason,
    Throwable cause
) implements MapAttempt<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException reason이 null이거나 빈 문자열인 경우
     */
    public Unmapped {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
        // cause는 null 허용
    }

    /**
     * 원인 예외 없이 Unmapped 생성.
     *
     * @param reason 실패 사유
     * @param <T> 값 타입
     * @return Unmapped 인스턴스
     */
    public static <T> Unmapped<T> of(String reason) {
        return new Unmapped<>(reason, null);
    }
}
