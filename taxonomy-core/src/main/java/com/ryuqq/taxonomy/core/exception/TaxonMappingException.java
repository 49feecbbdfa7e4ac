package com.ryuqq.taxonomy.core.exception;

/**
 * 매퍼가 변환 중 실패함.
 *
 * <p>{@code convertFrom}/{@code convertTo} 구현체가 던지는 변환 실패입니다.
 * Resolver는 {@code map}/{@code mapToEntity}에서 이 예외를 그대로 전파하고,
 * {@code tryMap}에서만 실패 결과로 변환합니다.</p>
 *
 * @author Taxonomy Team
 * @since 1.0.0
 */
public class TaxonMappingException extends RuntimeException {

    /**
     * 생성자.
     *
     * @param message 오류 메시지
     */
    public TaxonMappingException(String message) {
        super(message);
    }

    /**
     * 생성자 (원인 포함).
     *
     * @param message 오류 메시지
     * @param cause 원인
     */
    public TaxonMappingException(String message, Throwable cause) {
        super(message, cause);
    }
}
