package com.ryuqq.taxonomy.core.exception;

/**
 * 중복 또는 겹치는 매퍼 등록이 거부됨.
 *
 * <p>중복 등록 정책이 REJECT일 때만 발생합니다.
 * 같은 인스턴스를 다시 등록하거나, 이미 해석된 타입을 처리할 수 있는 매퍼를 등록하면
 * 새 매퍼는 먼저 등록된 매퍼에 가려지므로 등록 자체를 거부합니다.</p>
 *
 * @author Taxonomy Team
 * @since 1.0.0
 */
public class DuplicateMapperException extends IllegalStateException {

    /**
     * 생성자.
     *
     * @param message 오류 메시지
     */
    public DuplicateMapperException(String message) {
        super(message);
    }
}
