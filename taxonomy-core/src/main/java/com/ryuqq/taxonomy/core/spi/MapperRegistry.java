package com.ryuqq.taxonomy.core.spi;

import java.util.List;

/**
 * 매퍼 레지스트리 SPI.
 *
 * <p>등록 순서를 보존하는 추가 전용(append-only) 매퍼 목록입니다.
 * 제거나 교체 연산은 없습니다.</p>
 *
 * <p><strong>구현 책임:</strong></p>
 * <ul>
 *   <li>등록 순서 보존 (first-match-wins 해석의 유일한 우선순위 기준)</li>
 *   <li>동시 등록과 동시 스캔 허용</li>
 *   <li>스캔 중인 호출자는 부분적으로 갱신된 목록을 보지 않아야 함</li>
 * </ul>
 *
 * <p><strong>동시성 제어 권장 방안:</strong></p>
 * <ul>
 *   <li>Copy-on-write 목록: 스캔은 불변 스냅샷을 순회</li>
 *   <li>단일 락: 등록과 스냅샷 생성을 같은 락으로 보호</li>
 * </ul>
 *
 * @author Taxonomy Team
 * @since 1.0.0
 */
public interface MapperRegistry {

    /**
     * 매퍼를 목록 끝에 추가.
     *
     * @param mapper 등록할 매퍼
     * @throws IllegalArgumentException mapper가 null인 경우
     */
    void register(TaxonMapper mapper);

    /**
     * 여러 매퍼를 순서대로 추가.
     *
     * <p>null 원소가 하나라도 있으면 아무것도 추가하지 않습니다.</p>
     *
     * @param mappers 등록할 매퍼 목록
     * @throws IllegalArgumentException mappers가 null이거나 null 원소를 포함한 경우
     */
    void registerAll(List<? extends TaxonMapper> mappers);

    /**
     * 현재 등록된 매퍼의 일관된 스냅샷.
     *
     * @return 등록 순서대로 정렬된 불변 목록
     */
    List<TaxonMapper> snapshot();

    /**
     * 등록된 매퍼 수.
     *
     * @return 매퍼 수
     */
    int size();

    /**
     * 등록된 매퍼가 없는지 확인.
     *
     * @return 비어있으면 true
     */
    default boolean isEmpty() {
        return size() == 0;
    }
}
