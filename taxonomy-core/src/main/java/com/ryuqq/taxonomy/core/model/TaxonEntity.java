package com.ryuqq.taxonomy.core.model;

import java.util.Map;
import java.util.UUID;

/**
 * 분류 체계(taxonomy) 항목의 정규 표현.
 *
 * <p>모든 매퍼는 이 형태에서 읽고 이 형태로 씁니다.
 * Resolver는 필드를 해석하지 않으며, 매퍼 간에 전달만 합니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>id:</strong> 항목 식별자</li>
 *   <li><strong>taxonomyId:</strong> 소속 분류 체계 식별자</li>
 *   <li><strong>parentId:</strong> 상위 항목 식별자 (루트 항목은 null)</li>
 *   <li><strong>name:</strong> 항목 이름</li>
 *   <li><strong>code:</strong> 외부 코드 (null 가능)</li>
 *   <li><strong>uri:</strong> 원본 위치 (null 가능)</li>
 *   <li><strong>displayNames:</strong> 로케일 태그별 표시 이름 (null이면 빈 Map)</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> displayNames는 방어적으로 복사됩니다.</p>
 *
 * @param id 항목 식별자
 * @param taxonomyId 분류 체계 식별자
 * @param parentId 상위 항목 식별자 (null 가능)
 * @param name 항목 이름
 * @param code 외부 코드 (null 가능)
 * @param uri 원본 위치 (null 가능)
 * @param displayNames 로케일 태그별 표시 이름
 *
 * @author Taxonomy Team
 * @since 1.0.0
 */
public record TaxonEntity(
    UUID id,
    UUID taxonomyId,
    UUID parentId,
    String name,
    String code,
    String uri,
    Map<String, String> displayNames
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 name이 빈 문자열인 경우
     */
    public TaxonEntity {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (taxonomyId == null) {
            throw new IllegalArgumentException("taxonomyId cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        displayNames = displayNames == null ? Map.of() : Map.copyOf(displayNames);
    }

    /**
     * 루트 항목 생성 (parentId, code, uri 없음).
     *
     * @param id 항목 식별자
     * @param taxonomyId 분류 체계 식별자
     * @param name 항목 이름
     * @return TaxonEntity 인스턴스
     */
    public static TaxonEntity root(UUID id, UUID taxonomyId, String name) {
        return new TaxonEntity(id, taxonomyId, null, name, null, null, Map.of());
    }

    /**
     * 하위 항목 생성.
     *
     * @param id 항목 식별자
     * @param parent 상위 항목
     * @param name 항목 이름
     * @return parent와 같은 분류 체계에 속한 TaxonEntity
     * @throws IllegalArgumentException parent가 null인 경우
     */
    public static TaxonEntity childOf(TaxonEntity parent, UUID id, String name) {
        if (parent == null) {
            throw new IllegalArgumentException("parent cannot be null");
        }
        return new TaxonEntity(id, parent.taxonomyId(), parent.id(), name, null, null, Map.of());
    }

    /**
     * 루트 항목 여부.
     *
     * @return parentId가 없으면 true
     */
    public boolean isRoot() {
        return parentId == null;
    }

    /**
     * 로케일 태그의 표시 이름 조회, 없으면 name.
     *
     * @param localeTag 로케일 태그 (예: "ko-KR")
     * @return 표시 이름
     */
    public String displayName(String localeTag) {
        return displayNames.getOrDefault(localeTag, name);
    }

    /**
     * code만 변경한 새 인스턴스 생성.
     */
    public TaxonEntity withCode(String code) {
        return new TaxonEntity(id, taxonomyId, parentId, name, code, uri, displayNames);
    }

    /**
     * uri만 변경한 새 인스턴스 생성.
     */
    public TaxonEntity withUri(String uri) {
        return new TaxonEntity(id, taxonomyId, parentId, name, code, uri, displayNames);
    }

    /**
     * displayNames만 변경한 새 인스턴스 생성.
     */
    public TaxonEntity withDisplayNames(Map<String, String> displayNames) {
        return new TaxonEntity(id, taxonomyId, parentId, name, code, uri, displayNames);
    }
}
