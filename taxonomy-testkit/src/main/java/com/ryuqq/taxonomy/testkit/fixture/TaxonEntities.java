package com.ryuqq.taxonomy.testkit.fixture;

import com.ryuqq.taxonomy.core.model.TaxonEntity;

import java.util.Map;
import java.util.UUID;

/**
 * 테스트용 {@link TaxonEntity} 생성 헬퍼.
 *
 * @author Taxonomy Team
 * @since 1.0.0
 */
public final class TaxonEntities {

    /**
     * 채널 분류 체계 식별자.
     */
    public static final UUID CHANNEL_TAXONOMY = UUID.fromString("a1b2c3d4-0000-0000-0000-000000000001");

    /**
     * 캠페인 분류 체계 식별자.
     */
    public static final UUID CAMPAIGN_TAXONOMY = UUID.fromString("a1b2c3d4-0000-0000-0000-000000000002");

    private TaxonEntities() {
    }

    /**
     * 채널 항목 생성.
     *
     * @param name 채널 이름
     * @return code가 지정된 루트 TaxonEntity
     */
    public static TaxonEntity channel(String name) {
        return TaxonEntity.root(UUID.randomUUID(), CHANNEL_TAXONOMY, name)
            .withCode(name.toUpperCase().replace(' ', '_'));
    }

    /**
     * 캠페인 항목 생성.
     *
     * @param parentId 상위 항목 식별자 (null 가능)
     * @param name 캠페인 이름
     * @return TaxonEntity
     */
    public static TaxonEntity campaign(UUID parentId, String name) {
        return new TaxonEntity(UUID.randomUUID(), CAMPAIGN_TAXONOMY, parentId, name, null, null,
            Map.of("en", name));
    }
}
