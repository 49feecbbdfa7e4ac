package com.ryuqq.taxonomy.testkit.fixture;

import java.util.UUID;

/**
 * 테스트용 대상 타입: 캠페인 분류 (상위 항목 보유).
 *
 * @param id 캠페인 식별자
 * @param parentId 상위 캠페인 그룹 식별자 (null 가능)
 * @param name 캠페인 이름
 *
 * @author Taxonomy Team
 * @since 1.0.0
 */
public record SampleCampaign(UUID id, UUID parentId, String name) {
}
