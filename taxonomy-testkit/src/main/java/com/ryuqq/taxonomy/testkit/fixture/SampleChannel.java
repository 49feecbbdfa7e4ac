package com.ryuqq.taxonomy.testkit.fixture;

import java.util.UUID;

/**
 * 테스트용 대상 타입: 채널 분류.
 *
 * @param id 채널 식별자
 * @param name 채널 이름
 * @param code 채널 코드 (null 가능)
 *
 * @author Taxonomy Team
 * @since 1.0.0
 */
public record SampleChannel(UUID id, String name, String code) {
}
