package com.ryuqq.taxonomy.application.mapper;

import com.ryuqq.taxonomy.core.model.TaxonEntity;
import com.ryuqq.taxonomy.core.model.TargetType;
import com.ryuqq.taxonomy.core.outcome.MapAttempt;
import com.ryuqq.taxonomy.core.spi.TaxonMapper;

/**
 * 타입 기반 매퍼 디스패처.
 *
 * <p>대상 타입에 맞는 {@link TaxonMapper}를 찾아 {@link TaxonEntity}와 외부 타입 간 변환을 위임합니다.</p>
 *
 * <p><strong>두 가지 호출 방식:</strong></p>
 * <ul>
 *   <li>계약(map): 매퍼가 없거나 변환이 실패하면 예외 전파</li>
 *   <li>탐색(tryMap): 모든 실패를 {@link com.ryuqq.taxonomy.core.outcome.Unmapped}로 반환</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * TaxonomyTypeMapper typeMapper = new DefaultTaxonomyTypeMapper(List.of(new ChannelMapper()));
 *
 * Channel channel = typeMapper.map(entity, Channel.class);
 * TaxonEntity back = typeMapper.mapToEntity(channel);
 *
 * MapAttempt&lt;Campaign&gt; attempt = typeMapper.tryMap(entity, Campaign.class);
 * if (!attempt.isMapped()) {
 *     // Campaign 매퍼 없음 → 건너뜀
 * }
 * </pre>
 *
 * @author Taxonomy Team
 * @since 1.0.0
 */
public interface TaxonomyTypeMapper {

    /**
     * 정규 표현을 대상 타입으로 변환.
     *
     * @param data 정규 표현
     * @param type 대상 타입
     * @return 매퍼가 반환한 인스턴스 (가공 없음)
     * @throws IllegalArgumentException data 또는 type이 null인 경우
     * @throws com.ryuqq.taxonomy.core.exception.MapperNotFoundException 대상 타입의 매퍼가 없는 경우
     */
    Object map(TaxonEntity data, TargetType type);

    /**
     * 정규 표현을 대상 Class로 변환 (typed facade).
     *
     * @param data 정규 표현
     * @param type 대상 Class
     * @param <T> 대상 타입
     * @return 변환된 인스턴스
     * @throws IllegalArgumentException data 또는 type이 null인 경우
     * @throws com.ryuqq.taxonomy.core.exception.MapperNotFoundException 대상 타입의 매퍼가 없는 경우
     * @throws ClassCastException 매퍼가 다른 타입의 값을 반환한 경우
     */
    <T> T map(TaxonEntity data, Class<T> type);

    /**
     * 예외 없이 변환 시도.
     *
     * <p>type 검증 이후의 모든 실패(매퍼 없음, 변환 실패)는 Unmapped로 반환됩니다.</p>
     *
     * @param data 정규 표현
     * @param type 대상 타입
     * @return 변환 결과
     * @throws IllegalArgumentException type이 null인 경우
     */
    MapAttempt<Object> tryMap(TaxonEntity data, TargetType type);

    /**
     * 예외 없이 대상 Class로 변환 시도 (typed facade).
     *
     * @param data 정규 표현
     * @param type 대상 Class
     * @param <T> 대상 타입
     * @return 변환 결과 (값의 타입이 맞지 않아도 Unmapped)
     * @throws IllegalArgumentException type이 null인 경우
     */
    <T> MapAttempt<T> tryMap(TaxonEntity data, Class<T> type);

    /**
     * 인스턴스를 정규 표현으로 역변환.
     *
     * <p>인스턴스의 런타임 타입으로 매퍼를 찾습니다.</p>
     *
     * @param instance 변환할 인스턴스
     * @return 정규 표현
     * @throws IllegalArgumentException instance가 null인 경우
     * @throws com.ryuqq.taxonomy.core.exception.MapperNotFoundException 런타임 타입의 매퍼가 없는 경우
     */
    TaxonEntity mapToEntity(Object instance);

    /**
     * 매퍼 등록.
     *
     * @param mapper 등록할 매퍼
     * @throws IllegalArgumentException mapper가 null인 경우
     * @throws com.ryuqq.taxonomy.core.exception.DuplicateMapperException 중복 정책이 REJECT이고 겹치는 경우
     */
    void register(TaxonMapper mapper);

    /**
     * 대상 타입의 매퍼가 있는지 확인 (예외 없음).
     *
     * @param type 대상 타입
     * @return 매퍼가 있으면 true
     * @throws IllegalArgumentException type이 null인 경우
     */
    boolean canMap(TargetType type);

    /**
     * 대상 Class의 매퍼가 있는지 확인 (예외 없음).
     *
     * @param type 대상 Class
     * @return 매퍼가 있으면 true
     * @throws IllegalArgumentException type이 null인 경우
     */
    default boolean canMap(Class<?> type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        return canMap(TargetType.of(type));
    }
}
