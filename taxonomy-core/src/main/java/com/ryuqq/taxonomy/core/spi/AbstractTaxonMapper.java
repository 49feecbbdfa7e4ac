package com.ryuqq.taxonomy.core.spi;

import com.ryuqq.taxonomy.core.exception.TaxonMappingException;
import com.ryuqq.taxonomy.core.model.TaxonEntity;
import com.ryuqq.taxonomy.core.model.TargetType;

/**
 * 하나의 Class에 고정된 매퍼 기반 클래스.
 *
 * <p>{@link #canHandle(TargetType)}는 대상 타입의 raw Class가 지정된 Class와 같은지로 판단하고,
 * {@link #convertTo(Object)}는 타입 검사 후 {@link #toEntity(Object)}에 위임합니다.</p>
 *
 * <p><strong>구현 예시:</strong></p>
 * <pre>
 * public class ChannelMapper extends AbstractTaxonMapper&lt;Channel&gt; {
 *     public ChannelMapper() {
 *         super(Channel.class);
 *     }
 *
 *     {@literal @}Override
 *     public Channel convertFrom(TaxonEntity entity) {
 *         return new Channel(entity.id(), entity.name());
 *     }
 *
 *     {@literal @}Override
 *     protected TaxonEntity toEntity(Channel channel) {
 *         return TaxonEntity.root(channel.id(), CHANNEL_TAXONOMY, channel.name());
 *     }
 * }
 * </pre>
 *
 * @param <T> 처리 대상 타입
 *
 * @author Taxonomy Team
 * @since 1.0.0
 */
public abstract class AbstractTaxonMapper<T> implements TaxonMapper {

    private final Class<T> handledType;

    /**
     * 생성자.
     *
     * @param handledType 처리 대상 Class
     * @throws IllegalArgumentException handledType이 null인 경우
     */
    protected AbstractTaxonMapper(Class<T> handledType) {
        if (handledType == null) {
            throw new IllegalArgumentException("handledType cannot be null");
        }
        this.handledType = handledType;
    }

    /**
     * 처리 대상 Class 조회.
     *
     * @return 처리 대상 Class
     */
    public Class<T> getHandledType() {
        return handledType;
    }

    @Override
    public boolean canHandle(TargetType targetType) {
        return targetType != null && targetType.is(handledType);
    }

    @Override
    public abstract T convertFrom(TaxonEntity entity);

    @Override
    public TaxonEntity convertTo(Object instance) {
        if (!handledType.isInstance(instance)) {
            throw new TaxonMappingException(getClass().getSimpleName() + " cannot convert "
                + (instance == null ? "null" : instance.getClass().getName())
                + " (expected " + handledType.getName() + ")");
        }
        return toEntity(handledType.cast(instance));
    }

    /**
     * 타입이 확인된 인스턴스를 정규 표현으로 변환.
     *
     * @param instance 처리 대상 인스턴스 (null 아님)
     * @return 정규 표현
     */
    protected abstract TaxonEntity toEntity(T instance);

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + handledType.getName() + '}';
    }
}
