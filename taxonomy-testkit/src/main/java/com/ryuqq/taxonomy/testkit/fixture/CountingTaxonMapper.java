package com.ryuqq.taxonomy.testkit.fixture;

import com.ryuqq.taxonomy.core.model.TaxonEntity;
import com.ryuqq.taxonomy.core.model.TargetType;
import com.ryuqq.taxonomy.core.spi.TaxonMapper;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * 호출 횟수를 기록하는 매퍼 래퍼.
 *
 * <p>캐시 동작 검증용: warm 상태에서 {@code canHandle}이 호출되지 않음을 확인합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * CountingTaxonMapper counting = new CountingTaxonMapper(new SampleChannelMapper());
 * typeMapper.register(counting);
 *
 * typeMapper.map(entity, SampleChannel.class);
 * typeMapper.map(entity, SampleChannel.class);
 *
 * assertThat(counting.canHandleCalls()).isEqualTo(1);
 * </pre>
 *
 * @author Taxonomy Team
 * @since 1.0.0
 */
public class CountingTaxonMapper implements TaxonMapper {

    private final TaxonMapper delegate;
    private final AtomicInteger canHandleCalls = new AtomicInteger();
    private final AtomicInteger convertFromCalls = new AtomicInteger();
    private final AtomicInteger convertToCalls = new AtomicInteger();

    /**
     * 생성자.
     *
     * @param delegate 실제 변환을 수행할 매퍼
     * @throws IllegalArgumentException delegate가 null인 경우
     */
    public CountingTaxonMapper(TaxonMapper delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        this.delegate = delegate;
    }

    @Override
    public boolean canHandle(TargetType targetType) {
        canHandleCalls.incrementAndGet();
        return delegate.canHandle(targetType);
    }

    @Override
    public Object convertFrom(TaxonEntity entity) {
        convertFromCalls.incrementAndGet();
        return delegate.convertFrom(entity);
    }

    @Override
    public TaxonEntity convertTo(Object instance) {
        convertToCalls.incrementAndGet();
        return delegate.convertTo(instance);
    }

    public int canHandleCalls() {
        return canHandleCalls.get();
    }

    public int convertFromCalls() {
        return convertFromCalls.get();
    }

    public int convertToCalls() {
        return convertToCalls.get();
    }

    public TaxonMapper getDelegate() {
        return delegate;
    }

    @Override
    public String toString() {
        return "Counting(" + delegate + ")";
    }
}
