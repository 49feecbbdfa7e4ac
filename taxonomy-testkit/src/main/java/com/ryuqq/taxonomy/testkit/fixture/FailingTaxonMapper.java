package com.ryuqq.taxonomy.testkit.fixture;

import com.ryuqq.taxonomy.core.exception.TaxonMappingException;
import com.ryuqq.taxonomy.core.model.TaxonEntity;
import com.ryuqq.taxonomy.core.model.TargetType;
import com.ryuqq.taxonomy.core.spi.TaxonMapper;

/**
 * 대상 타입은 처리한다고 선언하지만 변환은 항상 실패하는 매퍼.
 *
 * @author Taxonomy Team
 * @since 1.0.0
 */
public class FailingTaxonMapper implements TaxonMapper {

    private final Class<?> handledType;

    /**
     * 생성자.
     *
     * @param handledType 처리한다고 선언할 Class
     * @throws IllegalArgumentException handledType이 null인 경우
     */
    public FailingTaxonMapper(Class<?> handledType) {
        if (handledType == null) {
            throw new IllegalArgumentException("handledType cannot be null");
        }
        this.handledType = handledType;
    }

    @Override
    public boolean canHandle(TargetType targetType) {
        return targetType != null && targetType.is(handledType);
    }

    @Override
    public Object convertFrom(TaxonEntity entity) {
        throw new TaxonMappingException("convertFrom always fails for " + handledType.getSimpleName());
    }

    @Override
    public TaxonEntity convertTo(Object instance) {
        throw new TaxonMappingException("convertTo always fails for " + handledType.getSimpleName());
    }

    @Override
    public String toString() {
        return "Failing(" + handledType.getSimpleName() + ")";
    }
}
