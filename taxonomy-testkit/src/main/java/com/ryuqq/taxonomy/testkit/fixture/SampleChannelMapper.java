package com.ryuqq.taxonomy.testkit.fixture;

import com.ryuqq.taxonomy.core.exception.TaxonMappingException;
import com.ryuqq.taxonomy.core.model.TaxonEntity;
import com.ryuqq.taxonomy.core.spi.AbstractTaxonMapper;

/**
 * {@link SampleChannel} 매퍼.
 *
 * <p>채널 분류 체계가 아닌 항목은 {@link TaxonMappingException}으로 거부합니다.</p>
 *
 * @author Taxonomy Team
 * @since 1.0.0
 */
public class SampleChannelMapper extends AbstractTaxonMapper<SampleChannel> {

    public SampleChannelMapper() {
        super(SampleChannel.class);
    }

    @Override
    public SampleChannel convertFrom(TaxonEntity entity) {
        if (entity == null) {
            throw new TaxonMappingException("entity cannot be null");
        }
        if (!TaxonEntities.CHANNEL_TAXONOMY.equals(entity.taxonomyId())) {
            throw new TaxonMappingException("Not a channel taxon: " + entity.id());
        }
        return new SampleChannel(entity.id(), entity.name(), entity.code());
    }

    @Override
    protected TaxonEntity toEntity(SampleChannel channel) {
        return TaxonEntity.root(channel.id(), TaxonEntities.CHANNEL_TAXONOMY, channel.name())
            .withCode(channel.code());
    }
}
