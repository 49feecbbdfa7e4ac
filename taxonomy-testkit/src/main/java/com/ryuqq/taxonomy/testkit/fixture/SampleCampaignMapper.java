package com.ryuqq.taxonomy.testkit.fixture;

import com.ryuqq.taxonomy.core.exception.TaxonMappingException;
import com.ryuqq.taxonomy.core.model.TaxonEntity;
import com.ryuqq.taxonomy.core.spi.AbstractTaxonMapper;

import java.util.Map;

/**
 * {@link SampleCampaign} 매퍼.
 *
 * @author Taxonomy Team
 * @since 1.0.0
 */
public class SampleCampaignMapper extends AbstractTaxonMapper<SampleCampaign> {

    public SampleCampaignMapper() {
        super(SampleCampaign.class);
    }

    @Override
    public SampleCampaign convertFrom(TaxonEntity entity) {
        if (entity == null) {
            throw new TaxonMappingException("entity cannot be null");
        }
        return new SampleCampaign(entity.id(), entity.parentId(), entity.name());
    }

    @Override
    protected TaxonEntity toEntity(SampleCampaign campaign) {
        return new TaxonEntity(campaign.id(), TaxonEntities.CAMPAIGN_TAXONOMY, campaign.parentId(),
            campaign.name(), null, null, Map.of("en", campaign.name()));
    }
}
