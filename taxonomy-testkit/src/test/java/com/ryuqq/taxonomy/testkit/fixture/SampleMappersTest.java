package com.ryuqq.taxonomy.testkit.fixture;

import com.ryuqq.taxonomy.core.exception.TaxonMappingException;
import com.ryuqq.taxonomy.core.model.TaxonEntity;
import com.ryuqq.taxonomy.core.model.TargetType;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 테스트용 샘플 매퍼 자체 검증.
 *
 * @author Taxonomy Team
 * @since 1.0.0
 */
class SampleMappersTest {

    private final SampleChannelMapper channelMapper = new SampleChannelMapper();
    private final SampleCampaignMapper campaignMapper = new SampleCampaignMapper();

    @Test
    void channelMapper_ConvertsBothDirections() {
        // Given
        TaxonEntity entity = TaxonEntities.channel("Paid Search");

        // When
        SampleChannel channel = channelMapper.convertFrom(entity);
        TaxonEntity back = channelMapper.convertTo(channel);

        // Then
        assertEquals("Paid Search", channel.name());
        assertEquals("PAID_SEARCH", channel.code());
        assertEquals(entity, back);
    }

    @Test
    void channelMapper_RejectsOtherTaxonomy() {
        TaxonEntity campaign = TaxonEntities.campaign(null, "Spring Sale");

        assertThrows(TaxonMappingException.class, () -> channelMapper.convertFrom(campaign));
        assertThrows(TaxonMappingException.class, () -> channelMapper.convertFrom(null));
    }

    @Test
    void campaignMapper_KeepsParent() {
        // Given
        UUID parentId = UUID.randomUUID();
        TaxonEntity entity = TaxonEntities.campaign(parentId, "Spring Sale");

        // When
        SampleCampaign campaign = campaignMapper.convertFrom(entity);

        // Then
        assertEquals(parentId, campaign.parentId());
        assertEquals(entity, campaignMapper.convertTo(campaign));
    }

    @Test
    void mappers_HandleOnlyTheirOwnType() {
        assertTrue(channelMapper.canHandle(TargetType.of(SampleChannel.class)));
        assertFalse(channelMapper.canHandle(TargetType.of(SampleCampaign.class)));
        assertTrue(campaignMapper.canHandle(TargetType.of(SampleCampaign.class)));
        assertFalse(campaignMapper.canHandle(TargetType.of(SampleChannel.class)));
    }

    @Test
    void failingMapper_AlwaysThrows() {
        FailingTaxonMapper failing = new FailingTaxonMapper(SampleChannel.class);

        assertTrue(failing.canHandle(TargetType.of(SampleChannel.class)));
        assertThrows(TaxonMappingException.class,
            () -> failing.convertFrom(TaxonEntities.channel("Email")));
        assertFalse(failing.tryConvertFrom(TaxonEntities.channel("Email")).isMapped());
        assertThrows(IllegalArgumentException.class, () -> new FailingTaxonMapper(null));
    }

    @Test
    void countingMapper_CountsEachCall() {
        // Given
        CountingTaxonMapper counting = new CountingTaxonMapper(channelMapper);
        TaxonEntity entity = TaxonEntities.channel("Email");

        // When
        counting.canHandle(TargetType.of(SampleChannel.class));
        counting.canHandle(TargetType.of(SampleCampaign.class));
        Object channel = counting.convertFrom(entity);
        counting.convertTo(channel);

        // Then
        assertEquals(2, counting.canHandleCalls());
        assertEquals(1, counting.convertFromCalls());
        assertEquals(1, counting.convertToCalls());
        assertSame(channelMapper, counting.getDelegate());
    }
}
