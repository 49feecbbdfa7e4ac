package com.ryuqq.taxonomy.adapter.resolver;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * TypeMapperConfig 테스트.
 *
 * @author Taxonomy Team
 * @since 1.0.0
 */
class TypeMapperConfigTest {

    @Test
    void 기본값() {
        TypeMapperConfig config = new TypeMapperConfig();

        assertThat(config.duplicatePolicy()).isEqualTo(DuplicatePolicy.ALLOW);
        assertThat(config.initialCacheCapacity()).isEqualTo(64);
    }

    @Test
    void with_메서드는_한_필드만_변경() {
        // given
        TypeMapperConfig config = new TypeMapperConfig();

        // when
        TypeMapperConfig changed = config.withDuplicatePolicy(DuplicatePolicy.REJECT).withInitialCacheCapacity(8);

        // then
        assertThat(changed).isEqualTo(new TypeMapperConfig(DuplicatePolicy.REJECT, 8));
        assertThat(config.duplicatePolicy()).isEqualTo(DuplicatePolicy.ALLOW);
    }

    @Test
    void 유효하지_않은_값이면_IllegalArgumentException() {
        assertThatThrownBy(() -> new TypeMapperConfig(null, 64))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("duplicatePolicy cannot be null");
        assertThatThrownBy(() -> new TypeMapperConfig(DuplicatePolicy.ALLOW, 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("initialCacheCapacity must be positive");
    }

    @Test
    void 설정이_TypeMapper에_전달됨() {
        // given
        TypeMapperConfig config = new TypeMapperConfig().withDuplicatePolicy(DuplicatePolicy.WARN);

        // when
        DefaultTaxonomyTypeMapper typeMapper = new DefaultTaxonomyTypeMapper(java.util.List.of(), config);

        // then
        assertThat(typeMapper.getConfig()).isSameAs(config);
    }
}
