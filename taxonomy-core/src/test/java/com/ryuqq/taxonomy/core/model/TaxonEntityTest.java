package com.ryuqq.taxonomy.core.model;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TaxonEntity 테스트.
 *
 * @author Taxonomy Team
 * @since 1.0.0
 */
class TaxonEntityTest {

    private static final UUID TAXONOMY = UUID.randomUUID();

    @Test
    void root_HasNoParent() {
        // When
        TaxonEntity entity = TaxonEntity.root(UUID.randomUUID(), TAXONOMY, "Channels");

        // Then
        assertTrue(entity.isRoot());
        assertNull(entity.code());
        assertTrue(entity.displayNames().isEmpty());
    }

    @Test
    void childOf_InheritsTaxonomyAndPointsToParent() {
        // Given
        TaxonEntity parent = TaxonEntity.root(UUID.randomUUID(), TAXONOMY, "Online");

        // When
        TaxonEntity child = TaxonEntity.childOf(parent, UUID.randomUUID(), "Email");

        // Then
        assertFalse(child.isRoot());
        assertEquals(parent.id(), child.parentId());
        assertEquals(TAXONOMY, child.taxonomyId());
    }

    @Test
    void constructor_MissingRequiredFields_ThrowsException() {
        UUID id = UUID.randomUUID();
        assertThrows(IllegalArgumentException.class,
            () -> new TaxonEntity(null, TAXONOMY, null, "n", null, null, null));
        assertThrows(IllegalArgumentException.class,
            () -> new TaxonEntity(id, null, null, "n", null, null, null));
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
            () -> new TaxonEntity(id, TAXONOMY, null, "  ", null, null, null));
        assertTrue(exception.getMessage().contains("name"));
    }

    @Test
    void displayNames_AreDefensivelyCopied() {
        // Given
        Map<String, String> names = new HashMap<>();
        names.put("ko-KR", "이메일");
        TaxonEntity entity = TaxonEntity.root(UUID.randomUUID(), TAXONOMY, "Email").withDisplayNames(names);

        // When
        names.put("en", "Email");

        // Then
        assertEquals(1, entity.displayNames().size());
        assertThrows(UnsupportedOperationException.class, () -> entity.displayNames().put("x", "y"));
    }

    @Test
    void displayName_FallsBackToName() {
        // Given
        TaxonEntity entity = TaxonEntity.root(UUID.randomUUID(), TAXONOMY, "Email")
            .withDisplayNames(Map.of("ko-KR", "이메일"));

        // When & Then
        assertEquals("이메일", entity.displayName("ko-KR"));
        assertEquals("Email", entity.displayName("fr-FR"));
    }

    @Test
    void withCode_ReturnsNewInstance() {
        // Given
        TaxonEntity original = TaxonEntity.root(UUID.randomUUID(), TAXONOMY, "Email");

        // When
        TaxonEntity coded = original.withCode("EMAIL");

        // Then
        assertNull(original.code());
        assertEquals("EMAIL", coded.code());
        assertNotEquals(original, coded);
        assertEquals(coded, original.withCode("EMAIL"));
    }
}
