package com.ryuqq.taxonomy.testkit.contract;

import com.ryuqq.taxonomy.core.spi.MapperRegistry;
import com.ryuqq.taxonomy.core.spi.TaxonMapper;
import com.ryuqq.taxonomy.testkit.fixture.SampleCampaignMapper;
import com.ryuqq.taxonomy.testkit.fixture.SampleChannelMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for {@link MapperRegistry} implementations.
 *
 * <p>Adapter modules extend this class and supply a fresh registry from
 * {@link #createRegistry()}.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Registration order is preserved in snapshots</li>
 *   <li>Null mappers are rejected without touching the registry</li>
 *   <li>Snapshots are immutable and unaffected by later appends</li>
 *   <li>Concurrent appends and scans never lose or tear entries</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class InMemoryMapperRegistryContractTest extends AbstractMapperRegistryContractTest {
 *     {@literal @}Override
 *     protected MapperRegistry createRegistry() {
 *         return new InMemoryMapperRegistry();
 *     }
 * }
 * </pre>
 *
 * @author Taxonomy Team
 * @since 1.0.0
 */
public abstract class AbstractMapperRegistryContractTest {

    protected MapperRegistry registry;

    /**
     * Creates an empty registry under test.
     *
     * @return a new, empty registry
     */
    protected abstract MapperRegistry createRegistry();

    @BeforeEach
    void setUpRegistry() {
        registry = createRegistry();
    }

    @Test
    void testRegister_PreservesRegistrationOrder() {
        // Given
        TaxonMapper first = new SampleChannelMapper();
        TaxonMapper second = new SampleCampaignMapper();
        TaxonMapper third = new SampleChannelMapper();

        // When
        registry.register(first);
        registry.register(second);
        registry.register(third);

        // Then
        List<TaxonMapper> snapshot = registry.snapshot();
        assertEquals(3, snapshot.size());
        assertSame(first, snapshot.get(0));
        assertSame(second, snapshot.get(1));
        assertSame(third, snapshot.get(2));
    }

    @Test
    void testRegister_Null_ThrowsAndLeavesRegistryUnchanged() {
        // Given
        registry.register(new SampleChannelMapper());

        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> registry.register(null)
        );
        assertTrue(exception.getMessage().contains("cannot be null"));
        assertEquals(1, registry.size());
    }

    @Test
    void testRegisterAll_AppendsInListOrder() {
        // Given
        TaxonMapper a = new SampleChannelMapper();
        TaxonMapper b = new SampleCampaignMapper();
        registry.register(a);

        // When
        registry.registerAll(List.of(b, a));

        // Then
        List<TaxonMapper> snapshot = registry.snapshot();
        assertEquals(3, snapshot.size());
        assertSame(a, snapshot.get(0));
        assertSame(b, snapshot.get(1));
        assertSame(a, snapshot.get(2));
    }

    @Test
    void testRegisterAll_NullElement_AddsNothing() {
        // Given
        List<TaxonMapper> withNull = Arrays.asList(new SampleChannelMapper(), null);

        // When & Then
        assertThrows(IllegalArgumentException.class, () -> registry.registerAll(withNull));
        assertTrue(registry.isEmpty());
    }

    @Test
    void testRegisterAll_NullList_Throws() {
        assertThrows(IllegalArgumentException.class, () -> registry.registerAll(null));
    }

    @Test
    void testSnapshot_IsImmutableAndDetachedFromLaterAppends() {
        // Given
        registry.register(new SampleChannelMapper());
        List<TaxonMapper> snapshot = registry.snapshot();

        // When
        registry.register(new SampleCampaignMapper());

        // Then
        assertEquals(1, snapshot.size());
        assertEquals(2, registry.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(new SampleChannelMapper()));
    }

    @Test
    void testEmptyRegistry_HasEmptySnapshot() {
        assertTrue(registry.isEmpty());
        assertEquals(0, registry.size());
        assertTrue(registry.snapshot().isEmpty());
    }

    @Test
    void testConcurrentRegisterAndScan_AllMappersVisible() throws Exception {
        // Given
        int writers = 8;
        int perWriter = 50;
        ExecutorService pool = Executors.newFixedThreadPool(writers + 2);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        // When: writers append while readers scan
        for (int w = 0; w < writers; w++) {
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < perWriter; i++) {
                    registry.register(new SampleChannelMapper());
                }
                return null;
            }));
        }
        for (int r = 0; r < 2; r++) {
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < 200; i++) {
                    for (TaxonMapper mapper : registry.snapshot()) {
                        assertNotNull(mapper, "scan observed a torn entry");
                    }
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        pool.shutdown();

        // Then
        assertEquals(writers * perWriter, registry.size());
        assertEquals(writers * perWriter, registry.snapshot().size());
    }
}
