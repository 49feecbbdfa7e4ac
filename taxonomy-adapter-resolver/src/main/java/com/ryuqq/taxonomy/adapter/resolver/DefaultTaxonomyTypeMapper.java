package com.ryuqq.taxonomy.adapter.resolver;

import com.ryuqq.taxonomy.adapter.inmemory.cache.InMemoryResolutionCache;
import com.ryuqq.taxonomy.adapter.inmemory.registry.InMemoryMapperRegistry;
import com.ryuqq.taxonomy.application.mapper.TaxonomyTypeMapper;
import com.ryuqq.taxonomy.core.exception.DuplicateMapperException;
import com.ryuqq.taxonomy.core.exception.MapperNotFoundException;
import com.ryuqq.taxonomy.core.model.TaxonEntity;
import com.ryuqq.taxonomy.core.model.TargetType;
import com.ryuqq.taxonomy.core.outcome.MapAttempt;
import com.ryuqq.taxonomy.core.outcome.Mapped;
import com.ryuqq.taxonomy.core.outcome.Unmapped;
import com.ryuqq.taxonomy.core.spi.MapperRegistry;
import com.ryuqq.taxonomy.core.spi.ResolutionCache;
import com.ryuqq.taxonomy.core.spi.TaxonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * {@link TaxonomyTypeMapper} 기본 구현체.
 *
 * <p>레지스트리 선형 스캔 + 해석 캐시로 대상 타입의 매퍼를 찾고, 변환을 위임합니다.</p>
 *
 * <p><strong>해석 흐름:</strong></p>
 * <pre>
 * 1. key = type.identity()
 * 2. 캐시 hit → 캐시된 매퍼 반환 (스캔/canHandle 호출 없음)
 * 3. 캐시 miss → 레지스트리를 등록 순서대로 스캔, 첫 번째 canHandle(type) == true 매퍼 선택
 * 4. 찾으면 cache.putIfAbsent(type, mapper) 후 캐시에 남은 매퍼 반환
 * 5. 못 찾으면 MapperNotFoundException (실패는 캐시하지 않음)
 * </pre>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>레지스트리와 캐시는 각자 스레드 안전, 둘 사이의 락 없음</li>
 *   <li>같은 타입을 동시에 해석하면 스캔이 중복될 수 있으나 결과는 하나로 수렴</li>
 *   <li>등록(register)끼리만 직렬화, 해석은 등록을 기다리지 않음</li>
 * </ul>
 *
 * <p><strong>소유권:</strong> 레지스트리와 캐시는 이 인스턴스가 생성/주입받아 수명 동안 소유합니다.
 * 정적(static) 상태는 없습니다.</p>
 *
 * @author Taxonomy Team
 * @since 1.0.0
 */
public final class DefaultTaxonomyTypeMapper implements TaxonomyTypeMapper {

    private static final Logger log = LoggerFactory.getLogger(DefaultTaxonomyTypeMapper.class);

    private static final Map<Class<?>, Class<?>> PRIMITIVE_WRAPPERS = Map.of(
        boolean.class, Boolean.class,
        byte.class, Byte.class,
        char.class, Character.class,
        short.class, Short.class,
        int.class, Integer.class,
        long.class, Long.class,
        float.class, Float.class,
        double.class, Double.class,
        void.class, Void.class
    );

    private final MapperRegistry registry;
    private final ResolutionCache cache;
    private final TypeMapperConfig config;
    private final Object registrationLock = new Object();

    /**
     * 빈 레지스트리로 생성 (기본 설정).
     */
    public DefaultTaxonomyTypeMapper() {
        this(List.of(), new TypeMapperConfig());
    }

    /**
     * 고정 매퍼 목록으로 생성 (기본 설정).
     *
     * @param mappers 등록할 매퍼 (목록 순서 = 우선순위)
     * @throws IllegalArgumentException mappers가 null이거나 null 원소를 포함한 경우
     */
    public DefaultTaxonomyTypeMapper(List<? extends TaxonMapper> mappers) {
        this(mappers, new TypeMapperConfig());
    }

    /**
     * 고정 매퍼 목록으로 생성.
     *
     * @param mappers 등록할 매퍼 (목록 순서 = 우선순위)
     * @param config 설정
     * @throws IllegalArgumentException mappers/config가 null이거나 mappers에 null 원소가 있는 경우
     * @throws DuplicateMapperException duplicatePolicy가 REJECT이고 같은 인스턴스가 두 번 포함된 경우
     */
    public DefaultTaxonomyTypeMapper(List<? extends TaxonMapper> mappers, TypeMapperConfig config) {
        this(new InMemoryMapperRegistry(), newCache(config), config);
        if (mappers == null) {
            throw new IllegalArgumentException("mappers cannot be null");
        }
        for (TaxonMapper mapper : mappers) {
            if (mapper == null) {
                throw new IllegalArgumentException("mappers cannot contain null");
            }
        }
        for (TaxonMapper mapper : mappers) {
            register(mapper);
        }
        log.info("Registered {} initial mappers", mappers.size());
    }

    /**
     * SPI 구현체를 직접 주입하여 생성.
     *
     * @param registry 매퍼 레지스트리
     * @param cache 해석 캐시 (비어 있어야 함)
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null이거나 cache가 비어 있지 않은 경우
     */
    public DefaultTaxonomyTypeMapper(MapperRegistry registry, ResolutionCache cache, TypeMapperConfig config) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (cache == null) {
            throw new IllegalArgumentException("cache cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (cache.size() != 0) {
            throw new IllegalArgumentException("cache must be empty (current size: " + cache.size() + ")");
        }
        this.registry = registry;
        this.cache = cache;
        this.config = config;
        log.info("Taxonomy type mapper created (duplicatePolicy={})", config.duplicatePolicy());
    }

    private static ResolutionCache newCache(TypeMapperConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return new InMemoryResolutionCache(config.initialCacheCapacity());
    }

    @Override
    public Object map(TaxonEntity data, TargetType type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (data == null) {
            throw new IllegalArgumentException("data cannot be null");
        }
        TaxonMapper mapper = resolve(type);
        return mapper.convertFrom(data);
    }

    /**
     * {@inheritDoc}
     *
     * <p>primitive Class({@code int.class} 등)는 래퍼 타입으로 결과를 검사합니다.</p>
     */
    @Override
    public <T> T map(TaxonEntity data, Class<T> type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        return boxed(type).cast(map(data, TargetType.of(type)));
    }

    @Override
    public MapAttempt<Object> tryMap(TaxonEntity data, TargetType type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        try {
            TaxonMapper mapper = resolve(type);
            MapAttempt<Object> attempt = mapper.tryConvertFrom(data);
            if (attempt == null) {
                return Unmapped.of(mapper + " returned no result for " + type.identity());
            }
            return attempt;
        } catch (Exception e) {
            return toUnmapped(type, e);
        }
    }

    @Override
    public <T> MapAttempt<T> tryMap(TaxonEntity data, Class<T> type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        MapAttempt<Object> attempt = tryMap(data, TargetType.of(type));
        if (attempt instanceof Unmapped<Object> unmapped) {
            return new Unmapped<>(unmapped.reason(), unmapped.cause());
        }
        Class<T> expected = boxed(type);
        Object value = ((Mapped<Object>) attempt).value();
        if (value != null && !expected.isInstance(value)) {
            return Unmapped.of("Mapper for " + type.getName() + " returned " + value.getClass().getName());
        }
        return MapAttempt.mapped(expected.cast(value));
    }

    @Override
    public TaxonEntity mapToEntity(Object instance) {
        if (instance == null) {
            throw new IllegalArgumentException("instance cannot be null");
        }
        TaxonMapper mapper = resolve(TargetType.runtimeTypeOf(instance));
        return mapper.convertTo(instance);
    }

    /**
     * {@inheritDoc}
     *
     * <p>duplicatePolicy가 ALLOW가 아니면 등록 전에 겹침을 검사합니다.
     * 검사 이후 동시에 해석된 타입과의 겹침은 감지되지 않을 수 있습니다.</p>
     */
    @Override
    public void register(TaxonMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        synchronized (registrationLock) {
            if (config.duplicatePolicy() != DuplicatePolicy.ALLOW) {
                String overlap = findOverlap(mapper);
                if (overlap != null) {
                    if (config.duplicatePolicy() == DuplicatePolicy.REJECT) {
                        throw new DuplicateMapperException(overlap);
                    }
                    log.warn("Registering overlapping mapper: {}", overlap);
                }
            }
            registry.register(mapper);
        }
        log.debug("Registered mapper {} (total {})", mapper, registry.size());
    }

    @Override
    public boolean canMap(TargetType type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        try {
            resolve(type);
            return true;
        } catch (MapperNotFoundException e) {
            return false;
        } catch (Exception e) {
            log.debug("canMap for {} failed: {}", type.identity(), e.toString());
            return false;
        }
    }

    /**
     * 대상 타입의 매퍼 해석.
     *
     * @param type 대상 타입
     * @return 캐시되었거나 스캔으로 찾은 매퍼
     * @throws IllegalArgumentException type이 null인 경우
     * @throws MapperNotFoundException 처리 가능한 매퍼가 없는 경우
     */
    public TaxonMapper resolve(TargetType type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }

        // 1. 캐시 조회
        TaxonMapper cached = cache.get(type);
        if (cached != null) {
            return cached;
        }

        // 2. 등록 순서대로 스캔 (first-match-wins)
        log.debug("Resolution cache miss for {}", type.identity());
        for (TaxonMapper candidate : registry.snapshot()) {
            if (candidate.canHandle(type)) {
                // 3. 먼저 저장된 매퍼가 이김
                TaxonMapper winner = cache.putIfAbsent(type, candidate);
                log.debug("Resolved {} to {}", type.identity(), winner);
                return winner;
            }
        }

        // 4. 실패는 캐시하지 않음
        throw new MapperNotFoundException(type);
    }

    /**
     * 현재 등록된 매퍼 스냅샷.
     *
     * @return 등록 순서대로 정렬된 불변 목록
     */
    public List<TaxonMapper> registeredMappers() {
        return registry.snapshot();
    }

    /**
     * 해석되어 캐시된 타입 수.
     *
     * @return 캐시 크기
     */
    public int resolvedTypeCount() {
        return cache.size();
    }

    /**
     * 현재 설정 조회.
     *
     * @return 설정
     */
    public TypeMapperConfig getConfig() {
        return config;
    }

    /**
     * tryMap 실패를 Unmapped로 변환.
     *
     * @param type 대상 타입
     * @param e 해석 또는 변환 중 발생한 예외
     * @return Unmapped 결과
     */
    private static MapAttempt<Object> toUnmapped(TargetType type, Exception e) {
        log.debug("tryMap for {} failed: {}", type.identity(), e.toString());
        return MapAttempt.unmapped("Could not map to " + type.identity() + ": " + e.getMessage(), e);
    }

    /**
     * primitive Class를 래퍼 Class로 변환.
     *
     * @param type 대상 Class
     * @return primitive면 래퍼 Class, 아니면 그대로
     */
    @SuppressWarnings("unchecked")
    private static <T> Class<T> boxed(Class<T> type) {
        if (!type.isPrimitive()) {
            return type;
        }
        return (Class<T>) PRIMITIVE_WRAPPERS.get(type);
    }

    /**
     * 새 매퍼가 기존 등록과 겹치는지 검사.
     *
     * @param mapper 등록하려는 매퍼
     * @return 겹침 설명, 없으면 null
     */
    private String findOverlap(TaxonMapper mapper) {
        for (TaxonMapper existing : registry.snapshot()) {
            if (existing == mapper) {
                return mapper + " is already registered";
            }
        }
        for (TargetType resolved : cache.resolvedTypes()) {
            if (mapper.canHandle(resolved)) {
                return mapper + " handles " + resolved.identity()
                    + " which is already resolved to " + cache.get(resolved);
            }
        }
        return null;
    }
}
