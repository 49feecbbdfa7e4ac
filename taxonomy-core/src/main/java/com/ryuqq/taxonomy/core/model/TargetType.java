package com.ryuqq.taxonomy.core.model;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;

/**
 * 매핑 대상 타입 식별자.
 *
 * <p>TargetType은 {@link Type}을 감싸고, 캐시 키로 쓰이는 안정적인 문자열 식별자를 제공합니다.
 * 같은 논리 타입을 가리키는 두 TargetType은 항상 같은 {@link #identity()}를 반환합니다.</p>
 *
 * <p><strong>식별자 규칙:</strong></p>
 * <ul>
 *   <li>{@link Type#getTypeName()} 사용 (예: {@code java.util.List<java.lang.String>})</li>
 *   <li>하나의 JVM 프로세스 안에서만 안정적 (직렬화/프로세스 간 비교 대상 아님)</li>
 *   <li>equals/hashCode는 identity 기준</li>
 * </ul>
 *
 * @author Taxonomy Team
 * @since 1.0.0
 */
public final class TargetType {

    private final Type type;
    private final String identity;

    private TargetType(Type type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        this.type = type;
        this.identity = type.getTypeName();
    }

    /**
     * TargetType 생성.
     *
     * @param type 대상 타입 (Class 또는 ParameterizedType)
     * @return TargetType 인스턴스
     * @throws IllegalArgumentException type이 null인 경우
     */
    public static TargetType of(Type type) {
        return new TargetType(type);
    }

    /**
     * 값의 런타임 타입으로 TargetType 생성.
     *
     * @param value 대상 값
     * @return value.getClass()에 대한 TargetType
     * @throws IllegalArgumentException value가 null인 경우
     */
    public static TargetType runtimeTypeOf(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        return new TargetType(value.getClass());
    }

    /**
     * 원본 타입 조회.
     *
     * @return 감싼 Type
     */
    public Type getType() {
        return type;
    }

    /**
     * 캐시 키로 쓰이는 식별자.
     *
     * @return 타입 이름
     */
    public String identity() {
        return identity;
    }

    /**
     * 제네릭 인자를 제거한 raw Class 조회.
     *
     * @return raw Class, 알 수 없는 Type 구현이면 null
     */
    public Class<?> rawType() {
        if (type instanceof Class<?> c) {
            return c;
        }
        if (type instanceof ParameterizedType p && p.getRawType() instanceof Class<?> c) {
            return c;
        }
        return null;
    }

    /**
     * 이 타입이 주어진 Class를 그대로 가리키는지 확인.
     *
     * @param candidate 비교할 Class
     * @return raw 타입이 candidate와 같으면 true
     */
    public boolean is(Class<?> candidate) {
        return candidate != null && candidate.equals(rawType());
    }

    /**
     * 이 타입의 raw Class가 주어진 Class의 상위 타입인지 확인.
     *
     * @param candidate 비교할 Class
     * @return raw 타입에 candidate를 대입할 수 있으면 true
     */
    public boolean isAssignableFrom(Class<?> candidate) {
        Class<?> raw = rawType();
        return raw != null && candidate != null && raw.isAssignableFrom(candidate);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TargetType that = (TargetType) o;
        return identity.equals(that.identity);
    }

    @Override
    public int hashCode() {
        return identity.hashCode();
    }

    @Override
    public String toString() {
        return "TargetType{" + identity + '}';
    }
}
