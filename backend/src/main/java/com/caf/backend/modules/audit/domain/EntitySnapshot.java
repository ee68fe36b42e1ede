package com.caf.backend.modules.audit.domain;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.caf.backend.global.common.EntityType;

/**
 * Field-level view of an auditable entity at one point in time. Values are normalized on
 * construction so that snapshots built in memory compare equal to snapshots decoded from JSON:
 * integral numbers become {@link Long}, other numbers {@link BigDecimal}, identifiers, enums and
 * temporals their string form. Numbers neither type can hold (NaN, infinities, integers past the
 * long range) keep their string form too.
 */
public record EntitySnapshot(EntityType entityType, UUID entityId, UUID officeId, Map<String, Object> fields) {

    public EntitySnapshot {
        Objects.requireNonNull(entityType, "entityType is required");
        Map<String, Object> normalized = new LinkedHashMap<>();
        if (fields != null) {
            fields.forEach((key, value) -> normalized.put(key, normalize(value)));
        }
        fields = Collections.unmodifiableMap(normalized);
    }

    public static Builder builder(EntityType entityType, UUID entityId, UUID officeId) {
        return new Builder(entityType, entityId, officeId);
    }

    static Object normalize(Object value) {
        if (value == null || value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger bigInteger) {
            return bigInteger.bitLength() < Long.SIZE ? bigInteger.longValue() : bigInteger.toString();
        }
        if (value instanceof BigDecimal decimal) {
            return normalizeDecimal(decimal);
        }
        if (value instanceof Double || value instanceof Float) {
            double doubleValue = ((Number) value).doubleValue();
            if (Double.isNaN(doubleValue) || Double.isInfinite(doubleValue)) {
                return value.toString();
            }
        }
        if (value instanceof Number number) {
            try {
                return normalizeDecimal(new BigDecimal(number.toString()));
            } catch (NumberFormatException ex) {
                return number.toString();
            }
        }
        if (value instanceof UUID || value instanceof TemporalAccessor || value instanceof Character) {
            return value.toString();
        }
        if (value instanceof Enum<?> enumValue) {
            return enumValue.name().toLowerCase();
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> nested = new LinkedHashMap<>();
            map.forEach((key, nestedValue) -> nested.put(String.valueOf(key), normalize(nestedValue)));
            return Collections.unmodifiableMap(nested);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> items = new ArrayList<>(collection.size());
            collection.forEach(item -> items.add(normalize(item)));
            return Collections.unmodifiableList(items);
        }
        return value.toString();
    }

    private static Object normalizeDecimal(BigDecimal decimal) {
        BigDecimal stripped = decimal.stripTrailingZeros();
        if (stripped.scale() <= 0) {
            try {
                return stripped.longValueExact();
            } catch (ArithmeticException ex) {
                return stripped;
            }
        }
        return stripped;
    }

    public static final class Builder {

        private final EntityType entityType;
        private final UUID entityId;
        private final UUID officeId;
        private final Map<String, Object> fields = new LinkedHashMap<>();

        private Builder(EntityType entityType, UUID entityId, UUID officeId) {
            this.entityType = entityType;
            this.entityId = entityId;
            this.officeId = officeId;
        }

        public Builder field(String name, Object value) {
            fields.put(name, value);
            return this;
        }

        public EntitySnapshot build() {
            return new EntitySnapshot(entityType, entityId, officeId, fields);
        }
    }
}
