package com.nftindexer.ingestion.decoder;

import com.nftindexer.domain.EventKind;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Named arguments of a decoded log. Accessors throw {@link DecodeException} when a field is missing or of
 * another type, so handlers never see a half-decoded event.
 */
public final class DecodedEvent {

    private final EventKind kind;
    private final Map<String, Object> fields;

    private DecodedEvent(EventKind kind, Map<String, Object> fields) {
        this.kind = kind;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static Builder builder(EventKind kind) {
        return new Builder(kind);
    }

    public EventKind getKind() {
        return kind;
    }

    public Map<String, Object> getFields() {
        return fields;
    }

    public String address(String name) {
        return get(name, String.class);
    }

    public String bytes32(String name) {
        return get(name, String.class);
    }

    public BigInteger uint(String name) {
        return get(name, BigInteger.class);
    }

    public boolean bool(String name) {
        return get(name, Boolean.class);
    }

    @SuppressWarnings("unchecked")
    public List<BigInteger> uintList(String name) {
        return (List<BigInteger>) get(name, List.class);
    }

    @SuppressWarnings("unchecked")
    public List<String> addressList(String name) {
        return (List<String>) get(name, List.class);
    }

    private <T> T get(String name, Class<T> type) {
        Object value = fields.get(name);
        if (value == null) {
            throw new DecodeException("Field '" + name + "' missing from " + kind.getTag());
        }
        if (!type.isInstance(value)) {
            throw new DecodeException("Field '" + name + "' of " + kind.getTag() + " is not a " + type.getSimpleName());
        }
        return type.cast(value);
    }

    public static final class Builder {

        private final EventKind kind;
        private final Map<String, Object> fields = new LinkedHashMap<>();

        private Builder(EventKind kind) {
            this.kind = kind;
        }

        public Builder field(String name, Object value) {
            fields.put(name, value);
            return this;
        }

        public DecodedEvent build() {
            return new DecodedEvent(kind, fields);
        }
    }
}
