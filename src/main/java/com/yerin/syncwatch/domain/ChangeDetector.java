package com.yerin.syncwatch.domain;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 레코드 지문(SHA-256)과 필드 단위 diff.
 * 지문은 키 순서와 무관하고, 숫자/날짜는 고정된 문자열 형태로 정규화한 뒤 계산한다.
 */
public final class ChangeDetector {

    private static final ObjectMapper CANONICAL = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .configure(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN, true);

    private ChangeDetector() {}

    public static String fingerprint(Map<String, ?> record) {
        try {
            String json = CANONICAL.writeValueAsString(canonical(record == null ? Map.of() : record));
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(json.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (JsonProcessingException | NoSuchAlgorithmException e) {
            // canonical() 결과는 맵/리스트/문자열/숫자/불리언뿐이라 여기 올 일이 없다
            throw new IllegalStateException("fingerprint failed", e);
        }
    }

    public static ChangeSet diff(Map<String, ?> oldRecord, Map<String, ?> newRecord) {
        Map<String, ?> before = oldRecord == null ? Map.of() : oldRecord;
        Map<String, ?> after = newRecord == null ? Map.of() : newRecord;

        TreeSet<String> keys = new TreeSet<>(before.keySet());
        keys.addAll(after.keySet());

        Map<String, Object> changed = new LinkedHashMap<>();
        Map<String, Object> oldValues = new LinkedHashMap<>();
        for (String key : keys) {
            boolean presenceDiffers = before.containsKey(key) != after.containsKey(key);
            if (presenceDiffers || !Objects.equals(canonical(before.get(key)), canonical(after.get(key)))) {
                changed.put(key, after.get(key));
                oldValues.put(key, before.get(key));
            }
        }
        return new ChangeSet(changed, oldValues);
    }

    static Object canonical(Object value) {
        if (value == null || value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> sorted = new TreeMap<>();
            map.forEach((k, v) -> sorted.put(String.valueOf(k), canonical(v)));
            return sorted;
        }
        if (value instanceof Collection<?> items) {
            List<Object> out = new ArrayList<>(items.size());
            items.forEach(v -> out.add(canonical(v)));
            return out;
        }
        if (value instanceof Object[] items) {
            List<Object> out = new ArrayList<>(items.length);
            for (Object v : items) out.add(canonical(v));
            return out;
        }
        if (value instanceof BigDecimal decimal) {
            return normalize(decimal);
        }
        if (value instanceof BigInteger integer) {
            return new BigDecimal(integer);
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) return String.valueOf(d);
            return normalize(new BigDecimal(value.toString()));
        }
        if (value instanceof Number number) {
            return BigDecimal.valueOf(number.longValue());
        }
        if (value instanceof Date date) {
            return date.toInstant().toString();
        }
        if (value instanceof TemporalAccessor || value instanceof Enum<?>) {
            return value.toString();
        }
        return value.toString();
    }

    private static BigDecimal normalize(BigDecimal decimal) {
        BigDecimal stripped = decimal.stripTrailingZeros();
        return stripped.scale() < 0 ? stripped.setScale(0) : stripped;
    }
}
