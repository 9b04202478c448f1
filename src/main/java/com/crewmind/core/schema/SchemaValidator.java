package com.crewmind.core.schema;

import com.crewmind.core.model.FieldSpec;
import com.crewmind.core.model.OutputSchema;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a structured mapping from an agent's raw answer and checks it against an
 * {@link OutputSchema}.
 * <p>
 * Extraction tries, in order: a fenced {@code json} block, the outermost {@code {...}}
 * object, then {@code name: value} lines (continuation lines belong to the previous
 * field). A JSON object is only used when it holds at least one declared field. Values are coerced to the declared types where that is unambiguous.
 * Only declared fields are kept, in schema order.
 */
public class SchemaValidator {

    private static final Pattern FENCED_JSON = Pattern.compile("(?s)```(?:json)?\\s*(\\{.*?})\\s*```");
    private static final Pattern FIELD_LINE =
            Pattern.compile("^\\s*(?:[-*]\\s*)?\\**\\s*([A-Za-z][\\w \\-]{0,60}?)\\s*\\**\\s*:(?!//)\\s*(.*)$");
    private static final Pattern NUMERIC = Pattern.compile("^[-+]?[\\d,]*\\.?\\d+(?:[eE][-+]?\\d+)?$");
    private static final Pattern BULLET = Pattern.compile("^\\s*(?:[-*•]|\\d+[.)])\\s+");

    private final ObjectMapper objectMapper;

    public SchemaValidator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @return the coerced mapping; for an empty schema the parsed JSON object or {@code {"output": raw}}
     * @throws SchemaViolationException listing every missing or mistyped field
     */
    public Map<String, Object> validate(String raw, OutputSchema schema) {
        String text = raw == null ? "" : raw;
        Optional<Map<String, Object>> json = extractJson(text);

        if (schema.isEmpty()) {
            return json.orElseGet(() -> {
                var out = new LinkedHashMap<String, Object>();
                out.put("output", text);
                return out;
            });
        }

        // an object naming none of the fields is quoted content, not the answer
        Map<String, Object> candidates = json
                .filter(j -> schema.fields().stream().anyMatch(f -> lookup(j, f.name()) != null))
                .orElseGet(() -> extractFieldLines(text));
        var result = new LinkedHashMap<String, Object>();
        var violations = new ArrayList<SchemaViolationException.FieldViolation>();

        for (FieldSpec field : schema.fields()) {
            Object value = lookup(candidates, field.name());
            if (isAbsent(value)) {
                if (field.required()) {
                    violations.add(new SchemaViolationException.FieldViolation(field.name(), "missing required field"));
                }
                continue;
            }
            try {
                result.put(field.name(), coerce(value, field));
            } catch (IllegalArgumentException e) {
                violations.add(new SchemaViolationException.FieldViolation(field.name(), e.getMessage()));
            }
        }

        if (!violations.isEmpty()) {
            throw new SchemaViolationException(violations);
        }
        return result;
    }

    Optional<Map<String, Object>> extractJson(String text) {
        Matcher fenced = FENCED_JSON.matcher(text);
        if (fenced.find()) {
            var parsed = parseObject(fenced.group(1));
            if (parsed.isPresent()) return parsed;
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return parseObject(text.substring(start, end + 1));
        }
        return Optional.empty();
    }

    private Optional<Map<String, Object>> parseObject(String candidate) {
        try {
            Map<String, Object> map = objectMapper.readValue(candidate, new TypeReference<LinkedHashMap<String, Object>>() {});
            return Optional.ofNullable(map);
        } catch (Exception e) {
            return Optional.empty();
        }
    }

    Map<String, Object> extractFieldLines(String text) {
        var fields = new LinkedHashMap<String, Object>();
        String current = null;
        StringBuilder value = null;
        for (String line : text.split("\\R")) {
            Matcher m = FIELD_LINE.matcher(line);
            if (m.matches() && !m.group(1).isBlank()) {
                if (current != null) fields.put(current, value.toString().trim());
                current = normalizeName(m.group(1));
                value = new StringBuilder(m.group(2).trim());
            } else if (current != null && !line.isBlank()) {
                if (value.length() > 0) value.append('\n');
                value.append(line.trim());
            }
        }
        if (current != null) fields.put(current, value.toString().trim());
        return fields;
    }

    private static Object lookup(Map<String, Object> candidates, String fieldName) {
        if (candidates.containsKey(fieldName)) {
            return candidates.get(fieldName);
        }
        String wanted = normalizeName(fieldName);
        for (var entry : candidates.entrySet()) {
            if (normalizeName(entry.getKey()).equals(wanted)) {
                return entry.getValue();
            }
        }
        return null;
    }

    private static String normalizeName(String name) {
        return name.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s\\-]+", "_");
    }

    private static boolean isAbsent(Object value) {
        return value == null || (value instanceof String s && s.isBlank());
    }

    private Object coerce(Object value, FieldSpec field) {
        return switch (field.type()) {
            case STRING -> toStringValue(value);
            case INTEGER -> toInteger(value);
            case NUMBER -> toNumber(value);
            case BOOLEAN -> toBoolean(value);
            case LIST -> toList(value);
            case OBJECT -> toObject(value);
        };
    }

    private static String toStringValue(Object value) {
        if (value instanceof Map || value instanceof List) {
            throw new IllegalArgumentException("expected string but got " + describe(value));
        }
        return value.toString().trim();
    }

    private static Long toInteger(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short) {
            return ((Number) value).longValue();
        }
        BigDecimal decimal = toDecimal(value, "integer");
        try {
            return decimal.longValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("expected integer but got " + value);
        }
    }

    private static Double toNumber(Object value) {
        if (value instanceof Number n) return n.doubleValue();
        return toDecimal(value, "number").doubleValue();
    }

    private static BigDecimal toDecimal(Object value, String expected) {
        if (value instanceof Number n) {
            return new BigDecimal(n.toString());
        }
        if (value instanceof String s && NUMERIC.matcher(s.trim()).matches()) {
            return new BigDecimal(s.trim().replace(",", ""));
        }
        throw new IllegalArgumentException("expected " + expected + " but got " + describe(value));
    }

    private static Boolean toBoolean(Object value) {
        if (value instanceof Boolean b) return b;
        String s = value.toString().trim().toLowerCase(Locale.ROOT);
        return switch (s) {
            case "true", "yes", "y", "1" -> true;
            case "false", "no", "n", "0" -> false;
            default -> throw new IllegalArgumentException("expected boolean but got " + describe(value));
        };
    }

    private static List<Object> toList(Object value) {
        if (value instanceof List<?> list) {
            return new ArrayList<>(list);
        }
        if (value instanceof String s) {
            String[] parts = s.contains("\n") ? s.split("\\R") : s.split(",");
            var items = new ArrayList<Object>();
            for (String part : parts) {
                String item = BULLET.matcher(part).replaceFirst("").trim();
                if (!item.isEmpty()) items.add(item);
            }
            return items;
        }
        if (value instanceof Map) {
            throw new IllegalArgumentException("expected list but got object");
        }
        return new ArrayList<>(List.of(value));
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> toObject(Object value) {
        if (value instanceof Map<?, ?> map) {
            return new LinkedHashMap<>((Map<String, Object>) map);
        }
        if (value instanceof String s) {
            var parsed = parseObject(s.trim());
            if (parsed.isPresent()) return parsed.get();
        }
        throw new IllegalArgumentException("expected object but got " + describe(value));
    }

    private static String describe(Object value) {
        if (value instanceof Map) return "object";
        if (value instanceof List) return "list";
        String s = String.valueOf(value);
        return "'" + (s.length() > 40 ? s.substring(0, 40) + "..." : s) + "'";
    }
}
