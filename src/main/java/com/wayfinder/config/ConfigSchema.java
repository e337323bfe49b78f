package com.wayfinder.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Typed field definitions for a flat JSON configuration object.
 *
 * Validation rejects unknown fields, checks types and ranges, and fills in
 * defaults for missing optional fields.
 */
public class ConfigSchema {

    private final Map<String, FieldDefinition> fields;

    public ConfigSchema(Map<String, FieldDefinition> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * Validates raw configuration values.
     *
     * @param config raw values by field name
     * @return validated values, defaults applied, in schema order
     * @throws ConfigValidationException if a field is unknown, missing or invalid
     */
    public Map<String, Object> validate(Map<String, Object> config) throws ConfigValidationException {
        for (String name : config.keySet()) {
            if (!fields.containsKey(name)) {
                throw new ConfigValidationException(
                    String.format("Unknown field '%s', expected one of %s", name, fields.keySet()), name
                );
            }
        }

        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<String, FieldDefinition> entry : fields.entrySet()) {
            String fieldName = entry.getKey();
            FieldDefinition fieldDef = entry.getValue();
            Object value = config.get(fieldName);

            // Apply default if missing
            if (value == null) {
                if (fieldDef.required()) {
                    throw new ConfigValidationException(
                        String.format("Required field '%s' is missing", fieldName), fieldName
                    );
                }
                result.put(fieldName, fieldDef.defaultValue());
                continue;
            }

            fieldDef.validate(fieldName, value);
            result.put(fieldName, value);
        }
        return result;
    }

    public Map<String, FieldDefinition> getFields() {
        return fields;
    }

    /**
     * Definition of a configuration field.
     */
    public static class FieldDefinition {
        private final FieldType type;
        private final boolean required;
        private final Object defaultValue;
        private final Integer minValue;
        private final Integer maxValue;
        private final Set<String> allowedValues;

        private FieldDefinition(Builder builder) {
            this.type = builder.type;
            this.required = builder.required;
            this.defaultValue = builder.defaultValue;
            this.minValue = builder.minValue;
            this.maxValue = builder.maxValue;
            this.allowedValues = builder.allowedValues;
        }

        /**
         * Validates a field value.
         */
        public void validate(String fieldName, Object value) throws ConfigValidationException {
            if (!type.isValid(value)) {
                throw new ConfigValidationException(
                    String.format("Field '%s' expected %s, got %s",
                        fieldName, type.name(), value.getClass().getSimpleName()), fieldName
                );
            }

            // Integer range
            if (value instanceof Integer) {
                int intValue = (Integer) value;
                if (minValue != null && intValue < minValue) {
                    throw new ConfigValidationException(
                        String.format("Field '%s' value %d is below minimum %d", fieldName, intValue, minValue),
                        fieldName
                    );
                }
                if (maxValue != null && intValue > maxValue) {
                    throw new ConfigValidationException(
                        String.format("Field '%s' value %d is above maximum %d", fieldName, intValue, maxValue),
                        fieldName
                    );
                }
            }

            // Enumerated strings
            if (value instanceof String && allowedValues != null && !allowedValues.contains(value)) {
                throw new ConfigValidationException(
                    String.format("Field '%s' value '%s' is not one of %s", fieldName, value, allowedValues),
                    fieldName
                );
            }
        }

        public FieldType type() { return type; }
        public boolean required() { return required; }
        public Object defaultValue() { return defaultValue; }

        /**
         * Builder for field definitions.
         */
        public static class Builder {
            private FieldType type;
            private boolean required = false;
            private Object defaultValue;
            private Integer minValue;
            private Integer maxValue;
            private Set<String> allowedValues;

            public Builder type(FieldType type) {
                this.type = type;
                return this;
            }

            public Builder required(boolean required) {
                this.required = required;
                return this;
            }

            public Builder defaultValue(Object defaultValue) {
                this.defaultValue = defaultValue;
                return this;
            }

            public Builder range(int min, int max) {
                this.minValue = min;
                this.maxValue = max;
                return this;
            }

            public Builder allowed(Set<String> values) {
                this.allowedValues = Set.copyOf(values);
                return this;
            }

            public FieldDefinition build() {
                if (type == null) {
                    throw new IllegalStateException("Field type is required");
                }
                return new FieldDefinition(this);
            }
        }
    }

    /**
     * Supported field types.
     */
    public enum FieldType {
        STRING(String.class),
        INTEGER(Integer.class),
        BOOLEAN(Boolean.class);

        private final Class<?> javaType;

        FieldType(Class<?> javaType) {
            this.javaType = javaType;
        }

        public boolean isValid(Object value) {
            if (value == null) return false;
            return javaType.isAssignableFrom(value.getClass());
        }
    }
}
