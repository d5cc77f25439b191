package com.conveyor.engine.model;

import com.conveyor.engine.exception.ConfigurationException;

import java.util.List;

/**
 * A caller-supplied run parameter, declared up front by the pipeline.
 *
 * Values arrive as strings (HTTP body, command line) and are converted to
 * their declared type before any stage runs. STRING resolves to String,
 * CHOICE to String, BOOLEAN to Boolean.
 *
 * @param defaultValue  used when the caller omits the parameter; null makes it required
 * @param allowedValues CHOICE only; the first entry is the default when none is given
 */
public record Parameter(
        String        name,
        ParameterType type,
        String        defaultValue,
        List<String>  allowedValues,
        String        description
) {
    public Parameter {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("parameter name must not be blank");
        }
        allowedValues = allowedValues == null ? List.of() : List.copyOf(allowedValues);
        if (type == ParameterType.CHOICE && allowedValues.isEmpty()) {
            throw new IllegalArgumentException("choice parameter '" + name + "' needs allowed values");
        }
        if (type == ParameterType.CHOICE && defaultValue == null) {
            defaultValue = allowedValues.get(0);
        }
    }

    public static Parameter string(String name, String defaultValue, String description) {
        return new Parameter(name, ParameterType.STRING, defaultValue, List.of(), description);
    }

    public static Parameter choice(String name, List<String> allowedValues, String description) {
        return new Parameter(name, ParameterType.CHOICE, null, allowedValues, description);
    }

    public static Parameter bool(String name, boolean defaultValue, String description) {
        return new Parameter(name, ParameterType.BOOLEAN, String.valueOf(defaultValue), List.of(), description);
    }

    /**
     * Convert a raw value (null when the caller did not supply one) into the
     * declared type.
     *
     * @throws ConfigurationException if the value is missing and there is no
     *                                default, or does not fit the declared type
     */
    public Object resolve(String raw) {
        String value = raw != null ? raw : defaultValue;
        if (value == null) {
            throw new ConfigurationException("Missing required parameter '" + name + "'");
        }
        return switch (type) {
            case STRING -> value;
            case CHOICE -> {
                if (!allowedValues.contains(value)) {
                    throw new ConfigurationException("Parameter '" + name + "' must be one of "
                            + allowedValues + ", got '" + value + "'");
                }
                yield value;
            }
            case BOOLEAN -> {
                if (value.equalsIgnoreCase("true"))  yield Boolean.TRUE;
                if (value.equalsIgnoreCase("false")) yield Boolean.FALSE;
                throw new ConfigurationException("Parameter '" + name
                        + "' must be true or false, got '" + value + "'");
            }
        };
    }
}
