package com.nextrows.client.model;

import com.nextrows.NextrowsException.ValidationException;

/**
 * One named input of an app run.
 *
 * @param key   the input name, e.g. {@code "url"}
 * @param value a {@link String}, {@link Number} or {@link Boolean}
 */
public record AppInput(String key, Object value) {

    public AppInput {
        if (key == null) {
            throw new ValidationException("app input key must not be null");
        }
        if (!(value instanceof String || value instanceof Number || value instanceof Boolean)) {
            throw new ValidationException("app input '" + key + "' must be a string, number or boolean, got "
                    + (value == null ? "null" : value.getClass().getName()));
        }
    }

    public static AppInput of(String key, String value) {
        return new AppInput(key, value);
    }

    public static AppInput of(String key, Number value) {
        return new AppInput(key, value);
    }

    public static AppInput of(String key, boolean value) {
        return new AppInput(key, value);
    }
}
