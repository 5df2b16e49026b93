package com.metrion.service.core.coerce;

import com.metrion.service.core.error.UnsupportedValueTypeException;

/** Scalar types a metadata filter may declare. */
public enum ValueType {
    INTEGER("integer"),
    FLOAT("float"),
    BOOLEAN("boolean"),
    STRING("string");

    private final String wireValue;

    ValueType(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    /** Exact match on the wire name; {@code Integer} or {@code " float"} are not supported types. */
    public static ValueType fromDeclared(String declared) {
        for (ValueType type : values()) {
            if (type.wireValue.equals(declared)) {
                return type;
            }
        }
        throw new UnsupportedValueTypeException(declared);
    }
}
