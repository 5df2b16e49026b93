package com.metrion.service.core.error;

public class InvalidValueException extends QueryClientException {
    private final String value;

    public InvalidValueException(String value, String expected) {
        this(value, expected, null);
    }

    public InvalidValueException(String value, String expected, Throwable cause) {
        super(
                QueryErrorKind.INVALID_VALUE,
                "Failed to convert the value " + value + " to the expected data type " + expected + ".",
                cause);
        this.value = value;
    }

    public String value() {
        return value;
    }
}
