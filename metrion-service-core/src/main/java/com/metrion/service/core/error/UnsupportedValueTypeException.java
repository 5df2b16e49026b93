package com.metrion.service.core.error;

public class UnsupportedValueTypeException extends QueryClientException {
    private final String type;

    public UnsupportedValueTypeException(String type) {
        super(
                QueryErrorKind.UNSUPPORTED_TYPE,
                "The data type " + type
                        + " is not supported. The supported data type list is: integer, float, boolean and string.");
        this.type = type;
    }

    public String type() {
        return type;
    }
}
