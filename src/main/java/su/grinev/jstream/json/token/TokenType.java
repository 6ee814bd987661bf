package su.grinev.jstream.json.token;

public enum TokenType {
    NONE,
    START_OBJECT,
    END_OBJECT,
    START_ARRAY,
    END_ARRAY,
    PROPERTY_NAME,
    STRING,
    NUMBER,
    TRUE,
    FALSE,
    NULL,
    COMMENT;

    /**
     * True for the tokens a JSON value can begin with.
     */
    public boolean isValueStart() {
        return switch (this) {
            case START_OBJECT, START_ARRAY, STRING, NUMBER, TRUE, FALSE, NULL -> true;
            default -> false;
        };
    }

    public boolean isScalar() {
        return switch (this) {
            case STRING, NUMBER, TRUE, FALSE, NULL -> true;
            default -> false;
        };
    }

    public boolean isContainerEnd() {
        return this == END_OBJECT || this == END_ARRAY;
    }
}
