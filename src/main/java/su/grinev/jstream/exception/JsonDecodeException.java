package su.grinev.jstream.exception;

import lombok.Getter;

import java.lang.reflect.Type;

/**
 * A syntactically valid value that cannot be mapped to the target type.
 */
@Getter
public class JsonDecodeException extends JsonStreamException {

    /**
     * Absolute offset of the offending value in the stream, or -1 when unknown.
     */
    private final long bytePosition;
    private final Type targetType;

    public JsonDecodeException(String message, Type targetType, long bytePosition) {
        super(format(message, targetType, bytePosition));
        this.targetType = targetType;
        this.bytePosition = bytePosition;
    }

    public JsonDecodeException(String message, Type targetType, long bytePosition, Throwable cause) {
        super(format(message, targetType, bytePosition), cause);
        this.targetType = targetType;
        this.bytePosition = bytePosition;
    }

    private static String format(String message, Type targetType, long bytePosition) {
        String typeName = targetType == null ? "?" : targetType.getTypeName();
        if (bytePosition < 0) {
            return "%s [target: %s]".formatted(message, typeName);
        }
        return "%s [target: %s, offset: %d]".formatted(message, typeName, bytePosition);
    }
}
