package su.grinev.jstream.decode;

import su.grinev.jstream.exception.JsonDecodeException;
import su.grinev.jstream.json.JsonTreeReader;
import su.grinev.jstream.json.Utf8JsonTokenizer;
import su.grinev.jstream.json.token.TokenType;

import java.lang.reflect.Type;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;

/**
 * Ready-made descriptors for scalars and containers. Every descriptor returns {@code null} for a JSON {@code null}.
 */
public final class Descriptors {

    private static final ValueDescriptor<String> STRING = scalar(String.class, TokenType.STRING,
            (tokenizer, context) -> tokenizer.getString());
    private static final ValueDescriptor<Integer> INTEGER = scalar(Integer.class, TokenType.NUMBER,
            (tokenizer, context) -> tokenizer.getInt());
    private static final ValueDescriptor<Long> LONG = scalar(Long.class, TokenType.NUMBER,
            (tokenizer, context) -> tokenizer.getLong());
    private static final ValueDescriptor<Double> DOUBLE = scalar(Double.class, TokenType.NUMBER,
            (tokenizer, context) -> tokenizer.getDouble());
    private static final ValueDescriptor<BigDecimal> BIG_DECIMAL = scalar(BigDecimal.class, TokenType.NUMBER,
            (tokenizer, context) -> tokenizer.getBigDecimal());
    private static final ValueDescriptor<BigInteger> BIG_INTEGER = scalar(BigInteger.class, TokenType.NUMBER,
            (tokenizer, context) -> tokenizer.getBigInteger());
    private static final ValueDescriptor<Boolean> BOOLEAN = new ValueDescriptor<>() {
        @Override
        public Type getType() {
            return Boolean.class;
        }

        @Override
        public Boolean read(Utf8JsonTokenizer tokenizer, DecodeContext context) {
            return switch (tokenizer.getTokenType()) {
                case TRUE -> Boolean.TRUE;
                case FALSE -> Boolean.FALSE;
                case NULL -> null;
                default -> throw mismatch(tokenizer, Boolean.class);
            };
        }
    };
    private static final ValueDescriptor<Object> GENERIC = new ValueDescriptor<>() {
        private final JsonTreeReader treeReader = new JsonTreeReader();

        @Override
        public Type getType() {
            return Object.class;
        }

        @Override
        public Object read(Utf8JsonTokenizer tokenizer, DecodeContext context) {
            return treeReader.read(tokenizer);
        }
    };

    private Descriptors() {
    }

    public static ValueDescriptor<String> string() {
        return STRING;
    }

    public static ValueDescriptor<Integer> integer() {
        return INTEGER;
    }

    public static ValueDescriptor<Long> longValue() {
        return LONG;
    }

    public static ValueDescriptor<Double> doubleValue() {
        return DOUBLE;
    }

    public static ValueDescriptor<BigDecimal> bigDecimal() {
        return BIG_DECIMAL;
    }

    public static ValueDescriptor<BigInteger> bigInteger() {
        return BIG_INTEGER;
    }

    public static ValueDescriptor<Boolean> bool() {
        return BOOLEAN;
    }

    /**
     * Any JSON value as maps, lists, strings, numbers and booleans, see {@link JsonTreeReader}.
     */
    public static ValueDescriptor<Object> generic() {
        return GENERIC;
    }

    /**
     * Enum constant by name; the name comparison follows the context's case sensitivity.
     */
    public static <E extends Enum<E>> ValueDescriptor<E> enumByName(Class<E> enumType) {
        E[] constants = enumType.getEnumConstants();
        return scalar(enumType, TokenType.STRING, (tokenizer, context) -> {
            String name = tokenizer.getString();
            for (E constant : constants) {
                if (context.matches(constant.name(), name)) {
                    return constant;
                }
            }
            throw new JsonDecodeException("Unknown constant '%s'".formatted(name), enumType, tokenizer.getTokenOffset());
        });
    }

    public static <E> ValueDescriptor<List<E>> listOf(ValueDescriptor<E> itemDescriptor) {
        Type listType = GenericTypes.parameterized(List.class, itemDescriptor.getType());
        return new ValueDescriptor<>() {
            @Override
            public Type getType() {
                return listType;
            }

            @Override
            public List<E> read(Utf8JsonTokenizer tokenizer, DecodeContext context) {
                if (tokenizer.getTokenType() == TokenType.NULL) {
                    return null;
                }
                if (tokenizer.getTokenType() != TokenType.START_ARRAY) {
                    throw mismatch(tokenizer, listType);
                }
                List<E> items = new ArrayList<>();
                while (tokenizer.readRequired() != TokenType.END_ARRAY) {
                    items.add(itemDescriptor.read(tokenizer, context));
                }
                return items;
            }
        };
    }

    /**
     * JSON object as a map keyed by property name, in document order. A repeated name keeps the last value.
     */
    public static <V> ValueDescriptor<Map<String, V>> mapOf(ValueDescriptor<V> valueDescriptor) {
        Type mapType = GenericTypes.parameterized(Map.class, String.class, valueDescriptor.getType());
        return new ValueDescriptor<>() {
            @Override
            public Type getType() {
                return mapType;
            }

            @Override
            public Map<String, V> read(Utf8JsonTokenizer tokenizer, DecodeContext context) {
                if (tokenizer.getTokenType() == TokenType.NULL) {
                    return null;
                }
                if (tokenizer.getTokenType() != TokenType.START_OBJECT) {
                    throw mismatch(tokenizer, mapType);
                }
                Map<String, V> entries = new LinkedHashMap<>();
                while (tokenizer.readRequired() != TokenType.END_OBJECT) {
                    String key = tokenizer.getString();
                    tokenizer.readRequired();
                    entries.put(key, valueDescriptor.read(tokenizer, context));
                }
                return entries;
            }
        };
    }

    static JsonDecodeException mismatch(Utf8JsonTokenizer tokenizer, Type targetType) {
        return new JsonDecodeException("Cannot read %s token".formatted(tokenizer.getTokenType()), targetType,
                tokenizer.getTokenOffset());
    }

    private static <T> ValueDescriptor<T> scalar(Class<T> type, TokenType expected,
                                                 BiFunction<Utf8JsonTokenizer, DecodeContext, T> reader) {
        return new ValueDescriptor<>() {
            @Override
            public Type getType() {
                return type;
            }

            @Override
            public T read(Utf8JsonTokenizer tokenizer, DecodeContext context) {
                TokenType tokenType = tokenizer.getTokenType();
                if (tokenType == TokenType.NULL) {
                    return null;
                }
                if (tokenType != expected) {
                    throw mismatch(tokenizer, type);
                }
                return reader.apply(tokenizer, context);
            }

            @Override
            public String toString() {
                return "ValueDescriptor<" + type.getSimpleName() + ">";
            }
        };
    }
}
