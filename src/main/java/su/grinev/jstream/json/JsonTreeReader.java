package su.grinev.jstream.json;

import su.grinev.jstream.json.token.TokenType;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;

/**
 * Reads one JSON value into plain Java objects: {@link LinkedHashMap} for objects, {@link ArrayList} for arrays,
 * {@link String}, {@link Boolean}, {@code null}, and {@link Long}, {@link BigInteger} or {@link BigDecimal}
 * for numbers. Nesting is handled with an explicit stack, so deep input does not grow the call stack.
 * A repeated property name keeps the last value.
 */
public class JsonTreeReader {

    /**
     * Reads the value starting at the tokenizer's current token and leaves the tokenizer on its last token.
     */
    public Object read(Utf8JsonTokenizer tokenizer) {
        Deque<ParserContext> stack = new LinkedList<>();
        Object root = open(tokenizer, stack);
        if (stack.isEmpty()) {
            return root;
        }

        String key = null;
        while (!stack.isEmpty()) {
            TokenType type = tokenizer.readRequired();
            ParserContext context = stack.peekLast();

            if (type.isContainerEnd()) {
                stack.removeLast();
                continue;
            }
            if (type == TokenType.PROPERTY_NAME) {
                key = tokenizer.getString();
                continue;
            }

            Object value = open(tokenizer, stack);
            if (context.value instanceof Map<?, ?> object) {
                ((Map<String, Object>) object).put(key, value);
                key = null;
            } else {
                ((List<Object>) context.value).add(value);
            }
        }
        return root;
    }

    private static Object open(Utf8JsonTokenizer tokenizer, Deque<ParserContext> stack) {
        return switch (tokenizer.getTokenType()) {
            case STRING -> tokenizer.getString();
            case NUMBER -> number(tokenizer);
            case TRUE -> Boolean.TRUE;
            case FALSE -> Boolean.FALSE;
            case NULL -> null;
            case START_OBJECT -> {
                Map<String, Object> nestedObject = new LinkedHashMap<>();
                stack.addLast(new ParserContext(nestedObject));
                yield nestedObject;
            }
            case START_ARRAY -> {
                List<Object> nestedArray = new ArrayList<>();
                stack.addLast(new ParserContext(nestedArray));
                yield nestedArray;
            }
            default -> throw new IllegalStateException("Unexpected token " + tokenizer.getTokenType());
        };
    }

    private static Object number(Utf8JsonTokenizer tokenizer) {
        if (!tokenizer.isIntegralNumber()) {
            return tokenizer.getBigDecimal();
        }
        BigInteger value = new BigInteger(tokenizer.getNumberText());
        return value.bitLength() < Long.SIZE ? (Object) value.longValue() : value;
    }

    private record ParserContext(Object value) { }
}
