package su.grinev.jstream.decode;

import su.grinev.jstream.exception.JsonDecodeException;
import su.grinev.jstream.json.Utf8JsonTokenizer;
import su.grinev.jstream.json.token.TokenType;

import java.lang.reflect.Type;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Reads a JSON object into {@code T} through an intermediate builder {@code B}, one setter per known property.
 * Unknown properties are skipped. For a mutable bean the builder is the bean itself, see {@link #forBean}.
 * <pre>{@code
 * ObjectDescriptor<Order, Order.OrderBuilder> orders = ObjectDescriptor.builder(Order.class, Order::builder, Order.OrderBuilder::build)
 *         .field("id", Descriptors.integer(), Order.OrderBuilder::id)
 *         .field("name", Descriptors.string(), Order.OrderBuilder::name)
 *         .build();
 * }</pre>
 */
public class ObjectDescriptor<T, B> implements ValueDescriptor<T> {

    private final Class<T> type;
    private final Supplier<B> factory;
    private final Function<B, T> finisher;
    private final Map<String, FieldBinding<B, ?>> fields;
    private final Map<String, FieldBinding<B, ?>> fieldsIgnoreCase;

    private ObjectDescriptor(Builder<T, B> builder) {
        this.type = builder.type;
        this.factory = builder.factory;
        this.finisher = builder.finisher;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(builder.fields));
        TreeMap<String, FieldBinding<B, ?>> ignoreCase = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        builder.fields.forEach(ignoreCase::putIfAbsent);
        this.fieldsIgnoreCase = Collections.unmodifiableMap(ignoreCase);
    }

    public static <T, B> Builder<T, B> builder(Class<T> type, Supplier<B> factory, Function<B, T> finisher) {
        return new Builder<>(type, factory, finisher);
    }

    public static <T> Builder<T, T> forBean(Class<T> type, Supplier<T> factory) {
        return new Builder<>(type, factory, Function.identity());
    }

    @Override
    public Type getType() {
        return type;
    }

    @Override
    public T read(Utf8JsonTokenizer tokenizer, DecodeContext context) {
        if (tokenizer.getTokenType() == TokenType.NULL) {
            return null;
        }
        if (tokenizer.getTokenType() != TokenType.START_OBJECT) {
            throw Descriptors.mismatch(tokenizer, type);
        }

        Map<String, FieldBinding<B, ?>> lookup = context.caseSensitive() ? fields : fieldsIgnoreCase;
        B target = factory.get();
        while (tokenizer.readRequired() != TokenType.END_OBJECT) {
            FieldBinding<B, ?> binding = lookup.get(tokenizer.getString());
            tokenizer.readRequired();
            if (binding == null) {
                tokenizer.skip();
            } else {
                binding.apply(target, tokenizer, context);
            }
        }
        return finisher.apply(target);
    }

    public Map<String, FieldBinding<B, ?>> getFields() {
        return fields;
    }

    @Override
    public String toString() {
        return "ObjectDescriptor<" + type.getSimpleName() + ">" + fields.keySet();
    }

    public record FieldBinding<B, V>(String name, ValueDescriptor<V> descriptor, BiConsumer<B, ? super V> setter) {

        void apply(B target, Utf8JsonTokenizer tokenizer, DecodeContext context) {
            V value = descriptor.read(tokenizer, context);
            if (value != null) {
                setter.accept(target, value);
                return;
            }
            try {
                setter.accept(target, null);
            } catch (NullPointerException e) {
                // a primitive setter unboxing null
                throw new JsonDecodeException("Property '%s' cannot be null".formatted(name), descriptor.getType(),
                        tokenizer.getTokenOffset(), e);
            }
        }
    }

    public static class Builder<T, B> {
        private final Class<T> type;
        private final Supplier<B> factory;
        private final Function<B, T> finisher;
        private final Map<String, FieldBinding<B, ?>> fields = new LinkedHashMap<>();

        private Builder(Class<T> type, Supplier<B> factory, Function<B, T> finisher) {
            this.type = Objects.requireNonNull(type, "type");
            this.factory = Objects.requireNonNull(factory, "factory");
            this.finisher = Objects.requireNonNull(finisher, "finisher");
        }

        public <V> Builder<T, B> field(String name, ValueDescriptor<V> descriptor, BiConsumer<B, ? super V> setter) {
            if (fields.containsKey(name)) {
                throw new IllegalArgumentException("Duplicate field '%s' for %s".formatted(name, type.getName()));
            }
            fields.put(name, new FieldBinding<>(name, descriptor, setter));
            return this;
        }

        public ObjectDescriptor<T, B> build() {
            return new ObjectDescriptor<>(this);
        }
    }
}
