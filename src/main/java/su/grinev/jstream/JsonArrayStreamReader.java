package su.grinev.jstream;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import su.grinev.jstream.decode.DecodeContext;
import su.grinev.jstream.decode.DecoderRegistry;
import su.grinev.jstream.decode.DescriptorDecoder;
import su.grinev.jstream.decode.ElementDecoder;
import su.grinev.jstream.decode.ReflectiveDecoder;
import su.grinev.jstream.decode.TypeReference;
import su.grinev.jstream.decode.ValueDescriptor;
import su.grinev.jstream.source.CancellationToken;
import su.grinev.jstream.source.ChunkSource;
import su.grinev.jstream.source.InputStreamChunkSource;

import java.io.InputStream;
import java.lang.reflect.Type;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Opens {@link JsonArrayStream}s over chunk sources.
 * <p>
 * The element decoder is chosen once per stream: an explicitly passed descriptor, else the descriptor registered
 * for the element type, else reflective binding when {@link JsonStreamOptions#isReflectionEnabled()}.
 * A reader holds no per-stream state and can be shared.
 * <pre>{@code
 * JsonArrayStreamReader reader = new JsonArrayStreamReader();
 * try (JsonArrayStream<Order> orders = reader.readArray(pipe.reader(), Order.class)) {
 *     for (Order order : orders) {
 *         process(order);
 *     }
 * }
 * }</pre>
 */
@Slf4j
@Getter
public class JsonArrayStreamReader {

    private static final Map<Class<?>, Class<?>> WRAPPERS = Map.of(
            boolean.class, Boolean.class,
            byte.class, Byte.class,
            short.class, Short.class,
            char.class, Character.class,
            int.class, Integer.class,
            long.class, Long.class,
            float.class, Float.class,
            double.class, Double.class);

    private final JsonStreamOptions options;
    private final DecoderRegistry registry;

    public JsonArrayStreamReader() {
        this(JsonStreamOptions.defaults(), new DecoderRegistry());
    }

    public JsonArrayStreamReader(JsonStreamOptions options) {
        this(options, new DecoderRegistry());
    }

    public JsonArrayStreamReader(JsonStreamOptions options, DecoderRegistry registry) {
        this.options = Objects.requireNonNull(options, "options");
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public <T> JsonArrayStream<T> readArray(ChunkSource source, Class<T> elementType) {
        return readArray(source, elementType, CancellationToken.NONE);
    }

    public <T> JsonArrayStream<T> readArray(ChunkSource source, Class<T> elementType, CancellationToken cancellationToken) {
        Class<?> boxed = WRAPPERS.getOrDefault(elementType, elementType);
        return open(source, decoderFor(boxed), cancellationToken, boxed);
    }

    public <T> JsonArrayStream<T> readArray(ChunkSource source, TypeReference<T> elementType) {
        return readArray(source, elementType, CancellationToken.NONE);
    }

    public <T> JsonArrayStream<T> readArray(ChunkSource source, TypeReference<T> elementType, CancellationToken cancellationToken) {
        return open(source, decoderFor(elementType.getType()), cancellationToken, elementType.getType());
    }

    public <T> JsonArrayStream<T> readArray(ChunkSource source, ValueDescriptor<T> descriptor) {
        return readArray(source, descriptor, CancellationToken.NONE);
    }

    public <T> JsonArrayStream<T> readArray(ChunkSource source, ValueDescriptor<T> descriptor, CancellationToken cancellationToken) {
        return open(source, new DescriptorDecoder<>(descriptor, decodeContext()), cancellationToken, descriptor.getType());
    }

    /**
     * Streams from a blocking {@link InputStream}; closing the returned stream closes {@code in}.
     */
    public <T> JsonArrayStream<T> readArray(InputStream in, Class<T> elementType) {
        return readArray(new InputStreamChunkSource(in), elementType, CancellationToken.NONE);
    }

    public <T> JsonArrayStream<T> readArray(InputStream in, TypeReference<T> elementType) {
        return readArray(new InputStreamChunkSource(in), elementType, CancellationToken.NONE);
    }

    @SuppressWarnings("unchecked")
    private <T> ElementDecoder<T> decoderFor(Type elementType) {
        Optional<ValueDescriptor<?>> descriptor = registry.lookup(elementType);
        if (descriptor.isPresent()) {
            return new DescriptorDecoder<>((ValueDescriptor<T>) descriptor.get(), decodeContext());
        }
        if (!options.isReflectionEnabled()) {
            throw new IllegalStateException("No descriptor registered for %s and reflective decoding is disabled"
                    .formatted(elementType.getTypeName()));
        }
        return new ReflectiveDecoder<>(elementType, decodeContext());
    }

    private DecodeContext decodeContext() {
        return options.isCaseSensitive() ? DecodeContext.CASE_SENSITIVE : DecodeContext.CASE_INSENSITIVE;
    }

    private <T> JsonArrayStream<T> open(ChunkSource source, ElementDecoder<T> decoder,
                                        CancellationToken cancellationToken, Type elementType) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(cancellationToken, "cancellationToken");
        log.debug("Opening array stream of {} over {}", elementType.getTypeName(), source);
        return new JsonArrayStream<>(source, decoder, cancellationToken, options);
    }
}
