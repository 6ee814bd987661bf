package su.grinev.jstream.decode;

import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.Type;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Descriptors by declared type. Registering a type that is already present replaces the earlier descriptor.
 * Safe for concurrent use; each stream reads it once when it starts.
 */
@Slf4j
public class DecoderRegistry {

    private final Map<Type, ValueDescriptor<?>> descriptors = new ConcurrentHashMap<>();

    public DecoderRegistry register(ValueDescriptor<?> descriptor) {
        return register(descriptor.getType(), descriptor);
    }

    public <T> DecoderRegistry register(Class<T> type, ValueDescriptor<? extends T> descriptor) {
        return register((Type) type, descriptor);
    }

    public <T> DecoderRegistry register(TypeReference<T> type, ValueDescriptor<? extends T> descriptor) {
        return register(type.getType(), descriptor);
    }

    public DecoderRegistry register(Type type, ValueDescriptor<?> descriptor) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(descriptor, "descriptor");
        ValueDescriptor<?> previous = descriptors.put(type, descriptor);
        if (previous != null && previous != descriptor) {
            log.debug("Replaced descriptor for {}: {} -> {}", type.getTypeName(), previous, descriptor);
        } else {
            log.debug("Registered descriptor for {}", type.getTypeName());
        }
        return this;
    }

    public DecoderRegistry registerAll(DescriptorContext context) {
        context.descriptors().forEach(this::register);
        return this;
    }

    @SuppressWarnings("unchecked")
    public <T> Optional<ValueDescriptor<T>> lookup(Class<T> type) {
        return Optional.ofNullable((ValueDescriptor<T>) descriptors.get(type));
    }

    @SuppressWarnings("unchecked")
    public <T> Optional<ValueDescriptor<T>> lookup(TypeReference<T> type) {
        return Optional.ofNullable((ValueDescriptor<T>) descriptors.get(type.getType()));
    }

    public Optional<ValueDescriptor<?>> lookup(Type type) {
        return Optional.ofNullable(descriptors.get(type));
    }

    public boolean contains(Type type) {
        return descriptors.containsKey(type);
    }

    public int size() {
        return descriptors.size();
    }
}
