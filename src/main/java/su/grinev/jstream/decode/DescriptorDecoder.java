package su.grinev.jstream.decode;

import su.grinev.jstream.exception.JsonDecodeException;
import su.grinev.jstream.json.JsonValueSpan;
import su.grinev.jstream.json.Utf8JsonTokenizer;

/**
 * Decodes elements with a {@link ValueDescriptor}. Conversion failures inside the descriptor are reported
 * as {@link JsonDecodeException} at the token being read when they happened.
 */
public class DescriptorDecoder<T> implements ElementDecoder<T> {

    private final ValueDescriptor<T> descriptor;
    private final DecodeContext context;

    public DescriptorDecoder(ValueDescriptor<T> descriptor, DecodeContext context) {
        this.descriptor = descriptor;
        this.context = context;
    }

    @Override
    public T decode(JsonValueSpan span) {
        Utf8JsonTokenizer tokenizer = span.openTokenizer();
        try {
            return descriptor.read(tokenizer, context);
        } catch (NumberFormatException | ArithmeticException | IllegalStateException e) {
            throw new JsonDecodeException("Cannot decode value: " + e.getMessage(), descriptor.getType(),
                    tokenizer.getTokenOffset(), e);
        }
    }

    public ValueDescriptor<T> getDescriptor() {
        return descriptor;
    }
}
