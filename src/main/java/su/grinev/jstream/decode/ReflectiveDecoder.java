package su.grinev.jstream.decode;

import lombok.extern.slf4j.Slf4j;
import su.grinev.jstream.exception.JsonDecodeException;
import su.grinev.jstream.json.JsonTreeReader;
import su.grinev.jstream.json.JsonValueSpan;
import su.grinev.jstream.json.Utf8JsonTokenizer;

import java.lang.reflect.Type;

/**
 * Fallback decoder for types without a descriptor: reads the element into a plain object tree
 * and binds it to the declared type by reflection.
 */
@Slf4j
public class ReflectiveDecoder<T> implements ElementDecoder<T> {

    private final Type type;
    private final JsonTreeReader treeReader = new JsonTreeReader();
    private final Binder binder;

    public ReflectiveDecoder(Type type, DecodeContext context) {
        this.type = type;
        this.binder = new Binder(context.caseSensitive());
        log.debug("Using reflective decoding for {}", type.getTypeName());
    }

    @Override
    @SuppressWarnings("unchecked")
    public T decode(JsonValueSpan span) {
        Utf8JsonTokenizer tokenizer = span.openTokenizer();
        Object tree;
        try {
            tree = treeReader.read(tokenizer);
        } catch (NumberFormatException e) {
            throw new JsonDecodeException("Cannot read number: " + e.getMessage(), type, tokenizer.getTokenOffset(), e);
        }
        return (T) binder.bind(type, tree, span.streamOffset());
    }
}
