package su.grinev.jstream.decode;

import su.grinev.jstream.json.Utf8JsonTokenizer;

import java.lang.reflect.Type;

/**
 * Precompiled plan for reading one JSON value of a known type without reflection.
 * <p>
 * {@link #read} is called with the tokenizer on the first token of the value and must return with the tokenizer
 * on the last token of that value: the matching end token for objects and arrays, the token itself for scalars.
 */
public interface ValueDescriptor<T> {

    Type getType();

    T read(Utf8JsonTokenizer tokenizer, DecodeContext context);
}
