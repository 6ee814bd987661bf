package su.grinev.jstream.decode;

import su.grinev.jstream.json.JsonValueSpan;

/**
 * Turns the bytes of one top-level array element into a value.
 */
public interface ElementDecoder<T> {

    T decode(JsonValueSpan span);
}
