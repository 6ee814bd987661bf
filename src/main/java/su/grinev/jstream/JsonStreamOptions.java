package su.grinev.jstream;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import su.grinev.jstream.json.JsonReaderOptions;
import su.grinev.jstream.pool.ArrayPool;

/**
 * Settings of a {@link JsonArrayStreamReader}, applied to every stream it opens.
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class JsonStreamOptions {

    public static final int DEFAULT_INITIAL_BUFFER_CAPACITY = 32;

    @Builder.Default
    private final JsonReaderOptions readerOptions = JsonReaderOptions.DEFAULT;
    /**
     * Starting number of slots of the per-stream element buffer; rounded up to a power of two.
     */
    @Builder.Default
    private final int initialBufferCapacity = DEFAULT_INITIAL_BUFFER_CAPACITY;
    @Builder.Default
    private final boolean caseSensitive = false;
    /**
     * When false, element types without a registered descriptor are rejected instead of bound by reflection.
     */
    @Builder.Default
    private final boolean reflectionEnabled = true;
    @Builder.Default
    @ToString.Exclude
    private final ArrayPool arrayPool = ArrayPool.shared();
    /**
     * When true, a top-level value other than an array is a syntax error.
     * When false, tokens are ignored until the first {@code [} at any depth, and input without one yields nothing.
     */
    @Builder.Default
    private final boolean requireTopLevelArray = true;

    public static JsonStreamOptions defaults() {
        return JsonStreamOptions.builder().build();
    }
}
