package su.grinev.jstream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import su.grinev.jstream.decode.Descriptors;
import su.grinev.jstream.decode.ObjectDescriptor;
import su.grinev.jstream.decode.ValueDescriptor;
import su.grinev.jstream.dto.Order;
import su.grinev.jstream.exception.JsonDecodeException;
import su.grinev.jstream.exception.JsonSyntaxException;
import su.grinev.jstream.exception.StreamCancelledException;
import su.grinev.jstream.json.CommentHandling;
import su.grinev.jstream.json.JsonReaderOptions;
import su.grinev.jstream.pool.ArrayPool;
import su.grinev.jstream.source.BytePipe;
import su.grinev.jstream.source.CancellationToken;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class JsonArrayStreamTests {

    private static final String MIXED = "[{\"id\":1,\"name\":\"Aé\"}, {\"id\":2,\"name\":\"B\\\"q\\u0041\"},"
            + "[1,2,{\"x\":null}], \"s\\\\t\", -12.5e3, 123456789012345678901234567890, true, false, null, {}]";

    private static final ValueDescriptor<Order> ORDER =
            ObjectDescriptor.builder(Order.class, Order::builder, Order.OrderBuilder::build)
                    .field("id", Descriptors.integer(), Order.OrderBuilder::id)
                    .field("name", Descriptors.string(), Order.OrderBuilder::name)
                    .build();

    private final ArrayPool pool = new ArrayPool(8);
    private final JsonArrayStreamReader reader = new JsonArrayStreamReader(JsonStreamOptions.builder()
            .arrayPool(pool)
            .build());

    @Test
    public void objectSplitMidPropertyNameTest() {
        ScriptedChunkSource source = ScriptedChunkSource.ofChunks("[{\"id\":1,\"na", "me\":\"A\"},{\"id\":2,\"name\":\"B\"}]");

        try (JsonArrayStream<Order> stream = reader.readArray(source, Order.class)) {
            assertEquals(List.of(new Order(1, "A"), new Order(2, "B")), collect(stream));
            assertEquals(JsonArrayStream.State.DONE, stream.state());
        }
        assertTrue(source.closed);
        assertEquals(0, pool.borrowedCount());
    }

    @Test
    public void primitiveArrayTest() {
        JsonArrayStream<Integer> stream = reader.readArray(ScriptedChunkSource.ofChunks("[1,2,3,4,5]"), Integer.class);

        assertEquals(List.of(1, 2, 3, 4, 5), collect(stream));
        assertEquals(0, pool.borrowedCount());
    }

    @Test
    public void primitiveClassIsBoxedTest() {
        JsonArrayStream<Integer> stream = reader.readArray(ScriptedChunkSource.ofChunks("[7, 8]"), int.class);

        assertEquals(List.of(7, 8), collect(stream));
        assertEquals(List.of(true, false), collect(reader.readArray(ScriptedChunkSource.ofChunks("[true, false]"), boolean.class)));
        assertEquals(List.of(1.5, -2.0), collect(reader.readArray(ScriptedChunkSource.ofChunks("[1.5, -2]"), double.class)));
        assertEquals(List.of(3L), collect(reader.readArray(ScriptedChunkSource.ofChunks("[3]"), long.class)));
    }

    @Test
    public void bytesAfterArrayEndAreNotReadTest() {
        ScriptedChunkSource source = ScriptedChunkSource.ofChunks("[1,2] }{ garbage", "[3, \"never\"");

        try (JsonArrayStream<Integer> stream = reader.readArray(source, Integer.class)) {
            assertEquals(List.of(1, 2), collect(stream));
            assertEquals(JsonArrayStream.State.DONE, stream.state());
            assertFalse(stream.hasNext());
        }
        assertEquals(1, source.reads);
        assertEquals(0, pool.borrowedCount());
    }

    @Test
    public void emptyArrayTest() {
        JsonArrayStream<Integer> stream = reader.readArray(ScriptedChunkSource.ofChunks(" [ ] "), Integer.class);

        assertFalse(stream.hasNext());
        assertEquals(JsonArrayStream.State.DONE, stream.state());
        assertEquals(0, pool.borrowedCount());
    }

    @Test
    public void emptySourceTest() {
        JsonArrayStream<Integer> stream = reader.readArray(ScriptedChunkSource.ofChunks(), Integer.class);

        assertFalse(stream.hasNext());
        assertEquals(JsonArrayStream.State.DONE, stream.state());
    }

    @Test
    public void oneByteChunksTest() {
        ScriptedChunkSource source = ScriptedChunkSource.split(MIXED, 1);

        List<Object> elements = collect(reader.readArray(source, Object.class));

        assertEquals(wholeBuffer(MIXED), elements);
        assertTrue(source.reads > MIXED.length());
    }

    @Test
    public void everySplitPointGivesSameElementsTest() {
        byte[] json = MIXED.getBytes(StandardCharsets.UTF_8);
        List<Object> expected = wholeBuffer(MIXED);

        for (int i = 1; i < json.length; i++) {
            ScriptedChunkSource source = ScriptedChunkSource.ofBytes(
                    Arrays.copyOfRange(json, 0, i), Arrays.copyOfRange(json, i, json.length));
            assertEquals(expected, collect(reader.readArray(source, Object.class)), "split at " + i);
        }
        assertEquals(0, pool.borrowedCount());
    }

    @Test
    public void everyChunkSizeGivesSameElementsTest() {
        List<Object> expected = wholeBuffer(MIXED);

        for (int size = 1; size <= MIXED.length(); size++) {
            assertEquals(expected, collect(reader.readArray(ScriptedChunkSource.split(MIXED, size), Object.class)),
                    "chunk size " + size);
        }
    }

    @Test
    public void genericElementsTest() {
        List<Object> elements = wholeBuffer(MIXED);

        assertEquals(10, elements.size());
        assertEquals(Map.of("id", 1L, "name", "Aé"), elements.get(0));
        assertEquals("B\"qA", ((Map<?, ?>) elements.get(1)).get("name"));
        assertEquals("s\\t", elements.get(3));
        assertEquals(new BigDecimal("-12.5e3"), elements.get(4));
        assertEquals(new BigInteger("123456789012345678901234567890"), elements.get(5));
        assertEquals(Boolean.TRUE, elements.get(6));
        assertNull(elements.get(8));
        assertEquals(Map.of(), elements.get(9));
    }

    @Test
    public void syntaxErrorAfterDeliveredElementsTest() {
        JsonArrayStream<Integer> stream = reader.readArray(ScriptedChunkSource.ofChunks("[1, abc]"), Integer.class);

        assertTrue(stream.hasNext());
        assertEquals(1, stream.next());
        JsonSyntaxException e = assertThrows(JsonSyntaxException.class, stream::hasNext);
        assertEquals(4, e.getBytePosition());
        assertEquals(1, e.getLineNumber());
        assertEquals(4, e.getBytePositionInLine());
        assertEquals(JsonArrayStream.State.FAULTED, stream.state());
        assertSame(e, assertThrows(JsonSyntaxException.class, stream::hasNext));
        assertEquals(0, pool.borrowedCount());
    }

    @Test
    public void syntaxErrorLineNumberTest() {
        JsonArrayStream<Integer> stream = reader.readArray(ScriptedChunkSource.split("[1,\n2,\n  x]", 3), Integer.class);

        assertEquals(1, stream.next());
        assertEquals(2, stream.next());
        JsonSyntaxException e = assertThrows(JsonSyntaxException.class, stream::hasNext);
        assertEquals(3, e.getLineNumber());
        assertEquals(2, e.getBytePositionInLine());
        assertEquals(9, e.getBytePosition());
    }

    @Test
    public void truncatedArrayTest() {
        JsonArrayStream<Integer> stream = reader.readArray(ScriptedChunkSource.ofChunks("[1,", "2"), Integer.class);

        assertEquals(1, stream.next());
        assertEquals(2, stream.next());
        assertThrows(JsonSyntaxException.class, stream::hasNext);
        assertEquals(0, pool.borrowedCount());
    }

    @Test
    public void truncatedArrayAtElementBoundaryTest() {
        JsonArrayStream<Integer> stream = reader.readArray(ScriptedChunkSource.ofChunks("[1,2", ",", ""), Integer.class);

        assertEquals(List.of(1, 2), take(stream, 2));
        assertThrows(JsonSyntaxException.class, stream::hasNext);
    }

    @Test
    public void topLevelObjectRejectedTest() {
        JsonArrayStream<Integer> stream = reader.readArray(ScriptedChunkSource.ofChunks("{\"a\":[1]}"), Integer.class);

        JsonSyntaxException e = assertThrows(JsonSyntaxException.class, stream::hasNext);
        assertEquals(0, e.getBytePosition());
        assertTrue(e.getMessage().contains("Expected a JSON array"));
    }

    @Test
    public void lenientTopLevelFindsFirstArrayTest() {
        JsonArrayStreamReader lenient = new JsonArrayStreamReader(JsonStreamOptions.builder()
                .requireTopLevelArray(false)
                .build());

        assertEquals(List.of(1, 2), collect(lenient.readArray(
                ScriptedChunkSource.split("{\"meta\":{\"n\":2},\"items\":[1,2]}", 4), Integer.class)));
        assertEquals(List.of(), collect(lenient.readArray(ScriptedChunkSource.ofChunks("\"text\""), Integer.class)));
    }

    @Test
    public void byteOrderMarkTest() {
        byte[] json = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF, '[', '4', ']'};

        assertEquals(List.of(4), collect(reader.readArray(ScriptedChunkSource.split(json, 1), Integer.class)));
    }

    @Test
    public void commentsRejectedByDefaultTest() {
        JsonArrayStream<Integer> stream = reader.readArray(ScriptedChunkSource.ofChunks("[1, /* two */ 2]"), Integer.class);

        assertEquals(1, stream.next());
        assertThrows(JsonSyntaxException.class, stream::hasNext);
    }

    @Test
    public void commentsSkippedTest() {
        for (CommentHandling handling : List.of(CommentHandling.SKIP, CommentHandling.ALLOW)) {
            JsonArrayStreamReader commentReader = new JsonArrayStreamReader(JsonStreamOptions.builder()
                    .readerOptions(JsonReaderOptions.builder().commentHandling(handling).build())
                    .build());
            String json = "// orders\n[{\"id\":1, /* inline */ \"name\":\"A\"}, // first\n {\"id\":2,\"name\":\"B\"} /* last */]";

            for (int size = 1; size <= json.length(); size += 3) {
                assertEquals(List.of(new Order(1, "A"), new Order(2, "B")),
                        collect(commentReader.readArray(ScriptedChunkSource.split(json, size), Order.class)),
                        handling + " chunk size " + size);
            }
        }
    }

    @Test
    public void trailingCommaTest() {
        JsonArrayStream<Integer> strict = reader.readArray(ScriptedChunkSource.ofChunks("[1,2,]"), Integer.class);
        assertEquals(List.of(1, 2), take(strict, 2));
        assertThrows(JsonSyntaxException.class, strict::hasNext);

        JsonArrayStreamReader lenient = new JsonArrayStreamReader(JsonStreamOptions.builder()
                .readerOptions(JsonReaderOptions.builder().allowTrailingCommas(true).build())
                .build());
        assertEquals(List.of(new Order(1, "A")),
                collect(lenient.readArray(ScriptedChunkSource.ofChunks("[{\"id\":1,\"name\":\"A\",},]"), Order.class)));
    }

    @Test
    public void caseInsensitiveByDefaultTest() {
        List<Order> orders = collect(reader.readArray(ScriptedChunkSource.ofChunks("[{\"ID\":7,\"NAME\":\"x\"}]"), Order.class));

        assertEquals(List.of(new Order(7, "x")), orders);
    }

    @Test
    public void caseSensitiveTest() {
        JsonArrayStreamReader sensitive = new JsonArrayStreamReader(JsonStreamOptions.builder()
                .caseSensitive(true)
                .build());

        List<Order> orders = collect(sensitive.readArray(
                ScriptedChunkSource.ofChunks("[{\"ID\":7,\"name\":\"x\"}]"), Order.class));

        assertEquals(List.of(new Order(0, "x")), orders);
    }

    @Test
    public void decodeErrorTest() {
        JsonArrayStream<Order> stream = reader.readArray(
                ScriptedChunkSource.ofChunks("[{\"id\":1}, {\"id\":\"x\"}]"), Order.class);

        assertEquals(new Order(1, null), stream.next());
        JsonDecodeException e = assertThrows(JsonDecodeException.class, stream::hasNext);
        assertEquals(11, e.getBytePosition());
        assertEquals(Order.class, e.getTargetType());
        assertEquals(0, pool.borrowedCount());
    }

    @Test
    public void descriptorDecodeErrorTest() {
        JsonArrayStream<Integer> stream = reader.readArray(ScriptedChunkSource.ofChunks("[1, 2.5]"), Descriptors.integer());

        assertEquals(1, stream.next());
        JsonDecodeException e = assertThrows(JsonDecodeException.class, stream::hasNext);
        assertEquals(4, e.getBytePosition());
    }

    @Test
    public void nullForPrimitivePropertyTest() {
        JsonArrayStream<Order> stream = reader.readArray(
                ScriptedChunkSource.ofChunks("[{\"id\":1,\"name\":\"A\"},{\"id\":null,\"name\":\"B\"}]"), ORDER);

        assertEquals(new Order(1, "A"), stream.next());
        JsonDecodeException e = assertThrows(JsonDecodeException.class, stream::hasNext);
        assertEquals(27, e.getBytePosition());
        assertEquals(JsonArrayStream.State.FAULTED, stream.state());
        assertEquals(0, pool.borrowedCount());
    }

    @Test
    public void invalidUtf8InStringTest() {
        byte[] json = {'[', '"', 'o', 'k', '"', ',', '"', (byte) 0xFF, (byte) 0xFE, '"', ']'};
        JsonArrayStream<String> stream = reader.readArray(ScriptedChunkSource.ofBytes(json), String.class);

        assertEquals("ok", stream.next());
        JsonSyntaxException e = assertThrows(JsonSyntaxException.class, stream::hasNext);
        assertEquals(7, e.getBytePosition());
        assertEquals(0, pool.borrowedCount());

        JsonArrayStream<String> described = reader.readArray(ScriptedChunkSource.ofBytes(json), Descriptors.string());
        assertEquals("ok", described.next());
        assertThrows(JsonSyntaxException.class, described::hasNext);
    }

    @Test
    @Timeout(10)
    public void oversizedExponentTest() {
        assertThrows(JsonDecodeException.class,
                () -> collect(reader.readArray(ScriptedChunkSource.ofChunks("[1e999999999]"), BigInteger.class)));
        assertThrows(JsonDecodeException.class,
                () -> collect(reader.readArray(ScriptedChunkSource.ofChunks("[1e999999999]"), Descriptors.bigInteger())));
        JsonDecodeException e = assertThrows(JsonDecodeException.class,
                () -> collect(reader.readArray(ScriptedChunkSource.ofChunks("[0, 1e9999999999]"), Object.class)));
        assertEquals(4, e.getBytePosition());
        assertEquals(0, pool.borrowedCount());
    }

    @Test
    public void bufferGrowsBeyondInitialCapacityTest() {
        JsonArrayStreamReader smallBuffer = new JsonArrayStreamReader(JsonStreamOptions.builder()
                .arrayPool(pool)
                .initialBufferCapacity(2)
                .build());
        StringBuilder json = new StringBuilder("[");
        List<Integer> expected = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            json.append(i == 0 ? "" : ",").append(i);
            expected.add(i);
        }
        json.append(']');

        assertEquals(expected, collect(smallBuffer.readArray(ScriptedChunkSource.ofChunks(json.toString()), Integer.class)));
        assertEquals(0, pool.borrowedCount());
    }

    @Test
    public void cancelBeforeFirstPullTest() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        ScriptedChunkSource source = ScriptedChunkSource.ofChunks("[1,2,3]");

        JsonArrayStream<Integer> stream = reader.readArray(source, Integer.class, token);
        assertEquals(1, pool.borrowedCount());

        assertThrows(StreamCancelledException.class, stream::hasNext);
        assertEquals(JsonArrayStream.State.CANCELLED, stream.state());
        assertEquals(0, source.reads);
        assertEquals(0, pool.borrowedCount());
    }

    @Test
    public void cancelBetweenPullsTest() {
        CancellationToken token = new CancellationToken();
        JsonArrayStream<Integer> stream = reader.readArray(ScriptedChunkSource.ofChunks("[1,2", ",3]"), Integer.class, token);

        assertEquals(1, stream.next());
        token.cancel();

        assertThrows(StreamCancelledException.class, stream::hasNext);
        assertEquals(0, pool.borrowedCount());
    }

    @Test
    public void closeReleasesBufferTest() {
        ScriptedChunkSource source = ScriptedChunkSource.ofChunks("[1,2", ",3]");
        JsonArrayStream<Integer> stream = reader.readArray(source, Integer.class);
        assertEquals(1, stream.next());

        stream.close();
        stream.close();

        assertEquals(JsonArrayStream.State.CLOSED, stream.state());
        assertFalse(stream.hasNext());
        assertTrue(source.closed);
        assertEquals(0, pool.borrowedCount());
    }

    @Test
    public void sourceFaultPropagatesUnchangedTest() {
        BytePipe pipe = new BytePipe();
        pipe.write("[1,".getBytes(StandardCharsets.UTF_8));
        pipe.complete(new IOException("connection reset"));

        JsonArrayStream<Integer> stream = reader.readArray(pipe.reader(), Integer.class);

        assertEquals(1, stream.next());
        UncheckedIOException e = assertThrows(UncheckedIOException.class, stream::hasNext);
        assertEquals("connection reset", e.getCause().getMessage());
        assertEquals(JsonArrayStream.State.FAULTED, stream.state());
        assertEquals(0, pool.borrowedCount());
    }

    @Test
    public void concurrentWriterTest() throws InterruptedException {
        BytePipe pipe = new BytePipe();
        byte[] json = MIXED.getBytes(StandardCharsets.UTF_8);
        Thread writer = new Thread(() -> {
            for (int i = 0; i < json.length; i += 5) {
                pipe.write(json, i, Math.min(5, json.length - i));
                Thread.yield();
            }
            pipe.complete();
        });
        writer.start();

        List<Object> elements = collect(reader.readArray(pipe.reader(), Object.class));
        writer.join();

        assertEquals(wholeBuffer(MIXED), elements);
    }

    @Test
    public void sameBytesTwiceGiveSameElementsTest() {
        List<Object> first = collect(reader.readArray(ScriptedChunkSource.split(MIXED, 7), Object.class));
        List<Object> second = collect(reader.readArray(ScriptedChunkSource.split(MIXED, 7), Object.class));

        assertEquals(first, second);
    }

    @Test
    public void streamTest() {
        try (JsonArrayStream<Order> orders = reader.readArray(
                ScriptedChunkSource.ofChunks("[{\"id\":1,\"name\":\"A\"},{\"id\":2,\"name\":\"B\"}]"), Order.class)) {
            assertEquals(List.of("A", "B"), orders.stream().map(Order::getName).toList());
            assertThrows(IllegalStateException.class, orders::iterator);
        }
    }

    private List<Object> wholeBuffer(String json) {
        return collect(reader.readArray(ScriptedChunkSource.ofChunks(json), Object.class));
    }

    private static <T> List<T> collect(JsonArrayStream<T> stream) {
        List<T> elements = new ArrayList<>();
        for (T element : stream) {
            elements.add(element);
        }
        return elements;
    }

    private static <T> List<T> take(JsonArrayStream<T> stream, int count) {
        List<T> elements = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            elements.add(stream.next());
        }
        return elements;
    }
}
