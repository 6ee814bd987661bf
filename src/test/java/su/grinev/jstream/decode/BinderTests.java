package su.grinev.jstream.decode;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import su.grinev.jstream.dto.Address;
import su.grinev.jstream.dto.Customer;
import su.grinev.jstream.dto.Point;
import su.grinev.jstream.dto.Status;
import su.grinev.jstream.exception.JsonDecodeException;
import su.grinev.jstream.json.JsonTreeReader;
import su.grinev.jstream.json.JsonValueSpan;

import java.lang.reflect.Type;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

public class BinderTests {

    private static final String CUSTOMER = "{\"customerId\": 42, \"fullName\": \"Ann\", \"status\": \"active\","
            + " \"address\": {\"city\": \"Riga\", \"zip\": \"LV-1050\"},"
            + " \"previousAddresses\": [{\"city\": \"Oslo\"}, null],"
            + " \"tags\": [\"a\", \"b\", \"a\"], \"limits\": {\"daily\": 100, \"monthly\": 2000},"
            + " \"balance\": 12.50, \"createdAt\": \"2024-01-02T03:04:05Z\", \"scores\": [3, 1, 2],"
            + " \"cached\": \"ignored\", \"unknown\": {\"deep\": [1, 2, 3]}}";

    private final JsonTreeReader treeReader = new JsonTreeReader();

    @Test
    public void bindObjectGraphTest() {
        Customer customer = (Customer) bind(new Binder(false), Customer.class, CUSTOMER);

        assertEquals(42L, customer.getCustomerId());
        assertEquals("Ann", customer.getFullName());
        assertEquals(Status.ACTIVE, customer.getStatus());
        assertEquals(new Address("Riga", "LV-1050"), customer.getAddress());
        assertEquals(new Address("Oslo", null), customer.getPreviousAddresses().get(0));
        assertNull(customer.getPreviousAddresses().get(1));
        assertEquals(Set.of("a", "b"), customer.getTags());
        assertEquals(Map.of("daily", 100, "monthly", 2000), customer.getLimits());
        assertEquals(new BigDecimal("12.50"), customer.getBalance());
        assertEquals(Instant.parse("2024-01-02T03:04:05Z"), customer.getCreatedAt());
        assertArrayEquals(new int[]{3, 1, 2}, customer.getScores());
        assertEquals("untouched", customer.getCached());
    }

    @Test
    public void caseInsensitiveMatchingTest() {
        Customer customer = (Customer) bind(new Binder(false), Customer.class, "{\"CUSTOMERID\": 7, \"fullname\": \"Bob\"}");

        assertEquals(7L, customer.getCustomerId());
        assertEquals("Bob", customer.getFullName());
    }

    @Test
    public void caseSensitiveMatchingTest() {
        Customer customer = (Customer) bind(new Binder(true), Customer.class,
                "{\"CUSTOMERID\": 7, \"fullName\": \"Bob\"}");

        assertEquals(0L, customer.getCustomerId());
        assertEquals("Bob", customer.getFullName());
        assertNull(customer.getStatus());
    }

    @Test
    public void caseSensitiveEnumTest() {
        JsonDecodeException e = assertThrows(JsonDecodeException.class,
                () -> bind(new Binder(true), Customer.class, "{\"status\": \"active\"}"));

        assertTrue(e.getMessage().contains("$.status"));
    }

    @Test
    public void recordTest() {
        assertEquals(new Point(1, 2, "p"), bind(new Binder(false), Point.class, "{\"x\": 1, \"Y\": 2, \"label\": \"p\", \"z\": 9}"));
        assertEquals(new Point(0, 5, null), bind(new Binder(false), Point.class, "{\"y\": 5}"));
    }

    @Test
    public void genericCollectionsTest() {
        Type type = new TypeReference<Map<String, List<Point>>>() { }.getType();

        Object value = bind(new Binder(false), type, "{\"a\": [{\"x\": 1, \"y\": 1}], \"b\": []}");

        assertEquals(Map.of("a", List.of(new Point(1, 1, null)), "b", List.of()), value);
    }

    @Test
    public void scalarTargetsTest() {
        Binder binder = new Binder(false);

        assertEquals('x', bind(binder, char.class, "\"x\""));
        assertEquals((short) -3, bind(binder, Short.class, "-3"));
        assertEquals(2.5f, bind(binder, float.class, "2.5"));
        assertEquals(1e300, bind(binder, double.class, "1e300"));
        assertEquals(new BigInteger("12345678901234567890"), bind(binder, BigInteger.class, "12345678901234567890"));
        assertEquals(UUID.fromString("123e4567-e89b-12d3-a456-426614174000"),
                bind(binder, UUID.class, "\"123e4567-e89b-12d3-a456-426614174000\""));
        assertNull(bind(binder, Integer.class, "null"));
        assertEquals(List.of(1L, "x"), bind(binder, Object.class, "[1, \"x\"]"));
    }

    @Test
    public void numberOutOfRangeTest() {
        JsonDecodeException e = assertThrows(JsonDecodeException.class, () -> bind(new Binder(false), int.class, "3000000000"));

        assertInstanceOf(ArithmeticException.class, e.getCause());
        assertEquals(int.class, e.getTargetType());
        assertThrows(JsonDecodeException.class, () -> bind(new Binder(false), long.class, "1.5"));
    }

    @Test
    @Timeout(10)
    public void exponentIntoBigIntegerTest() {
        Binder binder = new Binder(false);

        assertEquals(BigInteger.valueOf(1500), bind(binder, BigInteger.class, "1.5e3"));
        JsonDecodeException huge = assertThrows(JsonDecodeException.class, () -> bind(binder, BigInteger.class, "1e999999999"));
        assertInstanceOf(ArithmeticException.class, huge.getCause());
        assertThrows(JsonDecodeException.class, () -> bind(binder, BigInteger.class, "1e-999999999"));
        assertThrows(JsonDecodeException.class, () -> bind(binder, long.class, "1e999999999"));
    }

    @Test
    public void typeMismatchTest() {
        JsonDecodeException e = assertThrows(JsonDecodeException.class,
                () -> new Binder(false).bind(Customer.class, treeReader.read(JsonValueSpan.of("{\"address\": [1]}").openTokenizer()), 77));

        assertEquals(77, e.getBytePosition());
        assertEquals(Customer.class, e.getTargetType());
        assertTrue(e.getMessage().contains("Expected object but found array at $.address"), e.getMessage());
    }

    @Test
    public void nullIntoPrimitiveTest() {
        assertThrows(JsonDecodeException.class, () -> bind(new Binder(false), Point.class, "{\"x\": null}"));
    }

    @Test
    public void invalidTextValueTest() {
        JsonDecodeException e = assertThrows(JsonDecodeException.class,
                () -> bind(new Binder(false), Customer.class, "{\"createdAt\": \"yesterday\"}"));

        assertTrue(e.getMessage().contains("$.createdAt"));
    }

    @Test
    public void abstractTargetTest() {
        assertThrows(JsonDecodeException.class, () -> bind(new Binder(false), Runnable.class, "{}"));
        assertThrows(JsonDecodeException.class, () -> bind(new Binder(false), new TypeReference<Map<Integer, String>>() { }.getType(), "{}"));
    }

    private Object bind(Binder binder, Type type, String json) {
        return binder.bind(type, treeReader.read(JsonValueSpan.of(json).openTokenizer()), 0);
    }
}
