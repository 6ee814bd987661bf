package su.grinev.jstream.decode;

import su.grinev.jstream.exception.JsonDecodeException;
import su.grinev.jstream.json.token.NumberScanner;

import java.lang.reflect.Array;
import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Binds the plain object tree produced by {@link su.grinev.jstream.json.JsonTreeReader} to a declared type by
 * reflection. Supports scalars, enums, {@link Instant}, {@link LocalDate}, {@link LocalDateTime}, {@link UUID},
 * arrays, collections, {@code Map<String, V>}, records and classes with a no-argument constructor.
 * Unknown properties are ignored; missing ones keep the field's initial value (records get zero or null).
 */
public class Binder {

    private static final Map<Class<?>, Map<String, Field>> fieldCache = new ConcurrentHashMap<>();
    private static final Map<Class<?>, Map<String, Field>> fieldCacheIgnoreCase = new ConcurrentHashMap<>();
    private static final Map<Class<?>, RecordShape> recordCache = new ConcurrentHashMap<>();

    private final boolean caseSensitive;

    public Binder(boolean caseSensitive) {
        this.caseSensitive = caseSensitive;
    }

    /**
     * @param position absolute stream offset of the value, reported in errors
     */
    public Object bind(Type type, Object value, long position) {
        return convert(new BinderContext(type, position), type, value, "$");
    }

    private Object convert(BinderContext ctx, Type type, Object value, String path) {
        Class<?> raw = GenericTypes.rawClass(type);

        if (value == null) {
            if (raw.isPrimitive()) {
                throw ctx.error("null is not a valid " + raw.getName(), path, null);
            }
            return null;
        }
        if (raw == Object.class) {
            return value;
        }
        if (raw == String.class) {
            return expect(ctx, String.class, value, path);
        }
        if (raw == boolean.class || raw == Boolean.class) {
            return expect(ctx, Boolean.class, value, path);
        }
        if (raw == char.class || raw == Character.class) {
            String s = expect(ctx, String.class, value, path);
            if (s.length() != 1) {
                throw ctx.error("Expected a single character", path, null);
            }
            return s.charAt(0);
        }
        if (isNumeric(raw)) {
            return convertNumber(ctx, raw, expect(ctx, Number.class, value, path), path);
        }
        if (raw.isEnum()) {
            return convertEnum(ctx, raw, expect(ctx, String.class, value, path), path);
        }
        if (raw == Instant.class || raw == LocalDate.class || raw == LocalDateTime.class || raw == UUID.class) {
            return convertText(ctx, raw, expect(ctx, String.class, value, path), path);
        }
        if (raw.isArray()) {
            List<?> items = expect(ctx, List.class, value, path);
            Type itemType = GenericTypes.componentType(type);
            Object array = Array.newInstance(raw.getComponentType(), items.size());
            for (int i = 0; i < items.size(); i++) {
                Array.set(array, i, convert(ctx, itemType, items.get(i), path + "[" + i + "]"));
            }
            return array;
        }
        if (Collection.class.isAssignableFrom(raw)) {
            List<?> items = expect(ctx, List.class, value, path);
            Type itemType = GenericTypes.typeArgument(type, 0);
            Collection<Object> target = instantiateCollection(ctx, raw, path);
            for (int i = 0; i < items.size(); i++) {
                target.add(convert(ctx, itemType, items.get(i), path + "[" + i + "]"));
            }
            return target;
        }
        if (Map.class.isAssignableFrom(raw)) {
            Map<?, ?> entries = expect(ctx, Map.class, value, path);
            Type keyType = GenericTypes.typeArgument(type, 0);
            if (keyType != String.class && keyType != Object.class) {
                throw ctx.error("Map keys must be String, not " + keyType.getTypeName(), path, null);
            }
            Type valueType = GenericTypes.typeArgument(type, 1);
            Map<Object, Object> target = SortedMap.class.isAssignableFrom(raw) ? new TreeMap<>() : new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : entries.entrySet()) {
                target.put(entry.getKey(), convert(ctx, valueType, entry.getValue(), path + "." + entry.getKey()));
            }
            return target;
        }
        if (raw.isRecord()) {
            return bindRecord(ctx, raw, expect(ctx, Map.class, value, path), path);
        }
        if (raw.isInterface() || Modifier.isAbstract(raw.getModifiers())) {
            throw ctx.error("Cannot instantiate abstract type " + raw.getName(), path, null);
        }
        return bindObject(ctx, raw, expect(ctx, Map.class, value, path), path);
    }

    private Object bindObject(BinderContext ctx, Class<?> type, Map<?, ?> document, String path) {
        Object target = instantiate(ctx, type, path);
        Map<String, Field> fields = caseSensitive ? collectFields(type) : collectFieldsIgnoreCase(type);

        for (Map.Entry<?, ?> entry : document.entrySet()) {
            Field field = fields.get((String) entry.getKey());
            if (field == null) continue;

            String fieldPath = path + "." + field.getName();
            Object fieldValue = convert(ctx, field.getGenericType(), entry.getValue(), fieldPath);
            try {
                field.set(target, fieldValue);
            } catch (IllegalAccessException e) {
                throw ctx.error("Failed to bind field " + field.getName(), fieldPath, e);
            }
        }
        return target;
    }

    private Object bindRecord(BinderContext ctx, Class<?> type, Map<?, ?> document, String path) {
        RecordShape shape = recordCache.computeIfAbsent(type, Binder::describeRecord);
        RecordComponent[] components = shape.components();
        Map<String, Integer> index = caseSensitive ? shape.index() : shape.indexIgnoreCase();

        Object[] args = new Object[components.length];
        for (int i = 0; i < components.length; i++) {
            Class<?> componentType = components[i].getType();
            args[i] = componentType.isPrimitive() ? Array.get(Array.newInstance(componentType, 1), 0) : null;
        }
        for (Map.Entry<?, ?> entry : document.entrySet()) {
            Integer i = index.get((String) entry.getKey());
            if (i == null) continue;
            RecordComponent component = components[i];
            args[i] = convert(ctx, component.getGenericType(), entry.getValue(), path + "." + component.getName());
        }

        try {
            return shape.constructor().newInstance(args);
        } catch (ReflectiveOperationException e) {
            throw ctx.error("Failed to construct record " + type.getName(), path, e);
        }
    }

    private Object convertNumber(BinderContext ctx, Class<?> type, Number number, String path) {
        if (type == Number.class) {
            return number;
        }
        BigDecimal decimal = number instanceof BigDecimal d ? d
                : number instanceof BigInteger i ? new BigDecimal(i)
                : BigDecimal.valueOf(number.longValue());
        try {
            if (type == int.class || type == Integer.class) return decimal.intValueExact();
            if (type == long.class || type == Long.class) return decimal.longValueExact();
            if (type == short.class || type == Short.class) return decimal.shortValueExact();
            if (type == byte.class || type == Byte.class) return decimal.byteValueExact();
            if (type == double.class || type == Double.class) return decimal.doubleValue();
            if (type == float.class || type == Float.class) return decimal.floatValue();
            if (type == BigInteger.class) return NumberScanner.toBigIntegerExact(decimal);
            return decimal;
        } catch (ArithmeticException e) {
            throw ctx.error("Number %s does not fit %s".formatted(decimal, type.getSimpleName()), path, e);
        }
    }

    private Object convertEnum(BinderContext ctx, Class<?> type, String name, String path) {
        for (Object constant : type.getEnumConstants()) {
            String constantName = ((Enum<?>) constant).name();
            if (caseSensitive ? constantName.equals(name) : constantName.equalsIgnoreCase(name)) {
                return constant;
            }
        }
        throw ctx.error("Unknown constant '%s' of %s".formatted(name, type.getSimpleName()), path, null);
    }

    private Object convertText(BinderContext ctx, Class<?> type, String text, String path) {
        try {
            if (type == Instant.class) return Instant.parse(text);
            if (type == LocalDate.class) return LocalDate.parse(text);
            if (type == LocalDateTime.class) return LocalDateTime.parse(text);
            return UUID.fromString(text);
        } catch (DateTimeParseException | IllegalArgumentException e) {
            throw ctx.error("Cannot parse '%s' as %s".formatted(text, type.getSimpleName()), path, e);
        }
    }

    private static <V> V expect(BinderContext ctx, Class<V> expected, Object value, String path) {
        if (!expected.isInstance(value)) {
            throw ctx.error("Expected %s but found %s".formatted(describe(expected), describe(value.getClass())), path, null);
        }
        return expected.cast(value);
    }

    private static String describe(Class<?> type) {
        if (Map.class.isAssignableFrom(type)) return "object";
        if (List.class.isAssignableFrom(type)) return "array";
        if (Number.class.isAssignableFrom(type)) return "number";
        if (type == Boolean.class) return "boolean";
        return "string";
    }

    private static Object instantiate(BinderContext ctx, Class<?> clazz, String path) {
        try {
            Constructor<?> ctor = clazz.getDeclaredConstructor();
            ctor.setAccessible(true);
            return ctor.newInstance();
        } catch (ReflectiveOperationException | RuntimeException e) {
            throw ctx.error("Cannot instantiate " + clazz.getName(), path, e);
        }
    }

    private static Collection<Object> instantiateCollection(BinderContext ctx, Class<?> type, String path) {
        if (type.isAssignableFrom(ArrayList.class)) {
            return new ArrayList<>();
        }
        if (type.isAssignableFrom(LinkedHashSet.class)) {
            return new LinkedHashSet<>();
        }
        if (type.isAssignableFrom(TreeSet.class)) {
            return new TreeSet<>();
        }
        if (type.isAssignableFrom(ArrayDeque.class)) {
            return new ArrayDeque<>();
        }
        if (type.isAssignableFrom(LinkedList.class)) {
            return new LinkedList<>();
        }
        throw ctx.error("Unsupported collection type: " + type.getName(), path, null);
    }

    private static boolean isNumeric(Class<?> type) {
        return type == int.class || type == Integer.class
                || type == long.class || type == Long.class
                || type == short.class || type == Short.class
                || type == byte.class || type == Byte.class
                || type == double.class || type == Double.class
                || type == float.class || type == Float.class
                || type == BigInteger.class || type == BigDecimal.class
                || type == Number.class;
    }

    private static Map<String, Field> collectFields(Class<?> clazz) {
        return fieldCache.computeIfAbsent(clazz, c -> {
            Map<String, Field> fields = new LinkedHashMap<>();
            for (Class<?> k = c; k != null && k != Object.class; k = k.getSuperclass()) {
                for (Field f : k.getDeclaredFields()) {
                    int modifiers = f.getModifiers();
                    if (Modifier.isStatic(modifiers) || Modifier.isTransient(modifiers) || f.isSynthetic()) continue;
                    f.setAccessible(true);
                    fields.putIfAbsent(f.getName(), f);
                }
            }
            return Collections.unmodifiableMap(fields);
        });
    }

    private static Map<String, Field> collectFieldsIgnoreCase(Class<?> clazz) {
        return fieldCacheIgnoreCase.computeIfAbsent(clazz, c -> {
            Map<String, Field> fields = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
            collectFields(c).forEach(fields::putIfAbsent);
            return Collections.unmodifiableMap(fields);
        });
    }

    private static RecordShape describeRecord(Class<?> type) {
        RecordComponent[] components = type.getRecordComponents();
        Class<?>[] parameterTypes = new Class<?>[components.length];
        Map<String, Integer> index = new HashMap<>();
        Map<String, Integer> indexIgnoreCase = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (int i = 0; i < components.length; i++) {
            parameterTypes[i] = components[i].getType();
            index.put(components[i].getName(), i);
            indexIgnoreCase.putIfAbsent(components[i].getName(), i);
        }
        try {
            Constructor<?> constructor = type.getDeclaredConstructor(parameterTypes);
            constructor.setAccessible(true);
            return new RecordShape(constructor, components, index, indexIgnoreCase);
        } catch (NoSuchMethodException e) {
            throw new IllegalStateException("Record without canonical constructor: " + type.getName(), e);
        }
    }

    private record RecordShape(Constructor<?> constructor, RecordComponent[] components,
                               Map<String, Integer> index, Map<String, Integer> indexIgnoreCase) { }

    private record BinderContext(Type rootType, long position) {

        JsonDecodeException error(String message, String path, Throwable cause) {
            String located = message + " at " + path;
            return cause == null
                    ? new JsonDecodeException(located, rootType, position)
                    : new JsonDecodeException(located, rootType, position, cause);
        }
    }
}
