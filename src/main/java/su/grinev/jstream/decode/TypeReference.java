package su.grinev.jstream.decode;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;

/**
 * Captures a generic element type such as {@code List<Order>}; create it as an anonymous subclass:
 * {@code new TypeReference<List<Order>>() {}}.
 */
public abstract class TypeReference<T> {

    private final Type type;

    protected TypeReference() {
        Type superclass = getClass().getGenericSuperclass();
        if (!(superclass instanceof ParameterizedType parameterized)) {
            throw new IllegalStateException("TypeReference must be created with a type argument");
        }
        this.type = parameterized.getActualTypeArguments()[0];
    }

    public Type getType() {
        return type;
    }

    @Override
    public String toString() {
        return "TypeReference<" + type.getTypeName() + ">";
    }
}
