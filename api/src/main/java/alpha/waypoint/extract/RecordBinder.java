package alpha.waypoint.extract;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

import static java.util.Arrays.stream;

/**
 * Binds named string values to the components of a record.
 * 
 * @param <R> type of record
 */
final class RecordBinder<R extends Record>
{
    static <R extends Record> RecordBinder<R> of(Class<R> type) {
        if (!type.isRecord()) {
            throw new IllegalArgumentException(type + " is not a record.");
        }
        var comps = stream(type.getRecordComponents())
                .map(Component::of)
                .toArray(Component[]::new);
        Constructor<R> ctor;
        try {
            ctor = type.getDeclaredConstructor(stream(type.getRecordComponents())
                    .map(RecordComponent::getType)
                    .toArray(Class<?>[]::new));
        } catch (NoSuchMethodException e) {
            throw new AssertionError("Records have a canonical constructor.", e);
        }
        ctor.setAccessible(true);
        return new RecordBinder<>(ctor, comps);
    }
    
    private final Constructor<R> ctor;
    private final Component[] comps;
    
    private RecordBinder(Constructor<R> ctor, Component[] comps) {
        this.ctor = ctor;
        this.comps = comps;
    }
    
    /**
     * Creates the record.
     * 
     * @param values lookup of values by name; empty list if absent
     * @return the record
     * @throws IllegalArgumentException if a value is missing or malformed
     * @throws Exception from the record's constructor
     */
    R bind(Function<String, List<String>> values) throws Exception {
        Object[] args = new Object[comps.length];
        for (int i = 0; i < comps.length; ++i) {
            var c = comps[i];
            args[i] = c.convert(values.apply(c.name()));
        }
        try {
            return ctor.newInstance(args);
        } catch (InvocationTargetException e) {
            if (e.getCause() instanceof Exception x) {
                throw x;
            }
            throw e;
        }
    }
    
    private enum Kind { REQUIRED, OPTIONAL, LIST }
    
    private record Component(String name, Kind kind, Class<?> scalar) {
        static Component of(RecordComponent rc) {
            Class<?> raw = rc.getType();
            if (raw == Optional.class || raw == List.class) {
                Type g = rc.getGenericType();
                if (!(g instanceof ParameterizedType pt) ||
                    !(pt.getActualTypeArguments()[0] instanceof Class<?> arg)) {
                    throw new IllegalArgumentException(
                            "Component \"" + rc.getName() + "\" must have a class type argument.");
                }
                requireSupported(rc.getName(), arg);
                return new Component(rc.getName(),
                        raw == List.class ? Kind.LIST : Kind.OPTIONAL, arg);
            }
            requireSupported(rc.getName(), raw);
            return new Component(rc.getName(), Kind.REQUIRED, raw);
        }
        
        Object convert(List<String> values) {
            switch (kind) {
                case LIST -> {
                    return values.stream().map(this::convertOne).toList();
                }
                case OPTIONAL -> {
                    return values.isEmpty() ?
                            Optional.empty() : Optional.of(convertOne(values.get(0)));
                }
                default -> {
                    if (values.isEmpty()) {
                        throw new IllegalArgumentException(
                                "Missing parameter \"" + name + "\".");
                    }
                    return convertOne(values.get(0));
                }
            }
        }
        
        private Object convertOne(String v) {
            try {
                return toValue(scalar, v);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Parameter \"" + name +
                        "\" can not be converted to " + scalar.getSimpleName() +
                        ": \"" + v + "\".", e);
            }
        }
    }
    
    private static void requireSupported(String name, Class<?> type) {
        if (!isSupported(type)) {
            throw new IllegalArgumentException(
                    "Component \"" + name + "\" is of an unsupported type: " + type);
        }
    }
    
    private static boolean isSupported(Class<?> t) {
        return t == String.class || t == UUID.class || t.isEnum() ||
               t == int.class     || t == Integer.class ||
               t == long.class    || t == Long.class    ||
               t == short.class   || t == Short.class   ||
               t == byte.class    || t == Byte.class    ||
               t == double.class  || t == Double.class  ||
               t == float.class   || t == Float.class   ||
               t == boolean.class || t == Boolean.class;
    }
    
    @SuppressWarnings({"unchecked", "rawtypes"})
    private static Object toValue(Class<?> t, String v) {
        if (t == String.class) {
            return v;
        }
        if (t == int.class || t == Integer.class) {
            return Integer.parseInt(v);
        }
        if (t == long.class || t == Long.class) {
            return Long.parseLong(v);
        }
        if (t == short.class || t == Short.class) {
            return Short.parseShort(v);
        }
        if (t == byte.class || t == Byte.class) {
            return Byte.parseByte(v);
        }
        if (t == double.class || t == Double.class) {
            return Double.parseDouble(v);
        }
        if (t == float.class || t == Float.class) {
            return Float.parseFloat(v);
        }
        if (t == boolean.class || t == Boolean.class) {
            if (v.equalsIgnoreCase("true")) {
                return true;
            }
            if (v.equalsIgnoreCase("false")) {
                return false;
            }
            throw new IllegalArgumentException("Not a boolean.");
        }
        if (t == UUID.class) {
            return UUID.fromString(v);
        }
        // Enum; exact name first
        Class e = t;
        try {
            return Enum.valueOf(e, v);
        } catch (IllegalArgumentException notExact) {
            return Enum.valueOf(e, v.toUpperCase(Locale.ROOT));
        }
    }
}
