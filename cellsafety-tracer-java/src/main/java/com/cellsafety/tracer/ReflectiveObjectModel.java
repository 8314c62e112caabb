package com.cellsafety.tracer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * Reads attributes of plain Java objects through reflection and subscripts of
 * {@link Map}s, {@link List}s, arrays and strings.
 *
 * An attribute is an instance field of that name, declared on the class or a superclass; record
 * components are found the same way. Methods are never invoked, so a traced load cannot run host
 * code. Anything else, including a lookup the collection itself rejects, is a failed lookup.
 */
public class ReflectiveObjectModel implements ObjectModel {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReflectiveObjectModel.class);

    @Override
    public Object read(Object obj, Object key, boolean isSubscript) throws LookupFailedException {
        return isSubscript ? subscript(obj, key) : attribute(obj, String.valueOf(key));
    }

    private Object subscript(Object obj, Object key) throws LookupFailedException {
        if (obj instanceof Map<?, ?> map) {
            try {
                if (!map.containsKey(key)) {
                    throw new LookupFailedException("no key " + key);
                }
                return map.get(key);
            } catch (NullPointerException | ClassCastException | UnsupportedOperationException e) {
                throw new LookupFailedException("map rejected key " + key, e);
            }
        }
        if (obj instanceof List<?> list) {
            return list.get(index(key, list.size()));
        }
        if (obj instanceof CharSequence chars) {
            return String.valueOf(chars.charAt(index(key, chars.length())));
        }
        if (obj.getClass().isArray()) {
            return Array.get(obj, index(key, Array.getLength(obj)));
        }
        throw new LookupFailedException(obj.getClass().getName() + " is not subscriptable");
    }

    /** Negative indices count from the end. */
    private static int index(Object key, int length) throws LookupFailedException {
        long i;
        if (key instanceof Long || key instanceof Integer || key instanceof Short || key instanceof Byte) {
            i = ((Number) key).longValue();
        } else if (key instanceof BigInteger big && big.bitLength() < Long.SIZE) {
            i = big.longValue();
        } else {
            throw new LookupFailedException("index must be an integer within range, got " + key);
        }
        if (i < 0) i += length;
        if (i < 0 || i >= length) {
            throw new LookupFailedException("index " + key + " out of range");
        }
        return (int) i;
    }

    private Object attribute(Object obj, String name) throws LookupFailedException {
        Field field = findField(obj.getClass(), name);
        if (field == null) {
            throw new LookupFailedException(obj.getClass().getName() + " has no attribute " + name);
        }
        try {
            field.setAccessible(true);
            return field.get(obj);
        } catch (RuntimeException | IllegalAccessException e) {
            // the module system may refuse access to JDK internals
            LOGGER.debug("field {} of {} is not accessible: {}", name, obj.getClass().getName(), e.toString());
            throw new LookupFailedException("attribute " + name + " is not accessible", e);
        }
    }

    private static Field findField(Class<?> cls, String name) {
        for (Class<?> c = cls; c != null && c != Object.class; c = c.getSuperclass()) {
            for (Field f : c.getDeclaredFields()) {
                if (f.isSynthetic() || Modifier.isStatic(f.getModifiers())) continue;
                if (f.getName().equals(name)) return f;
            }
        }
        return null;
    }
}
