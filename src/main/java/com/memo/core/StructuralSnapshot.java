package com.memo.core;

import java.lang.reflect.Array;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Hash üretemeyen ya da değiştirilebilir kapsayıcı olan argümanların yapısal
 * kopyasını alır ve bu kopyaları derin eşitlikle karşılaştırır.
 * <p>
 * Diziler, listeler, kümeler ve map'ler kopyalanırken iç düğüm tipine
 * ({@link Node}) dönüştürülür; böylece çağıran taraf argümanı sonradan
 * değiştirse bile saklanan anahtar etkilenmez. Karşılaştırma hiçbir aşamada
 * {@code hashCode()} çağırmaz.
 */
final class StructuralSnapshot
{
    private StructuralSnapshot() {}

    enum Kind { SEQUENCE, SET, MAP }

    /** Kopyalanmış kapsayıcı. {@code origin} orijinal sınıftır ve eşitliğe dahildir. */
    static final class Node
    {
        private final Kind kind;
        private final Class<?> origin;
        private final List<Object> items;

        Node(Kind kind, Class<?> origin, List<Object> items)
        {
            this.kind = kind;
            this.origin = origin;
            this.items = items;
        }

        @Override
        public String toString()
        {
            return origin.getSimpleName() + items;
        }
    }

    static boolean isContainer(Object value)
    {
        return value != null
                && (value.getClass().isArray() || value instanceof Collection<?> || value instanceof Map<?, ?>);
    }

    /**
     * Değerin yapısal kopyasını üretir. Kapsayıcı olmayan yapraklar olduğu gibi
     * döner ancak en azından kendisiyle eşit olduğunu doğrulayabilmelidir.
     */
    static Object snapshot(Object value) throws KeyConstructionException
    {
        if (value == null) return null;
        Class<?> type = value.getClass();
        if (type.isArray()) {
            if (type.getComponentType().isPrimitive()) {
                int length = Array.getLength(value);
                Object copy = Array.newInstance(type.getComponentType(), length);
                System.arraycopy(value, 0, copy, 0, length);
                return copy;
            }
            Object[] source = (Object[]) value;
            List<Object> items = new ArrayList<>(source.length);
            for (Object item : source) items.add(snapshot(item));
            return new Node(Kind.SEQUENCE, type, items);
        }
        if (value instanceof Map<?, ?> map) {
            List<Object> items = new ArrayList<>(map.size());
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                items.add(new AbstractMap.SimpleImmutableEntry<>(snapshot(entry.getKey()), snapshot(entry.getValue())));
            }
            return new Node(Kind.MAP, type, items);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> items = new ArrayList<>(collection.size());
            for (Object item : collection) items.add(snapshot(item));
            return new Node(value instanceof Set<?> ? Kind.SET : Kind.SEQUENCE, type, items);
        }
        return requireReflexiveEquality(value);
    }

    static Object requireReflexiveEquality(Object value) throws KeyConstructionException
    {
        boolean reflexive;
        try {
            reflexive = value.equals(value);
        } catch (RuntimeException ex) {
            throw new KeyConstructionException(
                    "Argument of type " + value.getClass().getName() + " supports neither hashing nor equality", ex);
        }
        if (!reflexive) {
            throw new KeyConstructionException(
                    "Argument of type " + value.getClass().getName() + " is not equal to itself");
        }
        return value;
    }

    static boolean equal(Object a, Object b)
    {
        if (a == b) return true;
        if (a == null || b == null) return false;
        if (a instanceof Node x) {
            if (!(b instanceof Node y) || x.kind != y.kind || x.origin != y.origin || x.items.size() != y.items.size()) {
                return false;
            }
            return switch (x.kind) {
                case SEQUENCE -> sequenceEqual(x.items, y.items);
                case SET, MAP -> unorderedEqual(x.items, y.items);
            };
        }
        if (b instanceof Node) return false;
        if (a instanceof Map.Entry<?, ?> x && b instanceof Map.Entry<?, ?> y) {
            return equal(x.getKey(), y.getKey()) && equal(x.getValue(), y.getValue());
        }
        if (a.getClass().isArray()) {
            return a.getClass() == b.getClass() && Objects.deepEquals(a, b);
        }
        return a.getClass() == b.getClass() && a.equals(b);
    }

    private static boolean sequenceEqual(List<Object> left, List<Object> right)
    {
        Iterator<Object> it = right.iterator();
        for (Object item : left) {
            if (!equal(item, it.next())) return false;
        }
        return true;
    }

    // O(n^2); members may not be hashable
    private static boolean unorderedEqual(List<Object> left, List<Object> right)
    {
        boolean[] matched = new boolean[right.size()];
        for (Object item : left) {
            boolean found = false;
            for (int i = 0; i < right.size(); i++) {
                if (!matched[i] && equal(item, right.get(i))) {
                    matched[i] = true;
                    found = true;
                    break;
                }
            }
            if (!found) return false;
        }
        return true;
    }
}
