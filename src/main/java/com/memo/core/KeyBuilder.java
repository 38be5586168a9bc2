package com.memo.core;

import com.memo.core.model.CallArguments;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Çağrı argümanlarından tip duyarlı {@link CacheKey} üretir.
 * <p>
 * Konumsal argümanlar sırasıyla, ardından isimli argümanlar isme göre
 * sıralanarak anahtara eklenir; böylece isimli argümanların çağrıdaki sırası
 * kimliği değiştirmez. Her argüman için önce hash alınmaya çalışılır. Dizi,
 * koleksiyon ve map gibi değiştirilebilir kapsayıcılar ya da {@code hashCode()}
 * çağrısı hata veren nesneler anahtarın tamamını {@link CacheKey.Structural}
 * yapar. Özel {@link KeyMaker} çalışırken fırlatılan hata
 * {@link KeyConstructionException} olarak iletilir.
 */
public final class KeyBuilder
{
    private static final KeyBuilder STANDARD = new KeyBuilder(null);

    private final KeyMaker keyMaker;

    private KeyBuilder(KeyMaker keyMaker)
    {
        this.keyMaker = keyMaker;
    }

    public static KeyBuilder standard() { return STANDARD; }

    public static KeyBuilder using(KeyMaker keyMaker)
    {
        return keyMaker == null ? STANDARD : new KeyBuilder(keyMaker);
    }

    public boolean customKey() { return keyMaker != null; }

    public CacheKey build(CallArguments arguments) throws KeyConstructionException
    {
        if (keyMaker != null) {
            Object identity;
            try {
                identity = keyMaker.makeKey(arguments);
            } catch (RuntimeException ex) {
                throw new KeyConstructionException("Key maker failed: " + ex, ex);
            }
            return derive(new CallArguments(Collections.singletonList(identity), Map.of()));
        }
        return derive(arguments);
    }

    private CacheKey derive(CallArguments arguments) throws KeyConstructionException
    {
        List<CacheKey.Part> parts = new ArrayList<>(arguments.positional().size() + arguments.keywords().size());
        boolean hashable = true;
        for (Object value : arguments.positional()) {
            Probe probe = probe(value);
            hashable &= probe.hashable;
            parts.add(new CacheKey.Part(null, typeOf(value), probe.value));
        }
        for (Map.Entry<String, Object> keyword : new TreeMap<>(arguments.keywords()).entrySet()) {
            Probe probe = probe(keyword.getValue());
            hashable &= probe.hashable;
            parts.add(new CacheKey.Part(keyword.getKey(), typeOf(keyword.getValue()), probe.value));
        }
        if (hashable) {
            return new CacheKey.Hashed(parts);
        }
        // a hashable part is kept as is; structural comparison falls back to equals for leaves
        return new CacheKey.Structural(parts);
    }

    private static Probe probe(Object value) throws KeyConstructionException
    {
        if (value == null) return new Probe(true, null);
        if (StructuralSnapshot.isContainer(value)) {
            return new Probe(false, StructuralSnapshot.snapshot(value));
        }
        try {
            value.hashCode();
            return new Probe(true, value);
        } catch (RuntimeException ex) {
            return new Probe(false, StructuralSnapshot.requireReflexiveEquality(value));
        }
    }

    private static Class<?> typeOf(Object value)
    {
        return value == null ? Void.class : value.getClass();
    }

    private record Probe(boolean hashable, Object value) {}
}
