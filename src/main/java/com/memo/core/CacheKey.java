package com.memo.core;

import java.util.List;
import java.util.Objects;

/**
 * Tek bir çağrı imzasının önbellekteki kimliği.
 * <p>
 * İki biçimi vardır: {@link Hashed} anahtarlar önceden hesaplanmış bir hash ile
 * {@code HashMap} üzerinden O(1) bulunur; {@link Structural} anahtarlar hash
 * taşımaz ve kayıtlı diğer yapısal anahtarlarla tek tek, derin eşitlikle
 * karşılaştırılır.
 */
public sealed interface CacheKey permits CacheKey.Hashed, CacheKey.Structural
{
    List<Part> parts();

    boolean hashable();

    /**
     * Anahtarın bir bileşeni. Konumsal argümanlarda {@code keyword} null'dır.
     * {@code type} çalışma zamanı tipidir; {@code 3} ve {@code 3.0} bu sayede ayrışır.
     */
    record Part(String keyword, Class<?> type, Object value)
    {
        public boolean positional() { return keyword == null; }
    }

    final class Hashed implements CacheKey
    {
        private final List<Part> parts;
        private final int hash;

        Hashed(List<Part> parts)
        {
            this.parts = List.copyOf(parts);
            this.hash = this.parts.hashCode();
        }

        @Override public List<Part> parts() { return parts; }
        @Override public boolean hashable() { return true; }

        @Override
        public boolean equals(Object o)
        {
            if (this == o) return true;
            if (!(o instanceof Hashed other)) return false;
            return hash == other.hash && parts.equals(other.parts);
        }

        @Override public int hashCode() { return hash; }

        @Override public String toString() { return "Hashed" + parts; }
    }

    final class Structural implements CacheKey
    {
        private final List<Part> parts;

        Structural(List<Part> parts)
        {
            this.parts = List.copyOf(parts);
        }

        @Override public List<Part> parts() { return parts; }
        @Override public boolean hashable() { return false; }

        @Override
        public boolean equals(Object o)
        {
            if (this == o) return true;
            if (!(o instanceof Structural other) || parts.size() != other.parts.size()) return false;
            for (int i = 0; i < parts.size(); i++) {
                Part a = parts.get(i);
                Part b = other.parts.get(i);
                if (!Objects.equals(a.keyword(), b.keyword()) || a.type() != b.type()) return false;
                if (!StructuralSnapshot.equal(a.value(), b.value())) return false;
            }
            return true;
        }

        // no content hash; structural keys are only ever compared linearly
        @Override public int hashCode() { return parts.size(); }

        @Override public String toString() { return "Structural" + parts; }
    }
}
