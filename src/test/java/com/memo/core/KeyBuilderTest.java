package com.memo.core;

import com.memo.core.model.CallArguments;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class KeyBuilderTest
{
    private final KeyBuilder builder = KeyBuilder.standard();

    @Nested
    class TypeSensitivity
    {
        // Bu test sayısal olarak eşit ama tipi farklı argümanların farklı anahtar ürettiğini doğrular.
        @Test
        void numerically_equal_values_of_different_types_differ() throws Exception
        {
            CacheKey intKey = builder.build(CallArguments.of(3));
            CacheKey doubleKey = builder.build(CallArguments.of(3.0));
            CacheKey longKey = builder.build(CallArguments.of(3L));
            assertNotEquals(intKey, doubleKey);
            assertNotEquals(intKey, longKey);
            assertEquals(intKey, builder.build(CallArguments.of(3)));
        }

        // Bu test iç içe listelerde de eleman tipinin kimliğe dahil olduğunu gösterir.
        @Test
        void element_types_inside_structures_are_significant() throws Exception
        {
            CacheKey ints = builder.build(CallArguments.of(List.of(1, 2)));
            CacheKey doubles = builder.build(CallArguments.of(List.of(1.0, 2.0)));
            assertNotEquals(ints, doubles);
        }

        // Bu test null argümanın kendi tipiyle anahtarlandığını doğrular.
        @Test
        void null_arguments_are_hashable() throws Exception
        {
            CacheKey key = builder.build(CallArguments.of((Object) null));
            assertTrue(key.hashable());
            assertEquals(key, builder.build(CallArguments.of((Object) null)));
            assertNotEquals(key, builder.build(CallArguments.of("null")));
        }
    }

    @Nested
    class KeywordCanonicalization
    {
        // Bu test isimli argümanların çağrı sırasının kimliği değiştirmediğini doğrular.
        @Test
        void keyword_order_does_not_change_identity() throws Exception
        {
            Map<String, Object> first = new LinkedHashMap<>();
            first.put("b", 2);
            first.put("a", 1);
            Map<String, Object> second = new LinkedHashMap<>();
            second.put("a", 1);
            second.put("b", 2);
            CacheKey k1 = builder.build(CallArguments.of(List.of("x"), first));
            CacheKey k2 = builder.build(CallArguments.of(List.of("x"), second));
            assertEquals(k1, k2);
            assertEquals(k1.hashCode(), k2.hashCode());
            assertEquals("a", k1.parts().get(1).keyword());
            assertTrue(k1.parts().get(0).positional());
        }

        // Bu test aynı değerin konumsal ve isimli verilmesinin farklı imza sayıldığını gösterir.
        @Test
        void positional_and_keyword_forms_differ() throws Exception
        {
            CacheKey positional = builder.build(CallArguments.of(1));
            CacheKey keyword = builder.build(CallArguments.empty().with("x", 1));
            assertNotEquals(positional, keyword);
        }
    }

    @Nested
    class StructuralKeys
    {
        // Bu test dizilerin yapısal anahtar ürettiğini ve içerik eşitliğiyle karşılaştırıldığını doğrular.
        @Test
        void arrays_produce_structural_keys_compared_by_content() throws Exception
        {
            CacheKey first = builder.build(CallArguments.of((Object) new int[]{1, 2}));
            CacheKey second = builder.build(CallArguments.of((Object) new int[]{1, 2}));
            assertFalse(first.hashable());
            assertEquals(first, second);
            assertNotEquals(first, builder.build(CallArguments.of((Object) new int[]{2, 1})));
            assertNotEquals(first, builder.build(CallArguments.of((Object) new long[]{1, 2})));
        }

        // Bu test tek bir yapısal argümanın tüm anahtarı yapısal yaptığını gösterir.
        @Test
        void one_container_argument_makes_whole_key_structural() throws Exception
        {
            CacheKey key = builder.build(CallArguments.of("plain", 1, new ArrayList<>(List.of(1, 2))));
            assertFalse(key.hashable());
            assertInstanceOf(CacheKey.Structural.class, key);
        }

        // Bu test anahtar alındıktan sonra argümanın değiştirilmesinin anahtarı etkilemediğini doğrular.
        @Test
        void snapshot_is_isolated_from_later_mutation() throws Exception
        {
            List<Integer> argument = new ArrayList<>(List.of(1, 2));
            CacheKey before = builder.build(CallArguments.of(argument));
            argument.add(3);
            CacheKey after = builder.build(CallArguments.of(argument));
            assertNotEquals(before, after);
            assertEquals(before, builder.build(CallArguments.of(new ArrayList<>(List.of(1, 2)))));
        }

        // Bu test iç içe dizi içeren yapıların derin karşılaştırıldığını gösterir.
        @Test
        void nested_arrays_are_compared_deeply() throws Exception
        {
            Object[] a = {new int[]{1}, Arrays.asList("x", new String[]{"y"})};
            Object[] b = {new int[]{1}, Arrays.asList("x", new String[]{"y"})};
            assertEquals(builder.build(CallArguments.of((Object) a)), builder.build(CallArguments.of((Object) b)));
        }

        // Bu test küme ve map'lerin sıradan bağımsız karşılaştırıldığını doğrular.
        @Test
        void sets_and_maps_compare_without_order() throws Exception
        {
            Set<Object> s1 = new HashSet<>(List.of(1, 2, 3));
            Set<Object> s2 = new HashSet<>(List.of(3, 2, 1));
            assertEquals(builder.build(CallArguments.of(s1)), builder.build(CallArguments.of(s2)));

            Map<String, Object> m1 = new LinkedHashMap<>();
            m1.put("a", new int[]{1});
            m1.put("b", 2);
            Map<String, Object> m2 = new LinkedHashMap<>();
            m2.put("b", 2);
            m2.put("a", new int[]{1});
            assertEquals(builder.build(CallArguments.of(m1)), builder.build(CallArguments.of(m2)));
        }

        // Bu test hashCode çağrısı hata veren fakat eşitliği destekleyen nesnenin yapısal anahtara düştüğünü gösterir.
        @Test
        void unhashable_object_with_equality_falls_back_to_structural() throws Exception
        {
            CacheKey first = builder.build(CallArguments.of(new Unhashable("a")));
            CacheKey second = builder.build(CallArguments.of(new Unhashable("a")));
            assertFalse(first.hashable());
            assertEquals(first, second);
        }

        // Bu test ne hash ne eşitlik destekleyen argümanda anahtar üretiminin başarısız olduğunu doğrular.
        @Test
        void argument_without_hash_or_equality_fails()
        {
            assertThrows(KeyConstructionException.class, () -> builder.build(CallArguments.of(new Opaque())));
            assertThrows(KeyConstructionException.class,
                    () -> builder.build(CallArguments.of(List.of(new Opaque()))));
        }
    }

    @Nested
    class CustomKeyMaker
    {
        // Bu test kullanıcı tanımlı anahtar üreticisinin argümanları tek bir kimliğe indirgediğini gösterir.
        @Test
        void key_maker_result_is_the_identity() throws Exception
        {
            KeyBuilder custom = KeyBuilder.using(args -> args.positional().get(0).toString().toLowerCase());
            assertTrue(custom.customKey());
            assertEquals(custom.build(CallArguments.of("ABC", 1)), custom.build(CallArguments.of("abc", 2)));
        }

        // Bu test üreticinin fırlattığı hatanın anahtar üretim hatasına çevrildiğini doğrular.
        @Test
        void key_maker_failure_becomes_key_construction_failure()
        {
            IllegalStateException failure = new IllegalStateException("no identity");
            KeyBuilder custom = KeyBuilder.using(args -> { throw failure; });
            KeyConstructionException thrown = assertThrows(KeyConstructionException.class,
                    () -> custom.build(CallArguments.of(1)));
            assertSame(failure, thrown.getCause());
        }

        // Bu test null üretici verildiğinde standart anahtar üretimine dönüldüğünü doğrular.
        @Test
        void null_key_maker_means_standard_builder()
        {
            assertSame(KeyBuilder.standard(), KeyBuilder.using(null));
            assertFalse(KeyBuilder.standard().customKey());
        }
    }

    static final class Unhashable
    {
        private final String id;

        Unhashable(String id) { this.id = id; }

        @Override
        public boolean equals(Object o)
        {
            return o instanceof Unhashable other && other.id.equals(id);
        }

        @Override
        public int hashCode()
        {
            throw new UnsupportedOperationException("unhashable");
        }
    }

    static final class Opaque
    {
        @Override
        public boolean equals(Object o)
        {
            throw new UnsupportedOperationException("not comparable");
        }

        @Override
        public int hashCode()
        {
            throw new UnsupportedOperationException("unhashable");
        }
    }
}
