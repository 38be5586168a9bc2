package com.memo.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Bir hesaplama çağrısının konumsal ve isimli argümanlarını taşıyan değişmez
 * çağrı imzasıdır. Argüman değerleri {@code null} olabilir; isimli argümanlar
 * çağrıdaki sırayla saklanır, anahtar üretimi sırasında isme göre sıralanır.
 */
public record CallArguments(List<Object> positional, Map<String, Object> keywords)
{
    private static final CallArguments EMPTY = new CallArguments(List.of(), Map.of());

    public CallArguments
    {
        Objects.requireNonNull(positional, "positional");
        Objects.requireNonNull(keywords, "keywords");
        positional = Collections.unmodifiableList(new ArrayList<>(positional));
        Map<String, Object> copy = new LinkedHashMap<>();
        keywords.forEach((name, value) -> copy.put(Objects.requireNonNull(name, "keyword name"), value));
        keywords = Collections.unmodifiableMap(copy);
    }

    public static CallArguments empty() { return EMPTY; }

    public static CallArguments of(Object... positional)
    {
        return new CallArguments(positional == null ? Collections.singletonList(null) : Arrays.asList(positional), Map.of());
    }

    public static CallArguments of(List<?> positional, Map<String, ?> keywords)
    {
        return new CallArguments(new ArrayList<>(positional), new LinkedHashMap<>(keywords));
    }

    /** Aynı konumsal argümanlara bir isimli argüman ekleyerek yeni imza üretir. */
    public CallArguments with(String name, Object value)
    {
        Map<String, Object> next = new LinkedHashMap<>(keywords);
        next.put(name, value);
        return new CallArguments(positional, next);
    }
}
