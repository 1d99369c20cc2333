package com.nestplan.expression;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Helpers shared by the expressions holding {@link MapEntry} lists.
 */
final class MapEntries {

    private MapEntries() {}

    /** Flattens entries into key, value, key, value, ... */
    static List<Expression> flatten(List<MapEntry> entries) {
        List<Expression> flat = new ArrayList<>(entries.size() * 2);
        for (MapEntry entry : entries) {
            flat.add(entry.key());
            flat.add(entry.value());
        }
        return flat;
    }

    /** Inverse of {@link #flatten(List)}. */
    static List<MapEntry> rebuild(List<Expression> flat, int offset) {
        if ((flat.size() - offset) % 2 != 0) {
            throw new IllegalArgumentException("map entries need an even number of children, got " + (flat.size() - offset));
        }
        List<MapEntry> entries = new ArrayList<>((flat.size() - offset) / 2);
        for (int i = offset; i < flat.size(); i += 2) {
            entries.add(new MapEntry(flat.get(i), flat.get(i + 1)));
        }
        return entries;
    }

    static String render(List<MapEntry> entries, RenderContext context) {
        return entries.stream()
            .map(entry -> entry.render(context))
            .collect(Collectors.joining(", "));
    }
}
