package com.tazifor.datacube.model;

import java.util.*;
import java.util.function.BiFunction;
import java.util.function.UnaryOperator;

/**
 * Immutable mapping from zoom index to {@link Level}. The highest zoom is the
 * authoritative full-resolution level used by UDF execution and stitching.
 */
public final class Pyramid {

    private final NavigableMap<Integer, Level> levels;

    public Pyramid(Map<Integer, Level> levels) {
        if (levels == null || levels.isEmpty())
            throw new IllegalArgumentException("a pyramid needs at least one level");
        this.levels = Collections.unmodifiableNavigableMap(new TreeMap<>(levels));
    }

    public static Pyramid single(Level level) {
        return new Pyramid(Map.of(0, level));
    }

    public NavigableMap<Integer, Level> levels() {
        return levels;
    }

    public int maxZoom() {
        return levels.lastKey();
    }

    public Level highestLevel() {
        return levels.lastEntry().getValue();
    }

    public Level level(int zoom) {
        Level level = levels.get(zoom);
        if (level == null) throw new NoSuchElementException("no level at zoom " + zoom);
        return level;
    }

    public LayerType layerType() {
        return highestLevel().type();
    }

    public Pyramid withLevel(int zoom, Level level) {
        Map<Integer, Level> copy = new TreeMap<>(levels);
        copy.put(zoom, level);
        return new Pyramid(copy);
    }

    /** Rebuilds every level with {@code func}. */
    public Pyramid map(UnaryOperator<Level> func) {
        return mapWithZoom((zoom, level) -> func.apply(level));
    }

    public Pyramid mapWithZoom(BiFunction<Integer, Level, Level> func) {
        Map<Integer, Level> out = new TreeMap<>();
        levels.forEach((zoom, level) -> out.put(zoom, func.apply(zoom, level)));
        return new Pyramid(out);
    }
}
