package com.tazifor.datacube.model;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Dimension and band description of a data cube. Tile geometry lives on the
 * {@link Level}; this record only says which dimensions exist and how the
 * band axis is labelled.
 */
public record CubeMetadata(List<Dimension> dimensions, List<Band> bands) {

    public static final String X = "x";
    public static final String Y = "y";
    public static final String T = "t";
    public static final String BANDS = "bands";

    public CubeMetadata {
        dimensions = List.copyOf(dimensions);
        bands = bands == null ? List.of() : List.copyOf(bands);
        Set<String> names = new HashSet<>();
        for (Dimension d : dimensions) {
            if (!names.add(d.name()))
                throw new IllegalArgumentException("duplicate dimension " + d.name());
        }
    }

    /** x, y, t and bands dimensions. */
    public static CubeMetadata spacetime(Band... bands) {
        return new CubeMetadata(List.of(Dimension.spatial(X), Dimension.spatial(Y), Dimension.temporal(T),
            Dimension.bands(BANDS)), List.of(bands));
    }

    /** x, y and bands dimensions. */
    public static CubeMetadata spatial(Band... bands) {
        return new CubeMetadata(List.of(Dimension.spatial(X), Dimension.spatial(Y), Dimension.bands(BANDS)),
            List.of(bands));
    }

    public Optional<Dimension> dimension(String name) {
        return dimensions.stream().filter(d -> d.name().equals(name)).findFirst();
    }

    public boolean hasDimension(String name) {
        return dimension(name).isPresent();
    }

    public List<Dimension> spatialDimensions() {
        return dimensions.stream().filter(d -> d.type() == Dimension.Type.SPATIAL).collect(Collectors.toList());
    }

    public Optional<Dimension> temporalDimension() {
        return dimensions.stream().filter(d -> d.type() == Dimension.Type.TEMPORAL).findFirst();
    }

    public Optional<Dimension> bandDimension() {
        return dimensions.stream().filter(d -> d.type() == Dimension.Type.BANDS).findFirst();
    }

    public boolean hasTemporalDimension() {
        return temporalDimension().isPresent();
    }

    public boolean hasBandDimension() {
        return bandDimension().isPresent();
    }

    public boolean isTemporalDimension(String name) {
        return temporalDimension().map(d -> d.name().equals(name)).orElse(false);
    }

    public boolean isBandDimension(String name) {
        return bandDimension().map(d -> d.name().equals(name)).orElse(false);
    }

    public List<String> bandNames() {
        return bands.stream().map(Band::name).collect(Collectors.toList());
    }

    /**
     * Drops a dimension; dropping the band dimension also drops the band list.
     */
    public CubeMetadata reduceDimension(String name) {
        Dimension dim = dimension(name)
            .orElseThrow(() -> new IllegalArgumentException("no dimension named " + name));
        List<Dimension> remaining = dimensions.stream().filter(d -> d != dim).collect(Collectors.toList());
        return new CubeMetadata(remaining, dim.type() == Dimension.Type.BANDS ? List.of() : bands);
    }

    public CubeMetadata renameDimension(String source, String target) {
        if (!hasDimension(source))
            throw new IllegalArgumentException("no dimension named " + source);
        if (hasDimension(target))
            throw new IllegalArgumentException("dimension " + target + " already exists");
        List<Dimension> renamed = dimensions.stream()
            .map(d -> d.name().equals(source) ? new Dimension(target, d.type()) : d)
            .collect(Collectors.toList());
        return new CubeMetadata(renamed, bands);
    }

    /**
     * Adds a dimension. A band dimension starts with a single band named {@code label}.
     */
    public CubeMetadata addDimension(String name, String label, Dimension.Type type) {
        if (hasDimension(name))
            throw new IllegalArgumentException("dimension " + name + " already exists");
        List<Dimension> out = new ArrayList<>(dimensions);
        out.add(new Dimension(name, type));
        return new CubeMetadata(out, type == Dimension.Type.BANDS ? List.of(Band.of(label)) : bands);
    }

    public CubeMetadata appendBand(Band band) {
        List<Band> out = new ArrayList<>(bands);
        out.add(band);
        return new CubeMetadata(dimensions, out);
    }

    public CubeMetadata withBands(List<Band> newBands) {
        return new CubeMetadata(dimensions, newBands);
    }

    /**
     * Keeps the named bands in the requested order.
     */
    public CubeMetadata filterBands(List<String> names) {
        List<Band> out = new ArrayList<>(names.size());
        for (String name : names) {
            out.add(bands.stream().filter(b -> b.name().equals(name)).findFirst()
                .orElseThrow(() -> new IllegalArgumentException("no band named " + name + " in " + bandNames())));
        }
        return new CubeMetadata(dimensions, out);
    }
}
