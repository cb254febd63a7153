package com.tazifor.datacube.model;

import java.util.function.BiFunction;
import java.util.function.UnaryOperator;

/**
 * The pyramid-typed value every cube operation consumes and produces:
 * tiles per zoom level plus the dimension metadata describing them.
 */
public record DataCube(Pyramid pyramid, CubeMetadata metadata) {

    public static DataCube of(Level level, CubeMetadata metadata) {
        return new DataCube(Pyramid.single(level), metadata);
    }

    public Level highestLevel() {
        return pyramid.highestLevel();
    }

    public boolean isSpatial() {
        return pyramid.layerType() == LayerType.SPATIAL;
    }

    public DataCube applyToLevels(UnaryOperator<Level> func) {
        return new DataCube(pyramid.map(func), metadata);
    }

    public DataCube applyToLevelsWithZoom(BiFunction<Integer, Level, Level> func) {
        return new DataCube(pyramid.mapWithZoom(func), metadata);
    }

    public DataCube withMetadata(CubeMetadata newMetadata) {
        return new DataCube(pyramid, newMetadata);
    }

    public DataCube withPyramid(Pyramid newPyramid) {
        return new DataCube(newPyramid, metadata);
    }
}
