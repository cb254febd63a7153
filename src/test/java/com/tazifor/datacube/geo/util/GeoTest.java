package com.tazifor.datacube.geo.util;

import com.tazifor.datacube.geo.model.Point;
import com.tazifor.datacube.geo.model.Polygon;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GeoTest {

    // L-shaped polygon: the notch at the top-right is outside
    private final Polygon ell = new Polygon(List.of(
        Point.of(0, 0), Point.of(4, 0), Point.of(4, 2), Point.of(2, 2), Point.of(2, 4), Point.of(0, 4)));

    @Test
    void insideAndOutside() {
        assertThat(Geo.pointInPolygon(Point.of(1, 1), ell)).isTrue();
        assertThat(Geo.pointInPolygon(Point.of(1, 3), ell)).isTrue();
        assertThat(Geo.pointInPolygon(Point.of(3, 3), ell)).isFalse();
        assertThat(Geo.pointInPolygon(Point.of(-1, 1), ell)).isFalse();
    }

    @Test
    void edgesAndVerticesCountAsInside() {
        assertThat(Geo.pointInPolygon(Point.of(2, 0), ell)).isTrue();
        assertThat(Geo.pointInPolygon(Point.of(4, 2), ell)).isTrue();
        assertThat(Geo.pointInPolygon(Point.of(2, 3), ell)).isTrue();
    }
}
