package com.tazifor.datacube.service;

import com.tazifor.datacube.Fixtures;
import com.tazifor.datacube.geo.model.Extent;
import com.tazifor.datacube.geo.model.Polygon;
import com.tazifor.datacube.geo.model.TileKey;
import com.tazifor.datacube.model.*;
import com.tazifor.datacube.store.LocalTileStore;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.tazifor.datacube.Fixtures.day;
import static com.tazifor.datacube.Fixtures.filled;
import static com.tazifor.datacube.Fixtures.layout;
import static org.assertj.core.api.Assertions.assertThat;

class ZonalAggregatorTest {

    private final ZonalAggregator aggregator =
        new ZonalAggregator(new LocalTileStore(Fixtures.workers()), Fixtures.workers());

    @Test
    void meanSkipsNodataAndPixelsOutsideThePolygon() {
        double n = Double.NaN;
        Tile tile = Tile.of(4, 4, CellType.FLOAT32, Double.NaN,
            new double[]{
                10, 20, 99, 99,
                n, n, 99, 99,
                99, 99, 99, 99,
                99, 99, 99, 99},
            new double[]{
                n, n, 1, 1,
                n, n, 1, 1,
                1, 1, 1, 1,
                1, 1, 1, 1});
        Level level = Fixtures.spatial(layout(1, 1, 4, 4), Map.of(TileKey.of(0, 0), tile));
        DataCube cube = DataCube.of(level, CubeMetadata.spatial(Band.of("B04"), Band.of("B08")));

        // top-left 2x2 pixels
        Map<String, List<Double>> out = aggregator.polygonalMeanTimeseries(cube, Polygon.rectangle(new Extent(0, 2, 2, 4)));

        assertThat(out).containsOnlyKeys(ZonalAggregator.NO_DATE);
        assertThat(out.get(ZonalAggregator.NO_DATE).get(0)).isEqualTo(15.0);
        assertThat(out.get(ZonalAggregator.NO_DATE).get(1)).isNaN();
    }

    @Test
    void meanSpansTilesAndIgnoresTilesOutsideTheBounds() {
        Level level = Fixtures.spatial(layout(3, 1, 4, 4), Map.of(
            TileKey.of(0, 0), filled(4, 4, 1),
            TileKey.of(1, 0), filled(4, 4, 3),
            TileKey.of(2, 0), filled(4, 4, 100)));
        DataCube cube = DataCube.of(level, CubeMetadata.spatial(Band.of("B04")));

        Map<String, List<Double>> out = aggregator.polygonalMeanTimeseries(cube, Polygon.rectangle(new Extent(2, 0, 6, 4)));

        assertThat(out.get(ZonalAggregator.NO_DATE)).containsExactly(2.0);
    }

    @Test
    void datesAreReportedInTimeOrder() {
        Level level = Fixtures.spacetime(layout(1, 1, 2, 2), Map.of(
            TileKey.of(0, 0, day(9)), filled(2, 2, 9),
            TileKey.of(0, 0, day(2)), filled(2, 2, 2),
            TileKey.of(0, 0, day(5)), filled(2, 2, 5)));
        DataCube cube = DataCube.of(level, CubeMetadata.spacetime(Band.of("B04")));

        Map<String, List<Double>> out = aggregator.polygonalMeanTimeseries(cube, Polygon.rectangle(new Extent(0, 0, 2, 2)));

        assertThat(out.keySet()).containsExactly(
            "2021-01-02T00:00:00Z", "2021-01-05T00:00:00Z", "2021-01-09T00:00:00Z");
        assertThat(out.get("2021-01-05T00:00:00Z")).containsExactly(5.0);
    }

    @Test
    void polygonOutsideTheDataGivesNoEntries() {
        Level level = Fixtures.spatial(layout(1, 1, 2, 2), Map.of(TileKey.of(0, 0), filled(2, 2, 1)));
        DataCube cube = DataCube.of(level, CubeMetadata.spatial(Band.of("B04")));

        Map<String, List<Double>> out = aggregator.polygonalMeanTimeseries(cube, Polygon.rectangle(new Extent(10, 10, 12, 12)));

        assertThat(out).isEmpty();
    }
}
