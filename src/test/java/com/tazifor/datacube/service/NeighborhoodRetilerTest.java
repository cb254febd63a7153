package com.tazifor.datacube.service;

import com.tazifor.datacube.Fixtures;
import com.tazifor.datacube.geo.model.Extent;
import com.tazifor.datacube.geo.model.TileKey;
import com.tazifor.datacube.model.Band;
import com.tazifor.datacube.model.CubeMetadata;
import com.tazifor.datacube.model.DataArray;
import com.tazifor.datacube.model.Level;
import com.tazifor.datacube.model.Tile;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.tazifor.datacube.Fixtures.day;
import static com.tazifor.datacube.Fixtures.filled;
import static com.tazifor.datacube.Fixtures.layout;
import static com.tazifor.datacube.Fixtures.ramp;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NeighborhoodRetilerTest {

    private final NeighborhoodRetiler retiler = new NeighborhoodRetiler(Fixtures.workers());

    private static Level ramps() {
        return Fixtures.spatial(layout(2, 2, 4, 4), Map.of(
            TileKey.of(0, 0), ramp(4, 4, 0),
            TileKey.of(1, 0), ramp(4, 4, 100),
            TileKey.of(0, 1), ramp(4, 4, 200),
            TileKey.of(1, 1), ramp(4, 4, 300)));
    }

    @Test
    void windowsMatchingTheTilesReproduceTheLevel() {
        Level level = ramps();

        Level out = retiler.retile(level, 4, 4, 0, 0);

        assertThat(out.layout()).isEqualTo(level.layout());
        assertThat(out.tiles()).isEqualTo(level.tiles());
        assertThat(retiler.removeOverlap(out)).isSameAs(out);
    }

    @Test
    void marginsAreReadFromNeighbouringTiles() {
        Level level = Fixtures.spatial(layout(2, 1, 4, 4), Map.of(
            TileKey.of(0, 0), filled(4, 4, 1),
            TileKey.of(1, 0), filled(4, 4, 2)));

        Level out = retiler.retile(level, 4, 4, 2, 2);

        assertThat(out.bufferX()).isEqualTo(2);
        assertThat(out.bufferY()).isEqualTo(2);
        Tile left = out.tile(TileKey.of(0, 0));
        assertThat(left.cols()).isEqualTo(8);
        assertThat(left.rows()).isEqualTo(8);
        assertThat(left.get(0, 2, 2)).isEqualTo(1.0);
        assertThat(left.get(0, 6, 2)).isEqualTo(2.0);
        assertThat(left.get(0, 0, 2)).isNaN();
        assertThat(left.get(0, 3, 0)).isNaN();
        assertThat(out.tile(TileKey.of(1, 0)).get(0, 1, 3)).isEqualTo(1.0);
    }

    @Test
    void removeOverlapCropsBackToTheWindow() {
        Level level = Fixtures.spatial(layout(2, 1, 4, 4), Map.of(
            TileKey.of(0, 0), filled(4, 4, 1),
            TileKey.of(1, 0), filled(4, 4, 2)));

        Level out = retiler.removeOverlap(retiler.retile(level, 4, 4, 2, 1));

        assertThat(out.bufferX()).isZero();
        assertThat(out.bufferY()).isZero();
        assertThat(out.tiles()).isEqualTo(level.tiles());
    }

    @Test
    void smallerWindowsSplitTiles() {
        Level level = Fixtures.spatial(layout(1, 1, 8, 8), Map.of(TileKey.of(0, 0), ramp(8, 8, 0)));

        Level out = retiler.retile(level, 4, 4, 0, 0);

        assertThat(out.layout().tileLayout().layoutCols()).isEqualTo(2);
        assertThat(out.layout().extent()).isEqualTo(new Extent(0, 0, 8, 8));
        assertThat(out.size()).isEqualTo(4);
        assertThat(out.tile(TileKey.of(1, 1)).get(0, 0, 0)).isEqualTo(36.0);
        assertThat(out.tile(TileKey.of(1, 0)).get(0, 3, 3)).isEqualTo(31.0);
    }

    @Test
    void unevenWindowsAreAnchoredTopLeftAndPaddedWithNodata() {
        Level level = Fixtures.spatial(layout(1, 1, 6, 6), Map.of(TileKey.of(0, 0), ramp(6, 6, 0)));

        Level out = retiler.retile(level, 4, 4, 0, 0);

        assertThat(out.layout().extent()).isEqualTo(new Extent(0, -2, 8, 6));
        Tile corner = out.tile(TileKey.of(1, 1));
        assertThat(corner.get(0, 0, 0)).isEqualTo(28.0);
        assertThat(corner.get(0, 2, 0)).isNaN();
        assertThat(corner.get(0, 0, 2)).isNaN();
    }

    @Test
    void onlyWindowsOverExistingTilesAreProduced() {
        Level level = Fixtures.spatial(layout(2, 2, 4, 4), Map.of(TileKey.of(0, 0), filled(4, 4, 1)));

        Level out = retiler.retile(level, 2, 2, 0, 0);

        assertThat(out.tiles().keySet()).containsExactly(
            TileKey.of(0, 0), TileKey.of(1, 0), TileKey.of(0, 1), TileKey.of(1, 1));
    }

    @Test
    void datesAreRetiledIndependently() {
        Level level = Fixtures.spacetime(layout(2, 1, 4, 4), Map.of(
            TileKey.of(0, 0, day(1)), filled(4, 4, 1),
            TileKey.of(1, 0, day(2)), filled(4, 4, 2)));

        Level out = retiler.retile(level, 4, 4, 1, 1);

        assertThat(out.size()).isEqualTo(2);
        Tile first = out.tile(TileKey.of(0, 0, day(1)));
        assertThat(first.get(0, 4, 1)).isEqualTo(1.0);
        assertThat(first.get(0, 5, 1)).isNaN();
        assertThat(out.tile(TileKey.of(1, 0, day(2))).get(0, 0, 1)).isNaN();
    }

    @Test
    void retileThenRemoveOverlapStitchesToTheSameArray() {
        Level level = ramps();
        TileStitcher stitcher = new TileStitcher(Fixtures.workers());
        CubeMetadata md = CubeMetadata.spatial(Band.of("B04"));

        Level roundTrip = retiler.removeOverlap(retiler.retile(level, 2, 2, 1, 1));

        DataArray expected = stitcher.stitch(level, md, null, null, null);
        DataArray actual = stitcher.stitch(roundTrip, md, null, null, null);
        assertThat(actual.shape()).isEqualTo(expected.shape());
        assertThat(actual.values()).containsExactly(expected.values());
        assertThat(actual.attr("extent")).isEqualTo(expected.attr("extent"));
    }

    @Test
    void bufferedLevelsCannotBeRetiledAgain() {
        Level buffered = retiler.retile(ramps(), 4, 4, 1, 1);

        assertThatThrownBy(() -> retiler.retile(buffered, 4, 4, 1, 1))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
