package com.tazifor.datacube.service;

import com.tazifor.datacube.Fixtures;
import com.tazifor.datacube.error.AmbiguousBandException;
import com.tazifor.datacube.error.BandExistsException;
import com.tazifor.datacube.error.DatacubeException;
import com.tazifor.datacube.error.FeatureUnsupportedException;
import com.tazifor.datacube.error.KernelDimensionsUnevenException;
import com.tazifor.datacube.error.UnsupportedCombinationException;
import com.tazifor.datacube.geo.model.TileKey;
import com.tazifor.datacube.geo.model.TileLayout;
import com.tazifor.datacube.model.*;
import com.tazifor.datacube.process.BuiltinReducer;
import com.tazifor.datacube.process.ResampleMethod;
import com.tazifor.datacube.process.TemporalInterval;
import com.tazifor.datacube.process.UdfReducer;
import com.tazifor.datacube.store.LocalTileStore;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.tazifor.datacube.Fixtures.day;
import static com.tazifor.datacube.Fixtures.layout;
import static com.tazifor.datacube.Fixtures.ramp;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CubeProcessServiceTest {

    private final CubeProcessService service = new CubeProcessService(new LocalTileStore(Fixtures.workers()));

    /** Red is 1 and near infrared 3 everywhere, so NDVI is 0.5. */
    private static DataCube redNir(Band red, Band nir) {
        Tile tile = Tile.of(2, 2, CellType.FLOAT32, Double.NaN, new double[]{1, 1, 1, 1}, new double[]{3, 3, 3, 3});
        Level level = Fixtures.spatial(layout(1, 1, 2, 2), Map.of(TileKey.of(0, 0), tile));
        return DataCube.of(level, CubeMetadata.spatial(red, nir));
    }

    @Test
    void ndviByCommonNameReducesTheBandDimension() {
        DataCube out = service.ndvi(redNir(Band.of("B04", "red"), Band.of("B08", "nir")), null, null, null);

        assertThat(out.metadata().hasBandDimension()).isFalse();
        Tile tile = out.highestLevel().tile(TileKey.of(0, 0));
        assertThat(tile.bandCount()).isEqualTo(1);
        assertThat(tile.get(0, 1, 1)).isEqualTo(0.5);
    }

    @Test
    void ndviWithTargetBandAppendsIt() {
        DataCube out = service.ndvi(redNir(Band.of("B04"), Band.of("B08")), "B08", "B04", "NDVI");

        assertThat(out.metadata().bandNames()).containsExactly("B04", "B08", "NDVI");
        Tile tile = out.highestLevel().tile(TileKey.of(0, 0));
        assertThat(tile.get(0, 0, 0)).isEqualTo(1.0);
        assertThat(tile.get(1, 0, 0)).isEqualTo(3.0);
        assertThat(tile.get(2, 0, 0)).isEqualTo(0.5);
    }

    @Test
    void ndviReportsWhichBandLookupFailed() {
        assertThatThrownBy(() -> service.ndvi(redNir(Band.of("B04", "red"), Band.of("B05", "red")), null, null, null))
            .isInstanceOf(AmbiguousBandException.class)
            .extracting(e -> ((DatacubeException) e).code())
            .isEqualTo(AmbiguousBandException.RED_BAND_AMBIGUOUS);
        assertThatThrownBy(() -> service.ndvi(redNir(Band.of("B04", "red"), Band.of("B03", "green")), null, null, null))
            .extracting(e -> ((DatacubeException) e).code())
            .isEqualTo(AmbiguousBandException.NIR_BAND_AMBIGUOUS);

        DataCube noBands = redNir(Band.of("B04"), Band.of("B08"))
            .withMetadata(new CubeMetadata(List.of(Dimension.spatial("x"), Dimension.spatial("y")), List.of()));
        assertThatThrownBy(() -> service.ndvi(noBands, null, null, null))
            .extracting(e -> ((DatacubeException) e).code())
            .isEqualTo(AmbiguousBandException.DIMENSION_AMBIGUOUS);
    }

    @Test
    void ndviRefusesToOverwriteABand() {
        assertThatThrownBy(() -> service.ndvi(redNir(Band.of("B04", "red"), Band.of("B08", "nir")), null, null, "B04"))
            .isInstanceOf(BandExistsException.class)
            .hasMessageContaining("B04");
    }

    @Test
    void filterBandsKeepsTheRequestedOrder() {
        DataCube out = service.filterBands(redNir(Band.of("B04"), Band.of("B08")), List.of("B08", "B04"));

        assertThat(out.metadata().bandNames()).containsExactly("B08", "B04");
        assertThat(out.highestLevel().tile(TileKey.of(0, 0)).get(0, 0, 0)).isEqualTo(3.0);
        assertThatThrownBy(() -> service.filterBands(out, List.of("B02")))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void linearScaleRangeClampsAndNarrowsTheCellType() {
        Level level = Fixtures.spatial(layout(1, 1, 4, 4), Map.of(TileKey.of(0, 0), ramp(4, 4, 0)));
        DataCube cube = DataCube.of(level, CubeMetadata.spatial(Band.of("B04")));

        DataCube out = service.linearScaleRange(cube, 0, 10, 0, 100);

        Tile tile = out.highestLevel().tile(TileKey.of(0, 0));
        assertThat(out.highestLevel().cellType()).isEqualTo(CellType.UINT8);
        assertThat(tile.get(0, 1, 1)).isEqualTo(50.0);
        assertThat(tile.get(0, 3, 3)).isEqualTo(100.0);
    }

    @Test
    void narrowestTypeFollowsTheOutputRange() {
        assertThat(CubeProcessService.narrowestType(0, 254)).isEqualTo(CellType.UINT8);
        assertThat(CubeProcessService.narrowestType(0, 255)).isEqualTo(CellType.INT16);
        assertThat(CubeProcessService.narrowestType(-1000, 1000)).isEqualTo(CellType.INT16);
        assertThat(CubeProcessService.narrowestType(0, 1.5)).isEqualTo(CellType.FLOAT32);
        assertThat(CubeProcessService.narrowestType(0, 100_000)).isEqualTo(CellType.FLOAT32);
    }

    @Test
    void timeseriesReadsThePixelUnderThePointPerDate() {
        Level level = Fixtures.spacetime(layout(2, 1, 2, 2), Map.of(
            TileKey.of(1, 0, day(2)), ramp(2, 2, 20),
            TileKey.of(1, 0, day(1)), ramp(2, 2, 10),
            TileKey.of(0, 0, day(1)), ramp(2, 2, 0)));
        DataCube cube = DataCube.of(level, CubeMetadata.spacetime(Band.of("B04")));

        Map<String, List<Double>> out = service.timeseries(cube, 3.5, 0.5);

        assertThat(out.keySet()).containsExactly("2021-01-01T00:00:00Z", "2021-01-02T00:00:00Z");
        assertThat(out.get("2021-01-01T00:00:00Z")).containsExactly(13.0);
        assertThat(out.get("2021-01-02T00:00:00Z")).containsExactly(23.0);
        assertThat(service.timeseries(cube, 50, 50)).isEmpty();
    }

    @Test
    void aggregateTemporalOnlyTakesBuiltinReducers() {
        Level level = Fixtures.spacetime(layout(1, 1, 2, 2), Map.of(TileKey.of(0, 0, day(1)), ramp(2, 2, 0)));
        DataCube cube = DataCube.of(level, CubeMetadata.spacetime(Band.of("B04")));
        List<TemporalInterval> intervals = List.of(new TemporalInterval(day(1), day(8)));

        DataCube out = service.aggregateTemporal(cube, intervals, List.of(day(1)), new BuiltinReducer("max"));

        assertThat(out.highestLevel().tiles()).containsOnlyKeys(TileKey.of(0, 0, day(1)));
        assertThatThrownBy(() -> service.aggregateTemporal(cube, intervals, List.of(day(1)), new BuiltinReducer("median")))
            .isInstanceOf(UnsupportedCombinationException.class);
    }

    @Test
    void resampleSpatialAnchorsTheNewLayoutAtTheTopLeft() {
        Level level = Fixtures.spatial(layout(1, 1, 4, 4), Map.of(TileKey.of(0, 0), ramp(4, 4, 0)));
        DataCube cube = DataCube.of(level, CubeMetadata.spatial(Band.of("B04")));

        assertThat(service.resampleSpatial(cube, 0, ResampleMethod.NEAREST_NEIGHBOR)).isSameAs(cube);

        Level out = service.resampleSpatial(cube, 2, ResampleMethod.NEAREST_NEIGHBOR).highestLevel();
        assertThat(out.layout().tileLayout()).isEqualTo(new TileLayout(1, 1, 256, 256));
        assertThat(out.layout().extent().xmin()).isZero();
        assertThat(out.layout().extent().ymax()).isEqualTo(4.0);
        Tile tile = out.tile(TileKey.of(0, 0));
        assertThat(tile.get(0, 0, 0)).isEqualTo(5.0);
        assertThat(tile.get(0, 1, 1)).isEqualTo(15.0);
        assertThat(tile.get(0, 2, 2)).isNaN();
    }

    @Test
    void resampleCubeSpatialNeedsSingleLevelsInOneCrs() {
        Level level = Fixtures.spatial(layout(1, 1, 4, 4), Map.of(TileKey.of(0, 0), ramp(4, 4, 0)));
        CubeMetadata md = CubeMetadata.spatial(Band.of("B04"));
        DataCube single = DataCube.of(level, md);
        DataCube pyramid = new DataCube(new Pyramid(Map.of(0, level, 1, level)), md);
        DataCube otherCrs = DataCube.of(level.toBuilder().crs("EPSG:32631").build(), md);

        assertThatThrownBy(() -> service.resampleCubeSpatial(pyramid, single, ResampleMethod.NEAREST_NEIGHBOR))
            .isInstanceOf(FeatureUnsupportedException.class);
        assertThatThrownBy(() -> service.resampleCubeSpatial(single, otherCrs, ResampleMethod.NEAREST_NEIGHBOR))
            .isInstanceOf(FeatureUnsupportedException.class)
            .hasMessageContaining("EPSG:32631");
        assertThat(service.resampleCubeSpatial(single, single, ResampleMethod.NEAREST_NEIGHBOR).highestLevel().tiles())
            .isEqualTo(level.tiles());
    }

    @Test
    void renameAndAddDimensionOnlyTouchMetadata() {
        DataCube cube = redNir(Band.of("B04"), Band.of("B08"));

        DataCube renamed = service.renameDimension(cube, "bands", "spectral");
        DataCube added = service.addDimension(cube, "t", "2021-01-01", "temporal");

        assertThat(renamed.metadata().hasDimension("spectral")).isTrue();
        assertThat(renamed.highestLevel()).isSameAs(cube.highestLevel());
        assertThat(added.metadata().hasTemporalDimension()).isTrue();
    }

    private static DataCube series(String band, double value) {
        Level level = Fixtures.spacetime(layout(1, 1, 2, 2), Map.of(
            TileKey.of(0, 0, day(1)), Fixtures.filled(2, 2, value),
            TileKey.of(0, 0, day(2)), Fixtures.filled(2, 2, value + 1)));
        return DataCube.of(level, CubeMetadata.spacetime(Band.of(band)));
    }

    private static DataCube still(String band, double value) {
        Level level = Fixtures.spatial(layout(1, 1, 2, 2), Map.of(TileKey.of(0, 0), Fixtures.filled(2, 2, value)));
        return DataCube.of(level, CubeMetadata.spatial(Band.of(band)));
    }

    @Test
    void mergeCubesAppendsTheBandsOfTheOtherCube() {
        DataCube merged = service.mergeCubes(series("B04", 1), still("B08", 3), null);
        DataCube swapped = service.mergeCubes(still("B08", 3), series("B04", 1), null);

        assertThat(merged.metadata().hasTemporalDimension()).isTrue();
        assertThat(merged.metadata().bandNames()).containsExactly("B04", "B08");
        assertThat(merged.highestLevel().instants()).containsExactly(day(1), day(2));
        Tile second = merged.highestLevel().tile(TileKey.of(0, 0, day(2)));
        assertThat(second.get(0, 1, 1)).isEqualTo(2);
        assertThat(second.get(1, 1, 1)).isEqualTo(3);

        assertThat(swapped.metadata().hasTemporalDimension()).isTrue();
        assertThat(swapped.metadata().bandNames()).containsExactly("B08", "B04");
        assertThat(swapped.highestLevel().tile(TileKey.of(0, 0, day(1))).get(0, 0, 0)).isEqualTo(3);
    }

    @Test
    void mergeCubesResolvesOverlapWithABuiltinReducer() {
        DataCube merged = service.mergeCubes(series("B04", 1), series("B04", 7), new BuiltinReducer("max"));

        assertThat(merged.metadata().bandNames()).containsExactly("B04");
        assertThat(merged.highestLevel().tile(TileKey.of(0, 0, day(1))).band(0)).containsOnly(7.0);
        assertThat(merged.highestLevel().tile(TileKey.of(0, 0, day(2))).band(0)).containsOnly(8.0);
    }

    @Test
    void mergeCubesRejectsWhatItCannotCombine() {
        DataCube noBands = series("B04", 1).withMetadata(new CubeMetadata(
            List.of(Dimension.spatial("x"), Dimension.spatial("y"), Dimension.temporal("t")), List.of()));
        DataCube twoLevels = new DataCube(new Pyramid(Map.of(0, series("B04", 1).highestLevel(),
            1, series("B04", 1).highestLevel())), CubeMetadata.spacetime(Band.of("B04")));

        assertThatThrownBy(() -> service.mergeCubes(series("B04", 1), series("B04", 2), null))
            .isInstanceOf(UnsupportedCombinationException.class)
            .hasMessageContaining("[B04]");
        assertThatThrownBy(() -> service.mergeCubes(still("B04", 1), still("B08", 2), null))
            .isInstanceOf(FeatureUnsupportedException.class);
        assertThatThrownBy(() -> service.mergeCubes(series("B04", 1), series("B04", 2),
            UdfReducer.of("def apply_datacube(cube, context) { cube }")))
            .isInstanceOf(UnsupportedCombinationException.class);
        assertThatThrownBy(() -> service.mergeCubes(series("B04", 1), series("B08", 2), new BuiltinReducer("max")))
            .isInstanceOf(UnsupportedCombinationException.class);
        assertThatThrownBy(() -> service.mergeCubes(series("B04", 1), noBands, null))
            .isInstanceOf(UnsupportedCombinationException.class);
        assertThatThrownBy(() -> service.mergeCubes(twoLevels, series("B08", 2), null))
            .isInstanceOf(FeatureUnsupportedException.class)
            .hasMessageContaining("zoom 1");
    }

    @Test
    void maskCubeIsReLaidOntoTheDataLayout() {
        Map<TileKey, Tile> tiles = new HashMap<>();
        for (int col = 0; col < 2; col++) {
            for (int row = 0; row < 2; row++) tiles.put(TileKey.of(col, row, day(1)), Fixtures.filled(2, 2, 5));
        }
        DataCube data = DataCube.of(Fixtures.spacetime(layout(2, 2, 2, 2), tiles), CubeMetadata.spacetime(Band.of("B04")));
        double[] topHalf = {1, 1, 1, 1, 1, 1, 1, 1, 0, 0, 0, 0, 0, 0, 0, 0};
        DataCube mask = DataCube.of(Fixtures.spatial(layout(1, 1, 4, 4),
            Map.of(TileKey.of(0, 0), Tile.of(4, 4, CellType.FLOAT32, Double.NaN, topHalf))),
            CubeMetadata.spatial(Band.of("clouds")));

        DataCube masked = service.mask(data, mask, 0.0);

        assertThat(masked.metadata()).isEqualTo(data.metadata());
        assertThat(masked.highestLevel().tile(TileKey.of(0, 0, day(1))).band(0)).containsOnly(0.0);
        assertThat(masked.highestLevel().tile(TileKey.of(1, 0, day(1))).band(0)).containsOnly(0.0);
        assertThat(masked.highestLevel().tile(TileKey.of(0, 1, day(1))).band(0)).containsOnly(5.0);
        assertThatThrownBy(() -> service.mask(still("B04", 1), series("clouds", 1), null))
            .isInstanceOf(UnsupportedCombinationException.class);
    }

    @Test
    void applyKernelScalesTheKernelAndNeedsOddDimensions() {
        double[][] identity = {{0, 0, 0}, {0, 1, 0}, {0, 0, 0}};

        DataCube out = service.applyKernel(still("B04", 2), identity, 2.5, 0, 0);

        assertThat(out.highestLevel().tile(TileKey.of(0, 0)).band(0)).containsOnly(5.0);
        assertThatThrownBy(() -> service.applyKernel(still("B04", 2), new double[][]{{1, 1}}, 1, 0, 0))
            .isInstanceOf(KernelDimensionsUnevenException.class)
            .extracting(e -> ((DatacubeException) e).code())
            .isEqualTo("KernelDimensionsUneven");
    }
}
