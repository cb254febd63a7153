package com.tazifor.datacube;

import com.tazifor.datacube.config.EngineProperties;
import com.tazifor.datacube.error.WindowTooSmallException;
import com.tazifor.datacube.export.DownloadService;
import com.tazifor.datacube.export.ExportOptions;
import com.tazifor.datacube.geo.model.TileKey;
import com.tazifor.datacube.model.*;
import com.tazifor.datacube.process.DimensionWindow;
import com.tazifor.datacube.process.UdfReducer;
import com.tazifor.datacube.service.OperationDispatcher;
import com.tazifor.datacube.udf.CollapsedTimePolicy;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.tazifor.datacube.Fixtures.filled;
import static com.tazifor.datacube.Fixtures.layout;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
class DatacubeEngineApplicationTests {

    @Autowired
    private EngineProperties properties;
    @Autowired
    private OperationDispatcher dispatcher;
    @Autowired
    private DownloadService downloads;

    @Test
    void propertiesAreBoundFromApplicationYaml() {
        assertThat(properties.getNeighborhood().getMinWindowSize()).isEqualTo(32);
        assertThat(properties.getWorkers().getThreads()).isEqualTo(4);
        assertThat(properties.getUdf().getCollapsedTimePolicy()).isEqualTo(CollapsedTimePolicy.FIRST_INSTANT);
        assertThat(properties.getUdf().getCollapsedTimeLabel()).isEqualTo(Instant.EPOCH);
        assertThat(properties.getExport().isPrettyPrint()).isTrue();
    }

    @Test
    void neighborhoodUdfRunsEndToEnd() {
        Level level = Fixtures.spatial(layout(2, 2, 32, 32), Map.of(
            TileKey.of(0, 0), filled(32, 32, 1),
            TileKey.of(1, 0), filled(32, 32, 2),
            TileKey.of(0, 1), filled(32, 32, 3),
            TileKey.of(1, 1), filled(32, 32, 4)));
        DataCube cube = DataCube.of(level, CubeMetadata.spatial(Band.of("B04")));
        UdfReducer doubled = UdfReducer.of("def apply_datacube(cube, context) { cube * 2 }");

        DataCube out = dispatcher.applyNeighborhood(cube, doubled,
            List.of(DimensionWindow.pixels("x", 32), DimensionWindow.pixels("y", 32)),
            List.of(DimensionWindow.pixels("x", 8), DimensionWindow.pixels("y", 8)));

        assertThat(out.highestLevel().bufferX()).isZero();
        DataArray array = downloads.collect(out, new ExportOptions());
        assertThat(array.shape()).containsExactly(1, 64, 64);
        assertThat(array.get(0, 0, 0)).isEqualTo(6.0);
        assertThat(array.get(0, 63, 63)).isEqualTo(4.0);
    }

    @Test
    void windowFloorComesFromConfiguration() {
        Level level = Fixtures.spatial(layout(1, 1, 32, 32), Map.of(TileKey.of(0, 0), filled(32, 32, 1)));
        DataCube cube = DataCube.of(level, CubeMetadata.spatial(Band.of("B04")));

        assertThatThrownBy(() -> dispatcher.applyNeighborhood(cube, UdfReducer.of("cube"),
            List.of(DimensionWindow.pixels("x", 31), DimensionWindow.pixels("y", 32)), List.of()))
            .isInstanceOf(WindowTooSmallException.class);
    }
}
