package com.tazifor.datacube.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CubeMetadataTest {

    private final CubeMetadata md = CubeMetadata.spacetime(Band.of("B04", "red"), Band.of("B08", "nir"));

    @Test
    void reducingTheBandDimensionDropsTheBands() {
        CubeMetadata reduced = md.reduceDimension("bands");
        assertThat(reduced.hasBandDimension()).isFalse();
        assertThat(reduced.bands()).isEmpty();
        assertThat(reduced.hasTemporalDimension()).isTrue();
    }

    @Test
    void reducingTimeKeepsTheBands() {
        CubeMetadata reduced = md.reduceDimension("t");
        assertThat(reduced.hasTemporalDimension()).isFalse();
        assertThat(reduced.bandNames()).containsExactly("B04", "B08");
    }

    @Test
    void renameKeepsTheDimensionType() {
        CubeMetadata renamed = md.renameDimension("t", "time");
        assertThat(renamed.isTemporalDimension("time")).isTrue();
        assertThatThrownBy(() -> md.renameDimension("x", "y")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void filterBandsFollowsTheRequestedOrder() {
        assertThat(md.filterBands(List.of("B08", "B04")).bandNames()).containsExactly("B08", "B04");
        assertThatThrownBy(() -> md.filterBands(List.of("B02"))).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void addBandDimension() {
        CubeMetadata spatial = md.reduceDimension("bands").addDimension("layer", "ndvi", Dimension.Type.BANDS);
        assertThat(spatial.isBandDimension("layer")).isTrue();
        assertThat(spatial.bandNames()).containsExactly("ndvi");
    }
}
