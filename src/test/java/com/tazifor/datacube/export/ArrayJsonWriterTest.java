package com.tazifor.datacube.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tazifor.datacube.model.DataArray;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.tazifor.datacube.Fixtures.day;
import static org.assertj.core.api.Assertions.assertThat;

class ArrayJsonWriterTest {

    private final ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());

    private static DataArray sample() {
        Map<String, List<?>> coords = new LinkedHashMap<>();
        coords.put("t", List.of(day(1), day(2)));
        coords.put("x", List.of(0.5));
        coords.put("y", List.of(0.5, 1.5));
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("crs", "EPSG:4326");
        return new DataArray(List.of("t", "x", "y"), new int[]{2, 1, 2},
            new double[]{1, Double.NaN, 3, 4}, coords, attrs);
    }

    @Test
    void writesDimsCoordsAttrsAndNestedData() throws Exception {
        String json = new ArrayJsonWriter(mapper, false).writeAsString(sample());

        JsonNode doc = mapper.readTree(json);
        assertThat(doc.get("dims").toString()).isEqualTo("[\"t\",\"x\",\"y\"]");
        assertThat(doc.at("/coords/t/0").asText()).isEqualTo("2021-01-01T00:00:00Z");
        assertThat(doc.at("/coords/y/1").asDouble()).isEqualTo(1.5);
        assertThat(doc.at("/attrs/crs").asText()).isEqualTo("EPSG:4326");
        assertThat(doc.at("/attrs/dtype").asText()).isEqualTo("float64");
        assertThat(doc.at("/attrs/shape").toString()).isEqualTo("[2,1,2]");
        assertThat(doc.at("/data/0/0/0").asDouble()).isEqualTo(1.0);
        assertThat(doc.at("/data/1/0/1").asDouble()).isEqualTo(4.0);
    }

    @Test
    void nanCellsBecomeNull() throws Exception {
        JsonNode doc = mapper.readTree(new ArrayJsonWriter(mapper, false).writeAsString(sample()));

        assertThat(doc.at("/data/0/0/1").isNull()).isTrue();
    }

    @Test
    void prettyPrintingIsConfigurable() throws Exception {
        assertThat(new ArrayJsonWriter(mapper, true).writeAsString(sample())).contains("\n");
        assertThat(new ArrayJsonWriter(mapper, false).writeAsString(sample())).doesNotContain("\n");
    }

    @Test
    void leavesTheTargetStreamOpen() throws Exception {
        ArrayJsonWriter writer = new ArrayJsonWriter(mapper, false);
        ByteArrayOutputStream out = new ByteArrayOutputStream() {
            @Override
            public void close() {
                throw new AssertionError("stream closed by writer");
            }
        };

        writer.write(sample(), out);

        assertThat(out.size()).isPositive();
    }

    @Test
    void emptyArraysHaveEmptyData() throws Exception {
        DataArray empty = new DataArray(List.of("x", "y"), new int[]{0, 0}, new double[0], Map.of(), Map.of());

        JsonNode doc = mapper.readTree(new ArrayJsonWriter(mapper, false).writeAsString(empty));

        assertThat(doc.get("data").size()).isZero();
        assertThat(doc.at("/attrs/shape").toString()).isEqualTo("[0,0]");
    }
}
