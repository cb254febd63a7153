package com.tazifor.datacube.export;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.tazifor.datacube.model.DataArray;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes a stitched array as JSON:
 * <pre>
 * {
 *   "dims":   ["t", "bands", "x", "y"],
 *   "coords": {"t": [...], "bands": [...], "x": [...], "y": [...]},
 *   "attrs":  {"nodata": ..., "crs": ..., "dtype": "float64", "shape": [...]},
 *   "data":   [[[[...]]]]
 * }
 * </pre>
 * {@code NaN} cells are written as {@code null}, instants as ISO-8601 strings.
 */
public class ArrayJsonWriter {

    private final ObjectMapper mapper;
    private final boolean prettyPrint;

    public ArrayJsonWriter(ObjectMapper mapper, boolean prettyPrint) {
        this.mapper = mapper;
        this.prettyPrint = prettyPrint;
    }

    public void write(DataArray array, OutputStream out) throws IOException {
        Map<String, Object> attrs = new LinkedHashMap<>(array.attrs());
        attrs.put("dtype", "float64");
        attrs.put("shape", array.shape());

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("dims", array.dims());
        document.put("coords", coords(array));
        document.put("attrs", attrs);
        document.put("data", nested(array.values(), array.shape(), 0, 0));

        ObjectMapper writerMapper = mapper.copy()
            .configure(SerializationFeature.INDENT_OUTPUT, prettyPrint)
            .configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
        writerMapper.writeValue(out, document);
    }

    public String writeAsString(DataArray array) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        write(array, buffer);
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private static Map<String, List<Object>> coords(DataArray array) {
        Map<String, List<Object>> out = new LinkedHashMap<>();
        array.coords().forEach((dim, labels) -> {
            List<Object> converted = new ArrayList<>(labels.size());
            for (Object label : labels) converted.add(label instanceof TemporalAccessor ? label.toString() : label);
            out.put(dim, converted);
        });
        return out;
    }

    private static Object nested(double[] values, int[] shape, int axis, int offset) {
        if (axis == shape.length) {
            double v = values[offset];
            return Double.isNaN(v) ? null : v;
        }
        int stride = 1;
        for (int i = axis + 1; i < shape.length; i++) stride *= shape[i];
        List<Object> out = new ArrayList<>(shape[axis]);
        for (int i = 0; i < shape[axis]; i++) {
            out.add(nested(values, shape, axis + 1, offset + i * stride));
        }
        return out;
    }
}
