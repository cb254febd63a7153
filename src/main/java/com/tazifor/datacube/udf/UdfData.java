package com.tazifor.datacube.udf;

import com.tazifor.datacube.model.DataArray;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Exchange envelope handed to user code: coordinate reference, array
 * payload and the opaque user context. Script-style functions replace
 * {@code datacubes} in place.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UdfData {
    private Map<String, Object> projection;
    private List<DataArray> datacubes = new ArrayList<>();
    private Map<String, Object> userContext;
}
