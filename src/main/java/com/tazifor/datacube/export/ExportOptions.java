package com.tazifor.datacube.export;

import com.tazifor.datacube.geo.model.Extent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Download options. The crop box is given as {@code left, bottom, right,
 * top} in the cube's coordinate reference system; all of them must be set
 * for the crop to apply.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExportOptions {
    private Double left;
    private Double bottom;
    private Double right;
    private Double top;
    private Instant from;
    private Instant to;

    public boolean hasCrop() {
        return left != null && bottom != null && right != null && top != null;
    }

    public Extent crop() {
        return hasCrop() ? new Extent(left, bottom, right, top) : null;
    }
}
