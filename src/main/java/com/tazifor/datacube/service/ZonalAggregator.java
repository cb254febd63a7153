package com.tazifor.datacube.service;

import com.tazifor.datacube.geo.model.Polygon;
import com.tazifor.datacube.geo.model.TileKey;
import com.tazifor.datacube.model.DataCube;
import com.tazifor.datacube.model.Level;
import com.tazifor.datacube.model.Tile;
import com.tazifor.datacube.store.TileStore;
import com.tazifor.datacube.store.TileWorkerPool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;

/**
 * Per-polygon statistics over the highest level of a cube.
 */
@Slf4j
@Service
public class ZonalAggregator {

    /** Result key used for levels without a time dimension. */
    public static final String NO_DATE = "NoDate";

    private final TileStore store;
    private final TileWorkerPool workers;

    public ZonalAggregator(TileStore store, TileWorkerPool workers) {
        this.store = store;
        this.workers = workers;
    }

    /**
     * Mean of every band inside {@code polygon}, per instant.
     * <p>
     * Pixels whose center lies outside the polygon, nodata pixels and
     * {@code NaN} pixels are left out. An instant where a band has no valid
     * pixel at all reports {@code NaN} for that band.
     * </p>
     *
     * @return band means keyed by ISO-8601 instant (or {@value #NO_DATE}), in time order
     */
    public Map<String, List<Double>> polygonalMeanTimeseries(DataCube cube, Polygon polygon) {
        Level level = cube.highestLevel();
        Set<TileKey> covering = level.tiler().keysForPolygon(polygon, 0.0);
        Map<TileKey, Tile> candidates = new LinkedHashMap<>();
        level.tiles().forEach((k, t) -> {
            if (covering.contains(k.spatialKey())) candidates.put(k, t);
        });
        Level masked = store.mask(level.withTiles(candidates), polygon);

        int bands = masked.bandCount();
        List<Map.Entry<Instant, MeanAccumulator[]>> partials = workers.map(masked.entries(), e -> {
            Tile t = e.getValue();
            MeanAccumulator[] acc = new MeanAccumulator[bands];
            for (int b = 0; b < bands; b++) {
                MeanAccumulator a = MeanAccumulator.EMPTY;
                for (int r = 0; r < t.rows(); r++) {
                    for (int c = 0; c < t.cols(); c++) {
                        double v = t.get(b, c, r);
                        if (!t.isNoData(v)) a = a.add(v);
                    }
                }
                acc[b] = a;
            }
            return new AbstractMap.SimpleImmutableEntry<>(e.getKey().instant(), acc);
        });

        Map<Instant, MeanAccumulator[]> combined = new TreeMap<>(Comparator.nullsFirst(Comparator.naturalOrder()));
        for (Map.Entry<Instant, MeanAccumulator[]> p : partials) {
            MeanAccumulator[] current = combined.get(p.getKey());
            if (current == null) {
                combined.put(p.getKey(), p.getValue());
            } else {
                for (int b = 0; b < bands; b++) current[b] = current[b].combine(p.getValue()[b]);
            }
        }

        Map<String, List<Double>> out = new LinkedHashMap<>();
        combined.forEach((instant, acc) -> {
            String label = instant == null ? NO_DATE : instant.toString();
            List<Double> means = new ArrayList<>(bands);
            for (int b = 0; b < bands; b++) {
                if (acc[b].count() == 0)
                    log.warn("no valid pixels for band {} at {} inside the polygon: reporting NaN", b, label);
                means.add(acc[b].mean());
            }
            out.put(label, means);
        });
        return out;
    }
}
