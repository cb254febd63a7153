package com.tazifor.datacube.export;

import com.tazifor.datacube.model.DataArray;
import com.tazifor.datacube.model.DataCube;
import com.tazifor.datacube.service.TileStitcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Stitches a cube and writes it out as JSON.
 */
@Slf4j
@Service
public class DownloadService {

    private final TileStitcher stitcher;
    private final ArrayJsonWriter writer;

    public DownloadService(TileStitcher stitcher, ArrayJsonWriter writer) {
        this.stitcher = stitcher;
        this.writer = writer;
    }

    public DataArray collect(DataCube cube, ExportOptions options) {
        ExportOptions opts = options == null ? new ExportOptions() : options;
        return stitcher.stitch(cube, opts.crop(), opts.getFrom(), opts.getTo());
    }

    public void download(DataCube cube, ExportOptions options, OutputStream out) {
        DataArray array = collect(cube, options);
        try {
            writer.write(array, out);
        } catch (IOException e) {
            throw new UncheckedIOException("could not write array " + array, e);
        }
    }

    public Path download(DataCube cube, ExportOptions options, Path target) {
        try (OutputStream out = Files.newOutputStream(target)) {
            download(cube, options, out);
        } catch (IOException e) {
            throw new UncheckedIOException("could not write " + target, e);
        }
        log.info("wrote {} to {}", cube.highestLevel(), target);
        return target;
    }
}
