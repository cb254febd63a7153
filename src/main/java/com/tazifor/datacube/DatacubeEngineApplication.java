package com.tazifor.datacube;

import com.tazifor.datacube.config.EngineProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Datacube Engine - tile orchestration for raster datacubes
 *
 * Runs cube operations over a pyramid of spatially and temporally keyed tiles:
 * - reduce_dimension / apply / apply_neighborhood dispatch
 * - Groovy user-defined functions over single tiles or time series
 * - neighborhood retiling with overlap
 * - stitching tiles back into one labelled array
 * - polygon zonal statistics
 */
@SpringBootApplication
@EnableConfigurationProperties(EngineProperties.class)
public class DatacubeEngineApplication {

    public static void main(String[] args) {
        printBanner();
        SpringApplication.run(DatacubeEngineApplication.class, args);
    }

    private static void printBanner() {
        System.out.println("""
            ╔════════════════════════════════════════════════════════╗
            ║                                                        ║
            ║                   DATACUBE ENGINE                      ║
            ║          Tiles in, arrays out, udfs in between         ║
            ║                                                        ║
            ╚════════════════════════════════════════════════════════╝

            Starting Datacube Engine...
            """);
    }
}
