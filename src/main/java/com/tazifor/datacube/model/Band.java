package com.tazifor.datacube.model;

/**
 * A named band. {@code commonName} is the spectral alias ("red", "nir")
 * used when a process resolves bands by meaning instead of by name.
 */
public record Band(String name, String commonName, Double wavelengthUm) {

    public static Band of(String name) {
        return new Band(name, null, null);
    }

    public static Band of(String name, String commonName) {
        return new Band(name, commonName, null);
    }
}
