package com.tazifor.datacube.model;

public enum LayerType {
    SPATIAL,
    SPACETIME
}
