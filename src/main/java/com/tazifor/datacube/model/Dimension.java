package com.tazifor.datacube.model;

public record Dimension(String name, Type type) {

    public enum Type {
        SPATIAL,
        TEMPORAL,
        BANDS,
        OTHER;

        public static Type fromName(String name) {
            if (name == null) return OTHER;
            switch (name.toLowerCase()) {
                case "spatial": return SPATIAL;
                case "temporal": return TEMPORAL;
                case "bands": return BANDS;
                default: return OTHER;
            }
        }
    }

    public static Dimension spatial(String name) { return new Dimension(name, Type.SPATIAL); }

    public static Dimension temporal(String name) { return new Dimension(name, Type.TEMPORAL); }

    public static Dimension bands(String name) { return new Dimension(name, Type.BANDS); }
}
