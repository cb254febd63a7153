package com.tazifor.datacube.model;

import java.util.*;
import java.util.function.DoubleUnaryOperator;

/**
 * Labelled N-dimensional array of doubles.
 * <p>
 * This is the array payload exchanged with user-defined functions and the
 * result of stitching a level. Values are stored row-major: the last
 * dimension varies fastest. Each dimension may carry coordinate labels
 * (band names, instants, pixel-center positions). Instances are immutable;
 * all operations return new arrays.
 * </p>
 */
public final class DataArray {

    private final List<String> dims;
    private final int[] shape;
    private final double[] values;
    private final Map<String, List<Object>> coords;
    private final Map<String, Object> attrs;

    public DataArray(List<String> dims, int[] shape, double[] values,
                     Map<String, ? extends List<?>> coords, Map<String, Object> attrs) {
        if (dims.size() != shape.length)
            throw new IllegalArgumentException("dims " + dims + " do not match shape " + Arrays.toString(shape));
        if (new HashSet<>(dims).size() != dims.size())
            throw new IllegalArgumentException("duplicate dimension in " + dims);
        long size = 1;
        for (int s : shape) {
            if (s < 0) throw new IllegalArgumentException("negative dimension length in " + Arrays.toString(shape));
            size *= s;
        }
        if (size != values.length)
            throw new IllegalArgumentException("shape " + Arrays.toString(shape) + " holds " + size
                + " values, got " + values.length);
        Map<String, List<Object>> c = new LinkedHashMap<>();
        if (coords != null) {
            for (Map.Entry<String, ? extends List<?>> e : coords.entrySet()) {
                int axis = dims.indexOf(e.getKey());
                if (axis < 0 || e.getValue() == null) continue;
                if (e.getValue().size() != shape[axis])
                    throw new IllegalArgumentException("coordinate " + e.getKey() + " has " + e.getValue().size()
                        + " labels for length " + shape[axis]);
                c.put(e.getKey(), Collections.unmodifiableList(new ArrayList<>(e.getValue())));
            }
        }
        this.dims = List.copyOf(dims);
        this.shape = shape.clone();
        this.values = values;
        this.coords = Collections.unmodifiableMap(c);
        this.attrs = attrs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attrs));
    }

    public static DataArray of(List<String> dims, int[] shape, double[] values) {
        return new DataArray(dims, shape, values.clone(), Map.of(), Map.of());
    }

    public List<String> dims() { return dims; }

    public int[] shape() { return shape.clone(); }

    public int size() { return values.length; }

    public boolean hasDim(String dim) { return dims.contains(dim); }

    public int axis(String dim) {
        int axis = dims.indexOf(dim);
        if (axis < 0) throw new IllegalArgumentException("no dimension " + dim + " in " + dims);
        return axis;
    }

    public int length(String dim) { return shape[axis(dim)]; }

    /** Copy of the flat row-major values. */
    public double[] values() { return values.clone(); }

    public Map<String, List<Object>> coords() { return coords; }

    public List<Object> coords(String dim) {
        return coords.getOrDefault(dim, List.of());
    }

    public Map<String, Object> attrs() { return attrs; }

    public Object attr(String name) { return attrs.get(name); }

    public double get(int... index) {
        return values[offset(index)];
    }

    private int[] strides() {
        int[] strides = new int[shape.length];
        int stride = 1;
        for (int i = shape.length - 1; i >= 0; i--) {
            strides[i] = stride;
            stride *= shape[i];
        }
        return strides;
    }

    private int offset(int[] index) {
        if (index.length != shape.length)
            throw new IllegalArgumentException("expected " + shape.length + " indices, got " + index.length);
        int[] strides = strides();
        int off = 0;
        for (int i = 0; i < index.length; i++) {
            if (index[i] < 0 || index[i] >= shape[i])
                throw new IndexOutOfBoundsException("index " + index[i] + " out of range for " + dims.get(i));
            off += index[i] * strides[i];
        }
        return off;
    }

    public DataArray withValues(double[] newValues) {
        return new DataArray(dims, shape, newValues.clone(), coords, attrs);
    }

    public DataArray withAttrs(Map<String, Object> newAttrs) {
        Map<String, Object> merged = new LinkedHashMap<>(attrs);
        merged.putAll(newAttrs);
        return new DataArray(dims, shape, values, coords, merged);
    }

    public DataArray withCoords(String dim, List<?> labels) {
        Map<String, List<?>> c = new LinkedHashMap<>(coords);
        c.put(dim, labels);
        return new DataArray(dims, shape, values, c, attrs);
    }

    public DataArray map(DoubleUnaryOperator op) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) out[i] = op.applyAsDouble(values[i]);
        return new DataArray(dims, shape, out, coords, attrs);
    }

    public DataArray multiply(double factor) {
        return map(v -> v * factor);
    }

    public DataArray add(double offset) {
        return map(v -> v + offset);
    }

    /**
     * Selects one position along {@code dim}, dropping that dimension.
     */
    public DataArray isel(String dim, int index) {
        int axis = axis(dim);
        if (index < 0 || index >= shape[axis])
            throw new IndexOutOfBoundsException("index " + index + " out of range for " + dim);
        int outer = 1, inner = 1;
        for (int i = 0; i < axis; i++) outer *= shape[i];
        for (int i = axis + 1; i < shape.length; i++) inner *= shape[i];

        double[] out = new double[outer * inner];
        for (int o = 0; o < outer; o++) {
            System.arraycopy(values, (o * shape[axis] + index) * inner, out, o * inner, inner);
        }
        return new DataArray(without(dims, axis), without(shape, axis), out, coordsWithout(dim), attrs);
    }

    /**
     * Mean along {@code dim} ignoring {@code NaN} values; positions where
     * every value is {@code NaN} stay {@code NaN}.
     */
    public DataArray mean(String dim) {
        int axis = axis(dim);
        int outer = 1, inner = 1;
        for (int i = 0; i < axis; i++) outer *= shape[i];
        for (int i = axis + 1; i < shape.length; i++) inner *= shape[i];

        double[] out = new double[outer * inner];
        for (int o = 0; o < outer; o++) {
            for (int in = 0; in < inner; in++) {
                double sum = 0;
                int count = 0;
                for (int k = 0; k < shape[axis]; k++) {
                    double v = values[(o * shape[axis] + k) * inner + in];
                    if (!Double.isNaN(v)) {
                        sum += v;
                        count++;
                    }
                }
                out[o * inner + in] = count == 0 ? Double.NaN : sum / count;
            }
        }
        return new DataArray(without(dims, axis), without(shape, axis), out, coordsWithout(dim), attrs);
    }

    /**
     * Reorders the dimensions. {@code order} must name every dimension once.
     */
    public DataArray transpose(List<String> order) {
        if (order.size() != dims.size() || !new HashSet<>(order).equals(new HashSet<>(dims)))
            throw new IllegalArgumentException("cannot transpose " + dims + " to " + order);
        if (order.equals(dims)) return this;

        int n = dims.size();
        int[] perm = new int[n];
        int[] newShape = new int[n];
        for (int i = 0; i < n; i++) {
            perm[i] = dims.indexOf(order.get(i));
            newShape[i] = shape[perm[i]];
        }
        int[] oldStrides = strides();
        double[] out = new double[values.length];
        int[] idx = new int[n];
        for (int flat = 0; flat < out.length; flat++) {
            int src = 0;
            for (int i = 0; i < n; i++) src += idx[i] * oldStrides[perm[i]];
            out[flat] = values[src];
            for (int i = n - 1; i >= 0; i--) {
                if (++idx[i] < newShape[i]) break;
                idx[i] = 0;
            }
        }
        return new DataArray(order, newShape, out, coords, attrs);
    }

    /**
     * Inserts a new leading dimension of length 1.
     */
    public DataArray expandDims(String dim, Object label) {
        List<String> newDims = new ArrayList<>();
        newDims.add(dim);
        newDims.addAll(dims);
        int[] newShape = new int[shape.length + 1];
        newShape[0] = 1;
        System.arraycopy(shape, 0, newShape, 1, shape.length);
        Map<String, List<?>> c = new LinkedHashMap<>(coords);
        if (label != null) c.put(dim, List.of(label));
        return new DataArray(newDims, newShape, values, c, attrs);
    }

    /**
     * Stacks equally shaped arrays along a new leading dimension.
     */
    public static DataArray stack(String dim, List<?> labels, List<DataArray> arrays) {
        if (arrays.isEmpty())
            throw new IllegalArgumentException("nothing to stack");
        DataArray first = arrays.get(0);
        double[] out = new double[first.values.length * arrays.size()];
        for (int i = 0; i < arrays.size(); i++) {
            DataArray a = arrays.get(i);
            if (!a.dims.equals(first.dims) || !Arrays.equals(a.shape, first.shape))
                throw new IllegalArgumentException("cannot stack arrays of different shapes");
            System.arraycopy(a.values, 0, out, i * first.values.length, first.values.length);
        }
        List<String> newDims = new ArrayList<>();
        newDims.add(dim);
        newDims.addAll(first.dims);
        int[] newShape = new int[first.shape.length + 1];
        newShape[0] = arrays.size();
        System.arraycopy(first.shape, 0, newShape, 1, first.shape.length);
        Map<String, List<?>> c = new LinkedHashMap<>(first.coords);
        if (labels != null) c.put(dim, labels);
        return new DataArray(newDims, newShape, out, c, first.attrs);
    }

    private Map<String, List<Object>> coordsWithout(String dim) {
        Map<String, List<Object>> c = new LinkedHashMap<>(coords);
        c.remove(dim);
        return c;
    }

    private static List<String> without(List<String> list, int axis) {
        List<String> out = new ArrayList<>(list);
        out.remove(axis);
        return out;
    }

    private static int[] without(int[] arr, int axis) {
        int[] out = new int[arr.length - 1];
        for (int i = 0, j = 0; i < arr.length; i++) {
            if (i != axis) out[j++] = arr[i];
        }
        return out;
    }

    @Override
    public String toString() {
        return "DataArray" + dims + Arrays.toString(shape);
    }
}
