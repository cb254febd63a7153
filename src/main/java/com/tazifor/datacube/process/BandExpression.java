package com.tazifor.datacube.process;

/**
 * Expression evaluated per pixel over the values of all bands of that pixel.
 * Nodata inputs arrive as {@code NaN} and propagate through arithmetic.
 */
public interface BandExpression {

    double evaluate(double[] bandValues);

    static BandExpression band(int index) {
        return new BandRef(index);
    }

    static BandExpression constant(double value) {
        return new Constant(value);
    }

    static BandExpression add(BandExpression x, BandExpression y) {
        return new BinaryOperation(BinaryOperation.Operator.ADD, x, y);
    }

    static BandExpression subtract(BandExpression x, BandExpression y) {
        return new BinaryOperation(BinaryOperation.Operator.SUBTRACT, x, y);
    }

    static BandExpression multiply(BandExpression x, BandExpression y) {
        return new BinaryOperation(BinaryOperation.Operator.MULTIPLY, x, y);
    }

    static BandExpression divide(BandExpression x, BandExpression y) {
        return new BinaryOperation(BinaryOperation.Operator.DIVIDE, x, y);
    }

    /** {@code (x - y) / (x + y)} */
    static BandExpression normalizedDifference(BandExpression x, BandExpression y) {
        return divide(subtract(x, y), add(x, y));
    }

    record BandRef(int index) implements BandExpression {
        @Override
        public double evaluate(double[] bandValues) {
            if (index < 0 || index >= bandValues.length)
                throw new IndexOutOfBoundsException("band index " + index + " out of range, " + bandValues.length + " bands");
            return bandValues[index];
        }
    }

    record Constant(double value) implements BandExpression {
        @Override
        public double evaluate(double[] bandValues) {
            return value;
        }
    }

    record BinaryOperation(Operator operator, BandExpression x, BandExpression y) implements BandExpression {

        public enum Operator { ADD, SUBTRACT, MULTIPLY, DIVIDE }

        @Override
        public double evaluate(double[] bandValues) {
            double a = x.evaluate(bandValues);
            double b = y.evaluate(bandValues);
            switch (operator) {
                case ADD: return a + b;
                case SUBTRACT: return a - b;
                case MULTIPLY: return a * b;
                case DIVIDE: return b == 0 ? Double.NaN : a / b;
                default: throw new IllegalStateException("unknown operator " + operator);
            }
        }
    }
}
