package com.forecast.pipeline.core.model;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.DoubleUnaryOperator;

/**
 * Immutable, date-indexed numeric series carrying a name (the rule variation
 * that produced it). Values may be {@code NaN} where no forecast exists.
 */
public final class LabeledSeries {

    private final String name;
    private final List<LocalDate> index;
    private final double[] values;

    private LabeledSeries(String name, List<LocalDate> index, double[] values) {
        this.name = Objects.requireNonNull(name, "name is required");
        this.index = List.copyOf(Objects.requireNonNull(index, "index is required"));
        this.values = Objects.requireNonNull(values, "values is required").clone();
        if (this.index.size() != this.values.length) {
            throw new IllegalArgumentException("Index has " + this.index.size()
                    + " labels but " + this.values.length + " values were given");
        }
    }

    public static LabeledSeries of(String name, List<LocalDate> index, double... values) {
        return new LabeledSeries(name, index, values);
    }

    public static LabeledSeries empty(String name) {
        return new LabeledSeries(name, List.of(), new double[0]);
    }

    public String getName() {
        return name;
    }

    public List<LocalDate> getIndex() {
        return index;
    }

    public int size() {
        return values.length;
    }

    public double get(int position) {
        return values[position];
    }

    /**
     * Returns a copy of the values.
     */
    public double[] toArray() {
        return values.clone();
    }

    /**
     * Applies {@code operator} element-wise, keeping name and index.
     */
    public LabeledSeries map(DoubleUnaryOperator operator) {
        double[] mapped = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            mapped[i] = operator.applyAsDouble(values[i]);
        }
        return new LabeledSeries(name, index, mapped);
    }

    /**
     * True if both series have the same name, length and index labels.
     */
    public boolean hasSameShapeAs(LabeledSeries other) {
        return other != null
                && name.equals(other.name)
                && values.length == other.values.length
                && index.equals(other.index);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LabeledSeries that = (LabeledSeries) o;
        return name.equals(that.name) && index.equals(that.index) && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(name, index) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "LabeledSeries{" +
                "name='" + name + '\'' +
                ", size=" + values.length +
                '}';
    }
}
