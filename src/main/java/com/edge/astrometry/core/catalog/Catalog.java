package com.edge.astrometry.core.catalog;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.IntPredicate;

/**
 * 星表
 * <p>
 * 固定列宽的只读数值表，前两列始终是坐标（RA/Dec 或像素 X/Y）。
 * 所有变换都返回新的星表，不修改调用方持有的数据。
 */
public final class Catalog {
    private final double[][] rows;
    private final int width;

    private Catalog(double[][] rows, int width) {
        this.rows = rows;
        this.width = width;
    }

    /**
     * 从行数据创建星表（深拷贝）
     *
     * @param rows  行数据，每行长度必须一致且不少于 2
     * @param width 列数（空表时用于记住列宽）
     */
    public static Catalog of(double[][] rows, int width) {
        if (width < 2) {
            throw new IllegalArgumentException("Catalog needs at least 2 coordinate columns, got " + width);
        }
        double[][] copy = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            if (rows[i].length != width) {
                throw new IllegalArgumentException(
                    "Row " + i + " has " + rows[i].length + " columns, expected " + width);
            }
            copy[i] = rows[i].clone();
        }
        return new Catalog(copy, width);
    }

    public static Catalog of(double[][] rows) {
        if (rows.length == 0) {
            throw new IllegalArgumentException("Cannot infer column count of an empty catalog");
        }
        return of(rows, rows[0].length);
    }

    public static Catalog empty(int width) {
        return of(new double[0][], width);
    }

    /**
     * 仅包含坐标列的星表
     */
    public static Catalog ofCoordinates(double[] first, double[] second) {
        if (first.length != second.length) {
            throw new IllegalArgumentException("Coordinate arrays differ in length");
        }
        double[][] data = new double[first.length][];
        for (int i = 0; i < first.length; i++) {
            data[i] = new double[]{first[i], second[i]};
        }
        return new Catalog(data, 2);
    }

    public int size() {
        return rows.length;
    }

    public boolean isEmpty() {
        return rows.length == 0;
    }

    public int width() {
        return width;
    }

    public double get(int row, int column) {
        return rows[row][column];
    }

    public double x(int row) {
        return rows[row][0];
    }

    public double y(int row) {
        return rows[row][1];
    }

    /**
     * 返回某行的副本
     */
    public double[] row(int row) {
        return rows[row].clone();
    }

    public double[] column(int column) {
        double[] values = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            values[i] = rows[i][column];
        }
        return values;
    }

    public double[][] toArray() {
        double[][] copy = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            copy[i] = rows[i].clone();
        }
        return copy;
    }

    /**
     * 按行号选取子表，行号顺序即输出顺序
     */
    public Catalog select(int[] indices) {
        double[][] data = new double[indices.length][];
        for (int i = 0; i < indices.length; i++) {
            data[i] = rows[indices[i]].clone();
        }
        return new Catalog(data, width);
    }

    public Catalog filter(IntPredicate keepRow) {
        List<double[]> kept = new ArrayList<>();
        for (int i = 0; i < rows.length; i++) {
            if (keepRow.test(i)) {
                kept.add(rows[i].clone());
            }
        }
        return new Catalog(kept.toArray(new double[0][]), width);
    }

    /**
     * 只保留前两列坐标
     */
    public Catalog coordinates() {
        return projectColumns(2);
    }

    public Catalog projectColumns(int columnCount) {
        if (columnCount > width) {
            throw new IllegalArgumentException("Cannot project " + columnCount + " of " + width + " columns");
        }
        double[][] data = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            data[i] = Arrays.copyOf(rows[i], columnCount);
        }
        return new Catalog(data, columnCount);
    }

    /**
     * 用新的坐标替换前两列，其余列保持不变
     */
    public Catalog withCoordinates(double[] first, double[] second) {
        if (first.length != rows.length || second.length != rows.length) {
            throw new IllegalArgumentException("Coordinate arrays do not match catalog size " + rows.length);
        }
        double[][] data = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            data[i] = rows[i].clone();
            data[i][0] = first[i];
            data[i][1] = second[i];
        }
        return new Catalog(data, width);
    }

    /**
     * 纵向拼接两个列宽相同的星表
     */
    public Catalog append(Catalog other) {
        if (other.width != width) {
            throw new IllegalArgumentException("Cannot append catalog of width " + other.width + " to width " + width);
        }
        double[][] data = new double[rows.length + other.rows.length][];
        for (int i = 0; i < rows.length; i++) {
            data[i] = rows[i].clone();
        }
        for (int i = 0; i < other.rows.length; i++) {
            data[rows.length + i] = other.rows[i].clone();
        }
        return new Catalog(data, width);
    }

    public void requireWidth(int minimumWidth, String role) {
        if (width < minimumWidth) {
            throw new IllegalArgumentException(
                role + " catalog needs at least " + minimumWidth + " columns, got " + width);
        }
    }

    /**
     * 最大 |第二列|，用于赤纬缩放
     */
    public double maxAbsY() {
        double max = 0;
        for (double[] row : rows) {
            max = Math.max(max, Math.abs(row[1]));
        }
        return max;
    }

    @Override
    public String toString() {
        return String.format("Catalog[%d rows x %d cols]", rows.length, width);
    }
}
