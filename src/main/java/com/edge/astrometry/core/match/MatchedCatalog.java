package com.edge.astrometry.core.match;

import com.edge.astrometry.core.catalog.Catalog;

import java.util.function.IntPredicate;

/**
 * 交叉匹配结果表
 * <p>
 * 每行 = 源星表列 + 参考星表列。两种形式：
 * <ul>
 *   <li>丢弃形式：只有成功匹配的行</li>
 *   <li>哨兵形式：保留全部源行，未匹配行的参考列为 NaN</li>
 * </ul>
 */
public final class MatchedCatalog {
    private final Catalog table;
    private final int sourceWidth;
    private final int referenceWidth;

    MatchedCatalog(Catalog table, int sourceWidth, int referenceWidth) {
        if (table.width() != sourceWidth + referenceWidth) {
            throw new IllegalArgumentException("Matched table width " + table.width()
                + " != " + sourceWidth + " + " + referenceWidth);
        }
        this.table = table;
        this.sourceWidth = sourceWidth;
        this.referenceWidth = referenceWidth;
    }

    public static MatchedCatalog empty(int sourceWidth, int referenceWidth) {
        return new MatchedCatalog(Catalog.empty(sourceWidth + referenceWidth), sourceWidth, referenceWidth);
    }

    public Catalog getTable() { return table; }
    public int getSourceWidth() { return sourceWidth; }
    public int getReferenceWidth() { return referenceWidth; }

    public int size() {
        return table.size();
    }

    public boolean isEmpty() {
        return table.isEmpty();
    }

    public boolean isMatched(int row) {
        return !Double.isNaN(table.get(row, sourceWidth));
    }

    public int matchedCount() {
        int count = 0;
        for (int i = 0; i < table.size(); i++) {
            if (isMatched(i)) {
                count++;
            }
        }
        return count;
    }

    public double sourceValue(int row, int column) {
        return table.get(row, column);
    }

    public double referenceValue(int row, int column) {
        return table.get(row, sourceWidth + column);
    }

    public double referenceRa(int row) {
        return referenceValue(row, 0);
    }

    public double referenceDec(int row) {
        return referenceValue(row, 1);
    }

    /**
     * 源部分（保持行顺序）
     */
    public Catalog sourcePart() {
        return table.projectColumns(sourceWidth);
    }

    /**
     * 参考部分的坐标列
     */
    public Catalog referenceCoordinates() {
        int n = table.size();
        double[] ra = new double[n];
        double[] dec = new double[n];
        for (int i = 0; i < n; i++) {
            ra[i] = referenceRa(i);
            dec[i] = referenceDec(i);
        }
        return Catalog.ofCoordinates(ra, dec);
    }

    /**
     * 去掉未匹配的哨兵行
     */
    public MatchedCatalog matchedOnly() {
        return new MatchedCatalog(table.filter(this::isMatched), sourceWidth, referenceWidth);
    }

    public MatchedCatalog filter(IntPredicate keepRow) {
        return new MatchedCatalog(table.filter(keepRow), sourceWidth, referenceWidth);
    }

    /**
     * 按源星表某列的值筛选（如探测器 tile 编号）
     */
    public MatchedCatalog withSourceValue(int column, double value) {
        return filter(i -> table.get(i, column) == value);
    }

    @Override
    public String toString() {
        return String.format("MatchedCatalog[%d rows, %d matched, %d+%d cols]",
            size(), matchedCount(), sourceWidth, referenceWidth);
    }
}
