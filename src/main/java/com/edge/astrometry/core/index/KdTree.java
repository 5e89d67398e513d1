package com.edge.astrometry.core.index;

import com.edge.astrometry.core.catalog.Catalog;
import net.imglib2.KDTree;
import net.imglib2.RealPoint;
import net.imglib2.neighborsearch.RadiusNeighborSearchOnKDTree;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.IntConsumer;

/**
 * 二维 KD 树（基于 imglib2 {@link KDTree}）
 * <p>
 * 一次构建、只读查询。支持：
 * 1. 单点半径查询
 * 2. 两棵树之间的半径连接（每个查询点在另一棵树中的近邻索引）
 * 3. 两棵树之间的近邻对计数
 * <p>
 * 自连接（树与自身查询）时每个点至少匹配到自己。
 * 树本身不关心坐标系，调用方负责赤纬缩放等预处理。
 * <p>
 * 树节点上挂的是点在输入数组中的原始索引。imglib2 的树可以被多个线程共享，
 * 但 {@link RadiusNeighborSearchOnKDTree} 带状态，每次批量查询单独创建。
 */
public final class KdTree {
    private final double[] x;
    private final double[] y;
    // 空树时为 null（imglib2 需要至少一个点才能确定维数）
    private final KDTree<Integer> tree;

    private KdTree(double[] x, double[] y) {
        if (x.length != y.length) {
            throw new IllegalArgumentException("Coordinate arrays differ in length: " + x.length + " vs " + y.length);
        }
        this.x = x.clone();
        this.y = y.clone();
        if (x.length == 0) {
            this.tree = null;
            return;
        }
        List<Integer> indices = new ArrayList<>(x.length);
        List<RealPoint> positions = new ArrayList<>(x.length);
        for (int i = 0; i < x.length; i++) {
            indices.add(i);
            positions.add(new RealPoint(x[i], y[i]));
        }
        this.tree = new KDTree<>(indices, positions);
    }

    public static KdTree build(double[] x, double[] y) {
        return new KdTree(x, y);
    }

    /**
     * 用星表前两列构建
     */
    public static KdTree build(Catalog catalog) {
        return new KdTree(catalog.column(0), catalog.column(1));
    }

    public int size() {
        return x.length;
    }

    public double x(int index) {
        return x[index];
    }

    public double y(int index) {
        return y[index];
    }

    /**
     * 遍历与查询点距离不超过 radius 的所有点（原始索引，顺序不定）
     */
    public void forEachWithin(double qx, double qy, double radius, IntConsumer consumer) {
        if (tree == null || radius < 0) {
            return;
        }
        forEachWithin(new RadiusNeighborSearchOnKDTree<>(tree), qx, qy, radius, consumer);
    }

    /**
     * 单点半径查询，返回升序排列的原始索引
     */
    public int[] queryRadius(double qx, double qy, double radius) {
        IntCollector collector = new IntCollector();
        forEachWithin(qx, qy, radius, collector);
        return collector.sorted();
    }

    /**
     * 半径内点数
     */
    public int countWithin(double qx, double qy, double radius) {
        int[] count = new int[1];
        forEachWithin(qx, qy, radius, i -> count[0]++);
        return count[0];
    }

    /**
     * 对本树的每个点，查询 other 中半径内的所有点
     *
     * @return 与本树点顺序一致的列表，每项是 other 中的原始索引（升序）
     */
    public List<int[]> pointsWithinRadius(KdTree other, double radius) {
        List<int[]> result = new ArrayList<>(size());
        RadiusNeighborSearchOnKDTree<Integer> search = other.newSearch();
        for (int i = 0; i < size(); i++) {
            IntCollector collector = new IntCollector();
            if (search != null && radius >= 0) {
                other.forEachWithin(search, x[i], y[i], radius, collector);
            }
            result.add(collector.sorted());
        }
        return result;
    }

    /**
     * 统计 (本树点, other 点) 距离不超过 radius 的点对数
     */
    public long countPairsWithinRadius(KdTree other, double radius) {
        long total = 0;
        for (int count : neighborCounts(other, radius)) {
            total += count;
        }
        return total;
    }

    /**
     * 对本树的每个点，统计 other 中半径内的点数
     */
    public int[] neighborCounts(KdTree other, double radius) {
        int[] counts = new int[size()];
        RadiusNeighborSearchOnKDTree<Integer> search = other.newSearch();
        if (search == null || radius < 0) {
            return counts;
        }
        for (int i = 0; i < size(); i++) {
            int[] count = new int[1];
            other.forEachWithin(search, x[i], y[i], radius, j -> count[0]++);
            counts[i] = count[0];
        }
        return counts;
    }

    private RadiusNeighborSearchOnKDTree<Integer> newSearch() {
        return tree == null ? null : new RadiusNeighborSearchOnKDTree<>(tree);
    }

    /**
     * 用略大的半径检索后按闭区间 d <= radius 复核，边界上的点一定计入
     */
    private void forEachWithin(RadiusNeighborSearchOnKDTree<Integer> search, double qx, double qy, double radius,
                               IntConsumer consumer) {
        search.search(new RealPoint(qx, qy), Math.nextUp(radius), false);
        double radiusSq = radius * radius;
        for (int n = 0; n < search.numNeighbors(); n++) {
            int index = search.getSampler(n).get();
            double dx = x[index] - qx;
            double dy = y[index] - qy;
            if (dx * dx + dy * dy <= radiusSq) {
                consumer.accept(index);
            }
        }
    }

    private static final class IntCollector implements IntConsumer {
        private int[] values = new int[8];
        private int count;

        @Override
        public void accept(int value) {
            if (count == values.length) {
                values = Arrays.copyOf(values, count * 2);
            }
            values[count++] = value;
        }

        int[] sorted() {
            int[] result = Arrays.copyOf(values, count);
            Arrays.sort(result);
            return result;
        }
    }
}
