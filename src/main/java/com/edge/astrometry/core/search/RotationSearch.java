package com.edge.astrometry.core.search;

import com.edge.astrometry.core.catalog.Catalog;
import com.edge.astrometry.core.catalog.CatalogColumns;
import com.edge.astrometry.core.match.OffsetVote;
import com.edge.astrometry.core.match.OffsetVotingMatcher;
import com.edge.astrometry.core.model.SkyPoint;
import com.edge.astrometry.core.parallel.WorkerPool;
import com.edge.astrometry.core.parallel.WorkerTask;
import com.edge.astrometry.core.transform.CatalogRotator;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 旋转角网格搜索
 * <p>
 * 对每个网格角度，把源星表绕枢轴旋转后交给 {@link OffsetVotingMatcher}，
 * 票数最多的角度即为最佳猜测。
 * <p>
 * 显著性：与最佳角度相差超过 20' 的角度的票数中位数作为随机匹配背景 bg（没有这样的角度时取 1），
 * contrast = (best - bg) / sqrt(bg)，bg &lt; 1 时 contrast = best。
 */
public class RotationSearch {
    private static final Logger logger = LoggerFactory.getLogger(RotationSearch.class);

    public static final double CONTRAST_EXCLUSION_WINDOW = 20 * CatalogColumns.ARCMIN;

    private final OffsetVotingMatcher matcher;
    private final WorkerPool workerPool;

    public RotationSearch(OffsetVotingMatcher matcher, WorkerPool workerPool) {
        this.matcher = matcher;
        this.workerPool = workerPool;
    }

    public WorkerPool getWorkerPool() {
        return workerPool;
    }

    public RotationGuess findBestGuess(Catalog source, Catalog reference, SkyPoint pivot, double pointingError,
                                       AngleRange angleRange, double angleStep, double votingRadius) {
        return findBestGuess(source, reference, pivot, pointingError, angleRange, angleStep, votingRadius, workerPool);
    }

    /**
     * @param source        源星表坐标（度）
     * @param reference     参考星表坐标（度）
     * @param pivot         旋转中心
     * @param pointingError 指向误差半径（度）
     * @param angleRange    角度范围
     * @param angleStep     角度步长（度）
     * @param votingRadius  投票半径（度）
     * @param pool          执行网格的线程池
     */
    public RotationGuess findBestGuess(Catalog source, Catalog reference, SkyPoint pivot, double pointingError,
                                       AngleRange angleRange, double angleStep, double votingRadius,
                                       WorkerPool pool) {
        double[] grid = angleRange.toGrid(angleStep);
        SearchContext context = new SearchContext(matcher, source.coordinates(), reference.coordinates(),
            pivot, pointingError, votingRadius);

        Map<Integer, WorkerTask<SearchContext, AngleVote>> tasks = new LinkedHashMap<>();
        for (int i = 0; i < grid.length; i++) {
            int index = i;
            double angle = grid[i];
            tasks.put(index, ctx -> ctx.evaluate(index, angle));
        }
        logger.debug("旋转搜索: {} 个角度 ({}), 指向误差 {}'", grid.length, angleRange,
            String.format("%.1f", pointingError / CatalogColumns.ARCMIN));

        Map<Integer, AngleVote> byIndex = pool.runBatch(context, tasks);
        List<AngleVote> votes = new ArrayList<>(byIndex.values());
        return summarize(votes, pointingError);
    }

    /**
     * 选出最佳角度并计算显著性
     * <p>
     * 真实角度两侧的网格角度常常与它同票。同票时先比较半投票半径内的重合数，
     * 仍相同则取网格中第一段连续同分角度的中点（偶数长度取偏小的一个）。
     */
    static RotationGuess summarize(List<AngleVote> votes, double pointingError) {
        List<AngleVote> ordered = new ArrayList<>(votes);
        ordered.sort(Comparator.comparingInt(AngleVote::getIndex));

        int first = -1;
        for (int i = 0; i < ordered.size(); i++) {
            if (ordered.get(i).getVote().isFound() && (first < 0 || outranks(ordered.get(i), ordered.get(first)))) {
                first = i;
            }
        }
        if (first < 0) {
            logger.debug("所有角度都没有候选星对");
            return RotationGuess.noCandidates(pointingError, ordered);
        }
        int last = first;
        while (last + 1 < ordered.size() && sameRank(ordered.get(last + 1), ordered.get(first))) {
            last++;
        }
        AngleVote best = ordered.get(first + (last - first) / 2);
        if (last > first) {
            logger.debug("同分角度 {}°..{}° ({} 票), 取中点 {}°", ordered.get(first).getAngleDeg(),
                ordered.get(last).getAngleDeg(), best.getVotes(), best.getAngleDeg());
        }

        List<Double> offPeak = new ArrayList<>();
        for (AngleVote vote : ordered) {
            if (Math.abs(vote.getAngleDeg() - best.getAngleDeg()) > CONTRAST_EXCLUSION_WINDOW) {
                offPeak.add((double) vote.getVotes());
            }
        }
        double background = 1;
        if (!offPeak.isEmpty()) {
            double[] counts = offPeak.stream().mapToDouble(Double::doubleValue).toArray();
            background = new Median().withEstimationType(Percentile.EstimationType.R_7).evaluate(counts);
        }
        double contrast = background >= 1
            ? (best.getVotes() - background) / Math.sqrt(background)
            : best.getVotes();

        RotationGuess guess = RotationGuess.of(best, background, contrast, pointingError, ordered);
        logger.debug("旋转搜索结果: {}", guess);
        return guess;
    }

    private static boolean outranks(AngleVote a, AngleVote b) {
        if (a.getVotes() != b.getVotes()) {
            return a.getVotes() > b.getVotes();
        }
        return a.getFineVotes() > b.getFineVotes();
    }

    private static boolean sameRank(AngleVote a, AngleVote b) {
        return a.getVote().isFound() && a.getVotes() == b.getVotes() && a.getFineVotes() == b.getFineVotes();
    }

    /**
     * 每个工作线程只读访问的搜索上下文
     */
    static final class SearchContext {
        private final OffsetVotingMatcher matcher;
        private final Catalog source;
        private final Catalog reference;
        private final SkyPoint pivot;
        private final double pointingError;
        private final double votingRadius;

        SearchContext(OffsetVotingMatcher matcher, Catalog source, Catalog reference, SkyPoint pivot,
                      double pointingError, double votingRadius) {
            this.matcher = matcher;
            this.source = source;
            this.reference = reference;
            this.pivot = pivot;
            this.pointingError = pointingError;
            this.votingRadius = votingRadius;
        }

        AngleVote evaluate(int index, double angleDeg) {
            Catalog rotated = CatalogRotator.rotate(source, pivot, angleDeg);
            OffsetVote vote = matcher.countMatches(rotated, reference, pointingError, votingRadius);
            return new AngleVote(index, angleDeg, vote);
        }
    }
}
