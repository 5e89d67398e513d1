package com.edge.astrometry.core.refine;

import com.edge.astrometry.core.catalog.Catalog;
import com.edge.astrometry.core.catalog.CatalogColumns;
import com.edge.astrometry.core.match.MatchedCatalog;
import com.edge.astrometry.core.match.UniqueCatalogMatcher;
import com.edge.astrometry.core.parallel.WorkerPool;
import com.edge.astrometry.core.parallel.WorkerTask;
import com.edge.astrometry.core.tile.DetectorTile;
import com.edge.astrometry.core.tile.TileLayout;
import com.edge.astrometry.core.wcs.TileWcs;
import com.edge.astrometry.core.wcs.WcsParameterSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * 逐 tile 精修
 * <p>
 * 按 tile 编号拆分匹配星表，匹配数大于阈值的成像 tile 用最小二乘重新拟合指定的参数组，
 * 其余 tile 保留原变换。之后用新变换重新投影全部源，并在更小的半径内重新匹配。
 * tile 拟合互不依赖，放入线程池并行执行。
 */
public class RegionalRefiner {
    private static final Logger logger = LoggerFactory.getLogger(RegionalRefiner.class);

    private final UniqueCatalogMatcher matcher;
    private final LeastSquaresSolver solver;
    private final WorkerPool workerPool;

    public RegionalRefiner(UniqueCatalogMatcher matcher, LeastSquaresSolver solver, WorkerPool workerPool) {
        this.matcher = matcher;
        this.solver = solver;
        this.workerPool = workerPool;
    }

    public WorkerPool getWorkerPool() {
        return workerPool;
    }

    /**
     * @param source            源星表（完整列，像素坐标与 tile 编号必须存在）
     * @param reference         参考星表
     * @param tiles             当前 tile 变换
     * @param parametersToFit   拟合的参数组
     * @param minTileSampleSize tile 匹配数必须大于该值才拟合
     * @param fitMatchRadius    拟合前的匹配半径（度）
     * @param finalMatchRadius  拟合后的匹配半径（度）
     */
    public RegionalSolution improveSolution(Catalog source, Catalog reference, TileLayout tiles,
                                            WcsParameterSet parametersToFit, int minTileSampleSize,
                                            double fitMatchRadius, double finalMatchRadius) {
        return improveSolution(source, reference, tiles, parametersToFit, minTileSampleSize,
            fitMatchRadius, finalMatchRadius, workerPool);
    }

    public RegionalSolution improveSolution(Catalog source, Catalog reference, TileLayout tiles,
                                            WcsParameterSet parametersToFit, int minTileSampleSize,
                                            double fitMatchRadius, double finalMatchRadius,
                                            WorkerPool pool) {
        source.requireWidth(CatalogColumns.SOURCE_WIDTH, "Source");
        Catalog referenceCoordinates = reference.coordinates();

        Catalog projected = tiles.reproject(source);
        MatchedCatalog matched = matcher.matchWithSentinels(projected, referenceCoordinates, fitMatchRadius, 1)
            .matchedOnly();

        Map<Integer, TileFitOutcome> outcomes = new TreeMap<>();
        Map<Integer, WorkerTask<TileFitContext, TileFitOutcome>> tasks = new LinkedHashMap<>();
        for (DetectorTile tile : tiles.imageTiles()) {
            int tileId = tile.getId();
            MatchedCatalog inTile = matched.withSourceValue(CatalogColumns.TILE, tileId);
            if (inTile.size() <= minTileSampleSize) {
                logger.debug("tile {} 只有 {} 个匹配 (需要 >{})，保留原变换", tileId, inTile.size(), minTileSampleSize);
                outcomes.put(tileId, TileFitOutcome.skipped(tileId, inTile.size(), tile.getWcs()));
                continue;
            }
            TileWcs wcs = tile.getWcs();
            tasks.put(tileId, ctx -> ctx.fit(tileId, wcs, inTile));
        }

        TileFitContext context = new TileFitContext(solver, parametersToFit);
        outcomes.putAll(pool.runBatch(context, tasks));

        Map<Integer, TileWcs> updated = new LinkedHashMap<>();
        for (TileFitOutcome outcome : outcomes.values()) {
            updated.put(outcome.getTileId(), outcome.getWcs());
        }
        TileLayout newTiles = tiles.withWcs(updated);
        Catalog calibrated = newTiles.reproject(source);
        MatchedCatalog finalMatch = matcher.matchWithSentinels(calibrated, referenceCoordinates, finalMatchRadius, 1);

        logger.info("逐 tile 精修 ({}): {}/{} 个 tile 完成拟合, 最终 {} 个匹配",
            parametersToFit, tasks.size(), tiles.imageTiles().size(), finalMatch.matchedCount());
        return new RegionalSolution(newTiles, calibrated, finalMatch, outcomes);
    }

    /**
     * tile 拟合的只读上下文
     */
    static final class TileFitContext {
        private final LeastSquaresSolver solver;
        private final WcsParameterSet parametersToFit;

        TileFitContext(LeastSquaresSolver solver, WcsParameterSet parametersToFit) {
            this.solver = solver;
            this.parametersToFit = parametersToFit;
        }

        TileFitOutcome fit(int tileId, TileWcs wcs, MatchedCatalog inTile) {
            int n = inTile.size();
            double[] px = new double[n];
            double[] py = new double[n];
            double[] refRa = new double[n];
            double[] refDec = new double[n];
            double[] cosRefDec = new double[n];
            for (int i = 0; i < n; i++) {
                px[i] = inTile.sourceValue(i, CatalogColumns.PIXEL_X);
                py[i] = inTile.sourceValue(i, CatalogColumns.PIXEL_Y);
                refRa[i] = inTile.referenceRa(i);
                refDec[i] = inTile.referenceDec(i);
                cosRefDec[i] = Math.cos(Math.toRadians(refDec[i]));
            }

            LeastSquaresSolver.ResidualFunction residuals = p -> {
                TileWcs candidate = wcs.withParameters(parametersToFit, p);
                double[] r = new double[2 * n];
                for (int i = 0; i < n; i++) {
                    double[] sky = candidate.projectToSky(px[i], py[i]);
                    r[2 * i] = (sky[0] - refRa[i]) * cosRefDec[i] * 3600.0;
                    r[2 * i + 1] = (sky[1] - refDec[i]) * 3600.0;
                }
                return r;
            };

            double[] start = wcs.getParameters(parametersToFit);
            double rmsBefore = rms(residuals.residuals(start));
            FitResult fit = solver.solve(residuals, start, 2 * n);
            if (!fit.isConverged()) {
                logger.warn("tile {} 拟合未收敛 ({})，保留原变换", tileId, fit.getMessage());
                return TileFitOutcome.notConverged(tileId, n, rmsBefore, wcs);
            }
            TileWcs fitted = wcs.withParameters(parametersToFit, fit.getParameters());
            double rmsAfter = rms(residuals.residuals(fit.getParameters()));
            logger.debug("tile {}: {} 个匹配, rms {}\" -> {}\"", tileId, n,
                String.format("%.3f", rmsBefore), String.format("%.3f", rmsAfter));
            return TileFitOutcome.fitted(tileId, n, rmsBefore, rmsAfter, fitted);
        }

        private static double rms(double[] residuals) {
            double sum = 0;
            for (double r : residuals) {
                sum += r * r;
            }
            return Math.sqrt(sum / residuals.length);
        }
    }
}
