package com.edge.astrometry.core.calibration;

import com.edge.astrometry.core.catalog.Catalog;
import com.edge.astrometry.core.catalog.CatalogColumns;
import com.edge.astrometry.core.catalog.CatalogPreprocessor;
import com.edge.astrometry.core.catalog.PreparedCatalog;
import com.edge.astrometry.core.catalog.ReferenceCatalogSelector;
import com.edge.astrometry.core.match.MatchedCatalog;
import com.edge.astrometry.core.match.UniqueCatalogMatcher;
import com.edge.astrometry.core.model.SkyPoint;
import com.edge.astrometry.core.parallel.WorkerPool;
import com.edge.astrometry.core.quality.QualityEvaluator;
import com.edge.astrometry.core.quality.QualityRecord;
import com.edge.astrometry.core.refine.NonlinearRefiner;
import com.edge.astrometry.core.refine.RegionalRefiner;
import com.edge.astrometry.core.refine.RegionalSolution;
import com.edge.astrometry.core.refine.ShiftRotationFit;
import com.edge.astrometry.core.refine.TileFitOutcome;
import com.edge.astrometry.core.search.AngleRange;
import com.edge.astrometry.core.search.RotationGuess;
import com.edge.astrometry.core.search.RotationSearch;
import com.edge.astrometry.core.tile.TileLayout;
import com.edge.astrometry.core.transform.CatalogRotator;
import com.edge.astrometry.core.transform.ShiftRotation;
import com.edge.astrometry.core.wcs.WcsParameterSet;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * 标定流水线
 * <pre>
 * SHIFT_ONLY                          (mode = shift)
 * ROTATION_SEARCH -> PER_TILE_SHIFT -> PER_TILE_SHEAR -> DISTORTION_FIT
 *       |                                                    |
 *       +--------------> FAILED                 DONE <-------+
 * </pre>
 * 旋转搜索从最小的指向误差开始，第一个 contrast 达标的半径即被接受；全部不达标时返回 FAILED，
 * 附带 contrast 最高的（被拒绝的）猜测供诊断。模式决定流水线在哪个阶段结束。
 * <p>
 * 数据问题（无重叠、显著性不足）以 validSolution = false 返回，不抛异常；
 * 只有输入星表格式错误等调用方错误才抛 {@link IllegalArgumentException}。
 */
public class CalibrationOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(CalibrationOrchestrator.class);

    private final CatalogPreprocessor preprocessor;
    private final ReferenceCatalogSelector referenceSelector;
    private final RotationSearch rotationSearch;
    private final NonlinearRefiner nonlinearRefiner;
    private final RegionalRefiner regionalRefiner;
    private final UniqueCatalogMatcher uniqueMatcher;
    private final QualityEvaluator qualityEvaluator;
    private final ReferenceCatalogProvider referenceProvider;

    public CalibrationOrchestrator(CatalogPreprocessor preprocessor,
                                   ReferenceCatalogSelector referenceSelector,
                                   RotationSearch rotationSearch,
                                   NonlinearRefiner nonlinearRefiner,
                                   RegionalRefiner regionalRefiner,
                                   UniqueCatalogMatcher uniqueMatcher,
                                   QualityEvaluator qualityEvaluator,
                                   ReferenceCatalogProvider referenceProvider) {
        this.preprocessor = preprocessor;
        this.referenceSelector = referenceSelector;
        this.rotationSearch = rotationSearch;
        this.nonlinearRefiner = nonlinearRefiner;
        this.regionalRefiner = regionalRefiner;
        this.uniqueMatcher = uniqueMatcher;
        this.qualityEvaluator = qualityEvaluator;
        this.referenceProvider = referenceProvider;
    }

    public CalibrationResult calibrate(CalibrationInput input) {
        CalibrationSettings settings = input.getSettings();
        CalibrationMode mode = input.getMode();
        Catalog raw = input.getSource();
        raw.requireWidth(CatalogColumns.SOURCE_WIDTH, "Source");

        CalibrationResult.Builder result = CalibrationResult.builder(mode).tiles(input.getTiles());
        long startTime = System.currentTimeMillis();

        if (raw.isEmpty()) {
            return fail(result, "Source catalog is empty");
        }
        SkyPoint pivot = input.getPivot() != null ? input.getPivot() : medianPosition(raw);
        logger.info("开始标定: mode={}, {} 个源, 枢轴 {}", mode.getKey(), raw.size(), pivot);

        // 源星表
        PreparedCatalog prepared = preprocessor.prepare(raw, settings.getMinFwhm(), settings.getMaxMagError(),
            settings.getSourceIsolationRadius(), settings.getMaxSources());
        result.sourceCount(prepared.getFiltered().size());
        if (prepared.getFiltered().isEmpty()) {
            return fail(result, "No usable sources after flag and quality filtering");
        }
        Catalog sourceCoordinates = prepared.getCoordinates();

        // 参考星表
        Catalog reference = input.getReference();
        if (reference == null) {
            if (referenceProvider == null) {
                throw new IllegalArgumentException("No reference catalog given and no provider configured");
            }
            double radius = settings.getReferenceExtraRadius() + settings.maxPointingError();
            reference = referenceProvider.fetch(pivot.ra, pivot.dec, radius);
            logger.info("从参考星表源获取 {} 颗星 (半径 {}°)", reference.size(), String.format("%.2f", radius));
        }
        if (reference.isEmpty()) {
            return fail(result, "No overlap: reference catalog is empty");
        }
        reference.requireWidth(2, "Reference");
        Catalog overlapping = referenceSelector.selectOverlapping(sourceCoordinates, reference.coordinates(),
            settings.maxPointingError());
        if (overlapping.isEmpty()) {
            return fail(result, "No overlap: no reference stars within the source footprint");
        }
        Catalog isolatedReference = referenceSelector.isolate(overlapping, settings.getReferenceMaxSources(),
            settings.getReferenceIsolationStart(), settings.getReferenceIsolationMin(),
            settings.getReferenceIsolationStep());
        result.referenceCount(isolatedReference.size());

        WorkerPool searchPool = settings.isParallel()
            ? rotationSearch.getWorkerPool() : rotationSearch.getWorkerPool().asSerial();
        WorkerPool tilePool = settings.isParallel()
            ? regionalRefiner.getWorkerPool() : regionalRefiner.getWorkerPool().asSerial();

        ShiftRotation correction;
        if (mode == CalibrationMode.SHIFT) {
            double pointingError = settings.maxPointingError();
            RotationGuess guess = rotationSearch.findBestGuess(sourceCoordinates, isolatedReference, pivot,
                pointingError, AngleRange.none(), settings.getAngleStep(), settings.getVotingRadius(),
                searchPool.asSerial());
            result.guess(guess).pointingError(pointingError);
            if (!guess.isFound()) {
                return fail(result, "No overlap: no candidate offsets within " + formatArcmin(pointingError));
            }
            correction = ShiftRotation.shift(guess.getDRa(), guess.getDDec());
            result.stage(StageRecord.of(CalibrationStage.SHIFT_ONLY, correction, guess.getVotes(),
                String.format("shift only, contrast %.1f", guess.getContrast())));
            if (guess.getContrast() < settings.getMinContrast()) {
                // 只平移时不做 contrast 判定，仅提示
                logger.warn("平移模式 contrast {} 低于 {}, 仍应用平移", String.format("%.2f", guess.getContrast()),
                    settings.getMinContrast());
            }
        } else {
            RotationGuess accepted = null;
            RotationGuess best = null;
            for (double pointingError : settings.sortedPointingErrors()) {
                RotationGuess guess = rotationSearch.findBestGuess(sourceCoordinates, isolatedReference, pivot,
                    pointingError, settings.getRotatorRange(), settings.getAngleStep(), settings.getVotingRadius(),
                    searchPool);
                logger.info("指向误差 {}: {}", formatArcmin(pointingError), guess);
                if (best == null || guess.getContrast() > best.getContrast()) {
                    best = guess;
                }
                if (guess.isFound() && guess.getContrast() >= settings.getMinContrast()) {
                    accepted = guess;
                    break;
                }
            }
            if (accepted == null) {
                result.guess(best).pointingError(settings.maxPointingError());
                if (!best.isFound()) {
                    return fail(result, "No overlap: no candidate offsets at any pointing error");
                }
                result.correction(best.toShiftRotation())
                    .stage(StageRecord.of(CalibrationStage.ROTATION_SEARCH, best.toShiftRotation(), best.getVotes(),
                        String.format("rejected, contrast %.1f", best.getContrast())));
                return fail(result, String.format("Best contrast %.2f below minimum %.2f at all pointing errors",
                    best.getContrast(), settings.getMinContrast()));
            }
            result.guess(accepted).pointingError(accepted.getPointingError());
            result.stage(StageRecord.of(CalibrationStage.ROTATION_SEARCH, accepted.toShiftRotation(),
                accepted.getVotes(), String.format("grid search, contrast %.1f, background %.1f",
                    accepted.getContrast(), accepted.getBackgroundMatches())));

            ShiftRotationFit fit = nonlinearRefiner.fitShiftRotation(sourceCoordinates, isolatedReference,
                accepted.toShiftRotation(), pivot, settings.getGlobalMatchRadius(), settings.getGlobalMinMatches());
            correction = fit.getSolution();
            result.stage(StageRecord.of(CalibrationStage.ROTATION_SEARCH, correction, fit.getMatchCount(),
                "global refinement " + fit.getFit().getStatus()));
        }
        result.correction(correction);

        // 全局改正合入 tile 变换
        TileLayout tiles = input.getTiles().applyGlobal(correction, pivot);
        Catalog calibrated = tiles.reproject(CatalogRotator.apply(raw, pivot, correction));

        if (mode.runs(CalibrationStage.PER_TILE_SHIFT) || mode.runs(CalibrationStage.PER_TILE_SHEAR)
            || mode.runs(CalibrationStage.DISTORTION_FIT)) {
            if (tiles.imageTiles().isEmpty()) {
                logger.warn("没有成像 tile，跳过逐 tile 精修");
            } else {
                Catalog fitSources = tiles.reproject(CatalogRotator.apply(prepared.getFiltered(), pivot, correction));
                tiles = runTileStage(result, CalibrationStage.PER_TILE_SHIFT, mode, fitSources, overlapping, tiles,
                    WcsParameterSet.CENTER, settings.getTileShiftMinSample(), settings.getTileShiftMatchRadius(),
                    settings, tilePool);
                tiles = runTileStage(result, CalibrationStage.PER_TILE_SHEAR, mode, fitSources, overlapping, tiles,
                    WcsParameterSet.CENTER_AND_LINEAR, settings.getTileShearMinSample(),
                    settings.getTileShearMatchRadius(), settings, tilePool);
                tiles = runTileStage(result, CalibrationStage.DISTORTION_FIT, mode, fitSources, overlapping, tiles,
                    WcsParameterSet.DISTORTION, settings.getDistortionMinSample(),
                    settings.getDistortionMatchRadius(), settings, tilePool);
                calibrated = tiles.reproject(calibrated);
            }
        }

        MatchedCatalog matched = uniqueMatcher.matchWithSentinels(calibrated, overlapping.coordinates(),
            settings.getFinalMatchRadius(), 1);
        QualityRecord quality = qualityEvaluator.computeQuality(matched);
        Map<Integer, QualityRecord> tileQuality = qualityEvaluator.computeByTile(matched, tiles);

        CalibrationResult done = result.tiles(tiles)
            .calibrated(calibrated)
            .matched(matched)
            .quality(quality)
            .tileQuality(tileQuality)
            .valid();
        logger.info("标定完成, 耗时 {}ms: {}", System.currentTimeMillis() - startTime, done);
        return done;
    }

    private TileLayout runTileStage(CalibrationResult.Builder result, CalibrationStage stage, CalibrationMode mode,
                                    Catalog sources, Catalog reference, TileLayout tiles, WcsParameterSet parameters,
                                    int minSample, double matchRadius, CalibrationSettings settings,
                                    WorkerPool pool) {
        if (!mode.runs(stage)) {
            return tiles;
        }
        logger.info("阶段 {}: 拟合 {}", stage, parameters);
        RegionalSolution solution = regionalRefiner.improveSolution(sources, reference, tiles, parameters,
            minSample, matchRadius, settings.getFinalMatchRadius(), pool);
        result.tileOutcomes(solution.getOutcomes());
        int skipped = 0;
        for (TileFitOutcome outcome : solution.getOutcomes().values()) {
            if (outcome.getStatus() != TileFitOutcome.Status.FITTED) {
                skipped++;
            }
        }
        result.stage(new StageRecord(stage, 0, 0, 0, solution.getMatched().matchedCount(),
            String.format("%s: %d tiles fitted, %d kept", parameters, solution.fittedTileCount(), skipped)));
        return solution.getTiles();
    }

    private CalibrationResult fail(CalibrationResult.Builder result, String reason) {
        logger.warn("标定失败: {}", reason);
        return result.invalid(reason);
    }

    private static SkyPoint medianPosition(Catalog catalog) {
        Median median = new Median();
        return new SkyPoint(median.evaluate(catalog.column(CatalogColumns.RA)),
            median.evaluate(catalog.column(CatalogColumns.DEC)));
    }

    private static String formatArcmin(double degrees) {
        return String.format("%.1f'", degrees / CatalogColumns.ARCMIN);
    }
}
