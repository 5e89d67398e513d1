package com.edge.astrometry.config;

import com.edge.astrometry.core.calibration.CalibrationOrchestrator;
import com.edge.astrometry.core.calibration.CalibrationSettings;
import com.edge.astrometry.core.calibration.ReferenceCatalogProvider;
import com.edge.astrometry.core.catalog.CatalogColumns;
import com.edge.astrometry.core.catalog.CatalogPreprocessor;
import com.edge.astrometry.core.catalog.ReferenceCatalogSelector;
import com.edge.astrometry.core.match.OffsetVotingMatcher;
import com.edge.astrometry.core.match.UniqueCatalogMatcher;
import com.edge.astrometry.core.parallel.WorkerPool;
import com.edge.astrometry.core.quality.QualityEvaluator;
import com.edge.astrometry.core.refine.LeastSquaresSolver;
import com.edge.astrometry.core.refine.LevenbergMarquardtSolver;
import com.edge.astrometry.core.refine.NonlinearRefiner;
import com.edge.astrometry.core.refine.RegionalRefiner;
import com.edge.astrometry.core.search.AngleRange;
import com.edge.astrometry.core.search.RotationSearch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * 标定引擎配置
 * <p>
 * 从 application.yml 读取参数，组装线程池、求解器和标定流水线
 */
@Configuration
public class CalibrationEngineConfig {
    private static final Logger logger = LoggerFactory.getLogger(CalibrationEngineConfig.class);

    @Autowired
    private AstrometryConfig astrometryConfig;

    @Bean
    public WorkerPool calibrationWorkerPool() {
        AstrometryConfig.SystemConfig system = astrometryConfig.getSystem();
        WorkerPool pool = new WorkerPool(system.getWorkerThreads(), system.isParallel(), "Calibration-Worker");
        logger.info("WorkerPool 配置: workers={}, parallel={}", pool.getWorkerCount(), pool.isParallel());
        return pool;
    }

    @Bean
    public LeastSquaresSolver leastSquaresSolver() {
        AstrometryConfig.RefineConfig refine = astrometryConfig.getRefine();
        return new LevenbergMarquardtSolver(refine.getMaxEvaluations(), refine.getMaxIterations());
    }

    @Bean
    public RotationSearch rotationSearch(OffsetVotingMatcher offsetVotingMatcher, WorkerPool calibrationWorkerPool) {
        return new RotationSearch(offsetVotingMatcher, calibrationWorkerPool);
    }

    @Bean
    public NonlinearRefiner nonlinearRefiner(UniqueCatalogMatcher uniqueCatalogMatcher, LeastSquaresSolver solver) {
        return new NonlinearRefiner(uniqueCatalogMatcher, solver);
    }

    @Bean
    public RegionalRefiner regionalRefiner(UniqueCatalogMatcher uniqueCatalogMatcher, LeastSquaresSolver solver,
                                           WorkerPool calibrationWorkerPool) {
        return new RegionalRefiner(uniqueCatalogMatcher, solver, calibrationWorkerPool);
    }

    @Bean
    public CalibrationOrchestrator calibrationOrchestrator(CatalogPreprocessor preprocessor,
                                                           ReferenceCatalogSelector referenceSelector,
                                                           RotationSearch rotationSearch,
                                                           NonlinearRefiner nonlinearRefiner,
                                                           RegionalRefiner regionalRefiner,
                                                           UniqueCatalogMatcher uniqueCatalogMatcher,
                                                           QualityEvaluator qualityEvaluator,
                                                           ObjectProvider<ReferenceCatalogProvider> referenceProvider) {
        ReferenceCatalogProvider provider = referenceProvider.getIfAvailable();
        if (provider == null) {
            logger.info("未配置参考星表源，请求中必须携带参考星表");
        }
        return new CalibrationOrchestrator(preprocessor, referenceSelector, rotationSearch, nonlinearRefiner,
            regionalRefiner, uniqueCatalogMatcher, qualityEvaluator, provider);
    }

    /**
     * 默认标定参数（每次请求复制一份再应用覆盖项）
     */
    @Bean
    public CalibrationSettings calibrationSettings() {
        return toSettings(astrometryConfig);
    }

    static CalibrationSettings toSettings(AstrometryConfig config) {
        CalibrationSettings settings = new CalibrationSettings();

        AstrometryConfig.PreprocessConfig preprocess = config.getPreprocess();
        settings.setMinFwhm(preprocess.getMinFwhmArcsec() * CatalogColumns.ARCSEC);
        settings.setMaxMagError(preprocess.getMaxMagError());
        settings.setSourceIsolationRadius(preprocess.getIsolationRadiusArcsec() * CatalogColumns.ARCSEC);
        settings.setMaxSources(preprocess.getMaxSources());

        AstrometryConfig.ReferenceConfig reference = config.getReference();
        settings.setReferenceMaxSources(reference.getMaxSources());
        settings.setReferenceIsolationStart(reference.getIsolationStartArcsec() * CatalogColumns.ARCSEC);
        settings.setReferenceIsolationMin(reference.getIsolationMinArcsec() * CatalogColumns.ARCSEC);
        settings.setReferenceIsolationStep(reference.getIsolationStepArcsec() * CatalogColumns.ARCSEC);
        settings.setReferenceExtraRadius(reference.getExtraRadiusDeg());

        AstrometryConfig.SearchConfig search = config.getSearch();
        List<Double> pointingErrors = new ArrayList<>();
        for (Double arcmin : search.getPointingErrorsArcmin()) {
            pointingErrors.add(arcmin * CatalogColumns.ARCMIN);
        }
        settings.setPointingErrors(pointingErrors);
        settings.setRotatorRange(AngleRange.explicit(search.getRotatorMinDeg(), search.getRotatorMaxDeg()));
        settings.setAngleStep(search.getAngleStepArcmin() * CatalogColumns.ARCMIN);
        settings.setVotingRadius(search.getVotingRadiusArcsec() * CatalogColumns.ARCSEC);
        settings.setMinContrast(search.getMinContrast());
        settings.setParallel(config.getSystem().isParallel());

        AstrometryConfig.RefineConfig refine = config.getRefine();
        settings.setGlobalMatchRadius(refine.getGlobalMatchRadiusArcsec() * CatalogColumns.ARCSEC);
        settings.setGlobalMinMatches(refine.getGlobalMinMatches());
        settings.setTileShiftMatchRadius(refine.getTileShiftRadiusArcsec() * CatalogColumns.ARCSEC);
        settings.setTileShiftMinSample(refine.getTileShiftMinSample());
        settings.setTileShearMatchRadius(refine.getTileShearRadiusArcsec() * CatalogColumns.ARCSEC);
        settings.setTileShearMinSample(refine.getTileShearMinSample());
        settings.setDistortionMatchRadius(refine.getDistortionRadiusArcsec() * CatalogColumns.ARCSEC);
        settings.setDistortionMinSample(refine.getDistortionMinSample());
        settings.setFinalMatchRadius(refine.getFinalMatchRadiusArcsec() * CatalogColumns.ARCSEC);

        logger.info("标定参数: 指向误差 {}', 旋转范围 {}, 步长 {}', 最小 contrast {}",
            search.getPointingErrorsArcmin(), settings.getRotatorRange(), search.getAngleStepArcmin(),
            search.getMinContrast());
        return settings;
    }
}
