package com.edge.astrometry.service;

import com.edge.astrometry.config.AstrometryConfig;
import com.edge.astrometry.core.calibration.CalibrationInput;
import com.edge.astrometry.core.calibration.CalibrationMode;
import com.edge.astrometry.core.calibration.CalibrationOrchestrator;
import com.edge.astrometry.core.calibration.CalibrationResult;
import com.edge.astrometry.core.calibration.CalibrationSettings;
import com.edge.astrometry.core.calibration.StageRecord;
import com.edge.astrometry.core.catalog.Catalog;
import com.edge.astrometry.core.catalog.CatalogColumns;
import com.edge.astrometry.core.match.MatchedCatalog;
import com.edge.astrometry.core.model.SkyPoint;
import com.edge.astrometry.core.quality.QualityRecord;
import com.edge.astrometry.core.refine.TileFitOutcome;
import com.edge.astrometry.core.search.AngleRange;
import com.edge.astrometry.core.tile.DetectorTile;
import com.edge.astrometry.core.tile.TileLayout;
import com.edge.astrometry.core.wcs.TanWcs;
import com.edge.astrometry.core.wcs.TileWcs;
import com.edge.astrometry.dto.CalibrationRequest;
import com.edge.astrometry.dto.CalibrationResponse;
import com.edge.astrometry.dto.TileEntry;
import com.edge.astrometry.model.CalibrationRecord;
import com.edge.astrometry.repository.CalibrationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 标定服务
 * <p>
 * 请求 DTO 转换为星表与 tile 布局，执行标定流水线并记录历史
 */
@Service
public class CalibrationService {
    private static final Logger logger = LoggerFactory.getLogger(CalibrationService.class);

    private final CalibrationOrchestrator orchestrator;
    private final CalibrationSettings defaultSettings;
    private final CalibrationRepository repository;
    private final AstrometryConfig astrometryConfig;

    public CalibrationService(CalibrationOrchestrator orchestrator, CalibrationSettings defaultSettings,
                              CalibrationRepository repository, AstrometryConfig astrometryConfig) {
        this.orchestrator = orchestrator;
        this.defaultSettings = defaultSettings;
        this.repository = repository;
        this.astrometryConfig = astrometryConfig;
    }

    public CalibrationResponse calibrate(CalibrationRequest request) {
        if (request == null || request.getSources() == null || request.getSources().isEmpty()) {
            throw new IllegalArgumentException("Source catalog is required");
        }
        CalibrationMode mode = CalibrationMode.fromKey(request.getMode());
        CalibrationSettings settings = applyOverrides(defaultSettings.copy(), request.getOverrides());

        Catalog sources = toSourceCatalog(request.getSources());
        Catalog references = request.getReferences() == null || request.getReferences().isEmpty()
            ? null : toReferenceCatalog(request.getReferences());
        TileLayout tiles = toTileLayout(request.getTiles());
        SkyPoint pivot = null;
        if (request.getPivotRa() != null && request.getPivotDec() != null) {
            pivot = new SkyPoint(request.getPivotRa(), request.getPivotDec());
        }

        long start = System.currentTimeMillis();
        CalibrationResult result = orchestrator.calibrate(
            new CalibrationInput(sources, references, tiles, pivot, mode, settings));
        long duration = System.currentTimeMillis() - start;

        CalibrationRecord record = repository.insert(toRecord(result, duration));
        logger.info("标定 {} 完成 ({}ms): valid={}", record.getId(), duration, result.isValidSolution());
        return toResponse(record.getId(), result);
    }

    public Map<String, Object> getEffectiveSettings() {
        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put("system", astrometryConfig.getSystem());
        settings.put("preprocess", astrometryConfig.getPreprocess());
        settings.put("reference", astrometryConfig.getReference());
        settings.put("search", astrometryConfig.getSearch());
        settings.put("refine", astrometryConfig.getRefine());
        return settings;
    }

    public List<CalibrationRecord> history(int limit) {
        return repository.findRecent(limit);
    }

    public Optional<CalibrationRecord> findById(String id) {
        return repository.findById(id);
    }

    static CalibrationSettings applyOverrides(CalibrationSettings settings, CalibrationRequest.Overrides overrides) {
        if (overrides == null) {
            return settings;
        }
        if (overrides.getPointingErrorsArcmin() != null && !overrides.getPointingErrorsArcmin().isEmpty()) {
            List<Double> errors = new ArrayList<>();
            for (Double arcmin : overrides.getPointingErrorsArcmin()) {
                errors.add(arcmin * CatalogColumns.ARCMIN);
            }
            settings.setPointingErrors(errors);
        }
        if (overrides.getRotatorMinDeg() != null || overrides.getRotatorMaxDeg() != null) {
            double min = overrides.getRotatorMinDeg() != null
                ? overrides.getRotatorMinDeg() : settings.getRotatorRange().getMinDeg();
            double max = overrides.getRotatorMaxDeg() != null
                ? overrides.getRotatorMaxDeg() : settings.getRotatorRange().getMaxDeg();
            settings.setRotatorRange(min == 0 && max == 0 ? AngleRange.none() : AngleRange.explicit(min, max));
        }
        if (overrides.getAngleStepArcmin() != null) {
            settings.setAngleStep(overrides.getAngleStepArcmin() * CatalogColumns.ARCMIN);
        }
        if (overrides.getMinContrast() != null) {
            settings.setMinContrast(overrides.getMinContrast());
        }
        if (overrides.getParallel() != null) {
            settings.setParallel(overrides.getParallel());
        }
        return settings;
    }

    static Catalog toSourceCatalog(List<CalibrationRequest.SourceEntry> entries) {
        double[][] rows = new double[entries.size()][];
        for (int i = 0; i < rows.length; i++) {
            CalibrationRequest.SourceEntry s = entries.get(i);
            rows[i] = new double[]{
                s.getRa(), s.getDec(), s.getX(), s.getY(),
                s.getFwhmArcsec() * CatalogColumns.ARCSEC, s.getMag(), s.getMagErr(),
                s.getFlags(), s.getTile()
            };
        }
        return Catalog.of(rows, CatalogColumns.SOURCE_WIDTH);
    }

    static Catalog toReferenceCatalog(List<CalibrationRequest.ReferenceEntry> entries) {
        double[][] rows = new double[entries.size()][];
        for (int i = 0; i < rows.length; i++) {
            CalibrationRequest.ReferenceEntry r = entries.get(i);
            rows[i] = new double[]{r.getRa(), r.getDec(), r.getMag() != null ? r.getMag() : Double.NaN};
        }
        return Catalog.of(rows, 3);
    }

    static TileLayout toTileLayout(List<TileEntry> entries) {
        if (entries == null) {
            return TileLayout.empty();
        }
        List<DetectorTile> tiles = new ArrayList<>();
        for (TileEntry t : entries) {
            TanWcs wcs = new TanWcs(t.getCrval1(), t.getCrval2(), t.getCrpix1(), t.getCrpix2(), t.getCd());
            if (t.getXiCoefficients() != null && t.getEtaCoefficients() != null) {
                wcs = wcs.withDistortion(t.getXiCoefficients(), t.getEtaCoefficients());
            }
            tiles.add(new DetectorTile(t.getId(), wcs, t.isImageTile()));
        }
        return new TileLayout(tiles);
    }

    private CalibrationRecord toRecord(CalibrationResult result, long duration) {
        CalibrationRecord record = new CalibrationRecord();
        record.setDeviceId(astrometryConfig.getSystem().getDeviceId());
        record.setTimestamp(LocalDateTime.now());
        record.setDurationMs(duration);
        record.setMode(result.getMode().getKey());
        record.setValidSolution(result.isValidSolution());
        record.setReason(result.getReason());
        record.setAngleDeg(finite(result.getCorrection().getAngleDeg()));
        record.setShiftRaArcsec(finite(result.getCorrection().getDRaArcsec()));
        record.setShiftDecArcsec(finite(result.getCorrection().getDDecArcsec()));
        record.setContrast(result.getContrast());
        record.setBackgroundMatches(result.getBackgroundMatches());
        record.setSourceCount(result.getSourceCount());
        record.setReferenceCount(result.getReferenceCount());
        record.setMatchedCount(result.getMatched() != null ? result.getMatched().matchedCount() : 0);
        record.setQuality(result.getQuality().toMap());
        List<String> stages = new ArrayList<>();
        for (StageRecord stage : result.getStages()) {
            stages.add(stage.toString());
        }
        record.setStages(stages);
        return record;
    }

    private CalibrationResponse toResponse(String id, CalibrationResult result) {
        CalibrationResponse response = new CalibrationResponse();
        response.setId(id);
        response.setValidSolution(result.isValidSolution());
        response.setReason(result.getReason());
        response.setMode(result.getMode().getKey());
        response.setFinalStage(result.getFinalStage().name());
        response.setAngleDeg(finite(result.getCorrection().getAngleDeg()));
        response.setShiftRaArcsec(finite(result.getCorrection().getDRaArcsec()));
        response.setShiftDecArcsec(finite(result.getCorrection().getDDecArcsec()));
        response.setVotes(result.getGuess() != null ? result.getGuess().getVotes() : 0);
        response.setContrast(result.getContrast());
        response.setBackgroundMatches(result.getBackgroundMatches());
        response.setPointingErrorArcmin(finite(result.getPointingError() / CatalogColumns.ARCMIN));
        response.setSourceCount(result.getSourceCount());
        response.setReferenceCount(result.getReferenceCount());
        response.setQuality(result.getQuality().toMap());

        Map<Integer, Map<String, Double>> tileQuality = new LinkedHashMap<>();
        for (Map.Entry<Integer, QualityRecord> entry : result.getTileQuality().entrySet()) {
            tileQuality.put(entry.getKey(), entry.getValue().toMap());
        }
        response.setTileQuality(tileQuality);

        List<TileEntry> tiles = new ArrayList<>();
        for (DetectorTile tile : result.getTiles().getTiles()) {
            tiles.add(toTileEntry(tile));
        }
        response.setTiles(tiles);

        List<CalibrationResponse.TileOutcome> outcomes = new ArrayList<>();
        for (TileFitOutcome outcome : result.getTileOutcomes().values()) {
            CalibrationResponse.TileOutcome o = new CalibrationResponse.TileOutcome();
            o.setTileId(outcome.getTileId());
            o.setStatus(outcome.getStatus().name());
            o.setSampleCount(outcome.getSampleCount());
            o.setRmsBeforeArcsec(finite(outcome.getRmsBefore()));
            o.setRmsAfterArcsec(finite(outcome.getRmsAfter()));
            outcomes.add(o);
        }
        response.setTileOutcomes(outcomes);

        List<CalibrationResponse.Stage> stages = new ArrayList<>();
        for (StageRecord record : result.getStages()) {
            CalibrationResponse.Stage s = new CalibrationResponse.Stage();
            s.setStage(record.getStage().name());
            s.setAngleDeg(record.getAngleDeg());
            s.setShiftRaArcsec(record.getDRaArcsec());
            s.setShiftDecArcsec(record.getDDecArcsec());
            s.setMatchCount(record.getMatchCount());
            s.setDescription(record.getDescription());
            stages.add(s);
        }
        response.setStages(stages);

        List<CalibrationResponse.Match> matches = new ArrayList<>();
        MatchedCatalog matched = result.getMatched();
        if (matched != null) {
            for (int i = 0; i < matched.size(); i++) {
                CalibrationResponse.Match m = new CalibrationResponse.Match();
                m.setRa(matched.sourceValue(i, CatalogColumns.RA));
                m.setDec(matched.sourceValue(i, CatalogColumns.DEC));
                m.setTile((int) matched.sourceValue(i, CatalogColumns.TILE));
                if (matched.isMatched(i)) {
                    m.setRefRa(matched.referenceRa(i));
                    m.setRefDec(matched.referenceDec(i));
                }
                matches.add(m);
            }
        }
        response.setMatches(matches);
        return response;
    }

    private static TileEntry toTileEntry(DetectorTile tile) {
        TileEntry entry = new TileEntry();
        entry.setId(tile.getId());
        entry.setImageTile(tile.isImageTile());
        TileWcs wcs = tile.getWcs();
        if (wcs instanceof TanWcs) {
            TanWcs tan = (TanWcs) wcs;
            entry.setCrval1(tan.getCrval1());
            entry.setCrval2(tan.getCrval2());
            entry.setCrpix1(tan.getCrpix1());
            entry.setCrpix2(tan.getCrpix2());
            entry.setCd(tan.getCd());
            entry.setXiCoefficients(tan.getXiCoefficients());
            entry.setEtaCoefficients(tan.getEtaCoefficients());
        }
        return entry;
    }

    private static Double finite(double value) {
        return Double.isFinite(value) ? value : null;
    }
}
