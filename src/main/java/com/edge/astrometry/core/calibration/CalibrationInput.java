package com.edge.astrometry.core.calibration;

import com.edge.astrometry.core.catalog.Catalog;
import com.edge.astrometry.core.model.SkyPoint;
import com.edge.astrometry.core.tile.TileLayout;

/**
 * 一次标定的输入
 * <p>
 * reference 为空时由 {@link ReferenceCatalogProvider} 获取；pivot 为空时取源星表坐标中位数。
 */
public class CalibrationInput {
    private final Catalog source;
    private final Catalog reference;
    private final TileLayout tiles;
    private final SkyPoint pivot;
    private final CalibrationMode mode;
    private final CalibrationSettings settings;

    public CalibrationInput(Catalog source, Catalog reference, TileLayout tiles, SkyPoint pivot,
                            CalibrationMode mode, CalibrationSettings settings) {
        if (source == null) {
            throw new IllegalArgumentException("Source catalog is required");
        }
        this.source = source;
        this.reference = reference;
        this.tiles = tiles != null ? tiles : TileLayout.empty();
        this.pivot = pivot;
        this.mode = mode != null ? mode : CalibrationMode.OTASHEAR;
        this.settings = settings != null ? settings : new CalibrationSettings();
    }

    public Catalog getSource() { return source; }
    public Catalog getReference() { return reference; }
    public TileLayout getTiles() { return tiles; }
    public SkyPoint getPivot() { return pivot; }
    public CalibrationMode getMode() { return mode; }
    public CalibrationSettings getSettings() { return settings; }
}
