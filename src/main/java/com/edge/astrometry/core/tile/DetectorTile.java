package com.edge.astrometry.core.tile;

import com.edge.astrometry.core.wcs.TileWcs;

/**
 * 探测器 tile：编号、当前变换，以及是否为成像 tile（导星/辅助传感器不参与标定）
 */
public final class DetectorTile {
    private final int id;
    private final TileWcs wcs;
    private final boolean imageTile;

    public DetectorTile(int id, TileWcs wcs, boolean imageTile) {
        if (wcs == null) {
            throw new IllegalArgumentException("Tile " + id + " has no WCS");
        }
        this.id = id;
        this.wcs = wcs;
        this.imageTile = imageTile;
    }

    public static DetectorTile image(int id, TileWcs wcs) {
        return new DetectorTile(id, wcs, true);
    }

    public int getId() { return id; }
    public TileWcs getWcs() { return wcs; }
    public boolean isImageTile() { return imageTile; }

    public DetectorTile withWcs(TileWcs newWcs) {
        return new DetectorTile(id, newWcs, imageTile);
    }

    @Override
    public String toString() {
        return "DetectorTile[" + id + (imageTile ? "" : ", auxiliary") + ", " + wcs + "]";
    }
}
