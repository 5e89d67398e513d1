package com.edge.astrometry.core.tile;

import com.edge.astrometry.core.catalog.Catalog;
import com.edge.astrometry.core.catalog.CatalogColumns;
import com.edge.astrometry.core.model.SkyPoint;
import com.edge.astrometry.core.transform.ShiftRotation;
import com.edge.astrometry.core.wcs.TileWcs;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * 有序的 tile 集合（不可变）
 */
public final class TileLayout {
    private final Map<Integer, DetectorTile> tiles;

    public TileLayout(List<DetectorTile> tiles) {
        Map<Integer, DetectorTile> byId = new LinkedHashMap<>();
        for (DetectorTile tile : tiles) {
            if (byId.put(tile.getId(), tile) != null) {
                throw new IllegalArgumentException("Duplicate tile id " + tile.getId());
            }
        }
        this.tiles = Collections.unmodifiableMap(byId);
    }

    public static TileLayout empty() {
        return new TileLayout(Collections.emptyList());
    }

    public List<DetectorTile> getTiles() {
        return new ArrayList<>(tiles.values());
    }

    public List<DetectorTile> imageTiles() {
        List<DetectorTile> result = new ArrayList<>();
        for (DetectorTile tile : tiles.values()) {
            if (tile.isImageTile()) {
                result.add(tile);
            }
        }
        return result;
    }

    public DetectorTile get(int id) {
        return tiles.get(id);
    }

    public boolean isEmpty() {
        return tiles.isEmpty();
    }

    public int size() {
        return tiles.size();
    }

    public TileLayout withWcs(int id, TileWcs wcs) {
        List<DetectorTile> updated = new ArrayList<>();
        for (DetectorTile tile : tiles.values()) {
            updated.add(tile.getId() == id ? tile.withWcs(wcs) : tile);
        }
        return new TileLayout(updated);
    }

    public TileLayout withWcs(Map<Integer, TileWcs> replacements) {
        List<DetectorTile> updated = new ArrayList<>();
        for (DetectorTile tile : tiles.values()) {
            TileWcs wcs = replacements.get(tile.getId());
            updated.add(wcs != null ? tile.withWcs(wcs) : tile);
        }
        return new TileLayout(updated);
    }

    /**
     * 对每个成像 tile 的变换做同一改动
     */
    public TileLayout mapImageTiles(UnaryOperator<TileWcs> change) {
        List<DetectorTile> updated = new ArrayList<>();
        for (DetectorTile tile : tiles.values()) {
            updated.add(tile.isImageTile() ? tile.withWcs(change.apply(tile.getWcs())) : tile);
        }
        return new TileLayout(updated);
    }

    /**
     * 把全局旋转 + 平移合入每个成像 tile：先旋转再平移
     */
    public TileLayout applyGlobal(ShiftRotation correction, SkyPoint pivot) {
        return mapImageTiles(wcs -> wcs
            .withRotation(correction.getAngleDeg(), pivot)
            .withShift(correction.getDRa(), correction.getDDec()));
    }

    /**
     * 由像素坐标和所属成像 tile 的变换重新计算 RA/Dec 列；其他行保持原坐标
     */
    public Catalog reproject(Catalog catalog) {
        catalog.requireWidth(CatalogColumns.SOURCE_WIDTH, "Source");
        int n = catalog.size();
        double[] ra = catalog.column(CatalogColumns.RA);
        double[] dec = catalog.column(CatalogColumns.DEC);
        for (int i = 0; i < n; i++) {
            DetectorTile tile = tiles.get((int) catalog.get(i, CatalogColumns.TILE));
            if (tile == null || !tile.isImageTile()) {
                continue;
            }
            double[] sky = tile.getWcs().projectToSky(
                catalog.get(i, CatalogColumns.PIXEL_X), catalog.get(i, CatalogColumns.PIXEL_Y));
            ra[i] = sky[0];
            dec[i] = sky[1];
        }
        return catalog.withCoordinates(ra, dec);
    }
}
