package com.edge.astrometry.core.catalog;

/**
 * 预处理后的源星表
 * <p>
 * filtered 保留全部辅助列供后续阶段使用，coordinates 只含前两列供匹配使用。
 */
public class PreparedCatalog {
    private final Catalog filtered;
    private final Catalog coordinates;
    private final int rawCount;
    private final int afterFlags;
    private final int afterQuality;
    private final int afterIsolation;
    private final boolean isolationFallback;

    public PreparedCatalog(Catalog filtered, int rawCount, int afterFlags, int afterQuality,
                           int afterIsolation, boolean isolationFallback) {
        this.filtered = filtered;
        this.coordinates = filtered.coordinates();
        this.rawCount = rawCount;
        this.afterFlags = afterFlags;
        this.afterQuality = afterQuality;
        this.afterIsolation = afterIsolation;
        this.isolationFallback = isolationFallback;
    }

    public Catalog getFiltered() { return filtered; }
    public Catalog getCoordinates() { return coordinates; }
    public int getRawCount() { return rawCount; }
    public int getAfterFlags() { return afterFlags; }
    public int getAfterQuality() { return afterQuality; }
    public int getAfterIsolation() { return afterIsolation; }

    /**
     * 孤立星筛选把星表清空时回退到未筛选星表
     */
    public boolean isIsolationFallback() { return isolationFallback; }

    @Override
    public String toString() {
        return String.format("PreparedCatalog[raw=%d, flags=%d, quality=%d, isolated=%d%s, final=%d]",
            rawCount, afterFlags, afterQuality, afterIsolation,
            isolationFallback ? " (fallback)" : "", filtered.size());
    }
}
