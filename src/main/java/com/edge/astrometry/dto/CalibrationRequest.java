package com.edge.astrometry.dto;

import java.util.List;

/**
 * 标定请求
 */
public class CalibrationRequest {
    private List<SourceEntry> sources;
    private List<ReferenceEntry> references;   // 为空时使用服务端配置的参考星表源
    private List<TileEntry> tiles;
    private Double pivotRa;
    private Double pivotDec;
    private String mode;                       // shift / rotation / otashift / otashear / distortion
    private Overrides overrides;

    public List<SourceEntry> getSources() { return sources; }
    public void setSources(List<SourceEntry> sources) { this.sources = sources; }

    public List<ReferenceEntry> getReferences() { return references; }
    public void setReferences(List<ReferenceEntry> references) { this.references = references; }

    public List<TileEntry> getTiles() { return tiles; }
    public void setTiles(List<TileEntry> tiles) { this.tiles = tiles; }

    public Double getPivotRa() { return pivotRa; }
    public void setPivotRa(Double pivotRa) { this.pivotRa = pivotRa; }

    public Double getPivotDec() { return pivotDec; }
    public void setPivotDec(Double pivotDec) { this.pivotDec = pivotDec; }

    public String getMode() { return mode; }
    public void setMode(String mode) { this.mode = mode; }

    public Overrides getOverrides() { return overrides; }
    public void setOverrides(Overrides overrides) { this.overrides = overrides; }

    /**
     * 探测器源
     */
    public static class SourceEntry {
        private double ra;
        private double dec;
        private double x;
        private double y;
        private double fwhmArcsec = 1.0;
        private double mag;
        private double magErr;
        private int flags;
        private int tile;

        public double getRa() { return ra; }
        public void setRa(double ra) { this.ra = ra; }

        public double getDec() { return dec; }
        public void setDec(double dec) { this.dec = dec; }

        public double getX() { return x; }
        public void setX(double x) { this.x = x; }

        public double getY() { return y; }
        public void setY(double y) { this.y = y; }

        public double getFwhmArcsec() { return fwhmArcsec; }
        public void setFwhmArcsec(double fwhmArcsec) { this.fwhmArcsec = fwhmArcsec; }

        public double getMag() { return mag; }
        public void setMag(double mag) { this.mag = mag; }

        public double getMagErr() { return magErr; }
        public void setMagErr(double magErr) { this.magErr = magErr; }

        public int getFlags() { return flags; }
        public void setFlags(int flags) { this.flags = flags; }

        public int getTile() { return tile; }
        public void setTile(int tile) { this.tile = tile; }
    }

    /**
     * 参考星
     */
    public static class ReferenceEntry {
        private double ra;
        private double dec;
        private Double mag;

        public double getRa() { return ra; }
        public void setRa(double ra) { this.ra = ra; }

        public double getDec() { return dec; }
        public void setDec(double dec) { this.dec = dec; }

        public Double getMag() { return mag; }
        public void setMag(Double mag) { this.mag = mag; }
    }

    /**
     * 单次请求的参数覆盖
     */
    public static class Overrides {
        private List<Double> pointingErrorsArcmin;
        private Double rotatorMinDeg;
        private Double rotatorMaxDeg;
        private Double angleStepArcmin;
        private Double minContrast;
        private Boolean parallel;

        public List<Double> getPointingErrorsArcmin() { return pointingErrorsArcmin; }
        public void setPointingErrorsArcmin(List<Double> pointingErrorsArcmin) { this.pointingErrorsArcmin = pointingErrorsArcmin; }

        public Double getRotatorMinDeg() { return rotatorMinDeg; }
        public void setRotatorMinDeg(Double rotatorMinDeg) { this.rotatorMinDeg = rotatorMinDeg; }

        public Double getRotatorMaxDeg() { return rotatorMaxDeg; }
        public void setRotatorMaxDeg(Double rotatorMaxDeg) { this.rotatorMaxDeg = rotatorMaxDeg; }

        public Double getAngleStepArcmin() { return angleStepArcmin; }
        public void setAngleStepArcmin(Double angleStepArcmin) { this.angleStepArcmin = angleStepArcmin; }

        public Double getMinContrast() { return minContrast; }
        public void setMinContrast(Double minContrast) { this.minContrast = minContrast; }

        public Boolean getParallel() { return parallel; }
        public void setParallel(Boolean parallel) { this.parallel = parallel; }
    }
}
