package com.edge.astrometry.dto;

import java.util.List;
import java.util.Map;

/**
 * 标定响应；数值为 NaN 的字段输出为 null
 */
public class CalibrationResponse {
    private String id;
    private boolean validSolution;
    private String reason;
    private String mode;
    private String finalStage;
    private Double angleDeg;
    private Double shiftRaArcsec;
    private Double shiftDecArcsec;
    private int votes;
    private double contrast;
    private double backgroundMatches;
    private Double pointingErrorArcmin;
    private int sourceCount;
    private int referenceCount;
    private Map<String, Double> quality;
    private Map<Integer, Map<String, Double>> tileQuality;
    private List<TileEntry> tiles;
    private List<TileOutcome> tileOutcomes;
    private List<Stage> stages;
    private List<Match> matches;

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public boolean isValidSolution() { return validSolution; }
    public void setValidSolution(boolean validSolution) { this.validSolution = validSolution; }

    public String getReason() { return reason; }
    public void setReason(String reason) { this.reason = reason; }

    public String getMode() { return mode; }
    public void setMode(String mode) { this.mode = mode; }

    public String getFinalStage() { return finalStage; }
    public void setFinalStage(String finalStage) { this.finalStage = finalStage; }

    public Double getAngleDeg() { return angleDeg; }
    public void setAngleDeg(Double angleDeg) { this.angleDeg = angleDeg; }

    public Double getShiftRaArcsec() { return shiftRaArcsec; }
    public void setShiftRaArcsec(Double shiftRaArcsec) { this.shiftRaArcsec = shiftRaArcsec; }

    public Double getShiftDecArcsec() { return shiftDecArcsec; }
    public void setShiftDecArcsec(Double shiftDecArcsec) { this.shiftDecArcsec = shiftDecArcsec; }

    public int getVotes() { return votes; }
    public void setVotes(int votes) { this.votes = votes; }

    public double getContrast() { return contrast; }
    public void setContrast(double contrast) { this.contrast = contrast; }

    public double getBackgroundMatches() { return backgroundMatches; }
    public void setBackgroundMatches(double backgroundMatches) { this.backgroundMatches = backgroundMatches; }

    public Double getPointingErrorArcmin() { return pointingErrorArcmin; }
    public void setPointingErrorArcmin(Double pointingErrorArcmin) { this.pointingErrorArcmin = pointingErrorArcmin; }

    public int getSourceCount() { return sourceCount; }
    public void setSourceCount(int sourceCount) { this.sourceCount = sourceCount; }

    public int getReferenceCount() { return referenceCount; }
    public void setReferenceCount(int referenceCount) { this.referenceCount = referenceCount; }

    public Map<String, Double> getQuality() { return quality; }
    public void setQuality(Map<String, Double> quality) { this.quality = quality; }

    public Map<Integer, Map<String, Double>> getTileQuality() { return tileQuality; }
    public void setTileQuality(Map<Integer, Map<String, Double>> tileQuality) { this.tileQuality = tileQuality; }

    public List<TileEntry> getTiles() { return tiles; }
    public void setTiles(List<TileEntry> tiles) { this.tiles = tiles; }

    public List<TileOutcome> getTileOutcomes() { return tileOutcomes; }
    public void setTileOutcomes(List<TileOutcome> tileOutcomes) { this.tileOutcomes = tileOutcomes; }

    public List<Stage> getStages() { return stages; }
    public void setStages(List<Stage> stages) { this.stages = stages; }

    public List<Match> getMatches() { return matches; }
    public void setMatches(List<Match> matches) { this.matches = matches; }

    /**
     * 阶段记录
     */
    public static class Stage {
        private String stage;
        private double angleDeg;
        private double shiftRaArcsec;
        private double shiftDecArcsec;
        private int matchCount;
        private String description;

        public String getStage() { return stage; }
        public void setStage(String stage) { this.stage = stage; }

        public double getAngleDeg() { return angleDeg; }
        public void setAngleDeg(double angleDeg) { this.angleDeg = angleDeg; }

        public double getShiftRaArcsec() { return shiftRaArcsec; }
        public void setShiftRaArcsec(double shiftRaArcsec) { this.shiftRaArcsec = shiftRaArcsec; }

        public double getShiftDecArcsec() { return shiftDecArcsec; }
        public void setShiftDecArcsec(double shiftDecArcsec) { this.shiftDecArcsec = shiftDecArcsec; }

        public int getMatchCount() { return matchCount; }
        public void setMatchCount(int matchCount) { this.matchCount = matchCount; }

        public String getDescription() { return description; }
        public void setDescription(String description) { this.description = description; }
    }

    /**
     * tile 精修结果
     */
    public static class TileOutcome {
        private int tileId;
        private String status;
        private int sampleCount;
        private Double rmsBeforeArcsec;
        private Double rmsAfterArcsec;

        public int getTileId() { return tileId; }
        public void setTileId(int tileId) { this.tileId = tileId; }

        public String getStatus() { return status; }
        public void setStatus(String status) { this.status = status; }

        public int getSampleCount() { return sampleCount; }
        public void setSampleCount(int sampleCount) { this.sampleCount = sampleCount; }

        public Double getRmsBeforeArcsec() { return rmsBeforeArcsec; }
        public void setRmsBeforeArcsec(Double rmsBeforeArcsec) { this.rmsBeforeArcsec = rmsBeforeArcsec; }

        public Double getRmsAfterArcsec() { return rmsAfterArcsec; }
        public void setRmsAfterArcsec(Double rmsAfterArcsec) { this.rmsAfterArcsec = rmsAfterArcsec; }
    }

    /**
     * 最终匹配表的一行；未匹配时参考坐标为 null
     */
    public static class Match {
        private double ra;
        private double dec;
        private int tile;
        private Double refRa;
        private Double refDec;

        public double getRa() { return ra; }
        public void setRa(double ra) { this.ra = ra; }

        public double getDec() { return dec; }
        public void setDec(double dec) { this.dec = dec; }

        public int getTile() { return tile; }
        public void setTile(int tile) { this.tile = tile; }

        public Double getRefRa() { return refRa; }
        public void setRefRa(Double refRa) { this.refRa = refRa; }

        public Double getRefDec() { return refDec; }
        public void setRefDec(Double refDec) { this.refDec = refDec; }
    }
}
