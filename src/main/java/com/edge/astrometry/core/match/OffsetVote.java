package com.edge.astrometry.core.match;

import com.edge.astrometry.core.catalog.CatalogColumns;

/**
 * 偏移投票结果
 */
public final class OffsetVote {
    public enum Status {
        /** 找到得票最高的偏移 */
        FOUND,
        /** 指向误差范围内没有任何 (源, 参考) 对 */
        NO_CANDIDATES
    }

    private final Status status;
    private final int votes;
    // 投票半径一半内的重合数，票数相同时用于区分角度
    private final int fineVotes;
    private final double dRa;
    private final double dDec;
    private final int candidateCount;

    private OffsetVote(Status status, int votes, int fineVotes, double dRa, double dDec, int candidateCount) {
        this.status = status;
        this.votes = votes;
        this.fineVotes = fineVotes;
        this.dRa = dRa;
        this.dDec = dDec;
        this.candidateCount = candidateCount;
    }

    public static OffsetVote found(int votes, double dRa, double dDec, int candidateCount) {
        return found(votes, votes, dRa, dDec, candidateCount);
    }

    public static OffsetVote found(int votes, int fineVotes, double dRa, double dDec, int candidateCount) {
        return new OffsetVote(Status.FOUND, votes, fineVotes, dRa, dDec, candidateCount);
    }

    public static OffsetVote noCandidates() {
        return new OffsetVote(Status.NO_CANDIDATES, 0, 0, Double.NaN, Double.NaN, 0);
    }

    public Status getStatus() { return status; }
    public boolean isFound() { return status == Status.FOUND; }
    public int getVotes() { return votes; }
    public int getFineVotes() { return fineVotes; }
    /** RA 坐标偏移（度，已撤销赤纬缩放） */
    public double getDRa() { return dRa; }
    public double getDDec() { return dDec; }
    public int getCandidateCount() { return candidateCount; }

    @Override
    public String toString() {
        if (!isFound()) {
            return "OffsetVote[no candidates]";
        }
        return String.format("OffsetVote[votes=%d (fine %d), dRA=%.2f\", dDec=%.2f\", candidates=%d]",
            votes, fineVotes, dRa / CatalogColumns.ARCSEC, dDec / CatalogColumns.ARCSEC, candidateCount);
    }
}
