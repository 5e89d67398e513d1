package com.edge.astrometry.core.search;

import com.edge.astrometry.core.match.OffsetVote;

/**
 * 单个网格角度的投票结果
 */
public final class AngleVote {
    private final int index;
    private final double angleDeg;
    private final OffsetVote vote;

    public AngleVote(int index, double angleDeg, OffsetVote vote) {
        this.index = index;
        this.angleDeg = angleDeg;
        this.vote = vote;
    }

    public int getIndex() { return index; }
    public double getAngleDeg() { return angleDeg; }
    public OffsetVote getVote() { return vote; }

    public int getVotes() {
        return vote.getVotes();
    }

    public int getFineVotes() {
        return vote.getFineVotes();
    }

    @Override
    public String toString() {
        return String.format("AngleVote[#%d %.4f° %s]", index, angleDeg, vote);
    }
}
