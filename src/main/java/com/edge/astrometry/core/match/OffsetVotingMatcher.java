package com.edge.astrometry.core.match;

import com.edge.astrometry.core.catalog.Catalog;
import com.edge.astrometry.core.index.KdTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 偏移投票匹配器
 * <p>
 * 两个星表大致对齐后，找出被最多星对确认的相对偏移：
 * 1. RA 乘以 cos(dec) 缩放，使欧氏距离近似角距离
 * 2. 对每颗源星，收集指向误差半径内所有参考星的相对偏移（参考 - 源）
 * 3. 对偏移集合做自连接计数，投票半径内邻居最多的偏移即为结果
 * 4. 撤销 RA 缩放后返回
 */
@Component
public class OffsetVotingMatcher {
    private static final Logger logger = LoggerFactory.getLogger(OffsetVotingMatcher.class);

    /**
     * @param source        源星表（前两列 RA/Dec，度）
     * @param reference     参考星表
     * @param pointingError 先验位置不确定度（度）
     * @param votingRadius  偏移聚类半径（度）
     */
    public OffsetVote countMatches(Catalog source, Catalog reference, double pointingError, double votingRadius) {
        if (source.isEmpty() || reference.isEmpty()) {
            return OffsetVote.noCandidates();
        }

        double cosDec = DeclinationScale.factorFor(source, reference);
        double[] srcX = DeclinationScale.scaledRa(source, cosDec);
        double[] srcY = source.column(1);
        double[] refX = DeclinationScale.scaledRa(reference, cosDec);
        double[] refY = reference.column(1);

        KdTree sourceTree = KdTree.build(srcX, srcY);
        KdTree referenceTree = KdTree.build(refX, refY);

        List<int[]> nearby = sourceTree.pointsWithinRadius(referenceTree, pointingError);
        int candidateCount = 0;
        for (int[] refs : nearby) {
            candidateCount += refs.length;
        }
        if (candidateCount == 0) {
            logger.debug("指向误差 {}\" 内没有候选星对", String.format("%.1f", pointingError * 3600));
            return OffsetVote.noCandidates();
        }

        double[] offsetX = new double[candidateCount];
        double[] offsetY = new double[candidateCount];
        int pair = 0;
        for (int s = 0; s < nearby.size(); s++) {
            for (int r : nearby.get(s)) {
                offsetX[pair] = refX[r] - srcX[s];
                offsetY[pair] = refY[r] - srcY[s];
                pair++;
            }
        }

        KdTree offsetTree = KdTree.build(offsetX, offsetY);
        int[] coincidences = offsetTree.neighborCounts(offsetTree, votingRadius);

        int best = 0;
        for (int i = 1; i < coincidences.length; i++) {
            if (coincidences[i] > coincidences[best]) {
                best = i;
            }
        }

        // 角度偏离时共同星的偏移摊开，半径减半后的计数随之下降
        int fineVotes = offsetTree.countWithin(offsetX[best], offsetY[best], votingRadius / 2);

        OffsetVote vote = OffsetVote.found(coincidences[best], fineVotes,
            offsetX[best] / cosDec, offsetY[best], candidateCount);
        logger.debug("最佳偏移: {}", vote);
        return vote;
    }
}
