package org.yourcompany.tetrisrules.engine.impl;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yourcompany.tetrisrules.config.ClearInfo;
import org.yourcompany.tetrisrules.config.Rules;
import org.yourcompany.tetrisrules.config.SpinType;
import org.yourcompany.tetrisrules.engine.Scorer;
import org.yourcompany.tetrisrules.model.Game;
import org.yourcompany.tetrisrules.model.MoveDelta;

/**
 * NES 版のスコア計算。レベル 0 から始まり、スピンや B2B はありません。
 */
public class NesScorer extends Scorer {
    private static final Logger log = LoggerFactory.getLogger(NesScorer.class);

    public NesScorer(Game game, long score, int level) {
        super(game, score, level);
        int initialLevel = game.getRules().getInt(Rules.INITIAL_LEVEL);
        this.goal = Math.min(initialLevel * 10 + 10, Math.max(100, initialLevel * 10 - 50));
    }

    @Override
    public ClearInfo judge(MoveDelta delta) {
        long before = score;

        switch (delta.kind()) {
            case SOFT_DROP -> {
                if (!delta.isAuto()) score += delta.x();
            }
            case HARD_DROP -> {
                if (delta.locked()) {
                    // 元の NES にハードドロップはないが、他の回転システムと組み合わせるために加点する
                    if (!delta.isAuto()) score += delta.x();
                    return lock(delta, before);
                }
            }
            default -> { }
        }
        return ClearInfo.noClear(SpinType.NONE, 0, 0, score - before);
    }

    private ClearInfo lock(MoveDelta delta, long before) {
        int lineClears = delta.clears().size();
        long points = switch (lineClears) {
            case 1 -> 40; case 2 -> 100; case 3 -> 300; case 4 -> 1200; default -> 0;
        };
        score += points * (level + 1);
        lines += lineClears;
        if (lines >= goal) {
            level++;
            goal = lines + 10;
            log.debug("Level up: {} (lines={}, next goal={})", level, lines, goal);
        }
        String clearType = ClearInfo.createClearTypeText(lineClears, SpinType.NONE, false);
        return new ClearInfo(clearType, lineClears, SpinType.NONE, 0, 0, false, score - before);
    }

    public static final class Factory implements Scorer.Factory {
        @Override
        public Map<String, Object> ruleOverrides() {
            return Map.of(Rules.INITIAL_LEVEL, 0);
        }

        @Override
        public Scorer create(Game game, long score, int level) {
            return new NesScorer(game, score, level);
        }
    }
}
