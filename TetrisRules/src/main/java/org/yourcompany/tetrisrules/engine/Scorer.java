package org.yourcompany.tetrisrules.engine;

import org.yourcompany.tetrisrules.config.ClearInfo;
import org.yourcompany.tetrisrules.model.Game;
import org.yourcompany.tetrisrules.model.MoveDelta;

/**
 * スコア・レベル・消去ライン数を管理する部品。
 */
public abstract class Scorer implements EnginePart {

    protected final Game game;
    protected long score;
    protected int level;
    protected int lines;
    protected int goal;

    protected Scorer(Game game, long score, int level) {
        this.game = game;
        this.score = score;
        this.level = level;
    }

    /**
     * 操作 1 回ごとに呼ばれ、スコアを加算してその結果を返します。
     */
    public abstract ClearInfo judge(MoveDelta delta);

    public long getScore() { return score; }
    public int getLevel() { return level; }
    public int getLines() { return lines; }
    public int getGoal() { return goal; }

    public interface Factory extends PartFactory {
        Scorer create(Game game, long score, int level);
    }
}
