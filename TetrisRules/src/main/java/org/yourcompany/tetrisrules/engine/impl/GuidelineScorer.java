package org.yourcompany.tetrisrules.engine.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yourcompany.tetrisrules.config.ClearInfo;
import org.yourcompany.tetrisrules.config.SpinType;
import org.yourcompany.tetrisrules.engine.Scorer;
import org.yourcompany.tetrisrules.model.Board;
import org.yourcompany.tetrisrules.model.Game;
import org.yourcompany.tetrisrules.model.MoveDelta;
import org.yourcompany.tetrisrules.model.Piece;
import org.yourcompany.tetrisrules.model.PieceType;

/**
 * ガイドライン準拠のスコア計算。
 * 3 コーナー判定による T-SPIN / T-SPIN MINI、B2B、REN (コンボ)、パーフェクトクリアを扱います。
 * スピンの判定結果は、ピースが移動するか固定されるまで保持されます。
 */
public class GuidelineScorer extends Scorer {
    private static final Logger log = LoggerFactory.getLogger(GuidelineScorer.class);

    // 左上から時計回り
    private static final int[][] CORNERS = {{0, 0}, {0, 2}, {2, 2}, {2, 0}};
    // 上から時計回り。CORNERS[i] は EDGES[i] の反時計回り側の角
    private static final int[][] EDGES = {{0, 1}, {1, 2}, {2, 1}, {1, 0}};

    private int combo;
    private int backToBack;
    private SpinType spin = SpinType.NONE;

    public GuidelineScorer(Game game, long score, int level) {
        // ガイドラインのレベルは 1 から
        super(game, score, Math.max(1, level));
        this.goal = this.level * 10;
    }

    @Override
    public ClearInfo judge(MoveDelta delta) {
        long before = score;

        switch (delta.kind()) {
            case ROTATE -> {
                Piece piece = game.getPiece();
                if (delta.r() != 0 && piece.getKind() == PieceType.T) {
                    spin = detectSpin(game.getBoard(), piece, delta.x(), delta.y());
                }
            }
            case DRAG -> {
                if (delta.moved()) spin = SpinType.NONE;
            }
            case SWAP -> spin = SpinType.NONE;
            case SOFT_DROP -> {
                if (!delta.isAuto()) {
                    score += delta.x();
                }
                if (delta.moved()) spin = SpinType.NONE;
            }
            case HARD_DROP -> {
                if (delta.locked()) {
                    if (!delta.isAuto()) {
                        score += delta.x() * 2L; // レベル倍率はかからない
                    }
                    SpinType lockSpin = delta.x() == 0 ? spin : SpinType.NONE;
                    spin = SpinType.NONE;
                    return lock(delta, lockSpin, before);
                }
            }
        }
        return ClearInfo.noClear(spin, backToBack, combo, score - before);
    }

    private ClearInfo lock(MoveDelta delta, SpinType lockSpin, long before) {
        int lineClears = delta.clears().size();

        if (lineClears > 0) {
            if (lockSpin != SpinType.NONE || lineClears >= 4) {
                backToBack++;
            } else {
                backToBack = 0;
            }
            combo++;
        } else {
            combo = 0;
        }

        boolean perfectClear = !game.getBoard().hasPartialRows();
        long points = basePoints(lineClears, lockSpin, perfectClear);
        if (combo > 0) {
            points += 50L * (combo - 1);
        }
        points *= level;
        if (backToBack > 1) {
            points = points * 3 / 2;
            if (perfectClear) {
                points += 200L * level;
            }
        }

        score += points;
        lines += lineClears;
        if (lines >= goal) {
            goal += 10;
            level++;
            log.debug("Level up: {} (lines={}, next goal={})", level, lines, goal);
        }

        String clearType = ClearInfo.createClearTypeText(lineClears, lockSpin, perfectClear);
        return new ClearInfo(clearType, lineClears, lockSpin, backToBack, combo,
                perfectClear && lineClears > 0, score - before);
    }

    private static long basePoints(int lineClears, SpinType spinType, boolean perfectClear) {
        if (perfectClear) {
            return switch (lineClears) {
                case 1 -> 800; case 2 -> 1200; case 3 -> 1800; case 4 -> 2000; default -> 0;
            };
        }
        return switch (spinType) {
            case T_SPIN -> switch (lineClears) {
                case 0 -> 400; case 1 -> 800; case 2 -> 1200; case 3 -> 1600; default -> 0;
            };
            case T_SPIN_MINI -> switch (lineClears) {
                case 0 -> 100; case 1 -> 200; case 2 -> 400; default -> 0;
            };
            case NONE -> switch (lineClears) {
                case 1 -> 100; case 2 -> 300; case 3 -> 500; case 4 -> 800; default -> 0;
            };
        };
    }

    /**
     * 回転直後の T ミノの 3x3 の 4 隅を調べてスピンの種類を判定します。
     * 盤面外の角は埋まっているものとみなします。kickX / kickY は回転時の位置補正量です。
     */
    static SpinType detectSpin(Board board, Piece piece, int kickX, int kickY) {
        int[] corners = new int[4];
        for (int i = 0; i < CORNERS.length; i++) {
            int row = piece.getX() + CORNERS[i][0];
            int col = piece.getY() + CORNERS[i][1];
            boolean outside = row < 0 || row >= board.getHeight() || col < 0 || col >= board.getWidth();
            corners[i] = outside || board.get(row, col) != 0 ? 1 : 0;
        }

        int back = -1;
        int[][] minos = piece.getMinos();
        for (int i = 0; i < EDGES.length && back < 0; i++) {
            if (!containsMino(minos, EDGES[i])) {
                back = i;
            }
        }
        if (back < 0) {
            return SpinType.NONE;
        }

        int front = corners[(back + 2) % 4] + corners[(back + 3) % 4];
        int rear = corners[back] + corners[(back + 1) % 4];
        if (front == 2 && rear >= 1) {
            return SpinType.T_SPIN;
        }
        if (front == 1 && rear == 2) {
            // 大きく蹴られた場合 (TST 型や STSD 型) は MINI ではなく通常の T-SPIN
            return Math.abs(kickX) >= 2 && kickY != 0 ? SpinType.T_SPIN : SpinType.T_SPIN_MINI;
        }
        return SpinType.NONE;
    }

    private static boolean containsMino(int[][] minos, int[] cell) {
        for (int[] mino : minos) {
            if (mino[0] == cell[0] && mino[1] == cell[1]) return true;
        }
        return false;
    }

    public int getCombo() { return combo; }
    public int getBackToBack() { return backToBack; }
    public SpinType getPendingSpin() { return spin; }

    public static final class Factory implements Scorer.Factory {
        @Override
        public Scorer create(Game game, long score, int level) {
            return new GuidelineScorer(game, score, level);
        }
    }
}
