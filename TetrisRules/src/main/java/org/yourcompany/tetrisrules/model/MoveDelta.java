package org.yourcompany.tetrisrules.model;

import java.util.List;

/**
 * 1 回の {@link Move} を適用した結果。
 * x / y / r は適用前後のピースの位置と回転の差分 (r は 4 を法とする)、
 * clears は消去された行の番号 (検出順)、locked はこの操作でピースが固定されたかどうかです。
 */
public record MoveDelta(Move move, int x, int y, int r, List<Integer> clears, boolean locked) {

    public MoveDelta {
        clears = List.copyOf(clears);
    }

    public MoveKind kind() {
        return move.kind();
    }

    public boolean isAuto() {
        return move.auto();
    }

    public boolean moved() {
        return x != 0 || y != 0 || r != 0;
    }
}
