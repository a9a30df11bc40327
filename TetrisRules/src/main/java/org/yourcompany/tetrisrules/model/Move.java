package org.yourcompany.tetrisrules.model;

/**
 * {@link Game#push(Move)} に渡す操作。
 * x はソフトドロップの段数、y は横移動量 (正が右)、r は回転量 (正が時計回り) です。
 * auto はプレイヤーではなく重力などのエンジン側が発行した操作であることを表します。
 */
public record Move(MoveKind kind, int x, int y, int r, boolean auto) {

    public Move {
        if (kind == null) {
            throw new IllegalArgumentException("move kind must not be null");
        }
        if (kind == MoveKind.SOFT_DROP && x < 0) {
            throw new IllegalArgumentException("soft drop distance must not be negative, got " + x);
        }
    }

    public static Move drag(int tiles) {
        return new Move(MoveKind.DRAG, 0, tiles, 0, false);
    }

    public static Move left(int tiles) {
        return drag(-tiles);
    }

    public static Move right(int tiles) {
        return drag(tiles);
    }

    public static Move rotate(int turns) {
        return new Move(MoveKind.ROTATE, 0, 0, turns, false);
    }

    public static Move hardDrop() {
        return hardDrop(false);
    }

    public static Move hardDrop(boolean auto) {
        return new Move(MoveKind.HARD_DROP, 0, 0, 0, auto);
    }

    public static Move softDrop(int tiles) {
        return softDrop(tiles, false);
    }

    public static Move softDrop(int tiles, boolean auto) {
        return new Move(MoveKind.SOFT_DROP, tiles, 0, 0, auto);
    }

    public static Move swap() {
        return new Move(MoveKind.SWAP, 0, 0, 0, false);
    }
}
