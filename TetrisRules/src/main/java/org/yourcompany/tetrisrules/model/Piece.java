package org.yourcompany.tetrisrules.model;

import java.util.Arrays;

/**
 * 盤面上で操作中のテトリミノ。
 * x は行 (下向きが正)、y は列、r は回転状態 (0〜3) です。
 * minos は (x, y) を原点とした 4 つのミノの相対座標 {行, 列} を持ちます。
 * 不変オブジェクトなので、移動や回転は新しいインスタンスを返します。
 */
public final class Piece {
    private final PieceType kind;
    private final int x;
    private final int y;
    private final int r;
    private final int[][] minos;

    public Piece(PieceType kind, int x, int y, int r, int[][] minos) {
        if (r < 0 || r > 3) {
            throw new IllegalArgumentException("rotation state must be in 0..3, got " + r);
        }
        this.kind = kind;
        this.x = x;
        this.y = y;
        this.r = r;
        this.minos = copyOf(minos);
    }

    private static int[][] copyOf(int[][] minos) {
        int[][] copy = new int[minos.length][];
        for (int i = 0; i < minos.length; i++) {
            copy[i] = minos[i].clone();
        }
        return copy;
    }

    public PieceType getKind() { return kind; }
    public int getX() { return x; }
    public int getY() { return y; }
    public int getR() { return r; }

    public int[][] getMinos() {
        return copyOf(minos);
    }

    /**
     * 平行移動した新しいピースを返します。
     */
    public Piece moved(int dx, int dy) {
        if (dx == 0 && dy == 0) return this;
        return new Piece(kind, x + dx, y + dy, r, minos);
    }

    /**
     * 位置と回転状態を差し替えた新しいピースを返します。
     */
    public Piece rotated(int newX, int newY, int newR, int[][] newMinos) {
        return new Piece(kind, newX, newY, newR, newMinos);
    }

    /**
     * 盤面上の絶対座標 {行, 列} を返します。
     */
    public int[][] cells() {
        int[][] cells = new int[minos.length][];
        for (int i = 0; i < minos.length; i++) {
            cells[i] = new int[] { x + minos[i][0], y + minos[i][1] };
        }
        return cells;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Piece other)) return false;
        return kind == other.kind && x == other.x && y == other.y && r == other.r
                && Arrays.deepEquals(minos, other.minos);
    }

    @Override
    public int hashCode() {
        int hash = kind.hashCode();
        hash = 31 * hash + x;
        hash = 31 * hash + y;
        hash = 31 * hash + r;
        return 31 * hash + Arrays.deepHashCode(minos);
    }

    @Override
    public String toString() {
        return "Piece[" + kind + " at (" + x + ", " + y + "), r=" + r + "]";
    }
}
