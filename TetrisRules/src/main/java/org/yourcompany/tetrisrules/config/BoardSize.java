package org.yourcompany.tetrisrules.config;

/**
 * 見える盤面の大きさ（行数 × 列数）。内部の盤面はこの倍の高さを持ちます。
 */
public record BoardSize(int height, int width) {

    public static final BoardSize DEFAULT = new BoardSize(20, 10);

    public BoardSize {
        if (height <= 0 || width <= 0) {
            throw new ConfigurationException("board size must be positive, got " + height + "x" + width);
        }
    }

    public int internalHeight() {
        return height * 2;
    }
}
