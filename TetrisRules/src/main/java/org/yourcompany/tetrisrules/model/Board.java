package org.yourcompany.tetrisrules.model;

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;

import org.yourcompany.tetrisrules.config.ConfigurationException;

/**
 * ミノの値 (0〜15) を並べた 2 次元の盤面。
 * 内部データは 1 本の byte 配列で、オフセットと行・列のストライドで参照します。
 * {@link #row(int)} や {@link #slice(int, int)} はデータを共有するビューを返し、
 * ビューへの書き込みは元の盤面にも反映されます。コピーが必要なら {@link #copy()} を使います。
 * 行・列の添字に負の値を渡すと末尾から数えます。
 */
public final class Board implements Iterable<Board> {
    public static final int MAX_VALUE = 15;

    private final byte[] data;
    private final int rows;
    private final int cols;
    private final int offset;
    private final int rowStride;
    private final int colStride;
    private final Board base; // ビューの場合はデータの持ち主、持ち主自身なら null

    private Board(byte[] data, int rows, int cols, int offset, int rowStride, int colStride, Board base) {
        this.data = data;
        this.rows = rows;
        this.cols = cols;
        this.offset = offset;
        this.rowStride = rowStride;
        this.colStride = colStride;
        this.base = base;
    }

    /**
     * すべて 0 の盤面を作成します。
     */
    public static Board zeros(int rows, int cols) {
        if (rows <= 0 || cols <= 0) {
            throw new ConfigurationException("board must have a non-zero size, got " + rows + "x" + cols);
        }
        return new Board(new byte[rows * cols], rows, cols, 0, cols, 1, null);
    }

    /**
     * 2 次元配列から盤面を作成します。配列は空でなく長方形である必要があります。
     */
    public static Board of(int[][] cells) {
        if (cells.length == 0 || cells[0].length == 0) {
            throw new ConfigurationException("board must not be empty");
        }
        Board board = zeros(cells.length, cells[0].length);
        for (int row = 0; row < cells.length; row++) {
            if (cells[row].length != board.cols) {
                throw new ConfigurationException("board rows must all have the same width");
            }
            board.setRow(row, cells[row]);
        }
        return board;
    }

    public int getHeight() { return rows; }
    public int getWidth() { return cols; }

    /**
     * データの持ち主を返します。この盤面自身が持ち主なら null。
     */
    public Board getBase() { return base; }

    public boolean isView() { return base != null; }

    /** 2 つの盤面が同じデータを参照しているかどうか。 */
    public boolean sharesStorageWith(Board other) {
        return other != null && data == other.data;
    }

    private Board owner() {
        return base != null ? base : this;
    }

    private int normalize(int index, int length, int axis) {
        int normalized = index < 0 ? index + length : index;
        if (normalized < 0 || normalized >= length) {
            throw new BoardIndexException(index, axis);
        }
        return normalized;
    }

    private int indexOf(int row, int col) {
        return offset + normalize(row, rows, 0) * rowStride + normalize(col, cols, 1) * colStride;
    }

    private static void checkValue(int value) {
        if (value < 0 || value > MAX_VALUE) {
            throw new IllegalArgumentException("mino value must be in 0.." + MAX_VALUE + ", got " + value);
        }
    }

    public int get(int row, int col) {
        return data[indexOf(row, col)];
    }

    public void set(int row, int col, int value) {
        checkValue(value);
        data[indexOf(row, col)] = (byte) value;
    }

    /**
     * 指定した行を 1 行分のビューとして返します。
     */
    public Board row(int row) {
        int r = normalize(row, rows, 0);
        return new Board(data, 1, cols, offset + r * rowStride, rowStride, colStride, owner());
    }

    public Board slice(int from, int to) {
        return slice(from, to, 1);
    }

    /**
     * 行 [from, to) を step 行おきに取り出したビューを返します。
     */
    public Board slice(int from, int to, int step) {
        if (step <= 0) {
            throw new IllegalArgumentException("slice step must be positive, got " + step);
        }
        int start = from < 0 ? from + rows : from;
        int end = to < 0 ? to + rows : to;
        if (start < 0 || end > rows || start > end) {
            throw new BoardIndexException("invalid slice [" + from + ", " + to + ") of " + rows + " rows");
        }
        int count = (end - start + step - 1) / step;
        return new Board(data, count, cols, offset + start * rowStride, rowStride * step, colStride, owner());
    }

    /**
     * 下から n 行のビューを返します。
     */
    public Board tail(int n) {
        if (n < 0 || n > rows) {
            throw new BoardIndexException("cannot take the last " + n + " rows of " + rows + " rows");
        }
        return slice(rows - n, rows);
    }

    /**
     * 中身を複製した、データを共有しない新しい盤面を返します。
     */
    public Board copy() {
        Board copy = new Board(new byte[rows * cols], rows, cols, 0, cols, 1, null);
        for (int row = 0; row < rows; row++) {
            for (int col = 0; col < cols; col++) {
                copy.data[row * cols + col] = data[offset + row * rowStride + col * colStride];
            }
        }
        return copy;
    }

    public void fill(int value) {
        checkValue(value);
        for (int row = 0; row < rows; row++) {
            for (int col = 0; col < cols; col++) {
                data[offset + row * rowStride + col * colStride] = (byte) value;
            }
        }
    }

    public void setRow(int row, int[] values) {
        if (values.length != cols) {
            throw new IllegalArgumentException("row needs " + cols + " values, got " + values.length);
        }
        int r = normalize(row, rows, 0);
        for (int col = 0; col < cols; col++) {
            checkValue(values[col]);
            data[offset + r * rowStride + col * colStride] = (byte) values[col];
        }
    }

    public int[] rowValues(int row) {
        int r = normalize(row, rows, 0);
        int[] values = new int[cols];
        for (int col = 0; col < cols; col++) {
            values[col] = data[offset + r * rowStride + col * colStride];
        }
        return values;
    }

    public int[][] toArray() {
        int[][] cells = new int[rows][];
        for (int row = 0; row < rows; row++) {
            cells[row] = rowValues(row);
        }
        return cells;
    }

    /**
     * 指定した行を消去し、それより上の行をすべて 1 段下にずらします。一番上の行は空になります。
     */
    public void clearRow(int row) {
        int r = normalize(row, rows, 0);
        for (int target = r; target > 0; target--) {
            for (int col = 0; col < cols; col++) {
                data[offset + target * rowStride + col * colStride] =
                        data[offset + (target - 1) * rowStride + col * colStride];
            }
        }
        for (int col = 0; col < cols; col++) {
            data[offset + col * colStride] = 0;
        }
    }

    public boolean isRowFull(int row) {
        int r = normalize(row, rows, 0);
        for (int col = 0; col < cols; col++) {
            if (data[offset + r * rowStride + col * colStride] == 0) return false;
        }
        return true;
    }

    public boolean isRowEmpty(int row) {
        int r = normalize(row, rows, 0);
        for (int col = 0; col < cols; col++) {
            if (data[offset + r * rowStride + col * colStride] != 0) return false;
        }
        return true;
    }

    public boolean isEmpty() {
        for (int row = 0; row < rows; row++) {
            if (!isRowEmpty(row)) return false;
        }
        return true;
    }

    /**
     * 一部だけ埋まっている行があるかどうか。パーフェクトクリアの判定に使います。
     */
    public boolean hasPartialRows() {
        for (int row = 0; row < rows; row++) {
            if (!isRowEmpty(row) && !isRowFull(row)) return true;
        }
        return false;
    }

    /**
     * 上から順に各行のビューを返します。
     */
    @Override
    public Iterator<Board> iterator() {
        return new Iterator<>() {
            private int next = 0;

            @Override
            public boolean hasNext() {
                return next < rows;
            }

            @Override
            public Board next() {
                if (!hasNext()) throw new NoSuchElementException();
                return row(next++);
            }
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Board other)) return false;
        if (rows != other.rows || cols != other.cols) return false;
        for (int row = 0; row < rows; row++) {
            for (int col = 0; col < cols; col++) {
                if (get(row, col) != other.get(row, col)) return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int hash = 31 * rows + cols;
        for (int row = 0; row < rows; row++) {
            hash = 31 * hash + Arrays.hashCode(rowValues(row));
        }
        return hash;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int row = 0; row < rows; row++) {
            if (row > 0) sb.append('\n');
            for (int col = 0; col < cols; col++) {
                sb.append(MinoType.symbolOf(get(row, col)));
            }
        }
        return sb.toString();
    }
}
