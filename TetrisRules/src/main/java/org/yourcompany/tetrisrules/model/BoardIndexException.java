package org.yourcompany.tetrisrules.model;

/**
 * 盤面の範囲外を参照したときに投げられる例外。
 */
public class BoardIndexException extends IndexOutOfBoundsException {

    public BoardIndexException(int index, int axis) {
        super("board index " + index + " out of bounds for axis " + axis);
    }

    public BoardIndexException(String message) {
        super(message);
    }
}
