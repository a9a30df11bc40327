package org.yourcompany.tetrisrules.model;

/**
 * 盤面の 1 マスが取りうる値。
 * GHOST と GARBAGE は表示用のコピーにだけ書き込まれ、ゲームの盤面本体には現れません。
 */
public enum MinoType {
    EMPTY(0, '.'),
    I(1, 'I'),
    J(2, 'J'),
    L(3, 'L'),
    O(4, 'O'),
    S(5, 'S'),
    T(6, 'T'),
    Z(7, 'Z'),
    GHOST(8, '@'),
    GARBAGE(9, 'X');

    private final int code;
    private final char symbol;

    MinoType(int code, char symbol) {
        this.code = code;
        this.symbol = symbol;
    }

    public int getCode() { return code; }
    public char getSymbol() { return symbol; }

    /**
     * 盤面の値を表示用の 1 文字に変換します。未知の値は '?' になります。
     */
    public static char symbolOf(int code) {
        for (MinoType type : values()) {
            if (type.code == code) {
                return type.symbol;
            }
        }
        return '?';
    }
}
