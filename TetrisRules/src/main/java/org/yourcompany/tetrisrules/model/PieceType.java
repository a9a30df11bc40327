package org.yourcompany.tetrisrules.model;

/**
 * 7 種類のテトリミノ。盤面上では {@link #getCode()} の値 (1〜7) で表されます。
 */
public enum PieceType {
    I(1),
    J(2),
    L(3),
    O(4),
    S(5),
    T(6),
    Z(7);

    private final int code;

    PieceType(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static PieceType fromCode(int code) {
        for (PieceType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new IllegalArgumentException("no piece type with code " + code);
    }
}
