package org.yourcompany.tetrisrules.codec;

import org.yourcompany.tetrisrules.model.Board;
import org.yourcompany.tetrisrules.model.Piece;

/**
 * {@link BoardCodec#decode(byte[])} の結果。piece はピースが含まれていなければ null。
 */
public record EncodedState(Board board, Piece piece) {

    public boolean hasPiece() {
        return piece != null;
    }
}
