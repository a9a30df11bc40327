package org.yourcompany.tetrisrules.engine;

import org.yourcompany.tetrisrules.model.Board;
import org.yourcompany.tetrisrules.model.Game;
import org.yourcompany.tetrisrules.model.Piece;
import org.yourcompany.tetrisrules.model.PieceType;

/**
 * ピースの出現位置と回転を決める部品。衝突判定もここに一本化されています。
 */
public abstract class RotationSystem implements EnginePart {

    protected final Game game;

    protected RotationSystem(Game game) {
        this.game = game;
    }

    /**
     * 新しいピースを出現位置に生成します。
     */
    public abstract Piece spawn(PieceType kind);

    /**
     * ピースを turns 回 (正が時計回り) 回転させた結果を返します。
     * どの位置にも置けない場合は元のピースをそのまま返します。
     */
    public abstract Piece rotate(Piece piece, int turns);

    public boolean overlaps(Piece piece) {
        return overlaps(piece.getMinos(), piece.getX(), piece.getY());
    }

    /**
     * 原点 (px, py) に minos を置いたとき、盤面外にはみ出すか既存のブロックと重なるなら true。
     */
    public boolean overlaps(int[][] minos, int px, int py) {
        Board board = game.getBoard();
        for (int[] mino : minos) {
            int row = px + mino[0];
            int col = py + mino[1];
            if (row < 0 || row >= board.getHeight() || col < 0 || col >= board.getWidth()) {
                return true;
            }
            if (board.get(row, col) != 0) {
                return true;
            }
        }
        return false;
    }

    public interface Factory extends PartFactory {
        RotationSystem create(Game game);
    }
}
