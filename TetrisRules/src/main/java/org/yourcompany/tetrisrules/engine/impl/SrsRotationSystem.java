package org.yourcompany.tetrisrules.engine.impl;

import java.util.EnumMap;
import java.util.Map;

import org.yourcompany.tetrisrules.engine.KickTable;
import org.yourcompany.tetrisrules.engine.RotationSystem;
import org.yourcompany.tetrisrules.model.Board;
import org.yourcompany.tetrisrules.model.Game;
import org.yourcompany.tetrisrules.model.Piece;
import org.yourcompany.tetrisrules.model.PieceType;

/**
 * スーパーローテーションシステム (SRS)。
 * 回転先にそのまま置けなければ、壁蹴りテーブルの補正を順番に試します。
 * 座標はすべて {行, 列} で、行は下向きが正です。
 */
public class SrsRotationSystem extends RotationSystem {

    private static final Map<PieceType, int[][][]> SHAPES = new EnumMap<>(PieceType.class);

    static {
        SHAPES.put(PieceType.I, new int[][][] {
            {{1, 0}, {1, 1}, {1, 2}, {1, 3}},
            {{0, 2}, {1, 2}, {2, 2}, {3, 2}},
            {{2, 0}, {2, 1}, {2, 2}, {2, 3}},
            {{0, 1}, {1, 1}, {2, 1}, {3, 1}},
        });
        SHAPES.put(PieceType.L, new int[][][] {
            {{0, 2}, {1, 0}, {1, 1}, {1, 2}},
            {{0, 1}, {1, 1}, {2, 1}, {2, 2}},
            {{1, 0}, {1, 1}, {1, 2}, {2, 0}},
            {{0, 0}, {0, 1}, {1, 1}, {2, 1}},
        });
        SHAPES.put(PieceType.J, new int[][][] {
            {{0, 0}, {1, 0}, {1, 1}, {1, 2}},
            {{0, 1}, {0, 2}, {1, 1}, {2, 1}},
            {{1, 0}, {1, 1}, {1, 2}, {2, 2}},
            {{0, 1}, {1, 1}, {2, 0}, {2, 1}},
        });
        SHAPES.put(PieceType.S, new int[][][] {
            {{0, 1}, {0, 2}, {1, 0}, {1, 1}},
            {{0, 1}, {1, 1}, {1, 2}, {2, 2}},
            {{1, 1}, {1, 2}, {2, 0}, {2, 1}},
            {{0, 0}, {1, 0}, {1, 1}, {2, 1}},
        });
        SHAPES.put(PieceType.Z, new int[][][] {
            {{0, 0}, {0, 1}, {1, 1}, {1, 2}},
            {{0, 2}, {1, 1}, {1, 2}, {2, 1}},
            {{1, 0}, {1, 1}, {2, 1}, {2, 2}},
            {{0, 1}, {1, 0}, {1, 1}, {2, 0}},
        });
        SHAPES.put(PieceType.T, new int[][][] {
            {{0, 1}, {1, 0}, {1, 1}, {1, 2}},
            {{0, 1}, {1, 1}, {1, 2}, {2, 1}},
            {{1, 0}, {1, 1}, {1, 2}, {2, 1}},
            {{0, 1}, {1, 0}, {1, 1}, {2, 1}},
        });
        int[][] o = {{0, 1}, {0, 2}, {1, 1}, {1, 2}};
        SHAPES.put(PieceType.O, new int[][][] { o, o, o, o });
    }

    // J, L, S, T, Z 用 (O は形が変わらないため補正を使わない)
    public static final KickTable KICKS = KickTable.builder()
            .add(0, 1, new int[] {0, -1}, new int[] {-1, -1}, new int[] {2, 0}, new int[] {2, -1})
            .add(0, 3, new int[] {0, 1}, new int[] {-1, 1}, new int[] {2, 0}, new int[] {2, 1})
            .add(1, 0, new int[] {0, 1}, new int[] {1, 1}, new int[] {-2, 0}, new int[] {-2, 1})
            .add(1, 2, new int[] {0, 1}, new int[] {1, 1}, new int[] {-2, 0}, new int[] {-2, 1})
            .add(2, 1, new int[] {0, -1}, new int[] {-1, -1}, new int[] {2, 0}, new int[] {2, -1})
            .add(2, 3, new int[] {0, 1}, new int[] {-1, 1}, new int[] {2, 0}, new int[] {2, 1})
            .add(3, 0, new int[] {0, -1}, new int[] {1, -1}, new int[] {-2, 0}, new int[] {-2, -1})
            .add(3, 2, new int[] {0, -1}, new int[] {1, -1}, new int[] {-2, 0}, new int[] {-2, -1})
            .build();

    public static final KickTable I_KICKS = KickTable.builder()
            .add(0, 1, new int[] {0, -1}, new int[] {0, 1}, new int[] {1, -2}, new int[] {-2, 1})
            .add(0, 3, new int[] {0, -1}, new int[] {0, 2}, new int[] {-2, -1}, new int[] {1, 2})
            .add(1, 0, new int[] {0, 2}, new int[] {0, -1}, new int[] {-1, 2}, new int[] {2, -1})
            .add(1, 2, new int[] {0, -1}, new int[] {0, 2}, new int[] {-2, -1}, new int[] {1, 2})
            .add(2, 1, new int[] {0, 1}, new int[] {0, -2}, new int[] {2, 1}, new int[] {-1, 2})
            .add(2, 3, new int[] {0, 2}, new int[] {0, -1}, new int[] {-1, 2}, new int[] {2, -1})
            .add(3, 0, new int[] {0, 1}, new int[] {0, -2}, new int[] {2, 1}, new int[] {-1, -2})
            .add(3, 2, new int[] {0, -2}, new int[] {0, 1}, new int[] {1, -2}, new int[] {-2, 1})
            .build();

    public SrsRotationSystem(Game game) {
        super(game);
    }

    /**
     * 指定したピースと回転状態のミノの相対座標を返します。
     */
    public static int[][] shape(PieceType kind, int r) {
        int[][] minos = SHAPES.get(kind)[Math.floorMod(r, 4)];
        int[][] copy = new int[minos.length][];
        for (int i = 0; i < minos.length; i++) {
            copy[i] = minos[i].clone();
        }
        return copy;
    }

    protected KickTable kicks() {
        return KICKS;
    }

    protected KickTable iKicks() {
        return I_KICKS;
    }

    @Override
    public Piece spawn(PieceType kind) {
        Board board = game.getBoard();
        int x = board.getHeight() / 2 - 2;
        int y = (board.getWidth() + 3) / 2 - 3;
        return new Piece(kind, x, y, 0, shape(kind, 0));
    }

    @Override
    public Piece rotate(Piece piece, int turns) {
        int from = piece.getR();
        int to = Math.floorMod(from + turns, 4);
        int[][] minos = shape(piece.getKind(), to);

        if (!overlaps(minos, piece.getX(), piece.getY())) {
            return piece.rotated(piece.getX(), piece.getY(), to, minos);
        }

        KickTable table = piece.getKind() == PieceType.I ? iKicks() : kicks();
        for (KickTable.Offset kick : table.get(from, to)) {
            int x = piece.getX() + kick.dx();
            int y = piece.getY() + kick.dy();
            if (!overlaps(minos, x, y)) {
                return piece.rotated(x, y, to, minos);
            }
        }
        return piece;
    }

    public static final class Factory implements RotationSystem.Factory {
        @Override
        public RotationSystem create(Game game) {
            return new SrsRotationSystem(game);
        }
    }
}
