package org.yourcompany.tetrisrules.engine.impl;

import org.yourcompany.tetrisrules.engine.KickTable;
import org.yourcompany.tetrisrules.engine.RotationSystem;
import org.yourcompany.tetrisrules.model.Game;

/**
 * TETR.IO 式の SRS。通常の SRS の表に 180 度回転の補正を追加したもの。
 */
public class TetrioRotationSystem extends SrsRotationSystem {

    private static final KickTable SPIN_180 = KickTable.builder()
            .add(0, 2, new int[] {-1, 0}, new int[] {-1, 1}, new int[] {-1, -1}, new int[] {0, 1}, new int[] {0, -1})
            .add(1, 3, new int[] {0, 1}, new int[] {-2, 1}, new int[] {-1, 1}, new int[] {-2, 0}, new int[] {-1, 0})
            .add(2, 0, new int[] {1, 0}, new int[] {1, -1}, new int[] {1, 1}, new int[] {0, -1}, new int[] {0, 1})
            .add(3, 1, new int[] {0, -1}, new int[] {-2, -1}, new int[] {-1, -1}, new int[] {-2, 0}, new int[] {-1, 0})
            .build();

    public static final KickTable KICKS = SrsRotationSystem.KICKS.with(SPIN_180);
    public static final KickTable I_KICKS = SrsRotationSystem.I_KICKS.with(SPIN_180);

    public TetrioRotationSystem(Game game) {
        super(game);
    }

    @Override
    protected KickTable kicks() {
        return KICKS;
    }

    @Override
    protected KickTable iKicks() {
        return I_KICKS;
    }

    public static final class Factory implements RotationSystem.Factory {
        @Override
        public RotationSystem create(Game game) {
            return new TetrioRotationSystem(game);
        }
    }
}
