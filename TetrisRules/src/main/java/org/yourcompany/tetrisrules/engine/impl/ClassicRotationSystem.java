package org.yourcompany.tetrisrules.engine.impl;

import org.yourcompany.tetrisrules.engine.KickTable;
import org.yourcompany.tetrisrules.engine.RotationSystem;
import org.yourcompany.tetrisrules.model.Game;

/**
 * 壁蹴りのない旧来の回転。回転先にそのまま置けなければ回転しません。
 */
public class ClassicRotationSystem extends SrsRotationSystem {

    public ClassicRotationSystem(Game game) {
        super(game);
    }

    @Override
    protected KickTable kicks() {
        return KickTable.EMPTY;
    }

    @Override
    protected KickTable iKicks() {
        return KickTable.EMPTY;
    }

    public static final class Factory implements RotationSystem.Factory {
        @Override
        public RotationSystem create(Game game) {
            return new ClassicRotationSystem(game);
        }
    }
}
