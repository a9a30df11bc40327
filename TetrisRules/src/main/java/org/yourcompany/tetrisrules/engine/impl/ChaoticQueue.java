package org.yourcompany.tetrisrules.engine.impl;

import java.util.List;

import org.yourcompany.tetrisrules.config.Seed;
import org.yourcompany.tetrisrules.engine.PieceQueue;
import org.yourcompany.tetrisrules.model.Game;
import org.yourcompany.tetrisrules.model.PieceType;

/**
 * 毎回完全にランダムな種類を選ぶキュー。
 */
public class ChaoticQueue extends PieceQueue {
    private static final PieceType[] KINDS = PieceType.values();

    public ChaoticQueue(List<PieceType> initial, Seed seed) {
        super(initial, seed);
    }

    @Override
    protected void fill() {
        do {
            pieces.add(KINDS[random.nextInt(KINDS.length)]);
        } while (pieces.size() < KINDS.length);
    }

    public static final class Factory implements PieceQueue.Factory {
        @Override
        public PieceQueue create(Game game, List<PieceType> initial) {
            return new ChaoticQueue(initial, game.getSeed());
        }
    }
}
