package org.yourcompany.tetrisrules.engine.impl;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.yourcompany.tetrisrules.config.Seed;
import org.yourcompany.tetrisrules.engine.PieceQueue;
import org.yourcompany.tetrisrules.model.Game;
import org.yourcompany.tetrisrules.model.PieceType;

/**
 * 7 種類を 1 セットずつシャッフルして並べる「7 種 1 巡」方式のキュー。
 */
public class SevenBagQueue extends PieceQueue {

    public SevenBagQueue(List<PieceType> initial, Seed seed) {
        super(initial, seed);
    }

    @Override
    protected void fill() {
        List<PieceType> bag = new ArrayList<>(Arrays.asList(PieceType.values()));
        Collections.shuffle(bag, random);
        pieces.addAll(bag);
    }

    public static final class Factory implements PieceQueue.Factory {
        @Override
        public PieceQueue create(Game game, List<PieceType> initial) {
            return new SevenBagQueue(initial, game.getSeed());
        }
    }
}
