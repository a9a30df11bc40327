package org.yourcompany.tetrisrules.engine.impl;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;

import org.junit.jupiter.api.Test;
import org.yourcompany.tetrisrules.config.Rules;
import org.yourcompany.tetrisrules.engine.FakeClock;
import org.yourcompany.tetrisrules.model.Game;

class PresetsTest {

    @Test
    void modernUsesGuidelineParts() {
        Game game = Game.builder().clock(new FakeClock()).build();
        assertInstanceOf(InfinityGravity.class, game.getGravity());
        assertInstanceOf(SevenBagQueue.class, game.getQueue());
        assertInstanceOf(SrsRotationSystem.class, game.getRotationSystem());
        assertInstanceOf(GuidelineScorer.class, game.getScorer());
        assertTrue(game.getRules().contains("lock_delay"));
        assertEquals(1, game.getLevel());
    }

    @Test
    void tetrioOnlySwapsTheRotationSystem() {
        Game game = Game.builder().engineParts(Presets.TETRIO).clock(new FakeClock()).build();
        assertInstanceOf(TetrioRotationSystem.class, game.getRotationSystem());
        assertInstanceOf(GuidelineScorer.class, game.getScorer());
    }

    @Test
    void nesUsesClassicParts() {
        Game game = Game.builder().engineParts(Presets.NES).clock(new FakeClock()).build();
        assertInstanceOf(MarathonGravity.class, game.getGravity());
        assertInstanceOf(ChaoticQueue.class, game.getQueue());
        assertInstanceOf(ClassicRotationSystem.class, game.getRotationSystem());
        assertInstanceOf(NesScorer.class, game.getScorer());
        assertTrue(game.getRules().contains("marathon_auto_lock"));
        assertFalse(game.getRules().contains("lock_delay"));
        assertEquals(Map.of(Rules.INITIAL_LEVEL, 0), Presets.NES.scorer().ruleOverrides());
    }
}
