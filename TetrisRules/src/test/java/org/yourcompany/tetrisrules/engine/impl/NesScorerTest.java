package org.yourcompany.tetrisrules.engine.impl;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.yourcompany.tetrisrules.config.Rules;
import org.yourcompany.tetrisrules.config.SpinType;
import org.yourcompany.tetrisrules.engine.FakeClock;
import org.yourcompany.tetrisrules.model.Board;
import org.yourcompany.tetrisrules.model.Game;
import org.yourcompany.tetrisrules.model.PieceType;

class NesScorerTest {

    private static Game.Builder nes(PieceType... queue) {
        return Game.builder()
                .engineParts(Presets.NES)
                .clock(new FakeClock())
                .queue(queue);
    }

    private static void fillRowsExceptLeftColumn(Board board) {
        for (int row = 36; row < 40; row++) {
            for (int col = 1; col < board.getWidth(); col++) {
                board.set(row, col, PieceType.J.getCode());
            }
        }
    }

    @Test
    void startsAtLevelZero() {
        Game game = nes(PieceType.I).build();
        assertEquals(0, game.getLevel());
        assertEquals(0, game.getRules().getInt(Rules.INITIAL_LEVEL));
        assertEquals(10, game.getScorer().getGoal());
    }

    @Test
    void callerOverridesBeatThePresetLevel() {
        Game game = nes(PieceType.I).rule(Rules.INITIAL_LEVEL, 5).build();
        assertEquals(5, game.getLevel());
        assertEquals(60, game.getScorer().getGoal());
    }

    @Test
    void singleScoresFortyTimesTheNextLevel() {
        Game game = nes(PieceType.I).build();
        Board board = game.getBoard();
        for (int col = 0; col < board.getWidth(); col++) {
            if (col < 3 || col > 6) board.set(39, col, PieceType.J.getCode());
        }

        game.hardDrop();

        assertEquals(20 + 40, game.getScore());
        assertEquals("SINGLE", game.getLastClearInfo().getClearType());
        assertEquals(SpinType.NONE, game.getLastClearInfo().getSpinType());
    }

    @Test
    void levelAdvancesAtTheFirstGoalThenEveryTenLines() {
        Game game = nes(PieceType.I, PieceType.I, PieceType.I).build();
        for (int i = 0; i < 3; i++) {
            fillRowsExceptLeftColumn(game.getBoard());
            game.rotate(1);
            game.left(5);
            game.hardDrop();
        }

        assertEquals(3 * (18 + 1200), game.getScore());
        assertEquals(12, game.getLines());
        assertEquals(1, game.getLevel());
        assertEquals(22, game.getScorer().getGoal());
    }

    @Test
    void tSpinsAreNotRewarded() {
        Game game = nes(PieceType.T).build();
        for (int col = 1; col < 10; col++) {
            game.getBoard().set(39, col, PieceType.J.getCode());
        }
        game.left(3);
        game.softDrop(40);
        game.rotate(1);
        // 壁蹴りがないので回転できない
        assertEquals(0, game.getPiece().getR());
        assertEquals(19, game.getScore());
    }
}
