package org.yourcompany.tetrisrules.engine.impl;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.yourcompany.tetrisrules.config.ClearInfo;
import org.yourcompany.tetrisrules.config.ConfigurationException;
import org.yourcompany.tetrisrules.config.Seed;
import org.yourcompany.tetrisrules.config.SpinType;
import org.yourcompany.tetrisrules.engine.FakeClock;
import org.yourcompany.tetrisrules.model.Board;
import org.yourcompany.tetrisrules.model.Game;
import org.yourcompany.tetrisrules.model.PieceType;

class GuidelineScorerTest {

    private static Game game(PieceType... queue) {
        return Game.builder()
                .clock(new FakeClock())
                .seed(Seed.of("scorer"))
                .queue(queue)
                .build();
    }

    /** 指定した列を空けて行を埋める。 */
    private static void fillRow(Board board, int row, int... holes) {
        for (int col = 0; col < board.getWidth(); col++) {
            board.set(row, col, PieceType.I.getCode());
        }
        for (int hole : holes) {
            board.set(row, hole, 0);
        }
    }

    @Test
    void softAndHardDropsScoreByDistance() {
        Game game = game(PieceType.O, PieceType.O);
        game.softDrop(5);
        assertEquals(5, game.getScore());
        game.hardDrop();
        assertEquals(5 + 15 * 2, game.getScore());
        assertEquals(0, game.getLastClearInfo().getLinesCleared());
    }

    @Test
    void singleClearIsMultipliedByLevel() {
        Game game = Game.builder()
                .clock(new FakeClock())
                .seed(Seed.of("scorer"))
                .queue(PieceType.I)
                .level(3)
                .build();
        fillRow(game.getBoard(), 39, 3, 4, 5, 6);
        game.getBoard().set(38, 0, PieceType.O.getCode());

        game.hardDrop();

        ClearInfo info = game.getLastClearInfo();
        assertEquals("SINGLE", info.getClearType());
        assertEquals(100 * 3 + 20 * 2, info.getScoreDelta());
        assertEquals(List.of(39), game.getDelta().clears());
    }

    @Test
    void tSpinTriple() {
        Game game = game(PieceType.T);
        Board board = game.getBoard();
        board.set(35, 4, PieceType.I.getCode());
        fillRow(board, 37, 4);
        fillRow(board, 38, 3, 4);
        fillRow(board, 39, 4);

        game.left(2);
        game.softDrop(40);
        assertEquals(17, game.getScore());
        game.right(1);
        game.rotate(-1);

        assertEquals(3, game.getPiece().getR());
        assertEquals(2, game.getDelta().x());
        assertEquals(1, game.getDelta().y());
        assertEquals(SpinType.T_SPIN, ((GuidelineScorer) game.getScorer()).getPendingSpin());

        game.hardDrop();

        ClearInfo info = game.getLastClearInfo();
        assertEquals(List.of(37, 38, 39), game.getDelta().clears());
        assertEquals(3, info.getLinesCleared());
        assertEquals(SpinType.T_SPIN, info.getSpinType());
        assertEquals("T-SPIN TRIPLE", info.getClearType());
        assertEquals(1600, info.getScoreDelta());
        assertEquals(17 + 1600, game.getScore());
        assertEquals(1, info.getBackToBack());
        assertFalse(info.isPerfectClear());
    }

    @Test
    void tSpinMiniAgainstTheLeftWall() {
        Game game = game(PieceType.T);
        fillRow(game.getBoard(), 39, 0);

        game.left(3);
        game.softDrop(40);
        game.rotate(1);
        assertEquals(-1, game.getPiece().getY());

        game.hardDrop();

        ClearInfo info = game.getLastClearInfo();
        assertEquals(SpinType.T_SPIN_MINI, info.getSpinType());
        assertEquals("T-SPIN MINI SINGLE", info.getClearType());
        assertEquals(200, info.getScoreDelta());
        assertEquals(19 + 200, game.getScore());
    }

    @Test
    void tSpinMiniAgainstTheRightWall() {
        Game game = game(PieceType.T);
        fillRow(game.getBoard(), 39, 9);

        game.right(4);
        game.softDrop(40);
        game.rotate(-1);
        assertEquals(3, game.getPiece().getR());
        assertEquals(8, game.getPiece().getY());
        assertEquals(0, game.getDelta().x());
        assertEquals(1, game.getDelta().y());

        game.hardDrop();

        ClearInfo info = game.getLastClearInfo();
        assertEquals(SpinType.T_SPIN_MINI, info.getSpinType());
        assertEquals("T-SPIN MINI SINGLE", info.getClearType());
        assertEquals(200, info.getScoreDelta());
        assertEquals(19 + 200, game.getScore());
    }

    @Test
    void tSpinMiniOnTheFloor() {
        Game game = game(PieceType.T);
        Board board = game.getBoard();
        fillRow(board, 39, 4, 5, 6);
        board.set(38, 3, PieceType.I.getCode());
        board.set(38, 6, PieceType.I.getCode());

        game.rotate(1);
        game.softDrop(40);
        assertEquals(37, game.getPiece().getX());
        game.rotate(-1);

        assertEquals(0, game.getPiece().getR());
        assertEquals(38, game.getPiece().getX());
        assertEquals(4, game.getPiece().getY());
        assertEquals(SpinType.T_SPIN_MINI, ((GuidelineScorer) game.getScorer()).getPendingSpin());

        game.hardDrop();

        ClearInfo info = game.getLastClearInfo();
        assertEquals(List.of(39), game.getDelta().clears());
        assertEquals("T-SPIN MINI SINGLE", info.getClearType());
        assertEquals(200, info.getScoreDelta());
        assertFalse(info.isPerfectClear());
    }

    @Test
    void levelZeroStartsAtLevelOne() {
        Game game = Game.builder()
                .clock(new FakeClock())
                .seed(Seed.of("scorer"))
                .queue(PieceType.I)
                .level(0)
                .build();
        assertEquals(1, game.getLevel());
        assertEquals(10, game.getScorer().getGoal());

        fillRow(game.getBoard(), 39, 3, 4, 5, 6);
        game.getBoard().set(38, 0, PieceType.O.getCode());
        game.hardDrop();

        assertEquals(100 + 20 * 2, game.getLastClearInfo().getScoreDelta());
        assertEquals(1, game.getLevel());
    }

    @Test
    void negativeLevelIsRejected() {
        assertThrows(ConfigurationException.class, () -> Game.builder()
                .clock(new FakeClock())
                .level(-1)
                .build());
    }

    @Test
    void spinSurvivesBlockedMovesButNotASwap() {
        Game game = game(PieceType.T, PieceType.O);
        fillRow(game.getBoard(), 39, 0);
        GuidelineScorer scorer = (GuidelineScorer) game.getScorer();

        game.left(3);
        game.softDrop(40);
        game.rotate(1);
        game.right(1);
        game.left(1);
        assertEquals(0, game.getDelta().y());
        assertEquals(SpinType.T_SPIN_MINI, scorer.getPendingSpin());

        game.swap();
        assertEquals(SpinType.NONE, scorer.getPendingSpin());
    }

    @Test
    void rotationInOpenAirIsNotASpin() {
        Game game = game(PieceType.T);
        game.rotate(1);
        assertEquals(SpinType.NONE, ((GuidelineScorer) game.getScorer()).getPendingSpin());
    }

    @Test
    void perfectClearTetrisThenBackToBack() {
        Game game = game(PieceType.I, PieceType.I);
        Board board = game.getBoard();
        for (int row = 36; row < 40; row++) {
            fillRow(board, row, 0);
        }

        game.rotate(1);
        game.left(5);
        game.hardDrop();

        ClearInfo first = game.getLastClearInfo();
        assertTrue(first.isPerfectClear());
        assertEquals("PERFECT CLEAR QUAD", first.getClearType());
        assertEquals(2000 + 18 * 2, first.getScoreDelta());
        assertTrue(board.isEmpty());

        for (int row = 36; row < 40; row++) {
            fillRow(board, row, 0);
        }
        game.rotate(1);
        game.left(5);
        game.hardDrop();

        ClearInfo second = game.getLastClearInfo();
        assertTrue(second.isB2B());
        assertEquals(2, second.getComboCount());
        // (2000 + 50) * 3 / 2 + 200
        assertEquals(3275 + 18 * 2, second.getScoreDelta());
        assertEquals(2036 + 3311, game.getScore());
        assertEquals(8, game.getLines());
    }

    @Test
    void comboResetsOnALockWithoutClears() {
        Game game = game(PieceType.I, PieceType.I, PieceType.O);
        fillRow(game.getBoard(), 39, 3, 4, 5, 6);
        fillRow(game.getBoard(), 38, 0, 3, 4, 5, 6);

        game.hardDrop();
        assertEquals(1, game.getLastClearInfo().getComboCount());
        game.hardDrop();
        assertEquals(0, game.getLastClearInfo().getComboCount());
    }

    @Test
    void levelAdvancesEveryTenLines() {
        Game game = game(PieceType.I, PieceType.I, PieceType.I);
        Board board = game.getBoard();
        GuidelineScorer scorer = (GuidelineScorer) game.getScorer();
        assertEquals(10, scorer.getGoal());

        for (int i = 0; i < 3; i++) {
            for (int row = 36; row < 40; row++) {
                fillRow(board, row, 0);
            }
            game.rotate(1);
            game.left(5);
            game.hardDrop();
        }

        assertEquals(12, game.getLines());
        assertEquals(2, game.getLevel());
        assertEquals(20, scorer.getGoal());
    }
}
