package org.yourcompany.tetrisrules.codec;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.yourcompany.tetrisrules.config.ConfigurationException;
import org.yourcompany.tetrisrules.config.Seed;
import org.yourcompany.tetrisrules.engine.FakeClock;
import org.yourcompany.tetrisrules.engine.impl.SrsRotationSystem;
import org.yourcompany.tetrisrules.model.Board;
import org.yourcompany.tetrisrules.model.Game;
import org.yourcompany.tetrisrules.model.Piece;
import org.yourcompany.tetrisrules.model.PieceType;

class BoardCodecTest {

    @Test
    void layoutOfASmallBoard() {
        Board board = Board.of(new int[][] {{0, 0}, {1, 2}});
        Piece piece = new Piece(PieceType.T, -1, 3, 1, SrsRotationSystem.shape(PieceType.T, 1));

        byte[] encoded = BoardCodec.encode(board, piece);

        assertArrayEquals(new byte[] {1, 2, 2, 6, (byte) 0xFF, 3, 1, 0x12}, encoded);
    }

    @Test
    void missingPieceIsZeroed() {
        byte[] encoded = BoardCodec.encode(Board.zeros(4, 4));
        assertArrayEquals(new byte[] {0, 4, 4, 0, 0, 0, 0}, encoded);

        EncodedState decoded = BoardCodec.decode(encoded);
        assertFalse(decoded.hasPiece());
        assertEquals(Board.zeros(4, 4), decoded.board());
    }

    @Test
    void gameStateRoundTrips() {
        Game game = Game.builder().clock(new FakeClock()).seed(Seed.of("codec")).build();
        for (int i = 0; i < 5; i++) {
            game.left(i);
            game.rotate(i);
            game.hardDrop();
        }
        game.right(2);

        EncodedState decoded = BoardCodec.decode(BoardCodec.encode(game.getBoard(), game.getPiece()));

        assertEquals(game.getBoard(), decoded.board());
        assertEquals(game.getPiece(), decoded.piece());
    }

    @Test
    void oddCellCountsRoundTrip() {
        Board board = Board.zeros(5, 3);
        board.set(4, 0, 1);
        board.set(4, 2, 15);
        assertEquals(board, BoardCodec.decode(BoardCodec.encode(board)).board());

        Board single = Board.of(new int[][] {{5}});
        assertEquals(single, BoardCodec.decode(BoardCodec.encode(single)).board());

        Board column = Board.of(new int[][] {{0}, {0}, {3}});
        assertEquals(column, BoardCodec.decode(BoardCodec.encode(column)).board());
    }

    @Test
    void stringFormIsBase64() {
        Board board = Board.zeros(40, 10);
        board.set(39, 0, 7);
        String encoded = BoardCodec.encodeString(board, null);

        assertTrue(encoded.matches("[A-Za-z0-9+/=]+"));
        assertEquals(board, BoardCodec.decodeString(encoded).board());
    }

    @Test
    void malformedInputIsRejected() {
        assertThrows(ConfigurationException.class, () -> BoardCodec.decode(new byte[] {0, 1}));
        assertThrows(ConfigurationException.class, () -> BoardCodec.decode(new byte[] {0, 0, 4, 0, 0, 0, 0}));
        assertThrows(ConfigurationException.class,
                () -> BoardCodec.decode(new byte[] {0, 1, 2, 0, 0, 0, 0, 0x11, 0x11}));
        assertThrows(ConfigurationException.class,
                () -> BoardCodec.decode(new byte[] {1, 1, 2, 9, 0, 0, 0, 0x11}));
        assertThrows(ConfigurationException.class, () -> BoardCodec.decodeString("not base64!"));
        assertThrows(ConfigurationException.class, () -> BoardCodec.encode(Board.zeros(256, 1)));
    }
}
