package org.yourcompany.tetrisrules.codec;

import java.io.ByteArrayOutputStream;
import java.util.Base64;

import org.yourcompany.tetrisrules.config.ConfigurationException;
import org.yourcompany.tetrisrules.engine.impl.SrsRotationSystem;
import org.yourcompany.tetrisrules.model.Board;
import org.yourcompany.tetrisrules.model.Piece;
import org.yourcompany.tetrisrules.model.PieceType;

/**
 * 盤面と (任意の) ピースをコンパクトなバイト列に変換します。
 * <pre>
 * [flags][height][width][kind][x][y][r][盤面...]
 * </pre>
 * flags の bit0 はピースの有無で、ピースがなければ kind〜r は 0 になります。
 * 盤面は最初の空でない行から下端までを、1 バイトに 2 マス (上位 4bit が先) ずつ詰めます。
 */
public final class BoardCodec {
    private static final int HEADER_SIZE = 7;
    private static final int HAS_PIECE = 1;
    private static final int MAX_DIMENSION = 255;

    private BoardCodec() {
    }

    public static byte[] encode(Board board) {
        return encode(board, null);
    }

    public static byte[] encode(Board board, Piece piece) {
        int height = board.getHeight();
        int width = board.getWidth();
        if (height < 1 || height > MAX_DIMENSION || width < 1 || width > MAX_DIMENSION) {
            throw new ConfigurationException("board of " + height + "x" + width + " cannot be encoded");
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(piece != null ? HAS_PIECE : 0);
        out.write(height);
        out.write(width);
        if (piece != null) {
            out.write(piece.getKind().getCode());
            out.write(signedByte(piece.getX(), "x"));
            out.write(signedByte(piece.getY(), "y"));
            out.write(piece.getR());
        } else {
            out.write(new byte[4], 0, 4);
        }

        int start = 0;
        while (start < height && board.isRowEmpty(start)) {
            start++;
        }
        // マス数が奇数なら空行を 1 行含めて、詰め物のニブルを避ける
        if (((height - start) * width) % 2 != 0 && start > 0) {
            start--;
        }

        int high = -1;
        for (int row = start; row < height; row++) {
            for (int col = 0; col < width; col++) {
                int value = board.get(row, col);
                if (high < 0) {
                    high = value;
                } else {
                    out.write((high << 4) | value);
                    high = -1;
                }
            }
        }
        if (high >= 0) {
            out.write(high << 4);
        }
        return out.toByteArray();
    }

    private static int signedByte(int value, String name) {
        if (value < Byte.MIN_VALUE || value > Byte.MAX_VALUE) {
            throw new ConfigurationException("piece " + name + " " + value + " does not fit in a byte");
        }
        return value & 0xFF;
    }

    public static EncodedState decode(byte[] encoded) {
        if (encoded.length < HEADER_SIZE) {
            throw new ConfigurationException("encoded board is too short: " + encoded.length + " bytes");
        }
        int flags = encoded[0] & 0xFF;
        int height = encoded[1] & 0xFF;
        int width = encoded[2] & 0xFF;
        if (height == 0 || width == 0) {
            throw new ConfigurationException("encoded board has an empty dimension: " + height + "x" + width);
        }

        int bodyLength = encoded.length - HEADER_SIZE;
        int rows = Math.min(height, 2 * bodyLength / width);
        if (2 * bodyLength > height * width + 1) {
            throw new ConfigurationException("encoded board has more cells than " + height + "x" + width);
        }

        Board board = Board.zeros(height, width);
        int first = height - rows;
        for (int i = 0; i < rows * width; i++) {
            int packed = encoded[HEADER_SIZE + i / 2] & 0xFF;
            int value = i % 2 == 0 ? packed >> 4 : packed & 0x0F;
            board.set(first + i / width, i % width, value);
        }

        Piece piece = null;
        if ((flags & HAS_PIECE) != 0) {
            PieceType kind;
            try {
                kind = PieceType.fromCode(encoded[3] & 0xFF);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("encoded piece has an invalid kind", e);
            }
            int r = encoded[6] & 0xFF;
            if (r > 3) {
                throw new ConfigurationException("encoded piece has an invalid rotation: " + r);
            }
            piece = new Piece(kind, encoded[4], encoded[5], r, SrsRotationSystem.shape(kind, r));
        }
        return new EncodedState(board, piece);
    }

    public static String encodeString(Board board, Piece piece) {
        return Base64.getEncoder().encodeToString(encode(board, piece));
    }

    public static EncodedState decodeString(String encoded) {
        try {
            return decode(Base64.getDecoder().decode(encoded));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("encoded board is not valid Base64", e);
        }
    }
}
