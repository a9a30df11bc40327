package org.yourcompany.tetrisrules.codec;

import java.util.ArrayList;
import java.util.List;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.yourcompany.tetrisrules.config.ConfigurationException;
import org.yourcompany.tetrisrules.model.Game;
import org.yourcompany.tetrisrules.model.Piece;
import org.yourcompany.tetrisrules.model.PieceType;

/**
 * ゲームの状態を JSON にするための読み取り専用のスナップショット。
 * playfield はゴーストと操作中のピースを含む、見える部分の盤面です。
 */
public class GameSnapshot {
    private static final Gson GSON = new GsonBuilder().serializeNulls().create();

    private String status;
    private long score;
    private int level;
    private int lines;
    private String hold;
    private List<String> queue;
    private PieceState piece;
    private int[][] playfield;

    /** 操作中のピース。 */
    public static class PieceState {
        private String kind;
        private int x;
        private int y;
        private int r;

        private PieceState() {
        }

        public String getKind() { return kind; }
        public int getX() { return x; }
        public int getY() { return y; }
        public int getR() { return r; }
    }

    private GameSnapshot() {
    }

    public static GameSnapshot of(Game game) {
        GameSnapshot snapshot = new GameSnapshot();
        snapshot.status = game.getStatus().name();
        snapshot.score = game.getScore();
        snapshot.level = game.getLevel();
        snapshot.lines = game.getLines();
        snapshot.hold = game.getHold() != null ? game.getHold().name() : null;
        snapshot.queue = new ArrayList<>();
        for (PieceType kind : game.getQueue()) {
            snapshot.queue.add(kind.name());
        }
        Piece current = game.getPiece();
        snapshot.piece = new PieceState();
        snapshot.piece.kind = current.getKind().name();
        snapshot.piece.x = current.getX();
        snapshot.piece.y = current.getY();
        snapshot.piece.r = current.getR();
        snapshot.playfield = game.getPlayfield().toArray();
        return snapshot;
    }

    public String toJson() {
        return GSON.toJson(this);
    }

    public static GameSnapshot fromJson(String json) {
        try {
            GameSnapshot snapshot = GSON.fromJson(json, GameSnapshot.class);
            if (snapshot == null) {
                throw new ConfigurationException("snapshot JSON is empty");
            }
            return snapshot;
        } catch (JsonParseException e) {
            throw new ConfigurationException("snapshot JSON is malformed", e);
        }
    }

    public String getStatus() { return status; }
    public long getScore() { return score; }
    public int getLevel() { return level; }
    public int getLines() { return lines; }
    public String getHold() { return hold; }
    public List<String> getQueue() { return queue; }
    public PieceState getPiece() { return piece; }
    public int[][] getPlayfield() { return playfield; }
}
