package org.yourcompany.tetrisrules.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yourcompany.tetrisrules.config.BoardSize;
import org.yourcompany.tetrisrules.config.ClearInfo;
import org.yourcompany.tetrisrules.config.ConfigurationException;
import org.yourcompany.tetrisrules.config.Rules;
import org.yourcompany.tetrisrules.config.Ruleset;
import org.yourcompany.tetrisrules.config.Seed;
import org.yourcompany.tetrisrules.engine.EngineParts;
import org.yourcompany.tetrisrules.engine.Gravity;
import org.yourcompany.tetrisrules.engine.MonotonicClock;
import org.yourcompany.tetrisrules.engine.PartFactory;
import org.yourcompany.tetrisrules.engine.PieceQueue;
import org.yourcompany.tetrisrules.engine.RotationSystem;
import org.yourcompany.tetrisrules.engine.Scorer;
import org.yourcompany.tetrisrules.engine.impl.Presets;

/**
 * ゲームの進行を管理するクラス。
 * 盤面と操作中のピース、ホールド、4 つのエンジン部品 (重力・キュー・回転・得点) を持ち、
 * {@link #push(Move)} で受け取った操作を適用します。
 * <p>
 * 内部の盤面は見える部分の 2 倍の高さがあり、上半分は見えないバッファ領域です。
 * スレッドセーフではありません。
 */
public class Game {
    private static final Logger log = LoggerFactory.getLogger(Game.class);

    private final Ruleset rules;
    private final Board board;
    private final MonotonicClock clock;
    private EngineParts engineParts;

    private Seed seed;
    private Gravity gravity;
    private PieceQueue queue;
    private RotationSystem rotationSystem;
    private Scorer scorer;

    private Piece piece;
    private PlayingStatus status;
    private MoveDelta delta;
    private ClearInfo lastClearInfo;
    private PieceType hold;
    private boolean holdLocked;

    /**
     * {@link Presets#MODERN} の部品と既定のルールでゲームを作成します。
     */
    public Game() {
        this(builder());
    }

    private Game(Builder builder) {
        this.engineParts = builder.engineParts;
        this.clock = builder.clock;
        this.rules = Rules.createDefaults();

        // 部品による上書き < 呼び出し側の指定
        for (PartFactory part : engineParts.inOrder()) {
            rules.override(part.ruleOverrides());
        }
        if (builder.seed != null) {
            rules.set(Rules.SEED, builder.seed);
        }
        if (builder.boardSize != null) {
            rules.set(Rules.BOARD_SIZE, builder.boardSize);
        }
        // 部品のサブルールはまだ登録されていないため、ここでは基本ルールだけが反映される
        rules.override(builder.ruleOverrides);

        if (builder.board != null) {
            this.board = builder.board;
        } else {
            BoardSize size = rules.get(Rules.BOARD_SIZE, BoardSize.class);
            this.board = Board.zeros(size.internalHeight(), size.width());
        }

        int level = builder.level != null ? builder.level : rules.getInt(Rules.INITIAL_LEVEL);
        if (level < 0) {
            throw new ConfigurationException("level must not be negative, got " + level);
        }
        buildParts(builder.queue, builder.score, level);
        rules.overrideStrict(builder.ruleOverrides);

        start();
    }

    public static Builder builder() {
        return new Builder();
    }

    private void buildParts(List<PieceType> initialQueue, long score, int level) {
        Seed configured = rules.get(Rules.SEED, Seed.class);
        this.seed = configured != null ? configured : Seed.random();

        this.gravity = engineParts.gravity().create(this);
        this.queue = engineParts.queue().create(this, initialQueue);
        this.rotationSystem = engineParts.rotationSystem().create(this);
        this.scorer = engineParts.scorer().create(this, score, level);

        for (Ruleset partRules : partRulesets()) {
            rules.register(partRules);
        }
    }

    private List<Ruleset> partRulesets() {
        List<Ruleset> list = new ArrayList<>();
        gravity.rules().ifPresent(list::add);
        queue.rules().ifPresent(list::add);
        rotationSystem.rules().ifPresent(list::add);
        scorer.rules().ifPresent(list::add);
        return list;
    }

    private void start() {
        queue.setWindowSize(rules.getInt(Rules.QUEUE_SIZE));
        this.piece = rotationSystem.spawn(queue.pop());
        this.status = PlayingStatus.PLAYING;
        this.delta = null;
        this.lastClearInfo = null;
        this.hold = null;
        this.holdLocked = false;

        if (rotationSystem.overlaps(piece)) {
            lose("block out on spawn");
        }
    }

    // --- 操作 ---

    /**
     * 操作を 1 つ適用します。プレイ中でなければ何もしません。
     * プレイヤーの操作であれば、その後に重力を計算し、必要なら自動操作も適用します。
     */
    public void push(Move move) {
        if (status != PlayingStatus.PLAYING) {
            return;
        }

        MoveDelta result = dispatch(move);
        this.delta = result;

        queue.setWindowSize(rules.getInt(Rules.QUEUE_SIZE));
        queue.safeFill();

        ClearInfo info = scorer.judge(result);
        if (result.locked()) {
            this.lastClearInfo = info;
        }

        if (!move.auto()) {
            gravity.calculate(result).ifPresent(this::push);
        }
    }

    /**
     * 時間経過だけを反映します。一定間隔で呼び出してください。
     */
    public void tick() {
        if (status != PlayingStatus.PLAYING) {
            return;
        }
        gravity.calculate(null).ifPresent(this::push);
    }

    public void drag(int tiles) { push(Move.drag(tiles)); }
    public void left(int tiles) { push(Move.left(tiles)); }
    public void right(int tiles) { push(Move.right(tiles)); }
    public void rotate(int turns) { push(Move.rotate(turns)); }
    public void hardDrop() { push(Move.hardDrop()); }
    public void softDrop(int tiles) { push(Move.softDrop(tiles)); }
    public void swap() { push(Move.swap()); }

    /**
     * 一時停止と再開を切り替えます。ゲームオーバー後は何もしません。
     */
    public void pause() {
        if (status == PlayingStatus.PLAYING) {
            pause(true);
        } else if (status == PlayingStatus.IDLE) {
            pause(false);
        }
    }

    public void pause(boolean paused) {
        if (status == PlayingStatus.STOPPED) {
            return;
        }
        PlayingStatus next = paused ? PlayingStatus.IDLE : PlayingStatus.PLAYING;
        if (next != status) {
            log.debug("Game {}", paused ? "paused" : "resumed");
            status = next;
            if (paused) {
                gravity.pause();
            } else {
                gravity.resume();
            }
        }
    }

    /**
     * ゲームを最初からやり直します。ルールセットと部品の選択はそのまま引き継がれます。
     * {@link #setEngineParts(EngineParts)} で指定した部品はここで反映されます。
     */
    public void reset() {
        board.fill(0);

        Map<String, Object> previous = rules.values();
        for (Ruleset partRules : partRulesets()) {
            rules.unregister(partRules);
        }
        buildParts(null, 0, rules.getInt(Rules.INITIAL_LEVEL));

        Map<String, Object> carried = new LinkedHashMap<>();
        previous.forEach((name, value) -> {
            if (rules.contains(name)) carried.put(name, value);
        });
        rules.override(carried);

        start();
        log.debug("Game reset (seed={})", seed);
    }

    public void setEngineParts(EngineParts engineParts) {
        if (engineParts == null) {
            throw new IllegalArgumentException("engine parts must not be null");
        }
        this.engineParts = engineParts;
    }

    // --- 操作の適用 ---

    private MoveDelta dispatch(Move move) {
        Piece before = piece;
        List<Integer> clears = new ArrayList<>();

        switch (move.kind()) {
            case DRAG -> piece = slide(piece, 0, move.y());
            case SOFT_DROP -> piece = slide(piece, move.x(), 0);
            case ROTATE -> applyRotation(move.r());
            case SWAP -> {
                applySwap();
                return new MoveDelta(move, 0, 0, 0, clears, false);
            }
            case HARD_DROP -> {
                if (!move.auto() && !rules.getBoolean(Rules.CAN_HARD_DROP)) {
                    return new MoveDelta(move, 0, 0, 0, clears, false);
                }
                int distance = lockPiece(clears);
                return new MoveDelta(move, distance, 0, 0, clears, true);
            }
        }

        return new MoveDelta(move,
                piece.getX() - before.getX(),
                piece.getY() - before.getY(),
                Math.floorMod(piece.getR() - before.getR(), 4),
                clears, false);
    }

    /**
     * 1 マスずつ動かし、ぶつかったところで止めます。
     */
    private Piece slide(Piece from, int dx, int dy) {
        Piece current = from;
        int stepX = Integer.signum(dx);
        for (int i = 0; i < Math.abs(dx); i++) {
            Piece next = current.moved(stepX, 0);
            if (rotationSystem.overlaps(next)) break;
            current = next;
        }
        int stepY = Integer.signum(dy);
        for (int i = 0; i < Math.abs(dy); i++) {
            Piece next = current.moved(0, stepY);
            if (rotationSystem.overlaps(next)) break;
            current = next;
        }
        return current;
    }

    private void applyRotation(int turns) {
        if (Math.floorMod(turns, 4) == 2 && !rules.getBoolean(Rules.CAN_180_SPIN)) {
            return;
        }
        Piece rotated = rotationSystem.rotate(piece, turns);
        if (rotationSystem.overlaps(rotated)) {
            throw new IllegalStateException(rotationSystem.getClass().getSimpleName()
                    + " left " + rotated + " overlapping the board");
        }
        piece = rotated;
    }

    private void applySwap() {
        if (holdLocked) {
            return;
        }
        if (hold == null) {
            hold = queue.pop();
        }
        PieceType next = hold;
        hold = piece.getKind();
        piece = rotationSystem.spawn(next);
        holdLocked = true;
        gravity.pieceSwapped();

        if (rotationSystem.overlaps(piece)) {
            lose("block out on hold");
        }
    }

    /**
     * ピースを一番下まで落として固定し、揃った行を消して次のピースを出します。
     * @return 落下した段数
     */
    private int lockPiece(List<Integer> clears) {
        int distance = 0;
        while (!rotationSystem.overlaps(piece.moved(1, 0))) {
            piece = piece.moved(1, 0);
            distance++;
        }

        int hiddenRows = board.getHeight() - getHeight();
        boolean lockedOut = true;
        for (int[] cell : piece.cells()) {
            board.set(cell[0], cell[1], piece.getKind().getCode());
            if (cell[0] >= hiddenRows) {
                lockedOut = false;
            }
        }
        log.debug("Locked {} after dropping {} rows", piece, distance);
        if (lockedOut) {
            lose("lock out");
        }

        for (int row = 0; row < board.getHeight(); row++) {
            if (board.isRowFull(row)) {
                board.clearRow(row);
                clears.add(row);
            }
        }
        if (!clears.isEmpty()) {
            log.debug("Cleared rows {}", clears);
        }

        piece = rotationSystem.spawn(queue.pop());
        if (rotationSystem.overlaps(piece)) {
            lose("block out");
        }
        holdLocked = false;
        return distance;
    }

    private void lose(String reason) {
        if (status != PlayingStatus.STOPPED) {
            log.info("Game over ({}): score={}, level={}, lines={}", reason, getScore(), getLevel(), getLines());
        }
        status = PlayingStatus.STOPPED;
    }

    // --- 状態の参照 ---

    public Board getPlayfield() {
        return getPlayfield(0);
    }

    /**
     * ゴーストと操作中のピースを書き込んだ、見える部分の盤面のコピーを返します。
     * bufferLines を指定すると、見えないバッファ領域もその行数だけ含めます。
     */
    public Board getPlayfield(int bufferLines) {
        int visible = getHeight() + bufferLines;
        if (bufferLines < 0 || visible > board.getHeight()) {
            throw new BoardIndexException("cannot show " + bufferLines + " buffer lines of a "
                    + board.getHeight() + " row board");
        }
        Board field = board.copy();
        int ghostX = piece.getX();
        while (!rotationSystem.overlaps(piece.getMinos(), ghostX + 1, piece.getY())) {
            ghostX++;
        }
        for (int[] mino : piece.getMinos()) {
            field.set(ghostX + mino[0], piece.getY() + mino[1], MinoType.GHOST.getCode());
        }
        for (int[] cell : piece.cells()) {
            field.set(cell[0], cell[1], piece.getKind().getCode());
        }
        return field.tail(visible);
    }

    public long getScore() { return scorer.getScore(); }
    public int getLevel() { return scorer.getLevel(); }
    public int getLines() { return scorer.getLines(); }

    /** 見える部分の高さ (内部の盤面の半分)。 */
    public int getHeight() { return board.getHeight() / 2; }
    public int getWidth() { return board.getWidth(); }

    public PlayingStatus getStatus() { return status; }
    public boolean isPlaying() { return status == PlayingStatus.PLAYING; }
    public boolean isPaused() { return status == PlayingStatus.IDLE; }
    public boolean isLost() { return status == PlayingStatus.STOPPED; }

    public PieceQueue getQueue() { return queue; }
    public PieceType getHold() { return hold; }
    public boolean isHoldLocked() { return holdLocked; }
    public Piece getPiece() { return piece; }

    /** ゲームが持つ盤面そのもの (コピーではない)。 */
    public Board getBoard() { return board; }

    /** 直前に適用した操作の結果。まだ操作がなければ null。 */
    public MoveDelta getDelta() { return delta; }

    /** 直前にピースを固定したときの判定結果。まだ固定していなければ null。 */
    public ClearInfo getLastClearInfo() { return lastClearInfo; }

    public Seed getSeed() { return seed; }
    public Ruleset getRules() { return rules; }
    public EngineParts getEngineParts() { return engineParts; }
    public Gravity getGravity() { return gravity; }
    public RotationSystem getRotationSystem() { return rotationSystem; }
    public Scorer getScorer() { return scorer; }
    public MonotonicClock getClock() { return clock; }

    @Override
    public String toString() {
        return "Game[" + status + ", score=" + getScore() + ", level=" + getLevel()
                + ", piece=" + piece + ", hold=" + hold + ", queue=" + queue.asList() + "]";
    }

    /**
     * {@link Game} の生成に使うビルダー。指定しなかった項目はルールセットの既定値になります。
     */
    public static final class Builder {
        private EngineParts engineParts = Presets.MODERN;
        private final Map<String, Object> ruleOverrides = new LinkedHashMap<>();
        private Board board;
        private List<PieceType> queue;
        private Integer level;
        private long score;
        private Seed seed;
        private BoardSize boardSize;
        private MonotonicClock clock = MonotonicClock.SYSTEM;

        private Builder() {
        }

        public Builder engineParts(EngineParts engineParts) {
            this.engineParts = engineParts;
            return this;
        }

        public Builder rule(String name, Object value) {
            ruleOverrides.put(name, value);
            return this;
        }

        public Builder rules(Map<String, ?> overrides) {
            ruleOverrides.putAll(overrides);
            return this;
        }

        public Builder board(Board board) {
            this.board = board;
            return this;
        }

        public Builder queue(PieceType... pieces) {
            this.queue = Arrays.asList(pieces);
            return this;
        }

        public Builder queue(List<PieceType> pieces) {
            this.queue = pieces;
            return this;
        }

        public Builder level(int level) {
            this.level = level;
            return this;
        }

        public Builder score(long score) {
            this.score = score;
            return this;
        }

        public Builder seed(Seed seed) {
            this.seed = seed;
            return this;
        }

        public Builder boardSize(BoardSize boardSize) {
            this.boardSize = boardSize;
            return this;
        }

        public Builder clock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Game build() {
            if (engineParts == null) {
                throw new IllegalArgumentException("engine parts must not be null");
            }
            if (clock == null) {
                throw new IllegalArgumentException("clock must not be null");
            }
            return new Game(this);
        }
    }
}
