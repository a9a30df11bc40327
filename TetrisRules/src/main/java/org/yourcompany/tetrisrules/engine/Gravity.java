package org.yourcompany.tetrisrules.engine;

import java.util.Optional;

import org.yourcompany.tetrisrules.model.Game;
import org.yourcompany.tetrisrules.model.Move;
import org.yourcompany.tetrisrules.model.MoveDelta;

/**
 * 時間経過による落下と固定を決める部品。
 * {@link #calculate(MoveDelta)} が返した操作はゲームが自動操作として適用します。
 */
public abstract class Gravity implements EnginePart {
    private static final long SECOND = 1_000_000_000L;
    private static final long MIN_DROP_DELAY = 100_000L; // 100 µs

    protected final Game game;
    protected final MonotonicClock clock;
    protected long lastDrop;
    private long pausedAt;
    private boolean paused;

    protected Gravity(Game game) {
        this.game = game;
        this.clock = game.getClock();
        this.lastDrop = clock.nanoTime();
    }

    /**
     * 直前の操作の結果 (tick の場合は null) から、ゲームが次に適用すべき自動操作を求めます。
     */
    public abstract Optional<Move> calculate(MoveDelta delta);

    /**
     * 一時停止した時刻を記録します。
     */
    public void pause() {
        if (!paused) {
            pausedAt = clock.nanoTime();
            paused = true;
        }
    }

    /**
     * 再開時に、一時停止していた時間だけ各タイマーを後ろにずらします。
     */
    public void resume() {
        if (!paused) {
            return;
        }
        long pausedNanos = clock.nanoTime() - pausedAt;
        paused = false;
        lastDrop += pausedNanos;
        onResume(pausedNanos);
    }

    protected void onResume(long pausedNanos) {
    }

    /**
     * ホールドで新しいピースが出たときに呼ばれます。落下の計測をやり直します。
     */
    public void pieceSwapped() {
        lastDrop = clock.nanoTime();
    }

    /**
     * レベルごとの 1 段あたりの落下間隔 (ナノ秒)。
     */
    public static long dropDelay(int level) {
        double base = Math.max(0.0, 0.8 - (level - 1) * 0.007);
        double seconds = Math.pow(base, level - 1);
        return Math.max(MIN_DROP_DELAY, (long) (seconds * SECOND));
    }

    /**
     * 前回の落下から落下間隔以上経っていれば、経過分の自動ソフトドロップを返します。
     */
    protected Optional<Move> pendingDrop() {
        long now = clock.nanoTime();
        long delay = dropDelay(game.getLevel());
        long elapsed = now - lastDrop;
        if (elapsed < delay) {
            return Optional.empty();
        }
        lastDrop = now;
        int cells = (int) Math.min(elapsed / delay, game.getBoard().getHeight());
        return Optional.of(Move.softDrop(cells, true));
    }

    public interface Factory extends PartFactory {
        Gravity create(Game game);
    }
}
