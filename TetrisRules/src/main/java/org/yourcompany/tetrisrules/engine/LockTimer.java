package org.yourcompany.tetrisrules.engine;

/**
 * ロック遅延などの経過時間を測るタイマー。
 */
public final class LockTimer {
    private final MonotonicClock clock;
    private long started;
    private boolean running;

    public LockTimer(MonotonicClock clock) {
        this.clock = clock;
    }

    /** タイマーを (再) 開始します。 */
    public void start() {
        started = clock.nanoTime();
        running = true;
    }

    public void stop() {
        started = 0;
        running = false;
    }

    /** 動作中なら開始時刻を nanos だけ遅らせます。 */
    public void shift(long nanos) {
        if (running) {
            started += nanos;
        }
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * 動作中で、開始から durationNanos 以上経過していれば true。
     */
    public boolean isDone(long durationNanos) {
        return running && clock.nanoTime() - started >= durationNanos;
    }
}
