package org.yourcompany.tetrisrules.engine.impl;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yourcompany.tetrisrules.config.Rule;
import org.yourcompany.tetrisrules.config.Ruleset;
import org.yourcompany.tetrisrules.engine.Gravity;
import org.yourcompany.tetrisrules.engine.LockTimer;
import org.yourcompany.tetrisrules.model.Game;
import org.yourcompany.tetrisrules.model.Move;
import org.yourcompany.tetrisrules.model.MoveDelta;
import org.yourcompany.tetrisrules.model.MoveKind;
import org.yourcompany.tetrisrules.model.Piece;

/**
 * マラソンの落下速度に Infinity 方式のロック遅延を組み合わせた重力。
 * 接地するとロックタイマーが始まり、操作のたびに延長されますが、延長回数には上限があります。
 */
public class InfinityGravity extends Gravity {
    private static final Logger log = LoggerFactory.getLogger(InfinityGravity.class);

    public static final String RULESET_NAME = "lock";
    public static final String DELAY = "delay";
    public static final String RESETS = "resets";

    private final Ruleset rules = new Ruleset(RULESET_NAME,
            new Rule(DELAY, Integer.class, 500),
            new Rule(RESETS, Integer.class, 15));

    private final LockTimer lockTimer;
    private int lockResets;

    public InfinityGravity(Game game) {
        super(game);
        this.lockTimer = new LockTimer(clock);
    }

    @Override
    public Optional<Ruleset> rules() {
        return Optional.of(rules);
    }

    @Override
    public Optional<Move> calculate(MoveDelta delta) {
        long lockDelay = rules.getInt(DELAY) * 1_000_000L;
        int maxResets = rules.getInt(RESETS);

        if (delta != null) {
            if (delta.kind() == MoveKind.HARD_DROP) {
                lockTimer.stop();
                lockResets = 0;
            } else if (lockTimer.isRunning() && delta.moved()) {
                lockTimer.start();
                lockResets++;
            }
        }

        Piece piece = game.getPiece();
        if (!lockTimer.isRunning()
                && game.getRotationSystem().overlaps(piece.getMinos(), piece.getX() + 1, piece.getY())) {
            lockTimer.start();
        }

        if (lockTimer.isDone(lockDelay) || (lockTimer.isRunning() && lockResets >= maxResets)) {
            log.debug("Lock delay expired after {} resets, locking {}", lockResets, piece);
            lockTimer.stop();
            lockResets = 0;
            return Optional.of(Move.hardDrop(true));
        }

        return pendingDrop();
    }

    @Override
    protected void onResume(long pausedNanos) {
        lockTimer.shift(pausedNanos);
    }

    /**
     * ホールドで出てきたピースは新しいピースとして扱い、ロック遅延を最初からやり直します。
     */
    @Override
    public void pieceSwapped() {
        super.pieceSwapped();
        lockTimer.stop();
        lockResets = 0;
    }

    public int getLockResets() {
        return lockResets;
    }

    public boolean isLockTimerRunning() {
        return lockTimer.isRunning();
    }

    public static final class Factory implements Gravity.Factory {
        @Override
        public Gravity create(Game game) {
            return new InfinityGravity(game);
        }
    }
}
