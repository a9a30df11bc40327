package org.yourcompany.tetrisrules.engine.impl;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yourcompany.tetrisrules.config.Rule;
import org.yourcompany.tetrisrules.config.Ruleset;
import org.yourcompany.tetrisrules.engine.Gravity;
import org.yourcompany.tetrisrules.model.Game;
import org.yourcompany.tetrisrules.model.Move;
import org.yourcompany.tetrisrules.model.MoveDelta;
import org.yourcompany.tetrisrules.model.MoveKind;

/**
 * ロック遅延のないマラソン重力。
 * 一定時間ハードドロップされなければ、強制的に固定します。
 */
public class MarathonGravity extends Gravity {
    private static final Logger log = LoggerFactory.getLogger(MarathonGravity.class);
    private static final long SECOND = 1_000_000_000L;

    public static final String RULESET_NAME = "marathon";
    public static final String AUTO_LOCK = "auto_lock";

    private final Ruleset rules = new Ruleset(RULESET_NAME,
            new Rule(AUTO_LOCK, Integer.class, 30));

    private long lastHardDrop;

    public MarathonGravity(Game game) {
        super(game);
        this.lastHardDrop = clock.nanoTime();
    }

    @Override
    public Optional<Ruleset> rules() {
        return Optional.of(rules);
    }

    @Override
    public Optional<Move> calculate(MoveDelta delta) {
        long now = clock.nanoTime();
        if (delta != null && delta.kind() == MoveKind.HARD_DROP) {
            lastHardDrop = now;
        }

        if (now - lastHardDrop >= rules.getInt(AUTO_LOCK) * SECOND) {
            log.debug("No hard drop for {}s, locking {}", rules.getInt(AUTO_LOCK), game.getPiece());
            lastHardDrop = now;
            return Optional.of(Move.hardDrop(true));
        }

        return pendingDrop();
    }

    @Override
    protected void onResume(long pausedNanos) {
        lastHardDrop += pausedNanos;
    }

    public static final class Factory implements Gravity.Factory {
        @Override
        public Gravity create(Game game) {
            return new MarathonGravity(game);
        }
    }
}
