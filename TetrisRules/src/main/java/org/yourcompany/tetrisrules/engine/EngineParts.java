package org.yourcompany.tetrisrules.engine;

import java.util.List;
import java.util.Objects;

/**
 * ゲームを構成する 4 つの部品のファクトリの組。
 */
public record EngineParts(
        Gravity.Factory gravity,
        PieceQueue.Factory queue,
        RotationSystem.Factory rotationSystem,
        Scorer.Factory scorer) {

    public EngineParts {
        Objects.requireNonNull(gravity, "gravity");
        Objects.requireNonNull(queue, "queue");
        Objects.requireNonNull(rotationSystem, "rotationSystem");
        Objects.requireNonNull(scorer, "scorer");
    }

    public EngineParts withGravity(Gravity.Factory gravity) {
        return new EngineParts(gravity, queue, rotationSystem, scorer);
    }

    public EngineParts withQueue(PieceQueue.Factory queue) {
        return new EngineParts(gravity, queue, rotationSystem, scorer);
    }

    public EngineParts withRotationSystem(RotationSystem.Factory rotationSystem) {
        return new EngineParts(gravity, queue, rotationSystem, scorer);
    }

    public EngineParts withScorer(Scorer.Factory scorer) {
        return new EngineParts(gravity, queue, rotationSystem, scorer);
    }

    /**
     * ルール上書きを適用する順番 (gravity, queue, rotation system, scorer)。
     */
    public List<PartFactory> inOrder() {
        return List.of(gravity, queue, rotationSystem, scorer);
    }
}
