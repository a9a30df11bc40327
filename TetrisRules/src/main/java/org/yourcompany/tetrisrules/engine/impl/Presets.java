package org.yourcompany.tetrisrules.engine.impl;

import org.yourcompany.tetrisrules.engine.EngineParts;

/**
 * よく使う部品の組み合わせ。
 */
public final class Presets {

    /** 現行ガイドライン準拠 (Infinity 重力, 7-bag, SRS, ガイドライン得点)。 */
    public static final EngineParts MODERN = new EngineParts(
            new InfinityGravity.Factory(),
            new SevenBagQueue.Factory(),
            new SrsRotationSystem.Factory(),
            new GuidelineScorer.Factory());

    /** MODERN の回転を TETR.IO 式 (180 度回転の補正付き) に替えたもの。 */
    public static final EngineParts TETRIO = MODERN.withRotationSystem(new TetrioRotationSystem.Factory());

    /** NES 版 (マラソン重力, 完全ランダム, 壁蹴りなし, NES 得点)。 */
    public static final EngineParts NES = new EngineParts(
            new MarathonGravity.Factory(),
            new ChaoticQueue.Factory(),
            new ClassicRotationSystem.Factory(),
            new NesScorer.Factory());

    private Presets() {
    }
}
