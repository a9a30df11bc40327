package org.yourcompany.tetrisrules.config;

/**
 * ゲーム本体が定義する組み込みルールの名前。
 */
public final class Rules {

    public static final String BOARD_SIZE = "board_size";
    public static final String INITIAL_LEVEL = "initial_level";
    public static final String QUEUE_SIZE = "queue_size";
    public static final String SEED = "seed";
    public static final String CAN_180_SPIN = "can_180_spin";
    public static final String CAN_HARD_DROP = "can_hard_drop";

    private Rules() {
    }

    /**
     * 既定値の入った基本ルールセットを作成します。
     */
    public static Ruleset createDefaults() {
        return new Ruleset(
            new Rule(BOARD_SIZE, BoardSize.class, BoardSize.DEFAULT),
            new Rule(INITIAL_LEVEL, Integer.class, 1),
            new Rule(QUEUE_SIZE, Integer.class, 4),
            Rule.nullable(SEED, Seed.class, null),
            new Rule(CAN_180_SPIN, Boolean.class, true),
            new Rule(CAN_HARD_DROP, Boolean.class, true)
        );
    }
}
