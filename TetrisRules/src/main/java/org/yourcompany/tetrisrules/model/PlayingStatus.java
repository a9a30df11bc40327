package org.yourcompany.tetrisrules.model;

/**
 * ゲームの進行状態。
 */
public enum PlayingStatus {
    /** 通常どおり操作を受け付ける。 */
    PLAYING,
    /** 一時停止中。 */
    IDLE,
    /** ゲームオーバー (ロックアウト / ブロックアウト)。{@code reset()} まで戻らない。 */
    STOPPED
}
