package org.yourcompany.tetrisrules.engine;

/**
 * 単調増加するナノ秒単位の時計。テストでは任意の時刻を返す実装に差し替えます。
 */
@FunctionalInterface
public interface MonotonicClock {

    MonotonicClock SYSTEM = System::nanoTime;

    long nanoTime();
}
