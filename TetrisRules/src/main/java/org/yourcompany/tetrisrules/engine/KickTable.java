package org.yourcompany.tetrisrules.engine;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 回転状態の遷移 (from, to) ごとに、試す位置補正 (壁蹴り) を順番どおりに保持する表。
 * 不変で、{@link #with(KickTable)} で別の表を重ねた新しい表を作れます。
 */
public final class KickTable {

    /** 行方向 dx、列方向 dy の補正量。 */
    public record Offset(int dx, int dy) { }

    public static final KickTable EMPTY = new KickTable(Map.of());

    private final Map<Integer, List<Offset>> kicks;

    private KickTable(Map<Integer, List<Offset>> kicks) {
        this.kicks = kicks;
    }

    private static int key(int from, int to) {
        return from * 4 + to;
    }

    /**
     * 遷移 from → to で試す補正の一覧。登録がなければ空のリスト。
     */
    public List<Offset> get(int from, int to) {
        return kicks.getOrDefault(key(from, to), List.of());
    }

    public boolean isEmpty() {
        return kicks.isEmpty();
    }

    /**
     * overrides の遷移を上書き・追加した新しい表を返します。
     */
    public KickTable with(KickTable overrides) {
        Map<Integer, List<Offset>> merged = new HashMap<>(kicks);
        merged.putAll(overrides.kicks);
        return new KickTable(Collections.unmodifiableMap(merged));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<Integer, List<Offset>> kicks = new HashMap<>();

        private Builder() {
        }

        /**
         * offsets は {dx, dy} の組を並べたもの。
         */
        public Builder add(int from, int to, int[]... offsets) {
            Offset[] list = new Offset[offsets.length];
            for (int i = 0; i < offsets.length; i++) {
                list[i] = new Offset(offsets[i][0], offsets[i][1]);
            }
            kicks.put(key(from, to), List.of(list));
            return this;
        }

        public KickTable build() {
            return new KickTable(Collections.unmodifiableMap(new HashMap<>(kicks)));
        }
    }
}
