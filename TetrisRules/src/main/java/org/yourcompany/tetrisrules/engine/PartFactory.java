package org.yourcompany.tetrisrules.engine;

import java.util.Map;

/**
 * エンジン部品を生成するファクトリの共通インターフェース。
 */
public interface PartFactory {

    /**
     * この部品を使うときに基本ルールへ適用する上書き値。
     * 呼び出し側の上書きはこれより優先されます。
     */
    default Map<String, Object> ruleOverrides() {
        return Map.of();
    }
}
