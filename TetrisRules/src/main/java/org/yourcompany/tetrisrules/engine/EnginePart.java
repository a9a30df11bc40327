package org.yourcompany.tetrisrules.engine;

import java.util.Optional;

import org.yourcompany.tetrisrules.config.Ruleset;

/**
 * ゲームに差し込むエンジン部品の共通インターフェース。
 */
public interface EnginePart {

    /**
     * この部品が持つ名前付きサブルールセット。
     * ゲームはこれを「名前_」の接頭辞付きで自身のルールセットに登録します。
     */
    default Optional<Ruleset> rules() {
        return Optional.empty();
    }
}
