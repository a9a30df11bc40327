package org.yourcompany.tetrisrules.config;

/**
 * ルール設定や盤面の形状など、ゲーム構築時の設定ミスを表す例外。
 * 値を黙って補正することはせず、構築の時点で即座に失敗させます。
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
