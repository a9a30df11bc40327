package org.yourcompany.tetrisrules.config;

public enum SpinType {
    NONE,
    T_SPIN,
    T_SPIN_MINI
}
