package org.yourcompany.tetrisrules.model;

public enum MoveKind {
    DRAG,
    ROTATE,
    SOFT_DROP,
    HARD_DROP,
    SWAP
}
