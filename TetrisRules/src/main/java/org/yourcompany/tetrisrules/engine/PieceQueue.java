package org.yourcompany.tetrisrules.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yourcompany.tetrisrules.config.Seed;
import org.yourcompany.tetrisrules.model.Game;
import org.yourcompany.tetrisrules.model.PieceType;

/**
 * 次に出てくるピースの列 (NEXT)。
 * 内部には多めに引いたピースを持ち、外から見えるのは先頭の size 個だけです。
 */
public abstract class PieceQueue implements EnginePart, Iterable<PieceType> {
    private static final Logger log = LoggerFactory.getLogger(PieceQueue.class);

    protected final List<PieceType> pieces;
    protected final Random random;
    private final Seed seed;
    private int size = 4;

    protected PieceQueue(List<PieceType> initial, Seed seed) {
        this.pieces = new ArrayList<>(initial != null ? initial : List.of());
        this.seed = seed;
        this.random = new Random(seed.toLong());
    }

    /**
     * 内部バッファに 1 回分のピースを追加します。呼ばれるたびに少なくとも 1 個増やす必要があります。
     */
    protected abstract void fill();

    /**
     * バッファが表示数より多くなるまで {@link #fill()} を呼びます。
     */
    public void safeFill() {
        while (pieces.size() <= size) {
            int before = pieces.size();
            fill();
            if (pieces.size() <= before) {
                throw new IllegalStateException(getClass().getSimpleName() + ".fill() did not add any pieces");
            }
            log.trace("Queue refilled: {} -> {} pieces", before, pieces.size());
        }
    }

    /**
     * 先頭のピースを取り出します。
     */
    public PieceType pop() {
        safeFill();
        return pieces.remove(0);
    }

    public PieceType get(int index) {
        if (index < 0 || index >= size()) {
            throw new IndexOutOfBoundsException("queue index " + index + " out of bounds for size " + size());
        }
        return pieces.get(index);
    }

    /** 見えている個数。 */
    public int size() {
        return Math.min(size, pieces.size());
    }

    public int getWindowSize() {
        return size;
    }

    public void setWindowSize(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("queue size must not be negative, got " + size);
        }
        this.size = size;
    }

    public Seed getSeed() {
        return seed;
    }

    public List<PieceType> asList() {
        return Collections.unmodifiableList(new ArrayList<>(pieces.subList(0, size())));
    }

    @Override
    public Iterator<PieceType> iterator() {
        return asList().iterator();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + asList();
    }

    public interface Factory extends PartFactory {
        PieceQueue create(Game game, List<PieceType> initial);
    }
}
