package org.yourcompany.tetrisrules.engine.impl;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.yourcompany.tetrisrules.config.Seed;
import org.yourcompany.tetrisrules.engine.PieceQueue;
import org.yourcompany.tetrisrules.model.PieceType;

class SevenBagQueueTest {

    private static List<PieceType> popMany(PieceQueue queue, int count) {
        List<PieceType> popped = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            popped.add(queue.pop());
        }
        return popped;
    }

    @Test
    void everyBagOfSevenHoldsEachKindOnce() {
        List<PieceType> popped = popMany(new SevenBagQueue(List.of(), Seed.of("fair")), 70);
        for (int bag = 0; bag < 10; bag++) {
            Set<PieceType> kinds = EnumSet.copyOf(popped.subList(bag * 7, bag * 7 + 7));
            assertEquals(EnumSet.allOf(PieceType.class), kinds, "bag " + bag);
        }
    }

    @Test
    void sameSeedGivesSameSequence() {
        List<PieceType> first = popMany(new SevenBagQueue(List.of(), Seed.of("abc")), 14);
        List<PieceType> second = popMany(new SevenBagQueue(List.of(), Seed.of("abc")), 14);
        assertEquals(first, second);
    }

    @Test
    void differentSeedsUsuallyDiffer() {
        List<PieceType> first = popMany(new SevenBagQueue(List.of(), Seed.of("abc")), 21);
        List<PieceType> second = popMany(new SevenBagQueue(List.of(), Seed.of("xyz")), 21);
        assertNotEquals(first, second);
    }

    @Test
    void initialPiecesComeFirst() {
        PieceQueue queue = new SevenBagQueue(List.of(PieceType.O, PieceType.O), Seed.of("abc"));
        assertEquals(PieceType.O, queue.pop());
        assertEquals(PieceType.O, queue.pop());
        assertNotNull(queue.pop());
    }

    @Test
    void onlyTheWindowIsVisible() {
        PieceQueue queue = new SevenBagQueue(List.of(), Seed.of("abc"));
        queue.pop();
        assertEquals(4, queue.size());
        assertEquals(4, queue.asList().size());
        assertThrows(IndexOutOfBoundsException.class, () -> queue.get(4));

        queue.setWindowSize(6);
        assertEquals(6, queue.getWindowSize());
        queue.safeFill();
        assertEquals(6, queue.asList().size());
        assertEquals(queue.get(0), queue.pop());
    }

    @Test
    void chaoticQueueAlwaysGrows() {
        PieceQueue queue = new ChaoticQueue(List.of(PieceType.values()), Seed.of("abc"));
        queue.setWindowSize(10);
        queue.safeFill();
        assertEquals(10, queue.size());
        assertEquals(24, popMany(queue, 24).size());
    }

    @Test
    void fillThatDoesNotGrowIsAnError() {
        PieceQueue broken = new PieceQueue(List.of(), Seed.of("abc")) {
            @Override
            protected void fill() {
            }
        };
        assertThrows(IllegalStateException.class, broken::pop);
    }
}
