package org.yourcompany.tetrisrules.config;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class SeedTest {

    @Test
    void sameBytesGiveSameLong() {
        assertEquals(Seed.of("abc").toLong(), Seed.of(new byte[] {'a', 'b', 'c'}).toLong());
        assertEquals(Seed.of("abc"), Seed.of("abc"));
        assertNotEquals(Seed.of("abc").toLong(), Seed.of("abd").toLong());
    }

    @Test
    void randomSeedsDiffer() {
        assertNotEquals(Seed.random(), Seed.random());
        assertEquals(16, Seed.random().getBytes().length);
    }

    @Test
    void bytesAreCopied() {
        byte[] bytes = {1, 2, 3};
        Seed seed = Seed.of(bytes);
        bytes[0] = 9;
        assertEquals(1, seed.getBytes()[0]);
    }
}
