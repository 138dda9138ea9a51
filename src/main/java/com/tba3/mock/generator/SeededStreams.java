package com.tba3.mock.generator;

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;

import java.nio.charset.StandardCharsets;
import java.util.zip.Adler32;

/**
 * Turns seed strings into random streams. The Adler-32 checksum of the UTF-8 bytes is the numeric seed,
 * so equal strings always yield equal streams.
 */
public final class SeededStreams {
    static final RandomSource ALGORITHM = RandomSource.XO_SHI_RO_256_PP;

    private SeededStreams() {
    }

    public static long checksum(String seed) {
        Adler32 adler = new Adler32();
        adler.update(seed.getBytes(StandardCharsets.UTF_8));
        return adler.getValue();
    }

    public static UniformRandomProvider studentStream(String seed) {
        return ALGORITHM.create(checksum(seed));
    }

    public static UniformRandomProvider responseStream(String seed, int studentCount, int itemCount) {
        return ALGORITHM.create(checksum(seed + "-" + studentCount + "-" + itemCount));
    }
}
