package com.adlanda.knowledgesync.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for FileHashService.
 */
class FileHashServiceTest {

    private FileHashService hashService;

    @BeforeEach
    void setUp() {
        hashService = new FileHashService();
    }

    @Test
    void computeHash_sameContent_returnsSameHash() {
        assertThat(hashService.computeHash(bytes("hello world"))).isEqualTo(hashService.computeHash(bytes("hello world")));
    }

    @Test
    void computeHash_differentContent_returnsDifferentHash() {
        assertThat(hashService.computeHash(bytes("hello world"))).isNotEqualTo(hashService.computeHash(bytes("hello universe")));
    }

    @Test
    void computeHash_emptyContent_returnsKnownDigest() {
        // SHA-256 of empty input is well-known
        assertThat(hashService.computeHash(new byte[0]))
                .isEqualTo("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855");
    }

    @Test
    void computeHash_abc_returnsKnownDigest() {
        assertThat(hashService.computeHash(bytes("abc")))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    private static byte[] bytes(String content) {
        return content.getBytes(StandardCharsets.UTF_8);
    }
}
