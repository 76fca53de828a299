package com.questrail.videowall.auth;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class TokenCodecTest {

    @Test
    void roundTripsArbitrarySecrets() {
        Random random = new Random(42);
        for (int len = 1; len < 70; len++) {
            byte[] secret = new byte[len];
            random.nextBytes(secret);
            String token = TokenCodec.encode(secret);
            assertTrue(token.startsWith(TokenCodec.PREFIX));
            assertArrayEquals(secret, TokenCodec.decode(token), "length " + len);
        }
    }

    @Test
    void checksumIsSixCharacters() {
        assertEquals(6, TokenCodec.checksumOf(new byte[] {1, 2, 3}).length());
    }

    @Test
    void prefixIsCaseInsensitiveAndTrailingWhitespaceIgnored() {
        byte[] secret = "hunter2".getBytes();
        String token = TokenCodec.encode(secret);
        String shouted = "MAGLD_" + token.substring(TokenCodec.PREFIX.length()) + " \n";
        assertArrayEquals(secret, TokenCodec.decode(shouted));
    }

    @Test
    void rejectsShortToken() {
        assertThrows(InvalidTokenException.class, () -> TokenCodec.decode("magld_A"));
    }

    @Test
    void rejectsWrongPrefix() {
        String token = TokenCodec.encode(new byte[] {9, 9, 9, 9});
        assertThrows(InvalidTokenException.class, () -> TokenCodec.decode("xyzzy_" + token.substring(6)));
    }

    @Test
    void rejectsChecksumMismatch() {
        String token = TokenCodec.encode(new byte[] {1, 2, 3, 4, 5, 6});
        char last = token.charAt(token.length() - 1);
        String tampered = token.substring(0, token.length() - 1) + (last == 'A' ? 'B' : 'A');
        assertThrows(InvalidTokenException.class, () -> TokenCodec.decode(tampered));
    }

    @Test
    void rejectsInvalidBase64Body() {
        assertThrows(InvalidTokenException.class, () -> TokenCodec.decode("magld_!!!!AAAAAA"));
    }
}
