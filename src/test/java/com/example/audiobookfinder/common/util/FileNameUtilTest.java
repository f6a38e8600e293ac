package com.example.audiobookfinder.common.util;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class FileNameUtilTest {

    @Test
    void shouldReplaceEveryReservedCharacter() {
        assertEquals("a_b_c_d_e_f_g_h_i_j", FileNameUtil.sanitize("a<b>c:d\"e/f\\g|h?i*j"));
    }

    @Test
    void shouldKeepOrdinaryCharacters() {
        assertEquals("Unknown - The Hobbit - Full Audiobook (1of2)",
                FileNameUtil.sanitize("Unknown - The Hobbit - Full Audiobook (1of2)"));
    }

    @Test
    void shouldReturnEmptyForNull() {
        assertEquals("", FileNameUtil.sanitize(null));
    }
}
