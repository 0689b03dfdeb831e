package org.pragmatica.symex.math;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BitMathTest {

    @Test
    void mask_coversWidth() {
        assertEquals(0xFFL, BitMath.mask(8));
        assertEquals(-1L, BitMath.mask(64));
        assertEquals(1L, BitMath.mask(1));
    }

    @Test
    void isValidWidth_acceptsOneToSixtyFour() {
        assertTrue(BitMath.isValidWidth(1));
        assertTrue(BitMath.isValidWidth(64));
        assertFalse(BitMath.isValidWidth(0));
        assertFalse(BitMath.isValidWidth(65));
        assertFalse(BitMath.isValidWidth(-8));
    }

    @Test
    void resize_extendsAndTruncates() {
        assertEquals(0xF0L, BitMath.resize(0xF0, 8, 32, false));
        assertEquals(0xFFFFFFF0L, BitMath.resize(0xF0, 8, 32, true));
        assertEquals(0xF0L, BitMath.resize(0x12F0, 16, 8, true));
        assertEquals(0x70L, BitMath.resize(0x70, 8, 16, true));
    }

    @Test
    void signExtend_fillsUpperBits() {
        assertEquals(-1L, BitMath.signExtend(0xFF, 8));
        assertEquals(0x7FL, BitMath.signExtend(0x7F, 8));
    }
}
