package com.varia.model;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ContentRange.
 */
class ContentRangeTest {

    private final ContentRange firstThousand = new ContentRange(0, 999, 2000L);

    @Test
    void testParse() {
        assertEquals(Optional.of(firstThousand), ContentRange.parse("bytes 0-999/2000"));
        assertEquals(Optional.of(new ContentRange(3, 10, null)), ContentRange.parse("bytes 3-10/*"));
    }

    @Test
    void testParseRejectsUnsatisfiedAndMalformed() {
        assertTrue(ContentRange.parse("bytes */2000").isEmpty());
        assertTrue(ContentRange.parse("bytes 10-3/2000").isEmpty());
        assertTrue(ContentRange.parse("bytes 0-2000/2000").isEmpty());
        assertTrue(ContentRange.parse("0-10/20").isEmpty());
    }

    @Test
    void testCoversSubRange() {
        assertTrue(firstThousand.covers(ByteRange.closed(0, 499)));
        assertTrue(firstThousand.covers(ByteRange.closed(0, 999)));
        assertTrue(firstThousand.covers(ByteRange.closed(250, 750)));
    }

    @Test
    void testDoesNotCoverOutsideRange() {
        assertFalse(firstThousand.covers(ByteRange.closed(500, 1999)));
        assertFalse(firstThousand.covers(ByteRange.from(500)));
        assertFalse(firstThousand.covers(ByteRange.suffix(100)));
    }

    @Test
    void testSuffixCoveredByTail() {
        ContentRange tail = new ContentRange(1000, 1999, 2000L);

        assertTrue(tail.covers(ByteRange.suffix(500)));
        assertTrue(tail.covers(ByteRange.from(1500)));
    }

    @Test
    void testOpenRangeNotCoveredWithUnknownLength() {
        ContentRange unknownLength = new ContentRange(0, 999, null);

        assertTrue(unknownLength.covers(ByteRange.closed(0, 10)));
        assertFalse(unknownLength.covers(ByteRange.from(0)));
    }

    @Test
    void testHeaderValue() {
        assertEquals("bytes 0-999/2000", firstThousand.toHeaderValue());
        assertEquals("bytes 3-10/*", new ContentRange(3, 10, null).toHeaderValue());
        assertEquals(1000, firstThousand.length());
    }
}
