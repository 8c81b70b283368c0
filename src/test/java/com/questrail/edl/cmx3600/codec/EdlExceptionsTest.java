package com.questrail.edl.cmx3600.codec;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the rendered messages of {@link EdlParseException} and
 * {@link EdlEncodeException}.
 */
final class EdlExceptionsTest
{
    @Test
    void parseExceptionCarriesLineNumber()
    {
        EdlParseException parse = new EdlParseException(7, "expected timecode line after event");
        assertEquals(7, parse.line());
        assertEquals("line 7: expected timecode line after event", parse.getMessage());
    }

    @Test
    void parseExceptionKeepsCause()
    {
        NumberFormatException cause = new NumberFormatException("99999999999");
        EdlParseException parse = new EdlParseException(3, "event number out of range", cause);
        assertSame(cause, parse.getCause());
        assertEquals("line 3: event number out of range", parse.getMessage());
    }

    @Test
    void encodeExceptionIsPrefixed()
    {
        EdlEncodeException encode = new EdlEncodeException("timeline is null");
        assertEquals("encode error: timeline is null", encode.getMessage());
        assertEquals("timeline is null", encode.detail());
    }
}
