package com.questrail.edl.cmx3600.codec;

/**
 * Indicates that EDL text violates the structure the decoder requires.
 *
 * This covers:
 * <ul>
 *   <li>An event line not immediately followed by a timecode line</li>
 *   <li>An event timecode that cannot be converted at the decode rate</li>
 *   <li>An event number or transition duration too large for an int</li>
 * </ul>
 *
 * The whole decode call fails; no partial timeline is returned.
 */
public final class EdlParseException extends RuntimeException
{
    private final int line;
    private final String detail;

    public EdlParseException(int line, String detail) {
        super("line " + line + ": " + detail);
        this.line = line;
        this.detail = detail;
    }

    public EdlParseException(int line, String detail, Throwable cause) {
        super("line " + line + ": " + detail, cause);
        this.line = line;
        this.detail = detail;
    }

    /**
     * Returns the 1-based physical line the failure is attributed to.
     */
    public int line() {
        return line;
    }

    /**
     * Returns the failure description without the line prefix.
     */
    public String detail() {
        return detail;
    }
}
