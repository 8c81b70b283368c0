package com.questrail.edl.cmx3600.codec;

/**
 * Indicates that a timeline cannot be written as a CMX 3600 EDL, for example
 * because it has more than one video track.
 */
public final class EdlEncodeException extends RuntimeException
{
    private final String detail;

    public EdlEncodeException(String detail) {
        super("encode error: " + detail);
        this.detail = detail;
    }

    public EdlEncodeException(String detail, Throwable cause) {
        super("encode error: " + detail, cause);
        this.detail = detail;
    }

    public String detail() {
        return detail;
    }
}
