/**
 * CMX 3600 Codec Boundary
 * =============================================================================
 *
 * <p>Public entry points for reading and writing CMX 3600 Edit Decision Lists.</p>
 *
 * <pre>
 *   EDL text
 *        → EdlLineClassifier      (one physical line → one EdlLine variant)
 *            → EventAccumulator   (EdlLine stream → EdlEvent list)
 *                → TimelineBuilder (EdlEvent list → Timeline)
 *
 *   Timeline
 *        → TrackSerializer        (track children → EdlEvent list)
 *            → EventWriter        (EdlEvent → text)
 * </pre>
 *
 * <h2>Shared rules</h2>
 * <ul>
 *   <li>{@link com.questrail.edl.cmx3600.codec.Timecodes}: timecode parsing and
 *       formatting, drop-frame rate detection</li>
 *   <li>{@link com.questrail.edl.cmx3600.codec.ReelNames}: reel token normalization</li>
 * </ul>
 *
 * <h2>Failures</h2>
 * <p>{@link com.questrail.edl.cmx3600.codec.EdlParseException} and
 * {@link com.questrail.edl.cmx3600.codec.EdlEncodeException} end the call.
 * Recoverable oddities (an unparseable {@code M2} line, a bad locator
 * timecode, an unknown comment) are skipped and reported to the configured
 * observability sink.</p>
 */
package com.questrail.edl.cmx3600.codec;
