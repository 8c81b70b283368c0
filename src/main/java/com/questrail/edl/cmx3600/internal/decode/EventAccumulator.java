package com.questrail.edl.cmx3600.internal.decode;

import com.questrail.edl.cmx3600.codec.EdlParseException;
import com.questrail.edl.cmx3600.model.EdlDocument;
import com.questrail.edl.cmx3600.model.EdlEvent;
import com.questrail.edl.cmx3600.model.FrameCountMode;
import com.questrail.edl.cmx3600.observability.EdlDiagnosticEvent;
import com.questrail.edl.cmx3600.observability.EdlObservabilitySink;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * EventAccumulator
 * ============================================================================
 * Assembles physical lines into {@link EdlEvent}s.
 *
 * <h2>States</h2>
 * <pre>
 *   Idle ──event line──▶ AwaitingTimecodes ──timecode line──▶ Accumulating
 *                              │                                   │
 *                              └─anything else: EdlParseException  ├─comment / M2: mutate open event
 *                                                                  └─event line: flush, AwaitingTimecodes
 * </pre>
 *
 * <p>{@code AwaitingTimecodes} lasts exactly one physical line: the line after
 * an event line must be its timecode line. {@link #finish()} flushes the open
 * event, if any.</p>
 *
 * <p>{@code TITLE:} and {@code FCM:} headers are captured in any state and do
 * not close the open event.</p>
 *
 * <p>Instances are single-use and not thread-safe.</p>
 */
public final class EventAccumulator
{
    private sealed interface State permits Idle, AwaitingTimecodes, Accumulating {}

    private record Idle() implements State {}

    private record AwaitingTimecodes(EdlEvent.Builder event, int headerLine) implements State {}

    private record Accumulating(EdlEvent.Builder event) implements State {}

    private final EdlObservabilitySink sink;
    private final List<EdlEvent> events = new ArrayList<>();

    private State state = new Idle();
    private String title;
    private FrameCountMode frameCountMode;
    private int lastLineNumber;

    public EventAccumulator(EdlObservabilitySink sink) {
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Feeds the next physical line.
     *
     * @param lineNumber 1-based physical line number
     * @param line       line text without terminator
     * @throws EdlParseException if an event line is not followed by a timecode
     *                           line, or carries numbers too large for an int
     */
    public void accept(int lineNumber, String line) {
        lastLineNumber = lineNumber;

        if (state instanceof AwaitingTimecodes awaiting) {
            EdlLineGrammar.TimecodeFields tc = EdlLineGrammar.parseTimecodeLine(line)
                    .orElseThrow(() -> new EdlParseException(lineNumber, "expected timecode line after event"));
            awaiting.event()
                    .timecodes(tc.sourceIn(), tc.sourceOut(), tc.recordIn(), tc.recordOut())
                    .timecodeLine(lineNumber);
            state = new Accumulating(awaiting.event());
            return;
        }

        final boolean eventOpen = state instanceof Accumulating;
        EdlLine classified = EdlLineClassifier.classify(lineNumber, line, eventOpen);

        if (classified instanceof EdlLine.Blank) {
            return;
        }
        if (classified instanceof EdlLine.Title t) {
            title = t.title();
            return;
        }
        if (classified instanceof EdlLine.FrameCountModeHeader fcm) {
            onFrameCountMode(fcm);
            return;
        }
        if (classified instanceof EdlLine.EventLine e) {
            flush();
            state = new AwaitingTimecodes(open(e.header()), lineNumber);
            return;
        }
        if (classified instanceof EdlLine.Ignored ignored) {
            diagnostic(lineNumber, EdlDiagnosticEvent.Kind.IGNORED_LINE, "Ignored line: " + ignored.text());
            return;
        }

        // Every remaining variant is only produced while an event is open.
        EdlEvent.Builder event = ((Accumulating) state).event();

        if (classified instanceof EdlLine.SpeedLine s) {
            event.speedEffect(s.speedEffect());
        }
        else if (classified instanceof EdlLine.MalformedSpeedLine s) {
            diagnostic(lineNumber, EdlDiagnosticEvent.Kind.MALFORMED_SPEED, "Malformed M2 line: " + s.text());
        }
        else if (classified instanceof EdlLine.ClipNameComment c) {
            event.clipName(c.clipName());
        }
        else if (classified instanceof EdlLine.FilePathComment f) {
            event.filePath(f.filePath());
        }
        else if (classified instanceof EdlLine.FreezeFrameComment) {
            event.freezeFrame(true);
        }
        else if (classified instanceof EdlLine.LocatorComment l) {
            event.addLocator(l.locator());
        }
        else if (classified instanceof EdlLine.ColorSopComment c) {
            event.sop(c.sop().slope(), c.sop().offset(), c.sop().power());
        }
        else if (classified instanceof EdlLine.ColorSatComment c) {
            event.saturation(c.saturation());
        }
        else if (classified instanceof EdlLine.FreeComment c) {
            if (c.malformedColorDecision()) {
                diagnostic(lineNumber, EdlDiagnosticEvent.Kind.MALFORMED_COLOR_DECISION,
                        "Unparseable color decision kept as comment: " + c.text());
            }
            event.appendComment(c.text());
        }
        else {
            throw new IllegalStateException("Unhandled EDL line kind: " + classified);
        }
    }

    /**
     * Flushes the open event and returns everything read.
     *
     * @throws EdlParseException if input ended directly after an event line
     */
    public EdlDocument finish() {
        if (state instanceof AwaitingTimecodes) {
            throw new EdlParseException(lastLineNumber + 1, "expected timecode line after event");
        }
        flush();
        return new EdlDocument(Optional.ofNullable(title), Optional.ofNullable(frameCountMode), events);
    }

    private void flush() {
        if (state instanceof Accumulating accumulating) {
            EdlEvent event = accumulating.event().build();
            events.add(event);
            sink.onEventDecoded(event);
        }
        state = new Idle();
    }

    private static EdlEvent.Builder open(EdlLineGrammar.EventHeader header) {
        return EdlEvent.builder()
                .eventNumber(header.eventNumber())
                .reelName(header.reelName())
                .trackType(header.trackType())
                .editType(header.editType())
                .wipeCode(header.wipeCode())
                .transitionDuration(header.transitionDuration());
    }

    private void onFrameCountMode(EdlLine.FrameCountModeHeader header) {
        Optional<FrameCountMode> mode = FrameCountMode.fromToken(header.token());
        if (mode.isPresent()) {
            frameCountMode = mode.get();
        } else {
            diagnostic(header.lineNumber(), EdlDiagnosticEvent.Kind.UNKNOWN_FRAME_COUNT_MODE,
                    "Unknown frame count mode: " + header.token());
        }
    }

    private void diagnostic(int line, EdlDiagnosticEvent.Kind kind, String message) {
        sink.onDiagnostic(new EdlDiagnosticEvent(line, kind, message));
    }
}
