package com.questrail.edl.cmx3600.internal.encode;

import com.questrail.edl.cmx3600.codec.EdlEncodeException;
import com.questrail.edl.cmx3600.model.EdlEvent;
import com.questrail.edl.cmx3600.model.EditType;
import com.questrail.edl.cmx3600.model.TrackType;
import com.questrail.edl.cmx3600.observability.EdlDiagnosticEvent;
import com.questrail.edl.cmx3600.observability.RecordingObservabilitySink;
import com.questrail.edl.timeline.Clip;
import com.questrail.edl.timeline.ExternalReference;
import com.questrail.edl.timeline.Gap;
import com.questrail.edl.timeline.GeneratorReference;
import com.questrail.edl.timeline.MissingReference;
import com.questrail.edl.timeline.RationalTime;
import com.questrail.edl.timeline.TimeRange;
import com.questrail.edl.timeline.Track;
import com.questrail.edl.timeline.TrackKind;
import com.questrail.edl.timeline.Transition;
import com.questrail.edl.timeline.TransitionType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TrackSerializerTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link TrackSerializer}: record-time layout across gaps,
 * transition folding, reel names and timecode fallback.
 */
final class TrackSerializerTest
{
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final TrackSerializer serializer = new TrackSerializer(24.0, 8, sink);

    private static TimeRange range(long startFrame, long frames)
    {
        return new TimeRange(RationalTime.fromFrames(startFrame, 24), RationalTime.fromFrames(frames, 24));
    }

    private static Clip clip(String name, String reel, TimeRange range)
    {
        return new Clip(name, new ExternalReference(reel, reel, null), range);
    }

    @Test
    void clipsAreLaidOutBackToBack()
    {
        Track track = new Track("V", TrackKind.VIDEO)
                .appendChild(clip("Shot1", "R1", range(86400, 120)))
                .appendChild(clip("Shot2", "R2", range(0, 48)));

        List<EdlEvent> events = serializer.serialize(track, TrackType.V, 1);

        assertEquals(2, events.size());
        EdlEvent first = events.get(0);
        assertEquals(1, first.eventNumber());
        assertEquals("R1", first.reelName());
        assertEquals(EditType.CUT, first.editType());
        assertEquals("01:00:00:00", first.sourceIn());
        assertEquals("01:00:05:00", first.sourceOut());
        assertEquals("00:00:00:00", first.recordIn());
        assertEquals("00:00:05:00", first.recordOut());
        assertEquals("Shot1", first.clipName());

        EdlEvent second = events.get(1);
        assertEquals(2, second.eventNumber());
        assertEquals("00:00:05:00", second.recordIn());
        assertEquals("00:00:07:00", second.recordOut());
    }

    @Test
    void gapsAdvanceRecordTimeWithoutEvents()
    {
        Track track = new Track("V", TrackKind.VIDEO)
                .appendChild(Gap.withDuration(RationalTime.fromFrames(24, 24)))
                .appendChild(clip("Shot1", "R1", range(0, 24)));

        List<EdlEvent> events = serializer.serialize(track, TrackType.V, 5);

        assertEquals(1, events.size());
        assertEquals(5, events.get(0).eventNumber());
        assertEquals("00:00:01:00", events.get(0).recordIn());
        assertEquals("00:00:02:00", events.get(0).recordOut());
    }

    @Test
    void dissolveAfterClipIsFoldedIntoThatClip()
    {
        Transition dissolve = new Transition("", TransitionType.SMPTE_DISSOLVE,
                RationalTime.zero(24), RationalTime.fromFrames(30, 24), Map.of());

        Track track = new Track("V", TrackKind.VIDEO)
                .appendChild(clip("Shot1", "R1", range(0, 120)))
                .appendChild(dissolve)
                .appendChild(clip("Shot2", "R2", range(0, 120)));

        List<EdlEvent> events = serializer.serialize(track, TrackType.V, 1);

        assertEquals(2, events.size());
        assertEquals(EditType.DISSOLVE, events.get(0).editType());
        assertEquals(30, events.get(0).transitionDuration());
        assertEquals(EditType.CUT, events.get(1).editType());
        assertFalse(sink.hasDiagnostic(EdlDiagnosticEvent.Kind.SKIPPED_CHILD));
    }

    @Test
    void transitionDurationIsRescaledToEncodeRate()
    {
        Transition dissolve = new Transition("", TransitionType.SMPTE_DISSOLVE,
                RationalTime.zero(48), RationalTime.fromFrames(60, 48), Map.of());

        Track track = new Track("V", TrackKind.VIDEO)
                .appendChild(clip("Shot1", "R1", range(0, 120)))
                .appendChild(dissolve);

        assertEquals(30, serializer.serialize(track, TrackType.V, 1).get(0).transitionDuration());
    }

    @Test
    void customTransitionAfterClipIsConsumedAsCut()
    {
        Transition wipe = new Transition("W001", TransitionType.CUSTOM,
                RationalTime.zero(24), RationalTime.fromFrames(30, 24), Map.of());

        Track track = new Track("V", TrackKind.VIDEO)
                .appendChild(clip("Shot1", "R1", range(0, 120)))
                .appendChild(wipe);

        List<EdlEvent> events = serializer.serialize(track, TrackType.V, 1);
        assertEquals(EditType.CUT, events.get(0).editType());
        assertEquals(0, events.get(0).transitionDuration());
        assertFalse(sink.hasDiagnostic(EdlDiagnosticEvent.Kind.SKIPPED_CHILD));
    }

    @Test
    void leadingTransitionIsSkippedAndReported()
    {
        Transition dissolve = new Transition("", TransitionType.SMPTE_DISSOLVE,
                RationalTime.zero(24), RationalTime.fromFrames(30, 24), Map.of());

        Track track = new Track("V", TrackKind.VIDEO)
                .appendChild(dissolve)
                .appendChild(clip("Shot1", "R1", range(0, 120)));

        List<EdlEvent> events = serializer.serialize(track, TrackType.V, 1);

        assertEquals(1, events.size());
        assertEquals("00:00:00:00", events.get(0).recordIn());
        List<EdlDiagnosticEvent> skipped = sink.getDiagnostics(EdlDiagnosticEvent.Kind.SKIPPED_CHILD);
        assertEquals(1, skipped.size());
        assertTrue(skipped.get(0).message().startsWith("Skipped SMPTE_Dissolve"), skipped.get(0).message());
    }

    @Test
    void reelNamesAreSanitized()
    {
        assertEquals("VeryLong", serializer.reelName(new ExternalReference("VeryLongClipName", "x", null)));
        assertEquals("My_Clip", serializer.reelName(new ExternalReference("My Clip", "x", null)));
        assertEquals("clip_mov", serializer.reelName(new ExternalReference("", "clip.mov", null)));
        assertEquals("black", serializer.reelName(new GeneratorReference("black", "black", null)));
        assertEquals("AX", serializer.reelName(new MissingReference("", null)));

        TrackSerializer unlimited = new TrackSerializer(24.0, 0, sink);
        assertEquals("VeryLongClipName", unlimited.reelName(new ExternalReference("VeryLongClipName", "x", null)));
    }

    @Test
    void clipWithoutRangeFails()
    {
        Track track = new Track("V", TrackKind.VIDEO).appendChild(new Clip("NoRange", null, null));

        EdlEncodeException e = assertThrows(EdlEncodeException.class,
                () -> serializer.serialize(track, TrackType.V, 1));
        assertTrue(e.getMessage().contains("NoRange"));
    }

    @Test
    void clipUsesAvailableRangeWhenSourceRangeIsMissing()
    {
        Clip clip = new Clip("Avail", new ExternalReference("R1", "R1", range(24, 48)), null);
        Track track = new Track("V", TrackKind.VIDEO).appendChild(clip);

        EdlEvent event = serializer.serialize(track, TrackType.V, 1).get(0);
        assertEquals("00:00:01:00", event.sourceIn());
        assertEquals("00:00:03:00", event.sourceOut());
    }

    @Test
    void unrenderableTimecodeFallsBackToZero()
    {
        Track track = new Track("V", TrackKind.VIDEO).appendChild(clip("Early", "R1", range(-48, 24)));

        EdlEvent event = serializer.serialize(track, TrackType.V, 1).get(0);

        assertEquals("00:00:00:00", event.sourceIn());
        assertEquals("00:00:00:00", event.sourceOut());
        assertEquals("00:00:01:00", event.recordOut());
        assertEquals(2, sink.getDiagnostics(EdlDiagnosticEvent.Kind.TIMECODE_FALLBACK).size());
    }
}
