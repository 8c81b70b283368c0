package com.questrail.edl.cmx3600.internal.encode;

import com.questrail.edl.cmx3600.codec.EdlEncodeException;
import com.questrail.edl.cmx3600.codec.ReelNames;
import com.questrail.edl.cmx3600.codec.Timecodes;
import com.questrail.edl.cmx3600.model.EdlEvent;
import com.questrail.edl.cmx3600.model.EditType;
import com.questrail.edl.cmx3600.model.TrackType;
import com.questrail.edl.cmx3600.observability.EdlDiagnosticEvent;
import com.questrail.edl.cmx3600.observability.EdlObservabilitySink;
import com.questrail.edl.timeline.Clip;
import com.questrail.edl.timeline.Composable;
import com.questrail.edl.timeline.ExternalReference;
import com.questrail.edl.timeline.Gap;
import com.questrail.edl.timeline.InvalidTimecodeException;
import com.questrail.edl.timeline.MediaReference;
import com.questrail.edl.timeline.RationalTime;
import com.questrail.edl.timeline.TimeRange;
import com.questrail.edl.timeline.Track;
import com.questrail.edl.timeline.Transition;
import com.questrail.edl.timeline.TransitionType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * TrackSerializer
 * ============================================================================
 * Converts the children of one {@link Track} into {@link EdlEvent}s ready to
 * be written.
 *
 * <h2>Layout</h2>
 * A record-time cursor starts at zero for every track.
 * <ul>
 *   <li>A gap advances the cursor and produces no event</li>
 *   <li>A clip produces one event whose record range starts at the cursor
 *       and lasts the clip's duration; the cursor moves to its end</li>
 *   <li>A transition directly after a clip is folded into that clip's
 *       event: an SMPTE dissolve makes it a {@code D} event with the
 *       transition's out offset as duration, any other type leaves it a cut</li>
 *   <li>Any other transition is skipped and reported</li>
 * </ul>
 *
 * <h2>Reel names</h2>
 * The media reference name, else the external reference target URL, run
 * through {@link ReelNames#sanitize(String, int)}.
 *
 * <h2>What this serializer does NOT do</h2>
 * <ul>
 *   <li>Check the number of video tracks (done by the encoder before any
 *       track is serialized)</li>
 *   <li>Produce text (see {@link EventWriter})</li>
 * </ul>
 */
public final class TrackSerializer
{
    private final double rate;
    private final int reelNameLength;
    private final EdlObservabilitySink sink;

    public TrackSerializer(double rate, int reelNameLength, EdlObservabilitySink sink)
    {
        this.rate = rate;
        this.reelNameLength = reelNameLength;
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Serializes {@code track} with event numbers counting up from
     * {@code firstEventNumber}.
     *
     * @throws EdlEncodeException if a clip has no usable source range
     */
    public List<EdlEvent> serialize(Track track, TrackType trackType, int firstEventNumber)
    {
        Objects.requireNonNull(track, "track");
        Objects.requireNonNull(trackType, "trackType");

        final List<Composable> children = track.children();
        final List<EdlEvent> events = new ArrayList<>();

        int eventNumber = firstEventNumber;
        RationalTime recordTime = RationalTime.zero(rate);

        for (int i = 0; i < children.size(); i++) {
            final Composable child = children.get(i);

            if (child instanceof Gap gap) {
                recordTime = recordTime.add(gap.duration());
                continue;
            }

            if (!(child instanceof Clip clip)) {
                sink.onDiagnostic(new EdlDiagnosticEvent(0, EdlDiagnosticEvent.Kind.SKIPPED_CHILD,
                        "Skipped " + describe(child) + " '" + child.name()
                                + "' on track '" + track.name() + "'"));
                continue;
            }

            final TimeRange sourceRange = sourceRange(clip);
            final RationalTime duration = sourceRange.duration();
            final RationalTime sourceIn = sourceRange.startTime();
            final RationalTime sourceOut = sourceRange.endTimeExclusive();
            final RationalTime recordIn = recordTime;
            final RationalTime recordOut = recordTime.add(duration);

            EditType editType = EditType.CUT;
            int transitionDuration = 0;

            // The transition following a clip belongs to that clip's event.
            if (i + 1 < children.size() && children.get(i + 1) instanceof Transition transition) {
                if (transition.transitionType() == TransitionType.SMPTE_DISSOLVE) {
                    editType = EditType.DISSOLVE;
                    transitionDuration = (int) transition.outOffset().toFrames(rate);
                }
                i++;
            }

            final int number = eventNumber;
            events.add(EdlEvent.builder()
                    .eventNumber(number)
                    .reelName(reelName(clip.mediaReference()))
                    .trackType(trackType)
                    .editType(editType)
                    .transitionDuration(transitionDuration)
                    .timecodes(
                            format(number, "source in", sourceIn),
                            format(number, "source out", sourceOut),
                            format(number, "record in", recordIn),
                            format(number, "record out", recordOut))
                    .clipName(clip.name())
                    .build());

            eventNumber++;
            recordTime = recordOut;
        }

        return events;
    }

    private static TimeRange sourceRange(Clip clip)
    {
        try {
            return clip.trimmedRange();
        }
        catch (IllegalStateException e) {
            throw new EdlEncodeException("clip '" + clip.name() + "' has no source range", e);
        }
    }

    private static String describe(Composable child)
    {
        if (child instanceof Transition transition) {
            return transition.transitionType().label();
        }
        return child.getClass().getSimpleName();
    }

    String reelName(MediaReference reference)
    {
        String name = reference.name();
        if (name.isEmpty() && reference instanceof ExternalReference external) {
            name = external.targetUrl();
        }
        return ReelNames.sanitize(name, reelNameLength);
    }

    private String format(int eventNumber, String field, RationalTime time)
    {
        try {
            return Timecodes.format(time, rate);
        }
        catch (InvalidTimecodeException e) {
            sink.onDiagnostic(new EdlDiagnosticEvent(0, EdlDiagnosticEvent.Kind.TIMECODE_FALLBACK,
                    "Event " + eventNumber + " " + field + ": " + e.getMessage()));
            return Timecodes.ZERO;
        }
    }
}
