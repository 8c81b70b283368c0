package com.questrail.edl.cmx3600.internal.decode;

import com.questrail.edl.cmx3600.codec.EdlParseException;
import com.questrail.edl.cmx3600.codec.Timecodes;
import com.questrail.edl.cmx3600.model.AscCdl;
import com.questrail.edl.cmx3600.model.EdlDocument;
import com.questrail.edl.cmx3600.model.EdlEvent;
import com.questrail.edl.cmx3600.model.EditType;
import com.questrail.edl.cmx3600.model.Locator;
import com.questrail.edl.cmx3600.model.TrackType;
import com.questrail.edl.cmx3600.observability.EdlDiagnosticEvent;
import com.questrail.edl.cmx3600.observability.EdlObservabilitySink;
import com.questrail.edl.timeline.Clip;
import com.questrail.edl.timeline.Effect;
import com.questrail.edl.timeline.ExternalReference;
import com.questrail.edl.timeline.FreezeFrame;
import com.questrail.edl.timeline.Gap;
import com.questrail.edl.timeline.GeneratorReference;
import com.questrail.edl.timeline.InvalidTimecodeException;
import com.questrail.edl.timeline.LinearTimeWarp;
import com.questrail.edl.timeline.Marker;
import com.questrail.edl.timeline.MediaReference;
import com.questrail.edl.timeline.RationalTime;
import com.questrail.edl.timeline.TimeRange;
import com.questrail.edl.timeline.Timeline;
import com.questrail.edl.timeline.Track;
import com.questrail.edl.timeline.TrackKind;
import com.questrail.edl.timeline.Transition;
import com.questrail.edl.timeline.TransitionType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * TimelineBuilder
 * ============================================================================
 * Turns the events of an {@link EdlDocument} into a {@link Timeline}.
 *
 * <h2>Tracks</h2>
 * Events are grouped by track identifier. Groups become tracks in the order
 * their first event was read; within a group, events are laid out in event
 * number order. {@code V} becomes a video track, every audio identifier an
 * audio track named after the identifier.
 *
 * <h2>Per event</h2>
 * <ul>
 *   <li>A gap fills any record time between the previous event's record out
 *       and this event's record in (more than half a frame)</li>
 *   <li>A dissolve or wipe with a duration puts a transition before the clip</li>
 *   <li>{@code BLACK}/{@code BL} and {@code BARS} reels become generator
 *       references; every other reel an external reference</li>
 *   <li>M2 speed becomes a linear time warp, a freeze frame comment a freeze
 *       frame effect, locators become markers</li>
 * </ul>
 *
 * <h2>Metadata keys</h2>
 * <ul>
 *   <li>{@code cdl}: {@code slope}, {@code offset}, {@code power} (3 doubles each), {@code saturation}</li>
 *   <li>{@code wipe_code}: the {@code W###} token</li>
 *   <li>{@code cmx_3600}: {@code event_number}, {@code reel}, {@code comments}, {@code frozen}</li>
 *   <li>Timeline {@code fcm}: the {@code FCM:} header value</li>
 * </ul>
 */
public final class TimelineBuilder
{
    static final String CDL_KEY = "cdl";
    static final String WIPE_CODE_KEY = "wipe_code";
    static final String CMX_KEY = "cmx_3600";
    static final String FCM_KEY = "fcm";

    static final String DEFAULT_WIPE_NAME = "SMPTE_Wipe";

    /** Record time beyond the previous record out, in frames, that opens a gap. */
    private static final double GAP_THRESHOLD = 0.5;

    private final double rate;
    private final EdlObservabilitySink sink;

    public TimelineBuilder(double rate, EdlObservabilitySink sink) {
        this.rate = rate;
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public Timeline build(EdlDocument document) {
        Timeline timeline = new Timeline(document.title().orElse(""));
        document.frameCountMode().ifPresent(mode -> timeline.metadata().put(FCM_KEY, mode.token()));

        for (Map.Entry<TrackType, List<EdlEvent>> group : groupByTrack(document.events())) {
            timeline.addTrack(buildTrack(group.getKey(), group.getValue()));
        }
        return timeline;
    }

    /**
     * Groups events by track identifier; groups are ordered by the event
     * number of their first event, events inside a group by event number.
     */
    static List<Map.Entry<TrackType, List<EdlEvent>>> groupByTrack(List<EdlEvent> events) {
        Map<TrackType, List<EdlEvent>> groups = new LinkedHashMap<>();
        for (EdlEvent event : events) {
            groups.computeIfAbsent(event.trackType(), t -> new ArrayList<>()).add(event);
        }

        List<Map.Entry<TrackType, List<EdlEvent>>> ordered = new ArrayList<>(groups.entrySet());
        for (Map.Entry<TrackType, List<EdlEvent>> entry : ordered) {
            entry.getValue().sort(Comparator.comparingInt(EdlEvent::eventNumber));
        }
        // Each group is sorted, so get(0) is its lowest event number.
        ordered.sort(Comparator.comparingInt(e -> e.getValue().get(0).eventNumber()));
        return ordered;
    }

    private Track buildTrack(TrackType trackType, List<EdlEvent> events) {
        Track track = new Track(trackType.token(), trackType.isVideo() ? TrackKind.VIDEO : TrackKind.AUDIO);

        RationalTime lastRecordOut = null;

        for (EdlEvent event : events) {
            final RationalTime sourceIn = toTime(event, "source in", event.sourceIn());
            final RationalTime sourceOut = toTime(event, "source out", event.sourceOut());
            final RationalTime recordIn = toTime(event, "record in", event.recordIn());
            final RationalTime recordOut = toTime(event, "record out", event.recordOut());

            if (lastRecordOut != null && lastRecordOut.isValidTime()) {
                RationalTime gap = recordIn.subtract(lastRecordOut);
                if (gap.value() > GAP_THRESHOLD) {
                    track.appendChild(Gap.withDuration(gap));
                }
            }

            TimeRange sourceRange = TimeRange.fromStartEndTime(sourceIn, sourceOut);

            if (event.editType().isTransition() && event.transitionDuration() > 0) {
                track.appendChild(transitionFor(event));
            }

            track.appendChild(new Clip(
                    clipName(event),
                    mediaReference(event, sourceRange),
                    sourceRange,
                    effects(event),
                    markers(event),
                    metadata(event)));

            lastRecordOut = recordOut;
        }
        return track;
    }

    private RationalTime toTime(EdlEvent event, String field, String timecode) {
        try {
            return Timecodes.parse(timecode, rate);
        }
        catch (InvalidTimecodeException e) {
            throw new EdlParseException(event.timecodeLine(),
                    "invalid " + field + " timecode '" + timecode + "': " + e.getMessage(), e);
        }
    }

    static MediaReference mediaReference(EdlEvent event, TimeRange sourceRange) {
        final String reel = event.reelName().toUpperCase(Locale.ROOT);
        if (reel.equals("BLACK") || reel.equals("BL")) {
            return new GeneratorReference(GeneratorReference.BLACK, GeneratorReference.BLACK, sourceRange);
        }
        if (reel.equals("BARS")) {
            return new GeneratorReference(GeneratorReference.SMPTE_BARS, GeneratorReference.SMPTE_BARS, sourceRange);
        }

        final String target = isEmpty(event.filePath()) ? event.reelName() : event.filePath();
        return new ExternalReference(target, target, sourceRange);
    }

    static String clipName(EdlEvent event) {
        final String name = isEmpty(event.clipName()) ? event.reelName() : event.clipName();
        return EdlMetadataExtractors.stripFreezeFrameSuffix(name, event.freezeFrame());
    }

    private Transition transitionFor(EdlEvent event) {
        final RationalTime duration = RationalTime.fromFrames(event.transitionDuration(), rate);

        if (event.editType() == EditType.WIPE) {
            final String name = isEmpty(event.wipeCode()) ? DEFAULT_WIPE_NAME : event.wipeCode();
            return new Transition(name, TransitionType.CUSTOM, RationalTime.zero(rate), duration, Map.of());
        }
        return new Transition("", TransitionType.SMPTE_DISSOLVE, RationalTime.zero(rate), duration, Map.of());
    }

    private List<Effect> effects(EdlEvent event) {
        List<Effect> effects = new ArrayList<>();
        if (event.speedEffect() != null) {
            effects.add(new LinearTimeWarp("", event.speedEffect().speed() / rate));
        }
        if (event.freezeFrame()) {
            effects.add(new FreezeFrame(""));
        }
        return effects;
    }

    private List<Marker> markers(EdlEvent event) {
        List<Marker> markers = new ArrayList<>();
        for (Locator locator : event.locators()) {
            final RationalTime at;
            try {
                at = Timecodes.parse(locator.timecode(), rate);
            }
            catch (InvalidTimecodeException e) {
                sink.onDiagnostic(new EdlDiagnosticEvent(event.timecodeLine(),
                        EdlDiagnosticEvent.Kind.DROPPED_MARKER,
                        "Dropped locator on event " + event.eventNumber() + ": " + e.getMessage()));
                continue;
            }

            Map<String, Object> metadata = new LinkedHashMap<>();
            if (!locator.color().isEmpty()) {
                metadata.put("color", locator.color());
            }
            markers.add(new Marker(
                    locator.comment(),
                    new TimeRange(at, RationalTime.zero(rate)),
                    locator.color(),
                    locator.comment(),
                    metadata));
        }
        return markers;
    }

    private static Map<String, Object> metadata(EdlEvent event) {
        Map<String, Object> metadata = new LinkedHashMap<>();

        AscCdl cdl = event.ascCdl();
        if (cdl != null) {
            Map<String, Object> values = new LinkedHashMap<>();
            values.put("slope", cdl.slope().toList());
            values.put("offset", cdl.offset().toList());
            values.put("power", cdl.power().toList());
            values.put("saturation", cdl.saturation());
            metadata.put(CDL_KEY, values);
        }

        if (!isEmpty(event.wipeCode())) {
            metadata.put(WIPE_CODE_KEY, event.wipeCode());
        }

        Map<String, Object> cmx = new LinkedHashMap<>();
        cmx.put("event_number", event.eventNumber());
        cmx.put("reel", event.reelName());
        if (!isEmpty(event.comment())) {
            cmx.put("comments", event.comment());
        }
        if (event.freezeFrame()) {
            cmx.put("frozen", Boolean.TRUE);
        }
        metadata.put(CMX_KEY, cmx);

        return metadata;
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }
}
