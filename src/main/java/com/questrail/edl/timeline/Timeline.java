package com.questrail.edl.timeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Top-level editorial container: a name, an ordered stack of tracks and
 * free-form metadata.
 */
public final class Timeline
{
    private final String name;
    private final List<Track> tracks = new ArrayList<>();
    private final Map<String, Object> metadata = new LinkedHashMap<>();

    public Timeline(String name) {
        this.name = (name == null) ? "" : name;
    }

    public String name() {
        return name;
    }

    public Timeline addTrack(Track track) {
        tracks.add(Objects.requireNonNull(track, "track"));
        return this;
    }

    public List<Track> tracks() {
        return Collections.unmodifiableList(tracks);
    }

    public List<Track> videoTracks() {
        return tracksOfKind(TrackKind.VIDEO);
    }

    public List<Track> audioTracks() {
        return tracksOfKind(TrackKind.AUDIO);
    }

    public Map<String, Object> metadata() {
        return metadata;
    }

    private List<Track> tracksOfKind(TrackKind kind) {
        List<Track> result = new ArrayList<>();
        for (Track track : tracks) {
            if (track.kind() == kind) {
                result.add(track);
            }
        }
        return result;
    }
}
