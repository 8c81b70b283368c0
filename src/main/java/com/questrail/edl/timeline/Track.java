package com.questrail.edl.timeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An ordered sequence of {@link Composable} children of one {@link TrackKind}.
 *
 * <p>Children are laid out end to end in insertion order. The child list is
 * mutable through {@link #appendChild(Composable)} only.</p>
 */
public final class Track
{
    private final String name;
    private final TrackKind kind;
    private final List<Composable> children = new ArrayList<>();

    public Track(String name, TrackKind kind) {
        this.name = (name == null) ? "" : name;
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public String name() {
        return name;
    }

    public TrackKind kind() {
        return kind;
    }

    public Track appendChild(Composable child) {
        children.add(Objects.requireNonNull(child, "child"));
        return this;
    }

    /**
     * Returns an unmodifiable view of the children in track order.
     */
    public List<Composable> children() {
        return Collections.unmodifiableList(children);
    }

    @Override
    public String toString() {
        return "Track[name=" + name + ", kind=" + kind + ", children=" + children.size() + ']';
    }
}
