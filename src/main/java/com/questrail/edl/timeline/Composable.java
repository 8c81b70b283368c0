package com.questrail.edl.timeline;

/**
 * A child of a {@link Track}.
 *
 * <p>The set of children is closed: a track holds clips, gaps and transitions
 * and nothing else. Clips and gaps occupy time on the track; a transition
 * overlaps its neighbours and does not.</p>
 */
public sealed interface Composable permits Clip, Gap, Transition
{
    String name();
}
