package com.questrail.edl.timeline;

/**
 * An effect applied to a clip. Only the time effects an EDL can carry are modelled.
 */
public sealed interface Effect permits LinearTimeWarp, FreezeFrame
{
    String name();

    String effectName();
}
