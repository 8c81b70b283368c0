package com.questrail.edl.timeline;

public enum TrackKind {
    VIDEO,
    AUDIO
}
