package com.questrail.edl.cmx3600.internal.decode;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EdlLineClassifier} priority and the open-event rule
 * for comment lines.
 */
final class EdlLineClassifierTest
{
    private static EdlLine open(String line)
    {
        return EdlLineClassifier.classify(10, line, true);
    }

    @Test
    void headersAndEventLinesAreRecognizedInAnyState()
    {
        assertInstanceOf(EdlLine.Blank.class, EdlLineClassifier.classify(1, "   ", false));
        assertInstanceOf(EdlLine.Title.class, EdlLineClassifier.classify(1, "TITLE: Test", false));
        assertInstanceOf(EdlLine.FrameCountModeHeader.class, EdlLineClassifier.classify(2, "FCM: NON-DROP FRAME", true));
        assertInstanceOf(EdlLine.EventLine.class, EdlLineClassifier.classify(4, "001  AX       V     C", false));
        assertInstanceOf(EdlLine.EventLine.class, open("002  AX       V     C"));
    }

    @Test
    void commentsWithoutOpenEventAreIgnored()
    {
        EdlLine line = EdlLineClassifier.classify(3, "* FROM CLIP NAME: Orphan", false);

        EdlLine.Ignored ignored = assertInstanceOf(EdlLine.Ignored.class, line);
        assertEquals(3, ignored.lineNumber());
        assertEquals("* FROM CLIP NAME: Orphan", ignored.text());
    }

    @Test
    void commentVariantsInPriorityOrder()
    {
        assertInstanceOf(EdlLine.ClipNameComment.class, open("* FROM CLIP NAME: FrozenClip FF"));
        assertInstanceOf(EdlLine.FilePathComment.class, open("* FROM CLIP: S:\\a.mov"));
        assertInstanceOf(EdlLine.FilePathComment.class, open("* FROM FILE: S:\\a.exr"));
        assertInstanceOf(EdlLine.FreezeFrameComment.class, open("* FREEZE FRAME"));
        assertInstanceOf(EdlLine.LocatorComment.class, open("* LOC: 01:00:04:10 RED note"));
        assertInstanceOf(EdlLine.ColorSopComment.class, open("* ASC_SOP (1 1 1) (0 0 0) (1 1 1)"));
        assertInstanceOf(EdlLine.ColorSatComment.class, open("* ASC_SAT 0.9"));

        EdlLine.FreeComment free = assertInstanceOf(EdlLine.FreeComment.class, open("* just a note"));
        assertFalse(free.malformedColorDecision());
    }

    @Test
    void malformedColorDecisionBecomesFlaggedFreeComment()
    {
        EdlLine.FreeComment free =
                assertInstanceOf(EdlLine.FreeComment.class, open("* ASC_SOP (1 x 1) (0 0 0) (1 1 1)"));
        assertTrue(free.malformedColorDecision());
    }

    @Test
    void speedLines()
    {
        assertInstanceOf(EdlLine.SpeedLine.class, open("M2   CLIP1       047.6                01:00:04:05"));
        assertInstanceOf(EdlLine.MalformedSpeedLine.class, open("M2   CLIP1       1.2.3                01:00:04:05"));
    }

    @Test
    void unknownLinesAreIgnored()
    {
        assertInstanceOf(EdlLine.Ignored.class, open("SPLIT: AUDIO DELAY"));
        assertInstanceOf(EdlLine.Ignored.class, EdlLineClassifier.classify(1, "M2   CLIP1  047.6  01:00:04:05", false));
    }
}
