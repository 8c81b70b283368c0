package com.questrail.edl.cmx3600.internal.decode;

import com.questrail.edl.cmx3600.model.AscCdl;
import com.questrail.edl.cmx3600.model.Locator;
import com.questrail.edl.cmx3600.model.SpeedEffect;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class EdlMetadataExtractorsTest
{
    @Test
    void parsesSpeedLine()
    {
        SpeedEffect speed = EdlMetadataExtractors
                .parseSpeedEffect("M2   CLIP1       047.6                01:00:04:05")
                .orElseThrow();

        assertEquals("CLIP1", speed.name());
        assertEquals(47.6, speed.speed());
        assertEquals("01:00:04:05", speed.timecode());

        assertEquals(-25.0, EdlMetadataExtractors
                .parseSpeedEffect("M2   CLIP1  -025.0  01:00:04:05").orElseThrow().speed());
    }

    @Test
    void malformedSpeedIsEmpty()
    {
        assertTrue(EdlMetadataExtractors.parseSpeedEffect("M2   CLIP1  1.2.3  01:00:04:05").isEmpty());
        assertTrue(EdlMetadataExtractors.parseSpeedEffect("M2   CLIP1  fast  01:00:04:05").isEmpty());
        assertTrue(EdlMetadataExtractors.parseSpeedEffect("M2   CLIP1  24.0").isEmpty());
    }

    @Test
    void parsesClipNameAndFilePaths()
    {
        assertEquals(Optional.of("Speed_Clip"), EdlMetadataExtractors.parseClipName("* FROM CLIP NAME:  Speed_Clip"));
        assertEquals(Optional.of("Shot1"), EdlMetadataExtractors.parseClipName("*FROM CLIP NAME: Shot1"));
        assertEquals(Optional.of("S:\\path\\to\\clip.mov"),
                EdlMetadataExtractors.parseAvidFilePath("* FROM CLIP: S:\\path\\to\\clip.mov"));
        assertEquals(Optional.of("S:\\path\\to\\clip.exr"),
                EdlMetadataExtractors.parseNucodaFilePath("* FROM FILE: S:\\path\\to\\clip.exr"));

        assertTrue(EdlMetadataExtractors.parseAvidFilePath("* FROM CLIP NAME: Shot1").isEmpty());
    }

    @Test
    void detectsFreezeFrame()
    {
        assertTrue(EdlMetadataExtractors.isFreezeFrame("* FREEZE FRAME"));
        assertTrue(EdlMetadataExtractors.isFreezeFrame("*FREEZE FRAME"));
        assertTrue(EdlMetadataExtractors.isFreezeFrame("* some note FF"));
        assertFalse(EdlMetadataExtractors.isFreezeFrame("* OFF"));
    }

    @Test
    void parsesLocator()
    {
        Locator locator = EdlMetadataExtractors
                .parseLocator("* LOC: 01:00:04:10 RED This is a marker")
                .orElseThrow();

        assertEquals("01:00:04:10", locator.timecode());
        assertEquals("RED", locator.color());
        assertEquals("This is a marker", locator.comment());

        Locator bare = EdlMetadataExtractors.parseLocator("*LOC: 01:00:04:10 BLUE").orElseThrow();
        assertEquals("BLUE", bare.color());
        assertEquals("", bare.comment());
    }

    @Test
    void parsesSopWithSpacesOrCommas()
    {
        EdlMetadataExtractors.Sop sop = EdlMetadataExtractors
                .parseSop("* ASC_SOP (1.5 1.0 0.9) (0.1 -0.2 0.0) (1.0 1.1 0.95)")
                .orElseThrow();

        assertEquals(new AscCdl.Rgb(1.5, 1.0, 0.9), sop.slope());
        assertEquals(new AscCdl.Rgb(0.1, -0.2, 0.0), sop.offset());
        assertEquals(new AscCdl.Rgb(1.0, 1.1, 0.95), sop.power());

        EdlMetadataExtractors.Sop commas = EdlMetadataExtractors
                .parseSop("*ASC_SOP (2, 2, 2)(0,0,0)(1, 1, 1)")
                .orElseThrow();
        assertEquals(new AscCdl.Rgb(2, 2, 2), commas.slope());
    }

    @Test
    void malformedColorDecisionIsEmpty()
    {
        assertTrue(EdlMetadataExtractors.parseSop("* ASC_SOP (a b c) (0 0 0) (1 1 1)").isEmpty());
        assertTrue(EdlMetadataExtractors.parseSaturation("* ASC_SAT high").isEmpty());
        assertTrue(EdlMetadataExtractors.mentionsColorDecision("* ASC_SAT high"));
        assertEquals(0.9, EdlMetadataExtractors.parseSaturation("* ASC_SAT 0.9").getAsDouble());
    }

    @Test
    void stripsFreezeFrameSuffixOnlyWhenFrozen()
    {
        assertEquals("FrozenClip", EdlMetadataExtractors.stripFreezeFrameSuffix("FrozenClip FF", true));
        assertEquals("FrozenClip FF", EdlMetadataExtractors.stripFreezeFrameSuffix("FrozenClip FF", false));
        assertEquals("Clip", EdlMetadataExtractors.stripFreezeFrameSuffix("Clip", true));
    }
}
