package com.gdin.radiology.report.rag;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MilvusCaseVectorIndexTest {

    @Test
    public void testTextWithinByteLimitIsKept() {
        assertEquals("abcdefghij", MilvusCaseVectorIndex.truncateUtf8("abcdefghij", 10));
        assertNull(MilvusCaseVectorIndex.truncateUtf8(null, 10));
    }

    @Test
    public void testAsciiTextIsCutToByteLimit() {
        assertEquals("abcdefg...", MilvusCaseVectorIndex.truncateUtf8("abcdefghijk", 10));
    }

    @Test
    public void testAccentedTextIsCutOnBytesNotChars() {
        // 10 个字符但占 20 字节
        String french = "éééééééééé";

        String truncated = MilvusCaseVectorIndex.truncateUtf8(french, 10);

        assertEquals("ééé...", truncated);
        assertTrue(truncated.getBytes(StandardCharsets.UTF_8).length <= 10);
    }

    @Test
    public void testLongFrenchCaseFitsVarCharLimit() {
        String text = "Hernie discale L4-L5 paramédiane gauche avec rétrécissement foraminal. ".repeat(200);

        String truncated = MilvusCaseVectorIndex.truncateUtf8(text, 8192);

        assertTrue(truncated.getBytes(StandardCharsets.UTF_8).length <= 8192);
        assertTrue(truncated.endsWith("..."));
    }
}
