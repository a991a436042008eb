package com.gdin.radiology.report.generation;

import com.gdin.radiology.report.exception.PlaceholderResolutionException;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class SkeletonFormatterTest {

    @Test
    public void testNamedPlaceholdersAndEscapes() {
        String out = SkeletonFormatter.format("Patient: {patient_name}\nJSON: {{\"k\": 1}}\nBy {doctor_name}",
                Map.of("patient_name", "Jane Roe", "doctor_name", "Dr. Who"));
        assertEquals("Patient: Jane Roe\nJSON: {\"k\": 1}\nBy Dr. Who", out);
    }

    @Test
    public void testValuesAreNotReparsed() {
        assertEquals("{accession}", SkeletonFormatter.format("{indication}", Map.of("indication", "{accession}")));
    }

    @Test
    public void testUnknownPlaceholder() {
        PlaceholderResolutionException e = assertThrows(PlaceholderResolutionException.class,
                () -> SkeletonFormatter.format("Ward: {ward}", Map.of("patient_name", "x")));
        assertEquals("ward", e.getPlaceholder());
    }

    @Test
    public void testNullValue() {
        Map<String, String> values = new HashMap<>();
        values.put("referrer", null);
        assertThrows(PlaceholderResolutionException.class, () -> SkeletonFormatter.format("Ref: {referrer}", values));
    }

    @Test
    public void testUnbalancedBraces() {
        assertThrows(PlaceholderResolutionException.class, () -> SkeletonFormatter.format("open {brace", Map.of()));
        assertThrows(PlaceholderResolutionException.class, () -> SkeletonFormatter.format("close } brace", Map.of()));
    }
}
