package com.gdin.radiology.report.safety;

import com.gdin.radiology.report.models.ValidationSeverity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ValidationResponseParserTest {

    @Test
    public void testQuotedItems() {
        ValidationResponseParser.ParsedValidation parsed = ValidationResponseParser.parse("""
                ERRORS: ["Laterality mismatch", "Missing measurement"]
                WARNINGS: [none]
                INCONSISTENCIES: []
                SEVERITY: High""");

        assertEquals(List.of("Laterality mismatch", "Missing measurement"), parsed.getErrors());
        assertTrue(parsed.getWarnings().isEmpty());
        assertTrue(parsed.getInconsistencies().isEmpty());
        assertEquals(ValidationSeverity.HIGH, parsed.getSeverity());
    }

    @Test
    public void testBulletListOverSeveralLines() {
        ValidationResponseParser.ParsedValidation parsed = ValidationResponseParser.parse("""
                ERRORS: []
                WARNINGS: [
                - Impression is brief
                - Consider follow-up
                ]
                SEVERITY: [medium]""");

        assertEquals(List.of("Impression is brief", "Consider follow-up"), parsed.getWarnings());
        assertEquals(ValidationSeverity.MEDIUM, parsed.getSeverity());
    }

    @Test
    public void testMissingAndUnknownSeverity() {
        assertNull(ValidationResponseParser.parse("ERRORS: [a, b]").getSeverity());
        assertEquals(List.of("a", "b"), ValidationResponseParser.parse("ERRORS: [a, b]").getErrors());
        assertEquals(ValidationSeverity.UNKNOWN, ValidationResponseParser.parse("SEVERITY: catastrophic").getSeverity());
        assertTrue(ValidationResponseParser.parse(null).getErrors().isEmpty());
    }
}
