package me.christianrobert.synthdb.semantic.service;

import me.christianrobert.synthdb.semantic.model.SemanticCategory;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SamplePatternInferenceTest {

    @Test
    void testMacAddress() {
        assertEquals(Optional.of(SemanticCategory.MAC_ADDRESS), SamplePatternInference.infer("00:1a:2B:3c:4d:5e"));
    }

    @Test
    void testIpv4RequiresByteRange() {
        assertEquals(Optional.of(SemanticCategory.IPV4_ADDRESS), SamplePatternInference.infer("192.168.0.10"));
        assertTrue(SamplePatternInference.isIpv4("255.255.255.255"));
        assertFalse(SamplePatternInference.isIpv4("10.0.0.300"));
        assertFalse(SamplePatternInference.isIpv4("10.0.0"));
    }

    @Test
    void testEmail() {
        assertEquals(Optional.of(SemanticCategory.EMAIL), SamplePatternInference.infer("jane.doe@example.com"));
        assertTrue(SamplePatternInference.infer("@example.com").isEmpty());
        assertTrue(SamplePatternInference.infer("jane@localhost").isEmpty());
    }

    @Test
    void testClosedVocabulariesIgnoreCase() {
        assertEquals(Optional.of(SemanticCategory.STATUS), SamplePatternInference.infer("Active"));
        assertEquals(Optional.of(SemanticCategory.SKILL_LEVEL), SamplePatternInference.infer("expert"));
        assertEquals(Optional.of(SemanticCategory.PRIORITY), SamplePatternInference.infer(" HIGH "));
        assertEquals(Optional.of(SemanticCategory.CLASSIFICATION), SamplePatternInference.infer("confidential"));
    }

    @Test
    void testNoEvidence() {
        assertTrue(SamplePatternInference.infer(null).isEmpty());
        assertTrue(SamplePatternInference.infer("").isEmpty());
        assertTrue(SamplePatternInference.infer("Lorem ipsum").isEmpty());
    }
}
