package com.gdin.inspection.erpvector.integrity.json;

import com.gdin.inspection.erpvector.source.ErpSourceClient;
import com.gdin.inspection.erpvector.source.ReadOptions;
import com.gdin.inspection.erpvector.support.TestSchemas;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class JsonFkDetectorTest {
    private final JsonFkDetector namingOnly = new JsonFkDetector(TestSchemas.catalog(), null);

    @Test
    void analyticDistributionByName() {
        JsonFkCandidate c = namingOnly.evaluate("account.move.line", "analytic_distribution", null);
        assertTrue(c.isFk());
        assertEquals(0.95, c.getConfidence());
        assertEquals("account.analytic.account", c.getLikelyTargetModel());
        assertEquals("naming", c.getDetectionMethod());
    }

    @Test
    void namingExclusionsAndMetadata() {
        assertNull(namingOnly.evaluate("product.product", "name_search", null));

        JsonFkCandidate display = namingOnly.evaluate("res.partner", "display_options", null);
        assertEquals(JsonFieldClass.METADATA, display.getClassification());
        assertEquals(0.7, display.getConfidence());
        assertNull(display.getLikelyTargetModel());

        JsonFkCandidate unknown = namingOnly.evaluate("res.partner", "properties", null);
        assertEquals(0.5, unknown.getConfidence());
    }

    @Test
    void samplesConfirmOrOverrideNaming() {
        JsonFkCandidate confirmed = namingOnly.evaluate("account.move.line", "analytic_distribution",
                List.of(Map.of("5029", 100), Map.of("12", 40.0, "13", 60.0)));
        assertTrue(confirmed.isFk());
        assertEquals(0.98, confirmed.getConfidence());
        assertEquals("both", confirmed.getDetectionMethod());

        JsonFkCandidate stages = namingOnly.evaluate("crm.lead", "stage_history",
                List.of(Map.of("draft", "2024-01-01", "won", "2024-02-01")));
        assertEquals(JsonFieldClass.METADATA, stages.getClassification());
        assertEquals(1.0, stages.getConfidence());
    }

    @Test
    void sampleAnalysis() {
        JsonFkDetector.SampleAnalysis numeric = JsonFkDetector.analyze(List.of(Map.of("1", 50, "2", 50)));
        assertTrue(numeric.fk);
        assertEquals(1.0, numeric.confidence);

        JsonFkDetector.SampleAnalysis nested = JsonFkDetector.analyze(List.of(Map.of("layout", Map.of("x", 1))));
        assertFalse(nested.fk);

        JsonFkDetector.SampleAnalysis empty = JsonFkDetector.analyze(List.of(Map.of()));
        assertFalse(empty.fk);
        assertEquals(0.5, empty.confidence);
    }

    @Test
    void detectSamplesFromErpAndSkipsConfigured() {
        ErpSourceClient source = mock(ErpSourceClient.class);
        when(source.searchRead(eq("account.move.line"), anyList(), anyList(), any(ReadOptions.class)))
                .thenReturn(List.<Map<String, Object>>of(
                        Map.of("analytic_distribution", Map.of("7", 100)),
                        Map.of("analytic_distribution", "{\"8\": 30, \"9\": 70}")));
        JsonFkDetector detector = new JsonFkDetector(TestSchemas.catalog(), source);

        List<JsonFkCandidate> found = detector.detect(null, 0.8, 5, Set.of());
        assertEquals(1, found.size());
        assertEquals("both", found.get(0).getDetectionMethod());

        assertTrue(detector.detect(null, 0.8, 5, Set.of("account.move.line:analytic_distribution")).isEmpty());
        assertTrue(detector.detect("res.partner", 0.0, 5, Set.of()).isEmpty());
    }

    @Test
    void mappingsBelowThresholdAreDropped() {
        List<JsonFkCandidate> candidates = List.of(
                namingOnly.evaluate("account.move.line", "analytic_distribution", null),
                namingOnly.evaluate("res.partner", "display_options", null));
        List<JsonFkMapping> mappings = namingOnly.toMappings(candidates, 0.85);
        assertEquals(1, mappings.size());
        JsonFkMapping m = mappings.get(0);
        assertEquals("account.move.line:analytic_distribution", m.key());
        assertEquals("record_id", m.getKeyType());
        assertEquals("percentage", m.getValueType());
        assertNull(m.getKeyTargetModelId());

        assertEquals(2, namingOnly.toMappings(candidates, 0.5).size());
    }
}
