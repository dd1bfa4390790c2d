package com.property.linkage.bulk;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.property.linkage.api.LinkageSummary;
import com.property.linkage.api.RunSummary;
import com.property.linkage.core.model.DatasetKind;
import com.property.linkage.core.model.MatchStrategy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SummaryJsonWriterTest {

    private static RunSummary summary() {
        LinkageSummary liens = new LinkageSummary("liens.csv", DatasetKind.NICHE, 10, 1, 1, 0, 6, 6, 2, 2,
                Map.of(MatchStrategy.STRUCTURED_ID, 4L, MatchStrategy.NONE, 2L), 15, null);
        LinkageSummary broken = LinkageSummary.failure("vacant.csv", DatasetKind.NICHE, "missing FIPS");
        Map<String, Long> distribution = new LinkedHashMap<>();
        distribution.put("ABS1", 40L);
        distribution.put("Liens-ABS1", 6L);
        return new RunSummary("run-1", "roanoke_city", "Roanoke City", "51770",
                "2026-06-01T00:00:00Z", "2026-06-01T00:01:00Z", 100, 3, List.of(liens, broken), 105, distribution);
    }

    @Test
    @DisplayName("Should serialize the run summary")
    void testToJson() throws IOException {
        JsonNode json = new ObjectMapper().readTree(new SummaryJsonWriter().toJson(summary()));

        assertEquals("roanoke_city", json.get("regionKey").asText());
        assertEquals(105, json.get("finalRegistrySize").asLong());
        assertEquals(2, json.get("datasets").size());

        JsonNode liens = json.get("datasets").get(0);
        assertEquals("NICHE", liens.get("kind").asText());
        assertEquals(4, liens.get("strategyBreakdown").get("STRUCTURED_ID").asLong());
        assertFalse(liens.get("failed").asBoolean());

        JsonNode broken = json.get("datasets").get(1);
        assertTrue(broken.get("failed").asBoolean());
        assertEquals("missing FIPS", broken.get("error").asText());

        assertEquals(List.of("ABS1", "Liens-ABS1"), fieldNames(json.get("priorityCodeDistribution")));
    }

    @Test
    @DisplayName("Should write the summary file")
    void testWrite(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("summary.json");

        new SummaryJsonWriter().write(summary(), file);

        assertEquals("run-1", new ObjectMapper().readTree(file.toFile()).get("runId").asText());
    }

    private static List<String> fieldNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }
}
