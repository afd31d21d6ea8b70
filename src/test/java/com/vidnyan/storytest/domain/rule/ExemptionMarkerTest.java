package com.vidnyan.storytest.domain.rule;

import com.vidnyan.storytest.domain.model.AttributeRef;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExemptionMarkerTest {

    @Test
    void markerWithReason_IsValid() {
        List<AttributeRef> attributes = List.of(
                AttributeRef.of("StoryIgnoreAttribute", Map.of("Reason", "Called via reflection")));

        assertEquals(ExemptionMarker.Status.VALID, ExemptionMarker.inspect(attributes));
    }

    @Test
    void markerWithoutReason_IsNotAnExemption() {
        assertEquals(ExemptionMarker.Status.MISSING_REASON,
                ExemptionMarker.inspect(List.of(AttributeRef.of("StoryIgnore"))));
        assertEquals(ExemptionMarker.Status.MISSING_REASON,
                ExemptionMarker.inspect(List.of(AttributeRef.of("StoryIgnore", Map.of("reason", "  ")))));
    }

    @Test
    void noMarker() {
        assertEquals(ExemptionMarker.Status.NONE, ExemptionMarker.inspect(List.of(AttributeRef.of("Serializable"))));
    }
}
