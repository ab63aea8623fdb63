package com.taskcopilot.common.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ToolCallContextTest {

    @Test
    void metadata_isCopiedFromTheCallersMap() {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("k", "v1");
        ToolCallContext ctx = ToolCallContext.builder().toolName("Bash").metadata(metadata).build();

        metadata.put("k", "v2");
        metadata.put("extra", true);

        assertEquals(Map.of("k", "v1"), ctx.getMetadata());
        assertThrows(UnsupportedOperationException.class, () -> ctx.getMetadata().put("k", "v3"));
    }

    @Test
    void metadata_survivesToBuilder() {
        ToolCallContext ctx = ToolCallContext.builder().toolName("Bash").metadata(Map.of("k", "v1")).build();

        ToolCallContext copy = ctx.toBuilder().toolName("Run").build();

        assertEquals(Map.of("k", "v1"), copy.getMetadata());
        assertTrue(ToolCallContext.of("Bash", Map.of()).getMetadata().isEmpty());
    }

    @Test
    void toolInput_isCopiedInAndOut() {
        ToolCallContext ctx = ToolCallContext.of("Write", Map.of("file_path", "a.txt"));

        ((ObjectNode) ctx.getToolInput()).put("file_path", ".env");

        assertEquals("a.txt", ctx.getToolInput().get("file_path").asText());
    }
}
