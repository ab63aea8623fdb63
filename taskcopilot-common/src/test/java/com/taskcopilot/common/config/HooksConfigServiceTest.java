package com.taskcopilot.common.config;

import com.taskcopilot.common.model.PolicyAction;
import com.taskcopilot.common.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HooksConfigServiceTest {

    @TempDir
    Path tempDir;
    private Path configPath;

    @BeforeEach
    void setUp() {
        configPath = tempDir.resolve("hooks.json");
    }

    @Test
    void loadConfig_validJson_returnsConfig() throws IOException {
        String json = """
                {
                  "hooks": { "defaultTimeoutMs": 250, "maxHooksPerType": 10 },
                  "security": {
                    "disabledRules": ["credential-url"],
                    "customRules": [
                      { "id": "no-todo", "name": "No TODO", "patterns": ["TODO"],
                        "severity": "high", "action": "block" }
                    ]
                  }
                }
                """;
        Files.writeString(configPath, json);

        HooksConfig config = new HooksConfigService(configPath).loadConfig();

        assertEquals(250, config.getHooks().getDefaultTimeoutMs());
        assertEquals(10, config.getHooks().getMaxHooksPerType());
        assertEquals(3, config.getHooks().getDefaultPriority());
        assertEquals(List.of("credential-url"), config.getSecurity().getDisabledRules());
        HooksConfig.CustomRuleConfig rule = config.getSecurity().getCustomRules().get(0);
        assertEquals("no-todo", rule.getId());
        assertEquals(Severity.HIGH, rule.getSeverity());
        assertEquals(PolicyAction.BLOCK, rule.getAction());
        assertNull(rule.getPriority());
        // untouched sections fall back to defaults
        assertTrue(config.getAutoCheckpoint().getTriggers().isIterationStart());
        assertFalse(config.getAutoCheckpoint().getTriggers().isWorkProductStore());
    }

    @Test
    void loadConfig_missingFile_returnsDefaults() {
        HooksConfig config = new HooksConfigService(tempDir.resolve("nonexistent.json")).loadConfig();

        assertNotNull(config.getHooks());
        assertEquals(5000, config.getHooks().getDefaultTimeoutMs());
        assertTrue(config.getSecurity().isEnabled());
        assertEquals(1, config.getSecurity().getHookPriority());
        assertEquals(List.of("task_blocked", "error", "context_limit", "user_interrupt"),
                config.getAutoCheckpoint().getStopTriggers());
    }

    @Test
    void loadConfig_invalidJson_returnsDefaults() throws IOException {
        Files.writeString(configPath, "{ not json");

        HooksConfig config = new HooksConfigService(configPath).loadConfig();

        assertEquals(100, config.getSecurity().getMaxRules());
    }

    @Test
    void loadConfig_substitutesEnvironment() throws IOException {
        Files.writeString(configPath, """
                { "hooks": { "defaultTimeoutMs": ${HOOK_TIMEOUT:-900}, "defaultPriority": ${HOOK_PRIORITY} } }
                """);
        HooksConfigService service = new HooksConfigService(
                configPath, Duration.ofMillis(200), Map.of("HOOK_PRIORITY", "2"));

        HooksConfig config = service.loadConfig();

        assertEquals(900, config.getHooks().getDefaultTimeoutMs());
        assertEquals(2, config.getHooks().getDefaultPriority());
    }

    @Test
    void substituteEnvVars_plainString_noChange() {
        HooksConfigService service = new HooksConfigService(configPath);
        assertEquals("hello", service.substituteEnvVars("hello"));
    }

    @Test
    void loadConfig_isCached() throws IOException {
        Files.writeString(configPath, """
                { "hooks": { "defaultPriority": 4 } }
                """);

        HooksConfigService service = new HooksConfigService(configPath);
        HooksConfig first = service.loadConfig();
        HooksConfig second = service.loadConfig();

        assertSame(first, second);
    }

    @Test
    void reloadConfig_bypassesCache() throws IOException {
        Files.writeString(configPath, """
                { "hooks": { "defaultPriority": 4 } }
                """);
        HooksConfigService service = new HooksConfigService(configPath);
        assertEquals(4, service.loadConfig().getHooks().getDefaultPriority());

        Files.writeString(configPath, """
                { "hooks": { "defaultPriority": 2 } }
                """);

        assertEquals(2, service.reloadConfig().getHooks().getDefaultPriority());
    }
}
