package com.taskcopilot.security;

import com.taskcopilot.common.config.HooksConfig.CustomRuleConfig;
import com.taskcopilot.common.infra.ToolInputs;
import com.taskcopilot.common.model.PolicyAction;
import com.taskcopilot.security.SecurityRuleTools.ListResponse;
import com.taskcopilot.security.SecurityRuleTools.RegisterResponse;
import com.taskcopilot.security.SecurityRuleTools.TestResponse;
import com.taskcopilot.security.SecurityRuleTools.ToggleResponse;
import com.taskcopilot.security.rules.DefaultSecurityRules;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SecurityRuleToolsTest {

    SecurityRuleEngine engine;
    SecurityRuleTools tools;

    @BeforeEach
    void setUp() {
        engine = new SecurityRuleEngine();
        DefaultSecurityRules.install(engine);
        tools = new SecurityRuleTools(engine);
    }

    @Test
    void registerCustomRules() {
        RegisterResponse response = tools.registerRules(List.of(
                CustomRuleConfig.builder().id("no-prod").name("No prod").patterns(List.of("prod-db"))
                        .action(PolicyAction.BLOCK).build()),
                false);

        assertTrue(response.success());
        assertEquals(List.of("no-prod"), response.registered());
        assertEquals("Registered 1 custom security rule(s)", response.message());
        assertFalse(engine.evaluate("Bash", Map.of("command", "psql prod-db")).allowed());
    }

    @Test
    void invalidCustomRuleReportsFailure() {
        RegisterResponse response = tools.registerRules(List.of(
                CustomRuleConfig.builder().id("ok").patterns(List.of("x")).build(),
                CustomRuleConfig.builder().name("no id").build()),
                false);

        assertFalse(response.success());
        assertEquals(List.of("ok"), response.registered());
        assertTrue(response.message().startsWith("Failed to register rules: "));
    }

    @Test
    void resetRestoresDefaults() {
        tools.registerRules(List.of(CustomRuleConfig.builder().id("extra").patterns(List.of("x")).build()), false);
        tools.toggleRule("secret-detection", false);

        RegisterResponse response = tools.registerRules(null, true);

        assertTrue(response.success());
        assertEquals(DefaultSecurityRules.ruleIds(), response.registered());
        assertEquals(4, engine.size());
        assertTrue(engine.getRule("secret-detection").orElseThrow().enabled());
        assertTrue(engine.getRule("extra").isEmpty());
    }

    @Test
    void listRulesCountsEnabledAndDisabled() {
        tools.toggleRule("credential-url", false);

        ListResponse enabledOnly = tools.listRules(false, null);
        ListResponse all = tools.listRules(true, null);

        assertEquals(3, enabledOnly.rules().size());
        assertEquals(4, all.rules().size());
        assertEquals(4, all.totalCount());
        assertEquals(3, all.enabledCount());
    }

    @Test
    void listSingleRule() {
        ListResponse one = tools.listRules(false, "destructive-command");
        ListResponse missing = tools.listRules(false, "nope");

        assertEquals(1, one.totalCount());
        assertEquals(85, one.rules().get(0).priority());
        assertEquals(0, missing.totalCount());
        assertTrue(missing.rules().isEmpty());
    }

    @Test
    void testCallRendersLabels() {
        TestResponse response = tools.testCall("Bash", ToolInputs.of(Map.of("command", "rm -rf /")));

        assertEquals("Bash", response.toolName());
        assertFalse(response.allowed());
        assertEquals("block", response.action());
        assertEquals("critical", response.violations().get(0).severity());
        assertEquals("destructive-command", response.violations().get(0).ruleName());
    }

    @Test
    void toggleResponses() {
        ToggleResponse off = tools.toggleRule("secret-detection", false);
        ToggleResponse missing = tools.toggleRule("nope", true);

        assertTrue(off.success());
        assertEquals("Rule 'secret-detection' disabled", off.message());
        assertFalse(missing.success());
        assertFalse(missing.enabled());
        assertEquals("Rule 'nope' not found", missing.message());
    }
}
