package com.taskcopilot.security;

import com.taskcopilot.common.model.PolicyAction;
import com.taskcopilot.common.model.Severity;
import com.taskcopilot.common.model.ToolCallContext;
import com.taskcopilot.hooks.HookExecutor;
import com.taskcopilot.hooks.HookRegistry;
import com.taskcopilot.hooks.HookResults.PreActionOutcome;
import com.taskcopilot.hooks.HookResults.PreActionResult;
import com.taskcopilot.hooks.HookResults.PreActionStatus;
import com.taskcopilot.hooks.HookTypes.PreActionHook;
import com.taskcopilot.security.rules.DefaultSecurityRules;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SecurityPreActionHookTest {

    SecurityRuleEngine engine;
    HookRegistry registry;
    HookExecutor executor;

    @BeforeEach
    void setUp() {
        engine = new SecurityRuleEngine();
        DefaultSecurityRules.install(engine);
        registry = new HookRegistry();
        executor = new HookExecutor(registry);
        registry.register(SecurityPreActionHook.create(engine));
    }

    @AfterEach
    void tearDown() {
        executor.close();
    }

    @Test
    void blockedCallStopsLaterHooks() {
        AtomicInteger later = new AtomicInteger();
        registry.register(PreActionHook.builder().id("audit").priority(3)
                .handler(ctx -> {
                    later.incrementAndGet();
                    return PreActionResult.allow();
                }).build());

        PreActionOutcome outcome = executor.runPreAction(
                ToolCallContext.of("Bash", Map.of("command", "rm -rf /")));

        assertFalse(outcome.allowed());
        assertEquals(PolicyAction.BLOCK, outcome.action());
        assertEquals("Detected destructive command: Recursive force delete from root", outcome.violations().get(0));
        assertEquals(Severity.CRITICAL, outcome.results().get(0).getSeverity());
        assertEquals(0, later.get());
    }

    @Test
    void warningsPassThrough() {
        PreActionOutcome outcome = executor.runPreAction(
                ToolCallContext.of("Bash", Map.of("command", "chmod 777 out")));

        assertTrue(outcome.allowed());
        assertEquals(PolicyAction.WARN, outcome.action());
        assertEquals(1, outcome.warnings().size());
        assertEquals(PreActionStatus.WARN, outcome.results().get(0).getStatus());
    }

    @Test
    void cleanCallIsAllowed() {
        PreActionOutcome outcome = executor.runPreAction(
                ToolCallContext.of("Write", Map.of("file_path", "src/Main.java", "content", "class Main {}")));

        assertTrue(outcome.allowed());
        assertEquals(PolicyAction.ALLOW, outcome.action());
    }

    @Test
    void hookUsesConfiguredIdAndPriority() {
        PreActionHook hook = SecurityPreActionHook.create(engine, 2);

        assertEquals("security-rules", hook.getId());
        assertEquals(2, hook.getPriority());
    }
}
