package com.taskcopilot.hooks.checkpoint;

import com.taskcopilot.common.config.HooksConfig.AutoCheckpointConfig;
import com.taskcopilot.common.config.HooksConfig.Triggers;
import com.taskcopilot.common.model.ToolCallContext;
import com.taskcopilot.hooks.HookContexts.StopContext;
import com.taskcopilot.hooks.HookContexts.TaskState;
import com.taskcopilot.hooks.HookExecutor;
import com.taskcopilot.hooks.HookRegistry;
import com.taskcopilot.hooks.HookResults.StopOutcome;
import com.taskcopilot.hooks.HookTypes.HookType;
import com.taskcopilot.hooks.HookTypes.StopTrigger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class AutoCheckpointHooksTest {

    /** Records every request; fails when {@code failing} is set. */
    static class RecordingClient implements CheckpointClient {
        final List<CheckpointRequest> requests = new CopyOnWriteArrayList<>();
        volatile boolean failing;

        @Override
        public String createCheckpoint(CheckpointRequest request) {
            if (failing) {
                throw new IllegalStateException("database locked");
            }
            requests.add(request);
            return "cp-" + requests.size();
        }
    }

    RecordingClient client;
    AutoCheckpointHooks hooks;
    HookRegistry registry;
    HookExecutor executor;

    @BeforeEach
    void setUp() {
        client = new RecordingClient();
        hooks = new AutoCheckpointHooks(client);
        registry = new HookRegistry();
        executor = new HookExecutor(registry);
    }

    @AfterEach
    void tearDown() {
        executor.close();
    }

    @Test
    void iterationStartCreatesIterationCheckpoint() {
        hooks.onIterationStart("T1", 3);

        CheckpointRequest request = client.requests.get(0);
        assertEquals("T1", request.getTaskId());
        assertEquals(CheckpointRequest.Trigger.AUTO_ITERATION, request.getTrigger());
        assertEquals("iteration", request.getExecutionPhase());
        assertEquals(3, request.getExecutionStep());
        assertEquals(true, request.getAgentContext().get("autoCreated"));
    }

    @Test
    void iterationFailureKeepsDraft() {
        hooks.onIterationFailure("T1", 2, Map.of("passed", false), "draft output");

        CheckpointRequest request = client.requests.get(0);
        assertEquals("iteration_failed", request.getExecutionPhase());
        assertEquals("draft output", request.getDraftContent());
        assertEquals("implementation", request.getDraftType());
    }

    @Test
    void defaultTriggersSkipStatusChangesAndWorkProducts() {
        hooks.onTaskStatusChange("T1", "pending", "in_progress");
        hooks.onWorkProductStore("T1", "WP-1", "implementation");

        assertTrue(client.requests.isEmpty());
    }

    @Test
    void onlySignificantTransitionsAreCheckpointed() {
        hooks.updateConfig(AutoCheckpointConfig.builder()
                .triggers(Triggers.builder().taskStatusChange(true).build())
                .build());

        hooks.onTaskStatusChange("T1", "pending", "in_progress");
        hooks.onTaskStatusChange("T1", "in_progress", "completed");
        hooks.onTaskStatusChange("T1", "blocked", "in_progress");

        assertEquals(2, client.requests.size());
        assertEquals(CheckpointRequest.Trigger.MANUAL, client.requests.get(0).getTrigger());
        assertEquals("status_change", client.requests.get(0).getExecutionPhase());
    }

    @Test
    void disabledConfigCreatesNothing() {
        hooks.updateConfig(AutoCheckpointConfig.builder().enabled(false).build());

        hooks.onIterationStart("T1", 1);

        assertTrue(client.requests.isEmpty());
        assertFalse(hooks.getConfig().isEnabled());
    }

    @Test
    void clientFailureIsSwallowed() {
        client.failing = true;

        assertDoesNotThrow(() -> hooks.onIterationStart("T1", 1));
    }

    @Test
    void getConfigReturnsACopy() {
        hooks.getConfig().getTriggers().setIterationStart(false);

        assertTrue(hooks.getConfig().getTriggers().isIterationStart());
    }

    @Test
    void installedStopHookCheckpointsOnConfiguredTriggers() {
        hooks.install(registry);

        StopOutcome blocked = executor.runStop(StopContext.builder()
                .trigger(StopTrigger.TASK_BLOCKED)
                .taskState(new TaskState("T9", "blocked", null))
                .modifiedFiles(List.of("a.java"))
                .build());
        executor.runStop(StopContext.builder().trigger(StopTrigger.TASK_COMPLETE).taskId("T9").build());

        assertTrue(blocked.allSucceeded());
        assertEquals(1, client.requests.size());
        CheckpointRequest request = client.requests.get(0);
        assertEquals("T9", request.getTaskId());
        assertEquals(CheckpointRequest.Trigger.AUTO_STOP, request.getTrigger());
        assertEquals("task_blocked", request.getAgentContext().get("stopTrigger"));
    }

    @Test
    void stopHookReportsCheckpointFailure() {
        hooks.install(registry);
        client.failing = true;

        StopOutcome outcome = executor.runStop(StopContext.builder()
                .trigger(StopTrigger.ERROR).taskId("T1").build());

        assertFalse(outcome.allSucceeded());
        assertTrue(outcome.reports().get(0).success());
    }

    @Test
    void installedIterationHookFiresForIterationTools() {
        hooks.install(registry);

        executor.runPreAction(ToolCallContext.builder()
                .toolName("iteration_start")
                .toolInput(Map.of("taskId", "T4", "iterationNumber", 2))
                .build());
        executor.runPreAction(ToolCallContext.builder()
                .toolName("Bash")
                .taskId("T4")
                .toolInput(Map.of("command", "ls"))
                .build());

        assertEquals(1, client.requests.size());
        assertEquals("T4", client.requests.get(0).getTaskId());
        assertEquals(2, client.requests.get(0).getExecutionStep());
    }

    @Test
    void uninstallRemovesBothHooks() {
        hooks.install(registry);
        assertEquals(1, registry.count(HookType.STOP));
        assertEquals(1, registry.count(HookType.PRE_ACTION));

        hooks.uninstall(registry);

        assertEquals(0, registry.stats().total());
    }
}
