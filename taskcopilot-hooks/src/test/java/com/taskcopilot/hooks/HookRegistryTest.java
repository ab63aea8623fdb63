package com.taskcopilot.hooks;

import com.taskcopilot.common.infra.RegistrationCapacityExceededException;
import com.taskcopilot.hooks.HookResults.PreActionResult;
import com.taskcopilot.hooks.HookTypes.HookRegistration;
import com.taskcopilot.hooks.HookTypes.HookScope;
import com.taskcopilot.hooks.HookTypes.HookSummary;
import com.taskcopilot.hooks.HookTypes.HookType;
import com.taskcopilot.hooks.HookTypes.LifecycleHook;
import com.taskcopilot.hooks.HookTypes.PreActionHook;
import com.taskcopilot.hooks.HookTypes.ScopeFilter;
import com.taskcopilot.hooks.HookTypes.StopHook;
import com.taskcopilot.hooks.HookTypes.StopTrigger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HookRegistryTest {

    HookRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new HookRegistry();
    }

    static PreActionHook preHook(String id, Integer priority) {
        return PreActionHook.builder()
                .id(id)
                .name(id)
                .priority(priority)
                .handler(ctx -> PreActionResult.allow())
                .build();
    }

    static List<String> ids(List<? extends LifecycleHook> hooks) {
        return hooks.stream().map(LifecycleHook::getId).toList();
    }

    @Nested
    class Registration {

        @Test
        void generatesIdWhenMissing() {
            HookRegistration reg = registry.register(preHook(null, null));

            assertTrue(reg.hookId().matches("pre_action-[0-9a-z]+-[0-9a-z]{6}"), reg.hookId());
            assertEquals(HookScope.GLOBAL, reg.scope());
            assertTrue(reg.active());
            assertNotNull(reg.registeredAt());
        }

        @Test
        void registerThenListReturnsHookOnce() {
            registry.register(preHook("h1", 2));

            assertEquals(List.of("h1"), ids(registry.listApplicable(HookType.PRE_ACTION, ScopeFilter.NONE)));

            assertTrue(registry.unregister("h1", HookType.PRE_ACTION));
            assertTrue(registry.listApplicable(HookType.PRE_ACTION, ScopeFilter.NONE).isEmpty());
            assertFalse(registry.unregister("h1", HookType.PRE_ACTION));
        }

        @Test
        void duplicateIdReplacesEarlierEntry() {
            registry.register(preHook("dup", 1));
            registry.register(preHook("dup", 4));

            assertEquals(1, registry.count(HookType.PRE_ACTION));
            assertEquals(4, registry.get("dup", HookType.PRE_ACTION).orElseThrow().getPriority());
        }

        @Test
        void replacedHookKeepsItsTiePosition() {
            registry.register(preHook("a", 2));
            registry.register(preHook("b", 2));
            registry.register(preHook("a", 2));

            assertEquals(List.of("a", "b"),
                    ids(registry.listApplicable(HookType.PRE_ACTION, ScopeFilter.NONE)));
        }

        @Test
        void capacityIsEnforcedPerType() {
            HookRegistry small = new HookRegistry(2, 3);
            small.register(preHook("a", null));
            small.register(preHook("b", null));

            RegistrationCapacityExceededException e = assertThrows(RegistrationCapacityExceededException.class,
                    () -> small.register(preHook("c", null)));
            assertEquals("Maximum hooks (2) reached for type pre_action", e.getMessage());

            // replacing an existing id is not a new registration
            assertDoesNotThrow(() -> small.register(preHook("a", 1)));
            // other types have their own budget
            assertDoesNotThrow(() -> small.register(StopHook.builder().id("s").build()));
        }

        @Test
        void defaultCeilingIsOneHundred() {
            for (int i = 0; i < HookRegistry.MAX_HOOKS_PER_TYPE; i++) {
                registry.register(preHook("h" + i, null));
            }
            assertThrows(RegistrationCapacityExceededException.class, () -> registry.register(preHook("x", null)));
        }

        @Test
        void storedHookIsACopy() {
            PreActionHook hook = preHook("h1", 1);
            registry.register(hook);

            hook.setEnabled(false);
            ((PreActionHook) registry.get("h1", HookType.PRE_ACTION).orElseThrow()).setPriority(5);

            LifecycleHook stored = registry.get("h1", HookType.PRE_ACTION).orElseThrow();
            assertTrue(stored.isEnabled());
            assertEquals(1, stored.getPriority());
        }

        @Test
        void patternListsAreNotShared() {
            List<String> patterns = new ArrayList<>(List.of("Bash"));
            registry.register(PreActionHook.builder().id("h1").toolPatterns(patterns)
                    .handler(ctx -> PreActionResult.allow()).build());

            patterns.add("Write");
            PreActionHook fetched = (PreActionHook) registry.get("h1", HookType.PRE_ACTION).orElseThrow();
            fetched.getToolPatterns().add("Edit");
            registry.listApplicable(HookType.PRE_ACTION, ScopeFilter.NONE, PreActionHook.class)
                    .get(0).getToolPatterns().add("Run");

            List<PreActionHook> applicable =
                    registry.listApplicable(HookType.PRE_ACTION, ScopeFilter.NONE, PreActionHook.class);
            assertEquals(List.of("Bash"), applicable.get(0).getToolPatterns());
        }

        @Test
        void stopTriggersSurviveToggle() {
            List<StopTrigger> triggers = new ArrayList<>(List.of(StopTrigger.SESSION_END));
            registry.register(StopHook.builder().id("s1").triggers(triggers).build());
            registry.toggle("s1", HookType.STOP, false);

            triggers.add(StopTrigger.ERROR);

            StopHook stored = (StopHook) registry.get("s1", HookType.STOP).orElseThrow();
            assertFalse(stored.isEnabled());
            assertEquals(List.of(StopTrigger.SESSION_END), stored.getTriggers());
        }
    }

    @Nested
    class Ordering {

        @Test
        void ascendingPriorityWithRegistrationOrderTieBreak() {
            registry.register(preHook("late", 5));
            registry.register(preHook("first-default", null));
            registry.register(preHook("early", 1));
            registry.register(preHook("second-default", 3));

            assertEquals(List.of("early", "first-default", "second-default", "late"),
                    ids(registry.listApplicable(HookType.PRE_ACTION, ScopeFilter.NONE)));
        }

        @Test
        void getAllKeepsRegistrationOrderAndDisabledHooks() {
            registry.register(preHook("b", 5));
            registry.register(preHook("a", 1));
            registry.toggle("b", HookType.PRE_ACTION, false);

            assertEquals(List.of("b", "a"), ids(registry.getAll(HookType.PRE_ACTION)));
            assertEquals(List.of("a"), ids(registry.listApplicable(HookType.PRE_ACTION, ScopeFilter.NONE)));
        }
    }

    @Nested
    class Scoping {

        @Test
        void taskScopedHookOnlyVisibleToItsTask() {
            registry.register(preHook("task-hook", null), HookScope.TASK, null, "T1");

            assertEquals(List.of("task-hook"),
                    ids(registry.listApplicable(HookType.PRE_ACTION, new ScopeFilter(null, "T1"))));
            assertTrue(registry.listApplicable(HookType.PRE_ACTION, new ScopeFilter(null, "T2")).isEmpty());
            assertTrue(registry.listApplicable(HookType.PRE_ACTION, ScopeFilter.NONE).isEmpty());
        }

        @Test
        void agentScopedHookOnlyVisibleToItsAgent() {
            registry.register(preHook("agent-hook", null), HookScope.AGENT, "qa", null);
            registry.register(preHook("global-hook", null));

            assertEquals(List.of("agent-hook", "global-hook"),
                    ids(registry.listApplicable(HookType.PRE_ACTION, new ScopeFilter("qa", null))));
            assertEquals(List.of("global-hook"),
                    ids(registry.listApplicable(HookType.PRE_ACTION, new ScopeFilter("me", "T1"))));
        }
    }

    @Nested
    class Administration {

        @Test
        void toggleUnknownHookReturnsFalse() {
            assertFalse(registry.toggle("missing", HookType.STOP, true));
        }

        @Test
        void toggleKeepsPositionInOrder() {
            registry.register(preHook("a", 3));
            registry.register(preHook("b", 3));
            registry.toggle("a", HookType.PRE_ACTION, false);
            registry.toggle("a", HookType.PRE_ACTION, true);

            assertEquals(List.of("a", "b"), ids(registry.listApplicable(HookType.PRE_ACTION, ScopeFilter.NONE)));
        }

        @Test
        void listAllAndStatsCoverEveryType() {
            registry.register(preHook("p", 2), HookScope.AGENT, "qa", null);
            registry.register(StopHook.builder().id("s").name("stop").build());

            List<HookSummary> all = registry.listAll();
            assertEquals(2, all.size());
            HookSummary pre = all.get(0);
            assertEquals(HookType.PRE_ACTION, pre.type());
            assertEquals("qa", pre.agentId());
            assertEquals(2, pre.priority());
            assertEquals(3, all.get(1).priority());

            assertEquals(2, registry.stats().total());
            assertEquals(1, registry.stats().count(HookType.STOP));
            assertEquals(0, registry.stats().count(HookType.POST_ACTION));
        }

        @Test
        void clearRemovesOneTypeClearAllRemovesEverything() {
            registry.register(preHook("p", null));
            registry.register(StopHook.builder().id("s").build());

            registry.clear(HookType.PRE_ACTION);
            assertEquals(0, registry.count(HookType.PRE_ACTION));
            assertEquals(1, registry.count(HookType.STOP));

            registry.clearAll();
            assertEquals(0, registry.stats().total());
        }
    }
}
