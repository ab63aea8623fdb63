package com.taskcopilot.hooks;

import com.taskcopilot.common.infra.ErrorUtils;
import com.taskcopilot.common.infra.PatternMatchers;
import com.taskcopilot.common.model.PolicyAction;
import com.taskcopilot.common.model.ToolCallContext;
import com.taskcopilot.hooks.HookContexts.PostActionContext;
import com.taskcopilot.hooks.HookContexts.PromptContext;
import com.taskcopilot.hooks.HookContexts.StopContext;
import com.taskcopilot.hooks.HookResults.ExecutionReport;
import com.taskcopilot.hooks.HookResults.PostActionOutcome;
import com.taskcopilot.hooks.HookResults.PostActionResult;
import com.taskcopilot.hooks.HookResults.PreActionOutcome;
import com.taskcopilot.hooks.HookResults.PreActionResult;
import com.taskcopilot.hooks.HookResults.PromptOutcome;
import com.taskcopilot.hooks.HookResults.PromptResult;
import com.taskcopilot.hooks.HookResults.PromptStatus;
import com.taskcopilot.hooks.HookResults.StopOutcome;
import com.taskcopilot.hooks.HookResults.StopResult;
import com.taskcopilot.hooks.HookTypes.HookHandler;
import com.taskcopilot.hooks.HookTypes.HookType;
import com.taskcopilot.hooks.HookTypes.LifecycleHook;
import com.taskcopilot.hooks.HookTypes.PostActionHook;
import com.taskcopilot.hooks.HookTypes.PreActionHook;
import com.taskcopilot.hooks.HookTypes.PromptSubmittedHook;
import com.taskcopilot.hooks.HookTypes.ScopeFilter;
import com.taskcopilot.hooks.HookTypes.StopHook;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the hooks registered for each lifecycle point.
 * <p>
 * Hooks of one type run strictly one after another in priority order. Each
 * handler runs on a worker thread and the dispatching thread waits at most
 * the hook's timeout for it; a handler that overruns is abandoned, not
 * interrupted, and its late result is discarded. Handler failures never
 * escape a dispatch: they are downgraded (pre-action to WARN, post-action to
 * continue, prompt to proceed, stop to failed) and recorded in the report.
 */
@Slf4j
public class HookExecutor implements AutoCloseable {

    static final String TIMEOUT_ERROR = "Timeout";
    static final String NO_RESULT_ERROR = "Hook returned no result";

    private final HookRegistry registry;
    private final long defaultTimeoutMs;
    private final ExecutorService workers;

    public HookExecutor(HookRegistry registry) {
        this(registry, HookTypes.DEFAULT_TIMEOUT_MS);
    }

    public HookExecutor(HookRegistry registry, long defaultTimeoutMs) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.defaultTimeoutMs = defaultTimeoutMs > 0 ? defaultTimeoutMs : HookTypes.DEFAULT_TIMEOUT_MS;
        this.workers = newWorkerPool();
    }

    // =========================================================================
    // Pre-action
    // =========================================================================

    /**
     * Run pre-action hooks for a tool call. The first DENY stops the loop and
     * blocks the call; hooks after it are not invoked.
     */
    public PreActionOutcome runPreAction(ToolCallContext ctx) {
        List<PreActionHook> hooks = registry
                .listApplicable(HookType.PRE_ACTION, new ScopeFilter(ctx.getAgentId(), ctx.getTaskId()),
                        PreActionHook.class)
                .stream()
                .filter(h -> PatternMatchers.matchesAnyGlob(ctx.getToolName(), h.getToolPatterns()))
                .toList();

        boolean allowed = true;
        List<String> violations = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<PreActionResult> results = new ArrayList<>();
        List<ExecutionReport> reports = new ArrayList<>();

        for (PreActionHook hook : hooks) {
            Invocation<PreActionResult> inv = invoke(hook, hook.getHandler(), ctx);
            PreActionResult result = inv.succeeded()
                    ? inv.result().toBuilder().executionTimeMs(inv.durationMs()).build()
                    : PreActionResult.warn(inv.failureMessage()).toBuilder()
                            .executionTimeMs(inv.durationMs()).build();
            results.add(result);
            reports.add(inv.report(hook, result));

            if (result.getStatus() == HookResults.PreActionStatus.DENY) {
                allowed = false;
                violations.add(result.getReason() != null
                        ? result.getReason()
                        : "Blocked by hook " + hook.getId());
                break;
            }
            boolean hasListedWarnings = result.getWarnings() != null && !result.getWarnings().isEmpty();
            if (result.getStatus() == HookResults.PreActionStatus.WARN) {
                if (result.getReason() != null) {
                    warnings.add(result.getReason());
                } else if (!hasListedWarnings) {
                    warnings.add("Warning from hook " + hook.getId());
                }
            }
            if (hasListedWarnings) {
                warnings.addAll(result.getWarnings());
            }
        }

        PolicyAction action = PolicyAction.aggregate(violations.size(), warnings.size());
        log.debug("Pre-action dispatch for {}: {} hook(s), action={}", ctx.getToolName(), reports.size(),
                action.label());
        return new PreActionOutcome(allowed, action, violations, warnings, results, reports);
    }

    // =========================================================================
    // Post-action
    // =========================================================================

    /**
     * Run post-action hooks. Every matching hook runs; nothing is undone.
     */
    public PostActionOutcome runPostAction(PostActionContext ctx) {
        List<PostActionHook> hooks = registry
                .listApplicable(HookType.POST_ACTION, ctx.scope(), PostActionHook.class)
                .stream()
                .filter(h -> PatternMatchers.matchesAnyGlob(ctx.getToolName(), h.getToolPatterns()))
                .filter(h -> !(h.isOnErrorOnly() && ctx.isSuccess()))
                .toList();

        List<PostActionResult> results = new ArrayList<>();
        List<ExecutionReport> reports = new ArrayList<>();
        for (PostActionHook hook : hooks) {
            Invocation<PostActionResult> inv = invoke(hook, hook.getHandler(), ctx);
            PostActionResult result = (inv.succeeded() ? inv.result().toBuilder() : PostActionResult.pass().toBuilder())
                    .executionTimeMs(inv.durationMs())
                    .build();
            results.add(result);
            reports.add(inv.report(hook, result));
        }
        log.debug("Post-action dispatch for {}: {} hook(s)", ctx.getToolName(), reports.size());
        return new PostActionOutcome(results, reports);
    }

    // =========================================================================
    // Prompt submitted
    // =========================================================================

    /**
     * Run prompt hooks. All matching hooks run; any block or redirect turns
     * {@code proceed} off. Injections keep execution order, skills are
     * deduplicated.
     */
    public PromptOutcome runPromptSubmitted(PromptContext ctx) {
        String text = ctx.getPromptText() != null ? ctx.getPromptText() : "";
        List<PromptSubmittedHook> hooks = registry
                .listApplicable(HookType.PROMPT_SUBMITTED, ctx.scope(), PromptSubmittedHook.class)
                .stream()
                .filter(h -> PatternMatchers.findsAnyRegex(text, h.getPromptPatterns()))
                .filter(h -> matchesCommand(h, ctx.getCommand()))
                .toList();

        boolean proceed = true;
        String redirectTo = null;
        List<String> injections = new ArrayList<>();
        Set<String> skills = new LinkedHashSet<>();
        List<PromptResult> results = new ArrayList<>();
        List<ExecutionReport> reports = new ArrayList<>();

        for (PromptSubmittedHook hook : hooks) {
            Invocation<PromptResult> inv = invoke(hook, hook.getHandler(), ctx);
            PromptResult result = (inv.succeeded() ? inv.result().toBuilder() : PromptResult.proceed().toBuilder())
                    .executionTimeMs(inv.durationMs())
                    .build();
            results.add(result);
            reports.add(inv.report(hook, result));

            if (result.getContextInjection() != null) {
                injections.add(result.getContextInjection());
            }
            if (result.getSkillsToLoad() != null) {
                skills.addAll(result.getSkillsToLoad());
            }
            if (result.getStatus() == PromptStatus.BLOCK || result.getStatus() == PromptStatus.REDIRECT) {
                proceed = false;
                if (result.getStatus() == PromptStatus.REDIRECT && redirectTo == null) {
                    redirectTo = result.getRedirectTo();
                }
            }
        }
        log.debug("Prompt dispatch: {} hook(s), proceed={}", reports.size(), proceed);
        return new PromptOutcome(proceed, injections, skills, redirectTo, results, reports);
    }

    private static boolean matchesCommand(PromptSubmittedHook hook, String command) {
        List<String> commands = hook.getCommandPatterns();
        if (commands == null || commands.isEmpty())
            return true;
        return command != null && commands.contains(command);
    }

    // =========================================================================
    // Stop
    // =========================================================================

    /**
     * Run stop hooks that listen for the context's trigger. Best effort: a
     * failed hook is recorded and the next one still runs.
     */
    public StopOutcome runStop(StopContext ctx) {
        List<StopHook> hooks = registry
                .listApplicable(HookType.STOP, ctx.scope(), StopHook.class)
                .stream()
                .filter(h -> h.getTriggers() != null && h.getTriggers().contains(ctx.getTrigger()))
                .toList();

        List<StopResult> results = new ArrayList<>();
        List<ExecutionReport> reports = new ArrayList<>();
        for (StopHook hook : hooks) {
            Invocation<StopResult> inv = invoke(hook, hook.getHandler(), ctx);
            StopResult result = (inv.succeeded() ? inv.result().toBuilder()
                    : StopResult.failed(inv.failureMessage()).toBuilder())
                    .executionTimeMs(inv.durationMs())
                    .build();
            results.add(result);
            reports.add(inv.report(hook, result));
        }
        log.debug("Stop dispatch for {}: {} hook(s)",
                ctx.getTrigger() != null ? ctx.getTrigger().key() : null, reports.size());
        return new StopOutcome(results, reports);
    }

    // =========================================================================
    // Invocation
    // =========================================================================

    /**
     * Outcome of one bounded handler call. Exactly one of {@code result} and
     * {@code error} is set.
     */
    private record Invocation<R>(R result, String error, String failureMessage, long durationMs,
            Instant startedAt) {

        boolean succeeded() {
            return error == null;
        }

        ExecutionReport report(LifecycleHook hook, Object finalResult) {
            return new ExecutionReport(hook.getId(), hook.type(), succeeded(), durationMs, finalResult, error,
                    startedAt);
        }
    }

    private <C, R> Invocation<R> invoke(LifecycleHook hook, HookHandler<C, R> handler, C ctx) {
        long timeoutMs = hook.effectiveTimeoutMs(defaultTimeoutMs);
        Instant startedAt = Instant.now();
        long start = System.nanoTime();

        if (handler == null) {
            return failure(hook, "Hook has no handler", start, startedAt);
        }

        CompletableFuture<R> future;
        try {
            future = CompletableFuture.supplyAsync(() -> {
                try {
                    return handler.handle(ctx);
                } catch (Exception e) {
                    throw new CompletionException(e);
                }
            }, workers);
        } catch (RuntimeException e) {
            // pool rejected the task
            return failure(hook, ErrorUtils.formatErrorMessage(e), start, startedAt);
        }

        try {
            R result = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (result == null) {
                return failure(hook, NO_RESULT_ERROR, start, startedAt);
            }
            return new Invocation<>(result, null, null, elapsedMs(start), startedAt);
        } catch (TimeoutException e) {
            log.warn("Hook {} timed out after {}ms", hook.getId(), timeoutMs);
            return new Invocation<>(null, TIMEOUT_ERROR,
                    "Hook " + hook.getId() + " timed out after " + timeoutMs + "ms", elapsedMs(start), startedAt);
        } catch (ExecutionException e) {
            return failure(hook, ErrorUtils.formatErrorMessage(ErrorUtils.unwrap(e)), start, startedAt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failure(hook, "Interrupted", start, startedAt);
        }
    }

    private static <R> Invocation<R> failure(LifecycleHook hook, String message, long start, Instant startedAt) {
        log.warn("Hook {} ({}) failed: {}", hook.getId(), hook.type().key(), message);
        return new Invocation<>(null, message, "Hook " + hook.getId() + " error: " + message, elapsedMs(start),
                startedAt);
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private static ExecutorService newWorkerPool() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "hook-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void close() {
        workers.shutdownNow();
    }
}
