package com.taskcopilot.hooks;

import com.taskcopilot.common.infra.RegistrationCapacityExceededException;
import com.taskcopilot.hooks.HookTypes.HookRegistration;
import com.taskcopilot.hooks.HookTypes.HookScope;
import com.taskcopilot.hooks.HookTypes.HookSummary;
import com.taskcopilot.hooks.HookTypes.HookType;
import com.taskcopilot.hooks.HookTypes.LifecycleHook;
import com.taskcopilot.hooks.HookTypes.RegistryStats;
import com.taskcopilot.hooks.HookTypes.ScopeFilter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Stores lifecycle hooks by type and id together with their scope binding.
 * <p>
 * One instance is created at process start and shared by every dispatch
 * site. Writes are serialized; reads never block and always see a complete
 * entry. Hooks are copied on the way in and out, so callers never hold the
 * registry's own instances.
 */
@Slf4j
public class HookRegistry {

    public static final int MAX_HOOKS_PER_TYPE = 100;

    private static final String ID_ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";

    private record HookEntry(
            LifecycleHook hook,
            HookScope scope,
            String agentId,
            String taskId,
            Instant registeredAt,
            long sequence) {

        HookEntry withHook(LifecycleHook replacement) {
            return new HookEntry(replacement, scope, agentId, taskId, registeredAt, sequence);
        }
    }

    private final Map<HookType, ConcurrentHashMap<String, HookEntry>> hooks = new EnumMap<>(HookType.class);
    private final AtomicLong sequence = new AtomicLong();
    private final int maxPerType;
    private final int defaultPriority;

    public HookRegistry() {
        this(MAX_HOOKS_PER_TYPE, HookTypes.DEFAULT_PRIORITY);
    }

    public HookRegistry(int maxPerType, int defaultPriority) {
        this.maxPerType = maxPerType;
        this.defaultPriority = defaultPriority;
        for (HookType type : HookType.values()) {
            hooks.put(type, new ConcurrentHashMap<>());
        }
    }

    // =========================================================================
    // Registration
    // =========================================================================

    /**
     * Register a global hook.
     */
    public HookRegistration register(LifecycleHook hook) {
        return register(hook, HookScope.GLOBAL, null, null);
    }

    /**
     * Register a hook with a scope binding. A missing id is generated; an id
     * already present for the type replaces the earlier entry and keeps its
     * position among hooks of equal priority.
     *
     * @throws RegistrationCapacityExceededException when the type already holds
     *                                               the maximum number of hooks
     */
    public synchronized HookRegistration register(LifecycleHook hook, HookScope scope,
            String agentId, String taskId) {
        Objects.requireNonNull(hook, "hook");
        Objects.requireNonNull(scope, "scope");
        HookType type = hook.type();
        ConcurrentHashMap<String, HookEntry> entries = hooks.get(type);

        String id = hook.getId();
        if (id == null || id.isBlank()) {
            id = generateId(type);
        }
        if (!entries.containsKey(id) && entries.size() >= maxPerType) {
            throw new RegistrationCapacityExceededException(type.key(), maxPerType);
        }

        Instant now = Instant.now();
        HookEntry existing = entries.get(id);
        long seq = existing != null ? existing.sequence() : sequence.incrementAndGet();
        HookEntry previous = entries.put(id,
                new HookEntry(hook.withId(id), scope, agentId, taskId, now, seq));
        if (previous != null) {
            log.debug("Replaced {} hook {}", type.key(), id);
        } else {
            log.debug("Registered {} hook {} (scope={})", type.key(), id, scope.key());
        }
        return new HookRegistration(id, now, scope, hook.isEnabled());
    }

    public synchronized boolean unregister(String hookId, HookType type) {
        boolean removed = hookId != null && hooks.get(type).remove(hookId) != null;
        if (removed) {
            log.debug("Unregistered {} hook {}", type.key(), hookId);
        }
        return removed;
    }

    public synchronized boolean toggle(String hookId, HookType type, boolean enabled) {
        if (hookId == null)
            return false;
        HookEntry entry = hooks.get(type).get(hookId);
        if (entry == null)
            return false;
        hooks.get(type).put(hookId, entry.withHook(entry.hook().withEnabled(enabled)));
        log.debug("{} {} hook {}", enabled ? "Enabled" : "Disabled", type.key(), hookId);
        return true;
    }

    // =========================================================================
    // Lookup
    // =========================================================================

    public Optional<LifecycleHook> get(String hookId, HookType type) {
        if (hookId == null)
            return Optional.empty();
        return Optional.ofNullable(hooks.get(type).get(hookId)).map(e -> copy(e.hook()));
    }

    /**
     * Every hook of a type, enabled or not, in registration order.
     */
    public List<LifecycleHook> getAll(HookType type) {
        return ordered(type, Comparator.comparingLong(HookEntry::sequence)).stream()
                .map(e -> copy(e.hook()))
                .toList();
    }

    /**
     * Enabled hooks of a type that apply to the given binding, ascending by
     * priority with ties in registration order.
     */
    public List<LifecycleHook> listApplicable(HookType type, ScopeFilter filter) {
        ScopeFilter scope = filter != null ? filter : ScopeFilter.NONE;
        Comparator<HookEntry> order = Comparator
                .comparingInt((HookEntry e) -> e.hook().effectivePriority(defaultPriority))
                .thenComparingLong(HookEntry::sequence);
        return ordered(type, order).stream()
                .filter(e -> e.hook().isEnabled())
                .filter(e -> inScope(e, scope))
                .map(e -> copy(e.hook()))
                .toList();
    }

    /**
     * Typed variant of {@link #listApplicable(HookType, ScopeFilter)}.
     */
    public <H extends LifecycleHook> List<H> listApplicable(HookType type, ScopeFilter filter, Class<H> kind) {
        return listApplicable(type, filter).stream()
                .filter(kind::isInstance)
                .map(kind::cast)
                .toList();
    }

    public int count(HookType type) {
        return hooks.get(type).size();
    }

    public synchronized void clear(HookType type) {
        hooks.get(type).clear();
    }

    public synchronized void clearAll() {
        hooks.values().forEach(Map::clear);
    }

    /**
     * Summaries of every registered hook, grouped by type.
     */
    public List<HookSummary> listAll() {
        List<HookSummary> summaries = new ArrayList<>();
        for (HookType type : HookType.values()) {
            for (HookEntry e : ordered(type, Comparator.comparingLong(HookEntry::sequence))) {
                LifecycleHook hook = e.hook();
                summaries.add(new HookSummary(type, hook.getId(), hook.getName(), hook.isEnabled(),
                        hook.effectivePriority(defaultPriority), e.scope(), e.agentId(), e.taskId()));
            }
        }
        return summaries;
    }

    public RegistryStats stats() {
        Map<HookType, Integer> counts = new EnumMap<>(HookType.class);
        for (HookType type : HookType.values()) {
            counts.put(type, count(type));
        }
        return new RegistryStats(counts);
    }

    // =========================================================================
    // Internals
    // =========================================================================

    private List<HookEntry> ordered(HookType type, Comparator<HookEntry> order) {
        List<HookEntry> entries = new ArrayList<>(hooks.get(type).values());
        entries.sort(order);
        return entries;
    }

    private static boolean inScope(HookEntry entry, ScopeFilter filter) {
        return switch (entry.scope()) {
            case GLOBAL -> true;
            case AGENT -> filter.agentId() != null && filter.agentId().equals(entry.agentId());
            case TASK -> filter.taskId() != null && filter.taskId().equals(entry.taskId());
        };
    }

    private static LifecycleHook copy(LifecycleHook hook) {
        return hook.withEnabled(hook.isEnabled());
    }

    /**
     * Generated ids look like {@code pre_action-lq2x8k1c-a9f3zq}.
     */
    static String generateId(HookType type) {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder suffix = new StringBuilder(6);
        for (int i = 0; i < 6; i++) {
            suffix.append(ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length())));
        }
        return type.key() + "-" + Long.toString(System.currentTimeMillis(), 36) + "-" + suffix;
    }
}
