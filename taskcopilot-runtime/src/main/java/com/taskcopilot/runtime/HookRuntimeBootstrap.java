package com.taskcopilot.runtime;

import com.taskcopilot.common.config.HooksConfig;
import com.taskcopilot.common.config.HooksConfigService;
import com.taskcopilot.hooks.HookExecutor;
import com.taskcopilot.hooks.HookRegistry;
import com.taskcopilot.hooks.checkpoint.AutoCheckpointHooks;
import com.taskcopilot.hooks.checkpoint.CheckpointClient;
import com.taskcopilot.security.SecurityPreActionHook;
import com.taskcopilot.security.SecurityRuleEngine;
import com.taskcopilot.security.SecurityRuleTools;
import com.taskcopilot.security.rules.DefaultSecurityRules;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;

/**
 * Wires a {@link HookRuntime} from configuration: registry and executor
 * defaults, default and custom security rules, the security pre-action hook
 * and, when a checkpoint client is supplied, the auto-checkpoint hooks.
 */
@Slf4j
public final class HookRuntimeBootstrap {

    private HookRuntimeBootstrap() {
    }

    public static HookRuntime create(Path configFile, CheckpointClient checkpointClient) {
        return create(new HooksConfigService(configFile).loadConfig(), checkpointClient);
    }

    /**
     * @param checkpointClient may be {@code null}; no checkpoint hooks are
     *                         installed then
     */
    public static HookRuntime create(HooksConfig config, CheckpointClient checkpointClient) {
        HooksConfig cfg = config != null ? config : HooksConfig.defaults();
        if (cfg.getHooks() == null || cfg.getSecurity() == null || cfg.getAutoCheckpoint() == null) {
            HooksConfig defaults = HooksConfig.defaults();
            cfg = HooksConfig.builder()
                    .hooks(cfg.getHooks() != null ? cfg.getHooks() : defaults.getHooks())
                    .security(cfg.getSecurity() != null ? cfg.getSecurity() : defaults.getSecurity())
                    .autoCheckpoint(cfg.getAutoCheckpoint() != null ? cfg.getAutoCheckpoint()
                            : defaults.getAutoCheckpoint())
                    .build();
        }

        HooksConfig.HookDefaults hookDefaults = cfg.getHooks();
        HookRegistry registry = new HookRegistry(hookDefaults.getMaxHooksPerType(), hookDefaults.getDefaultPriority());
        HookExecutor executor = new HookExecutor(registry, hookDefaults.getDefaultTimeoutMs());

        HooksConfig.SecurityConfig security = cfg.getSecurity();
        SecurityRuleEngine engine = new SecurityRuleEngine(security.getMaxRules());
        if (security.isEnabled()) {
            installSecurity(security, engine, registry);
        } else {
            log.info("Security rules disabled by configuration");
        }

        AutoCheckpointHooks checkpointHooks = null;
        if (checkpointClient != null && cfg.getAutoCheckpoint().isEnabled()) {
            checkpointHooks = new AutoCheckpointHooks(checkpointClient, cfg.getAutoCheckpoint());
            checkpointHooks.install(registry);
        }

        log.info("Hook runtime ready: {} hook(s), {} security rule(s), auto-checkpoint {}",
                registry.stats().total(), engine.size(), checkpointHooks != null ? "on" : "off");
        return new HookRuntime(registry, executor, engine, checkpointHooks);
    }

    private static void installSecurity(HooksConfig.SecurityConfig security, SecurityRuleEngine engine,
            HookRegistry registry) {
        if (security.isInstallDefaults()) {
            DefaultSecurityRules.install(engine, security.getDisabledRules());
        }
        if (security.getCustomRules() != null && !security.getCustomRules().isEmpty()) {
            SecurityRuleTools.RegisterResponse response = new SecurityRuleTools(engine)
                    .registerRules(security.getCustomRules(), false);
            if (!response.success()) {
                log.warn("Some custom security rules were not registered: {}", response.message());
            }
        }
        if (security.isRegisterPreActionHook()) {
            registry.register(SecurityPreActionHook.create(engine, security.getHookPriority()));
        }
    }
}
