package com.taskcopilot.security.rules;

import com.taskcopilot.security.SecurityRuleEngine;
import com.taskcopilot.security.SecurityTypes.SecurityRule;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * The built-in rule set installed at startup.
 */
@Slf4j
public final class DefaultSecurityRules {

    private DefaultSecurityRules() {
    }

    public static List<SecurityRule> create() {
        return List.of(
                new SecretDetectionRule(),
                new DestructiveCommandRule(),
                new SensitiveFileRule(),
                new CredentialUrlRule());
    }

    public static List<String> ruleIds() {
        return create().stream().map(SecurityRule::id).toList();
    }

    public static List<String> install(SecurityRuleEngine engine) {
        return install(engine, Set.of());
    }

    /**
     * Register every default rule; ids listed in {@code disabled} are
     * registered switched off so they can be enabled later.
     *
     * @return the installed rule ids
     */
    public static List<String> install(SecurityRuleEngine engine, Collection<String> disabled) {
        List<SecurityRule> rules = create();
        for (SecurityRule rule : rules) {
            engine.registerRule(rule);
            if (disabled != null && disabled.contains(rule.id())) {
                engine.toggleRule(rule.id(), false);
                log.info("Default security rule {} disabled by configuration", rule.id());
            }
        }
        return rules.stream().map(SecurityRule::id).toList();
    }
}
