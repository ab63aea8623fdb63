package com.taskcopilot.security.rules;

import com.taskcopilot.common.model.PolicyAction;
import com.taskcopilot.common.model.Severity;
import com.taskcopilot.common.model.ToolCallContext;
import com.taskcopilot.security.SecurityTypes.RuleResult;
import com.taskcopilot.security.SecurityTypes.SecurityRule;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Blocks file writes whose content looks like it carries a credential.
 * Patterns are tried in table order; the first hit wins.
 */
public final class SecretDetectionRule implements SecurityRule {

    public static final String ID = "secret-detection";

    private record SecretPattern(String name, Pattern pattern, List<String> keywords, Severity severity) {
    }

    private static final List<SecretPattern> SECRET_PATTERNS = List.of(
            new SecretPattern("Generic API Key",
                    Pattern.compile("\\b([A-Za-z0-9_-]{20,})\\b"),
                    List.of("api_key", "apikey", "api-key", "key"), Severity.HIGH),
            new SecretPattern("AWS Access Key",
                    Pattern.compile("AKIA[0-9A-Z]{16}"), List.of(), Severity.CRITICAL),
            new SecretPattern("AWS Secret Key",
                    Pattern.compile("[A-Za-z0-9/+=]{40}"),
                    List.of("aws_secret", "secret_access_key"), Severity.CRITICAL),
            new SecretPattern("Google API Key",
                    Pattern.compile("AIza[0-9A-Za-z_-]{35}"), List.of(), Severity.CRITICAL),
            new SecretPattern("GitHub Token",
                    Pattern.compile("gh[pousr]_[A-Za-z0-9_]{36,}"), List.of(), Severity.CRITICAL),
            new SecretPattern("GitHub Classic Token",
                    Pattern.compile("ghp_[A-Za-z0-9]{36}"), List.of(), Severity.CRITICAL),
            new SecretPattern("Stripe API Key",
                    Pattern.compile("sk_live_[0-9a-zA-Z]{24,}"), List.of(), Severity.CRITICAL),
            new SecretPattern("Slack Token",
                    Pattern.compile("xox[baprs]-[0-9]{10,13}-[0-9]{10,13}-[a-zA-Z0-9]{24,}"), List.of(),
                    Severity.HIGH),
            new SecretPattern("JWT Token",
                    Pattern.compile("eyJ[A-Za-z0-9_-]*\\.eyJ[A-Za-z0-9_-]*\\.[A-Za-z0-9_-]*"), List.of(),
                    Severity.MEDIUM),
            new SecretPattern("Password Assignment",
                    Pattern.compile("password\\s*[=:]\\s*[\"']([^\"']{6,})[\"']", Pattern.CASE_INSENSITIVE),
                    List.of(), Severity.HIGH),
            new SecretPattern("Database Connection String",
                    Pattern.compile("(postgres|mysql|mongodb)://[^:]+:[^@]+@", Pattern.CASE_INSENSITIVE),
                    List.of(), Severity.CRITICAL),
            new SecretPattern("Private Key",
                    Pattern.compile("-----BEGIN (RSA|DSA|EC|OPENSSH) PRIVATE KEY-----"), List.of(),
                    Severity.CRITICAL));

    /** Evidence kept from a match; the rest of the secret is never echoed. */
    private static final int EVIDENCE_CHARS = 20;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String name() {
        return "Secret Detection";
    }

    @Override
    public String description() {
        return "Blocks writes containing API keys, passwords, tokens, or other secrets";
    }

    @Override
    public int priority() {
        return 90;
    }

    @Override
    public RuleResult evaluate(ToolCallContext context) {
        if (!context.isWriteOperation())
            return null;

        String allText = String.join("\n", context.extractStrings());
        String lower = allText.toLowerCase();

        for (SecretPattern secret : SECRET_PATTERNS) {
            Matcher m = secret.pattern().matcher(allText);
            if (!m.find())
                continue;
            if (!secret.keywords().isEmpty() && secret.keywords().stream().noneMatch(lower::contains))
                continue;
            String match = m.group();
            return new RuleResult(
                    PolicyAction.BLOCK,
                    ID,
                    "Detected potential " + secret.name() + " in file write",
                    secret.severity(),
                    match.substring(0, Math.min(EVIDENCE_CHARS, match.length())) + "...",
                    "Use environment variables or secure secret management instead");
        }
        return null;
    }
}
