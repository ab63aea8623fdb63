package com.taskcopilot.security.rules;

import com.taskcopilot.common.model.PolicyAction;
import com.taskcopilot.common.model.Severity;
import com.taskcopilot.common.model.ToolCallContext;
import com.taskcopilot.security.SecurityTypes.RuleResult;
import com.taskcopilot.security.SecurityTypes.SecurityRule;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Guards writes to environment files, credentials, keys and cloud configs.
 */
public final class SensitiveFileRule implements SecurityRule {

    public static final String ID = "sensitive-file-protection";

    private record FilePattern(Pattern pattern, Severity severity) {
    }

    private static final List<FilePattern> SENSITIVE_FILES = List.of(
            // environment files
            new FilePattern(Pattern.compile("\\.env(\\.local|\\.production)?$"), Severity.CRITICAL),
            new FilePattern(Pattern.compile("\\.env\\.[a-z]+$"), Severity.CRITICAL),
            // credentials
            new FilePattern(Pattern.compile("credentials?(\\.json|\\.yaml|\\.yml)?$", Pattern.CASE_INSENSITIVE),
                    Severity.CRITICAL),
            new FilePattern(Pattern.compile("secrets?(\\.json|\\.yaml|\\.yml)?$", Pattern.CASE_INSENSITIVE),
                    Severity.CRITICAL),
            new FilePattern(Pattern.compile("\\.password$", Pattern.CASE_INSENSITIVE), Severity.CRITICAL),
            // keys and certificates
            new FilePattern(Pattern.compile("id_rsa|id_dsa|id_ed25519$", Pattern.CASE_INSENSITIVE),
                    Severity.CRITICAL),
            new FilePattern(Pattern.compile("\\.pem$"), Severity.HIGH),
            new FilePattern(Pattern.compile("\\.key$"), Severity.HIGH),
            new FilePattern(Pattern.compile("\\.crt$"), Severity.MEDIUM),
            // cloud provider configs
            new FilePattern(Pattern.compile("\\.aws/credentials$", Pattern.CASE_INSENSITIVE), Severity.CRITICAL),
            new FilePattern(Pattern.compile("\\.kube/config$", Pattern.CASE_INSENSITIVE), Severity.CRITICAL),
            new FilePattern(Pattern.compile("gcloud/credentials\\.json$", Pattern.CASE_INSENSITIVE),
                    Severity.CRITICAL),
            // databases
            new FilePattern(Pattern.compile("\\.sqlite3?$", Pattern.CASE_INSENSITIVE), Severity.MEDIUM),
            new FilePattern(Pattern.compile("database\\.yml$", Pattern.CASE_INSENSITIVE), Severity.HIGH));

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String name() {
        return "Sensitive File Protection";
    }

    @Override
    public String description() {
        return "Blocks or warns when editing sensitive files like .env, credentials, private keys";
    }

    @Override
    public int priority() {
        return 80;
    }

    @Override
    public RuleResult evaluate(ToolCallContext context) {
        if (!context.isWriteOperation())
            return null;

        for (String filePath : context.getFilePaths()) {
            for (FilePattern sensitive : SENSITIVE_FILES) {
                if (!sensitive.pattern().matcher(filePath).find())
                    continue;
                boolean block = sensitive.severity() == Severity.CRITICAL;
                return new RuleResult(
                        block ? PolicyAction.BLOCK : PolicyAction.WARN,
                        ID,
                        "Attempting to modify sensitive file: " + filePath,
                        sensitive.severity(),
                        sensitive.pattern().pattern(),
                        block
                                ? "Sensitive files should be edited manually with proper verification."
                                : "Verify changes to sensitive files carefully.");
            }
        }
        return null;
    }
}
