package com.taskcopilot.security.rules;

import com.taskcopilot.common.model.PolicyAction;
import com.taskcopilot.common.model.Severity;
import com.taskcopilot.common.model.ToolCallContext;
import com.taskcopilot.security.SecurityTypes.RuleResult;
import com.taskcopilot.security.SecurityTypes.SecurityRule;

import java.util.regex.Pattern;

/**
 * Blocks http(s) URLs with embedded user:password credentials.
 */
public final class CredentialUrlRule implements SecurityRule {

    public static final String ID = "credential-url";

    private static final Pattern CREDENTIAL_URL = Pattern.compile("https?://[^:]+:[^@]+@", Pattern.CASE_INSENSITIVE);

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String name() {
        return "Credential URL Detection";
    }

    @Override
    public String description() {
        return "Blocks URLs containing embedded credentials";
    }

    @Override
    public int priority() {
        return 88;
    }

    @Override
    public RuleResult evaluate(ToolCallContext context) {
        if (!context.isWriteOperation())
            return null;

        String allText = String.join("\n", context.extractStrings());
        if (!CREDENTIAL_URL.matcher(allText).find())
            return null;

        return new RuleResult(
                PolicyAction.BLOCK,
                ID,
                "Detected URL with embedded credentials",
                Severity.CRITICAL,
                "http(s)://user:password@host",
                "Use environment variables or authentication tokens instead");
    }
}
