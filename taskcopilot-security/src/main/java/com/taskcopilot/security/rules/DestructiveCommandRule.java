package com.taskcopilot.security.rules;

import com.taskcopilot.common.model.PolicyAction;
import com.taskcopilot.common.model.Severity;
import com.taskcopilot.common.model.ToolCallContext;
import com.taskcopilot.security.SecurityTypes.RuleResult;
import com.taskcopilot.security.SecurityTypes.SecurityRule;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Flags shell commands that can destroy data or take a machine down.
 * Critical patterns block, the rest warn.
 */
public final class DestructiveCommandRule implements SecurityRule {

    public static final String ID = "destructive-command";

    private record CommandPattern(Pattern pattern, Severity severity, String description) {
    }

    private static final List<CommandPattern> DESTRUCTIVE_COMMANDS = List.of(
            // file system
            new CommandPattern(Pattern.compile("rm\\s+-rf\\s+/"), Severity.CRITICAL,
                    "Recursive force delete from root"),
            new CommandPattern(Pattern.compile("rm\\s+-rf\\s+~"), Severity.CRITICAL,
                    "Recursive force delete from home"),
            new CommandPattern(Pattern.compile("rm\\s+-rf\\s+\\*"), Severity.HIGH,
                    "Recursive force delete all files"),
            new CommandPattern(Pattern.compile(":\\(\\)\\{\\s*:\\|:&\\s*\\};:"), Severity.CRITICAL,
                    "Fork bomb"),
            // databases
            new CommandPattern(Pattern.compile("DROP\\s+(DATABASE|TABLE|SCHEMA)", Pattern.CASE_INSENSITIVE),
                    Severity.CRITICAL, "Database DROP operation"),
            new CommandPattern(Pattern.compile("TRUNCATE\\s+TABLE", Pattern.CASE_INSENSITIVE),
                    Severity.HIGH, "Table truncation"),
            new CommandPattern(Pattern.compile("DELETE\\s+FROM\\s+\\w+\\s*;", Pattern.CASE_INSENSITIVE),
                    Severity.HIGH, "Unfiltered DELETE"),
            // system
            new CommandPattern(Pattern.compile("shutdown|reboot|halt", Pattern.CASE_INSENSITIVE),
                    Severity.CRITICAL, "System shutdown command"),
            new CommandPattern(Pattern.compile("mkfs|dd\\s+if=", Pattern.CASE_INSENSITIVE),
                    Severity.CRITICAL, "Disk formatting command"),
            new CommandPattern(Pattern.compile("chmod\\s+777", Pattern.CASE_INSENSITIVE),
                    Severity.MEDIUM, "Overly permissive file permissions"),
            // package publishing
            new CommandPattern(Pattern.compile("npm\\s+publish\\s+--force"), Severity.HIGH,
                    "Force npm publish"),
            new CommandPattern(Pattern.compile("pip\\s+install\\s+--force-reinstall"), Severity.MEDIUM,
                    "Force pip reinstall"));

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String name() {
        return "Destructive Command Detection";
    }

    @Override
    public String description() {
        return "Warns on destructive commands like rm -rf, DROP TABLE, etc.";
    }

    @Override
    public int priority() {
        return 85;
    }

    @Override
    public RuleResult evaluate(ToolCallContext context) {
        if (!context.isCommandExecution())
            return null;

        String commandText = String.join(" ", context.extractStrings());

        for (CommandPattern cmd : DESTRUCTIVE_COMMANDS) {
            if (!cmd.pattern().matcher(commandText).find())
                continue;
            boolean block = cmd.severity() == Severity.CRITICAL;
            return new RuleResult(
                    block ? PolicyAction.BLOCK : PolicyAction.WARN,
                    ID,
                    "Detected destructive command: " + cmd.description(),
                    cmd.severity(),
                    cmd.pattern().pattern(),
                    block
                            ? "This command is blocked for safety. Review and execute manually if needed."
                            : "Review this command carefully before execution.");
        }
        return null;
    }
}
