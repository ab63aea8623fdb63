package com.taskcopilot.common.infra;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Matching helpers for user-supplied filters: tool-name globs and free-form
 * regular expressions. Compiled patterns are cached; built-in rule tables
 * compile their own patterns once as constants.
 */
@Slf4j
public final class PatternMatchers {

    private PatternMatchers() {
    }

    private static final Cache<String, Pattern> GLOB_CACHE = Caffeine.newBuilder()
            .maximumSize(1_000)
            .build();

    private static final Cache<String, Optional<Pattern>> REGEX_CACHE = Caffeine.newBuilder()
            .maximumSize(1_000)
            .build();

    /**
     * Case-insensitive glob match where {@code *} matches any run of
     * characters; every other character is literal.
     */
    public static boolean matchesGlob(String value, String glob) {
        if (value == null || glob == null)
            return false;
        return GLOB_CACHE.get(glob, PatternMatchers::compileGlob).matcher(value).matches();
    }

    /**
     * True when the list is empty/null or any glob matches.
     */
    public static boolean matchesAnyGlob(String value, List<String> globs) {
        if (globs == null || globs.isEmpty())
            return true;
        for (String glob : globs) {
            if (matchesGlob(value, glob))
                return true;
        }
        return false;
    }

    /**
     * Case-insensitive search for a user-supplied regex anywhere in the text.
     * An invalid pattern never matches.
     */
    public static boolean findsRegex(String text, String regex) {
        if (text == null || regex == null)
            return false;
        return compileRegex(regex)
                .map(p -> p.matcher(text).find())
                .orElse(false);
    }

    /**
     * True when the list is empty/null or any regex is found in the text.
     */
    public static boolean findsAnyRegex(String text, List<String> regexes) {
        if (regexes == null || regexes.isEmpty())
            return true;
        for (String regex : regexes) {
            if (findsRegex(text, regex))
                return true;
        }
        return false;
    }

    /**
     * Compile (or fetch from cache) a case-insensitive user regex.
     *
     * @return empty when the pattern does not compile
     */
    public static Optional<Pattern> compileRegex(String regex) {
        return REGEX_CACHE.get(regex, key -> {
            try {
                return Optional.of(Pattern.compile(key, Pattern.CASE_INSENSITIVE));
            } catch (PatternSyntaxException e) {
                log.warn("Ignoring invalid pattern '{}': {}", key, e.getDescription());
                return Optional.empty();
            }
        });
    }

    static Pattern compileGlob(String glob) {
        String regex = Pattern.quote(glob).replace("*", "\\E.*\\Q");
        return Pattern.compile("^" + regex + "$", Pattern.CASE_INSENSITIVE);
    }
}
