package com.drover.core.bus;

import com.drover.core.model.AgentMessage;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Flags message text that looks like an attempt to override an agent's instructions.
 */
public final class InjectionScanner {

    private static final List<Pattern> PATTERNS = compile(
            "ignore\\s+(previous|above|all)\\s+(instructions|prompts)",
            "you\\s+are\\s+now\\s+",
            "system\\s*:\\s*",
            "<\\s*system\\s*>",
            "forget\\s+(everything|your\\s+instructions)",
            "new\\s+instructions?\\s*:",
            "ADMIN\\s*:",
            "override\\s+mode",
            "disregard\\s+(your|all|previous)\\s+(directives|instructions|rules)",
            "pretend\\s+you\\s+are",
            "act\\s+as\\s+if\\s+you\\s+were",
            "jailbreak",
            "DAN\\s+mode");

    private InjectionScanner() {}

    private static List<Pattern> compile(String... regexes) {
        var patterns = new ArrayList<Pattern>(regexes.length);
        for (String regex : regexes) {
            patterns.add(Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
        }
        return List.copyOf(patterns);
    }

    /**
     * @return the patterns matched by the message content or payload, empty if clean
     */
    public static List<String> scan(AgentMessage message) {
        String content = message.content();
        String payload = message.payload().isEmpty() ? "" : message.payload().toString();
        var matches = new ArrayList<String>();
        for (Pattern pattern : PATTERNS) {
            if (pattern.matcher(content).find() || pattern.matcher(payload).find()) {
                matches.add(pattern.pattern());
            }
        }
        return matches;
    }
}
