package com.mergeline.backend.registry;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ordered list of sed-like rewrite rules for cross-repository labels.
 * <p>
 * Each rule is written {@code <sep>pattern<sep>replacement<sep>flags}, where the
 * separator is the first character of the line. Supported flags: {@code g}
 * (replace all), {@code i} (case-insensitive), {@code m} (multiline).
 */
public final class LabelSubstitutions {

    private record Rule(Pattern pattern, String replacement, boolean global) {}

    private final List<Rule> rules;

    private LabelSubstitutions(List<Rule> rules) {
        this.rules = rules;
    }

    public static LabelSubstitutions parse(String text) {
        List<Rule> rules = new ArrayList<>();
        if (text == null || text.isBlank()) return new LabelSubstitutions(rules);

        for (String line : text.split("\\R")) {
            if (line.isEmpty()) continue;

            String sep = Pattern.quote(line.substring(0, 1));
            String[] parts = line.substring(1).split(sep, -1);
            if (parts.length != 3) {
                throw new IllegalArgumentException("invalid label substitution: " + line);
            }

            String flags = parts[2].toLowerCase();
            int mode = 0;
            if (flags.contains("i")) mode |= Pattern.CASE_INSENSITIVE;
            if (flags.contains("m")) mode |= Pattern.MULTILINE;

            rules.add(new Rule(
                    Pattern.compile(parts[0], mode),
                    toJavaReplacement(parts[1]),
                    flags.contains("g")
            ));
        }
        return new LabelSubstitutions(rules);
    }

    public String apply(String label) {
        String out = label;
        for (Rule r : rules) {
            Matcher m = r.pattern().matcher(out);
            out = r.global() ? m.replaceAll(r.replacement()) : m.replaceFirst(r.replacement());
        }
        return out;
    }

    public int size() {
        return rules.size();
    }

    // \1 style back-references become $1
    private static String toJavaReplacement(String repl) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < repl.length(); i++) {
            char c = repl.charAt(i);
            if (c == '\\' && i + 1 < repl.length() && Character.isDigit(repl.charAt(i + 1))) {
                sb.append('$').append(repl.charAt(++i));
            } else if (c == '$') {
                sb.append("\\$");
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
