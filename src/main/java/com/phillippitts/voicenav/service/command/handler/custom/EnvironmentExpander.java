package com.phillippitts.voicenav.service.command.handler.custom;

import java.util.Objects;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands {@code ${VAR}} and {@code %VAR%} references. Unknown variables are left as written.
 */
final class EnvironmentExpander {

    private static final Pattern REFERENCE = Pattern.compile("\\$\\{(\\w+)}|%(\\w+)%");

    private final UnaryOperator<String> lookup;

    EnvironmentExpander(UnaryOperator<String> lookup) {
        this.lookup = Objects.requireNonNull(lookup, "lookup must not be null");
    }

    static EnvironmentExpander system() {
        return new EnvironmentExpander(System::getenv);
    }

    String expand(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        Matcher m = REFERENCE.matcher(value);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String name = m.group(1) != null ? m.group(1) : m.group(2);
            String resolved = lookup.apply(name);
            m.appendReplacement(out, Matcher.quoteReplacement(resolved != null ? resolved : m.group()));
        }
        m.appendTail(out);
        return out.toString();
    }
}
