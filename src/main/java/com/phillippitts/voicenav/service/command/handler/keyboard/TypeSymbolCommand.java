package com.phillippitts.voicenav.service.command.handler.keyboard;

import com.phillippitts.voicenav.service.command.AbstractCommand;
import com.phillippitts.voicenav.service.command.CommandContext;
import com.phillippitts.voicenav.service.command.CommandPriority;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Types a symbol named by voice ("slash", "open paren", "tilde").
 *
 * <p>Two instances are registered: the bare form at normal priority, and the
 * "type &lt;symbol&gt;" form ranked just above {@link TypeTextCommand} so that "type comma"
 * yields "," rather than the word.
 */
public final class TypeSymbolCommand extends AbstractCommand {

    static final Map<String, String> SYMBOLS;

    static {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("slash", "/");
        m.put("backslash", "\\");
        m.put("open", "(");
        m.put("open paren", "(");
        m.put("close", ")");
        m.put("close paren", ")");
        m.put("curly open", "{");
        m.put("open curly", "{");
        m.put("curly close", "}");
        m.put("close curly", "}");
        m.put("equal", "=");
        m.put("equals", "=");
        m.put("quotation", "\"");
        m.put("quote", "\"");
        m.put("tick", "'");
        m.put("apostrophe", "'");
        m.put("dollar", "$");
        m.put("and", "&");
        m.put("ampersand", "&");
        m.put("array open", "[");
        m.put("open bracket", "[");
        m.put("array close", "]");
        m.put("close bracket", "]");
        m.put("question", "?");
        m.put("exclamation", "!");
        m.put("percent", "%");
        m.put("star", "*");
        m.put("asterisk", "*");
        m.put("plus", "+");
        m.put("minus", "-");
        m.put("dash", "-");
        m.put("dot", ".");
        m.put("period", ".");
        m.put("colon", ":");
        m.put("semicolon", ";");
        m.put("comma", ",");
        m.put("hashtag", "#");
        m.put("hash", "#");
        m.put("pound", "#");
        m.put("greater", ">");
        m.put("greater than", ">");
        m.put("smaller", "<");
        m.put("less than", "<");
        m.put("bar", "|");
        m.put("pipe", "|");
        m.put("elevate", "^");
        m.put("caret", "^");
        m.put("round", "~");
        m.put("tilde", "~");
        SYMBOLS = Map.copyOf(m);
    }

    private final boolean prefixed;

    private TypeSymbolCommand(boolean prefixed, int priority, String description, List<String> examples) {
        super(priority, description, examples);
        this.prefixed = prefixed;
    }

    public static TypeSymbolCommand bare() {
        return new TypeSymbolCommand(false, CommandPriority.NORMAL, "Type a symbol by name",
                List.of("slash", "open paren", "tilde"));
    }

    public static TypeSymbolCommand prefixed() {
        return new TypeSymbolCommand(true, CommandPriority.HIGH + 10, "Type a symbol with 'type' prefix",
                List.of("type comma", "type dollar"));
    }

    @Override
    public boolean matches(String text) {
        return symbolName(text).map(SYMBOLS::containsKey).orElse(false);
    }

    @Override
    public Optional<String> execute(CommandContext context, String text) {
        return symbolName(text).map(SYMBOLS::get);
    }

    @Override
    public String name() {
        return prefixed ? "TypePrefixedSymbolCommand" : "TypeSymbolCommand";
    }

    private Optional<String> symbolName(String text) {
        String t = clean(text);
        if (!prefixed) {
            return Optional.of(t);
        }
        return t.startsWith(TypeTextCommand.PREFIX)
                ? Optional.of(t.substring(TypeTextCommand.PREFIX.length()).trim())
                : Optional.empty();
    }
}
