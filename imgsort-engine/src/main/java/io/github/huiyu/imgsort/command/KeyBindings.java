package io.github.huiyu.imgsort.command;

import com.google.common.collect.ImmutableMap;

import io.github.huiyu.imgsort.config.Configuration;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Input symbol to command. Digits 1 to 9 move the current image into the configured
 * categories, in order. Symbols are case insensitive.
 */
@Component
public class KeyBindings {

    private static final ImmutableMap<String, Command> FIXED = ImmutableMap.<String, Command>builder()
            .put("right", Command.of(Command.Type.NEXT))
            .put("left", Command.of(Command.Type.PREVIOUS))
            .put("home", Command.of(Command.Type.FIRST))
            .put("end", Command.of(Command.Type.LAST))
            .put("r", Command.of(Command.Type.RANDOM))
            .put("delete", Command.of(Command.Type.DELETE))
            .put("u", Command.of(Command.Type.UNDO))
            .put("s", Command.of(Command.Type.SLIDESHOW))
            .put("q", Command.of(Command.Type.QUIT))
            .build();

    private final ImmutableMap<String, Command> bindings;

    @Autowired
    public KeyBindings(Configuration config) {
        this(config.getCategories());
    }

    public KeyBindings(List<String> categories) {
        ImmutableMap.Builder<String, Command> builder = ImmutableMap.builder();
        builder.putAll(FIXED);
        for (int i = 0; i < categories.size(); i++) {
            builder.put(String.valueOf(i + 1), Command.move(categories.get(i)));
        }
        this.bindings = builder.build();
    }

    /**
     * @return the bound command, null for an unbound symbol
     */
    public Command resolve(String symbol) {
        if (symbol == null) {
            return null;
        }
        return bindings.get(symbol.trim().toLowerCase(Locale.ROOT));
    }

    public Map<String, Command> getBindings() {
        return bindings;
    }
}
