package css.nesting;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Ordered list of alternative selectors (`a, b` matches `a` OR `b`).
///
/// Entries are kept in insertion order and are never deduplicated.
public record SelectorList(List<String> selectors) {

    public SelectorList {
        Objects.requireNonNull(selectors, "selectors must not be null");
        selectors = List.copyOf(selectors);
        if (selectors.isEmpty()) {
            throw new IllegalArgumentException("selector list must not be empty");
        }
        for (final var selector : selectors) {
            if (selector.isBlank()) {
                throw new IllegalArgumentException("selector must not be blank: " + selectors);
            }
        }
    }

    public static SelectorList of(String... selectors) {
        return new SelectorList(List.of(selectors));
    }

    /// Splits selector text at top-level commas, trimming each alternative.
    /// @param text raw selector text, e.g. `.a, .b:is(.c, .d)`
    /// @return the parsed list
    /// @throws IllegalArgumentException if any alternative is empty
    public static SelectorList parse(String text) {
        Objects.requireNonNull(text, "text must not be null");
        return new SelectorList(splitTopLevel(text));
    }

    public int size() {
        return selectors.size();
    }

    public boolean isSingle() {
        return selectors.size() == 1;
    }

    /// Every entry split at its own top-level commas, so `["a, b", "c"]` gives `[a, b, c]`.
    public List<String> alternatives() {
        final var out = new ArrayList<String>(selectors.size());
        for (final var selector : selectors) {
            final int before = out.size();
            for (final var part : splitTopLevel(selector)) {
                if (!part.isEmpty()) out.add(part);
            }
            if (out.size() == before) out.add(selector.trim());
        }
        return List.copyOf(out);
    }

    /// Entries joined with `, `, as written in a style sheet.
    public String text() {
        return String.join(", ", selectors);
    }

    @Override
    public String toString() {
        return text();
    }

    // Commas inside (), [] or quotes belong to the enclosing alternative.
    static List<String> splitTopLevel(String text) {
        final var parts = new ArrayList<String>();
        int depth = 0;
        char quote = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (c == '\\') {
                i++;
                continue;
            }
            if (quote != 0) {
                if (c == quote) quote = 0;
                continue;
            }
            switch (c) {
                case '"', '\'' -> quote = c;
                case '(', '[' -> depth++;
                case ')', ']' -> depth = Math.max(0, depth - 1);
                case ',' -> {
                    if (depth == 0) {
                        parts.add(text.substring(start, i).trim());
                        start = i + 1;
                    }
                }
                default -> {
                }
            }
        }
        parts.add(text.substring(start).trim());
        return parts;
    }
}
