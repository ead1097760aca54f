package com.e2eq.composite.core;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds {@code {{key}}} component tokens in a document body. Keys are not validated here;
 * a key nothing resolves is simply left in place by the expander.
 */
public final class TokenScanner {
    private TokenScanner() {}

    private static final Pattern TOKEN = Pattern.compile("\\{\\{([^}]+)}}");

    /** One occurrence of a token: the literal text matched and the key inside the braces. */
    public record Token(String match, String key, int start, int end) {}

    /**
     * Returns every token occurrence in order of appearance, duplicates included.
     */
    public static List<Token> scan(String body) {
        if (body == null || body.isEmpty()) return List.of();
        List<Token> out = new ArrayList<>();
        Matcher m = TOKEN.matcher(body);
        while (m.find()) {
            out.add(new Token(m.group(), m.group(1), m.start(), m.end()));
        }
        return out;
    }

    /**
     * Distinct keys in order of first appearance.
     */
    public static List<String> distinctKeys(String body) {
        Set<String> keys = new LinkedHashSet<>();
        for (Token t : scan(body)) keys.add(t.key());
        return List.copyOf(keys);
    }

    public static String token(String key) {
        return "{{" + key + "}}";
    }
}
