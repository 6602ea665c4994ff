package com.purchasingpower.coderag.search;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Case-folded lexical tokens, split on a configurable separator class.
 *
 * <p>The default separator keeps letters and digits of any script together with
 * underscores, so {@code parse_config} stays one token and CJK text is not dropped.
 */
public class QueryTokenizer {

    private final Pattern separator;

    public QueryTokenizer(String separatorPattern) {
        this.separator = Pattern.compile(separatorPattern, Pattern.UNICODE_CHARACTER_CLASS);
    }

    public List<String> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<String> tokens = new ArrayList<>();
        for (String token : separator.split(text.toLowerCase(Locale.ROOT))) {
            if (!token.isBlank()) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
