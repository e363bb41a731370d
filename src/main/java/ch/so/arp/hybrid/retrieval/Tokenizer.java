package ch.so.arp.hybrid.retrieval;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalises free text into the token stream shared by the sparse index, the
 * query side of BM25 and the hashing embedder. Tokens are lowercase runs of
 * ASCII letters and digits that may contain inner hyphens, so that error codes
 * such as {@code E-4012} survive as a single token ({@code e-4012}). There is
 * no stemming and no stop-word removal.
 */
public final class Tokenizer {

    private static final Pattern TOKEN = Pattern.compile("[a-z0-9](?:[a-z0-9-]*[a-z0-9])?");

    private Tokenizer() {
    }

    public static List<String> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        Matcher matcher = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
        List<String> tokens = new ArrayList<>();
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return List.copyOf(tokens);
    }
}
