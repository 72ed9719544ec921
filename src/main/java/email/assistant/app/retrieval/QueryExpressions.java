package email.assistant.app.retrieval;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Builders for Gmail search expressions. Pure functions only.
 */
public final class QueryExpressions {
    public static final String RECENT_ITEMS = "newer_than:1d";
    public static final String FAILSAFE_RECENT = "newer_than:2d";

    static final int MAX_TOKENS_PER_SOURCE = 15;

    private static final Set<String> SWEEP_STOP_WORDS = Set.of(
            "the", "and", "for", "from", "with", "that", "this", "your", "you",
            "about", "into", "what", "when", "how", "much", "should");
    private static final Set<String> REFINE_STOP_WORDS = Set.of(
            "give", "what", "from", "emails", "about", "that", "this", "should");
    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^a-z0-9@.]+");
    private static final Pattern TIME_FILTER = Pattern.compile("\\b(after:|before:|newer_than:|older_than:)", Pattern.CASE_INSENSITIVE);

    private QueryExpressions() {
    }

    public static String quoteIfNeeded(String term) {
        return term.contains(" ") ? "\"" + term + "\"" : term;
    }

    /**
     * Keyword query from explicit term lists. Must-haves: one term alone, two terms
     * AND-ed, three or more OR-ed in parentheses; nice-to-haves follow as an OR group.
     * Without must-haves every keyword and nice-to-have is OR-ed.
     *
     * @param emptyQuery returned when no terms were given
     */
    public static String buildLegacyQuery(List<String> mustHave, List<String> niceToHave, List<String> keywords, String emptyQuery) {
        List<String> must = nonBlank(mustHave);
        List<String> nice = nonBlank(niceToHave);
        String query;

        if (!must.isEmpty()) {
            if (must.size() == 1) {
                query = quoteIfNeeded(must.get(0));
            } else if (must.size() == 2) {
                query = joinQuoted(must, " ");
            } else {
                query = "(" + joinQuoted(must, " OR ") + ")";
            }
            if (!nice.isEmpty()) {
                query = query + " (" + joinQuoted(nice, " OR ") + ")";
            }
        } else {
            List<String> all = new ArrayList<>(nonBlank(keywords));
            all.addAll(nice);
            query = joinQuoted(all, " OR ");
        }

        query = query.trim();
        return query.isEmpty() ? emptyQuery : query;
    }

    /**
     * Lower-cases and splits on anything but letters, digits, '@' and '.'; drops short
     * tokens and stop words; keeps at most 15 tokens.
     */
    public static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> tokens = new ArrayList<>();
        for (String token : TOKEN_SPLIT.split(text.toLowerCase(Locale.ROOT))) {
            if (token.length() > 2 && !SWEEP_STOP_WORDS.contains(token)) {
                tokens.add(token);
                if (tokens.size() == MAX_TOKENS_PER_SOURCE) {
                    break;
                }
            }
        }
        return tokens;
    }

    /**
     * Ordered, de-duplicated tokens from the intent and every keyword list.
     */
    public static Set<String> tokenBag(String intent, Collection<String> keywords,
                                       Collection<String> mustHave, Collection<String> niceToHave) {
        Set<String> bag = new LinkedHashSet<>(tokenize(intent));
        for (Collection<String> source : List.of(keywords, mustHave, niceToHave)) {
            for (String keyword : source) {
                bag.addAll(tokenize(keyword));
            }
        }
        return bag;
    }

    public static String orJoin(Collection<String> terms) {
        return terms.stream().map(QueryExpressions::quoteIfNeeded).collect(Collectors.joining(" OR "));
    }

    public static String failsafeQuery(Collection<String> tokenBag) {
        return tokenBag.isEmpty() ? FAILSAFE_RECENT : orJoin(tokenBag);
    }

    /**
     * Space separated words longer than three characters, minus filler words. Used when
     * the model cannot refine an intent.
     */
    public static String fallbackKeywords(String intent) {
        if (intent == null) {
            return "";
        }
        return List.of(intent.trim().split("\\s+")).stream()
                .filter(word -> word.length() > 3 && !REFINE_STOP_WORDS.contains(word.toLowerCase(Locale.ROOT)))
                .collect(Collectors.joining(" "));
    }

    public static boolean hasTimeFilter(String query) {
        return query != null && TIME_FILTER.matcher(query).find();
    }

    /**
     * Appends the window unless the query already restricts time.
     */
    public static String withWindow(String query, String window) {
        if (window == null || window.isBlank() || hasTimeFilter(query)) {
            return query;
        }
        return query + " " + window;
    }

    private static List<String> nonBlank(List<String> terms) {
        if (terms == null) {
            return List.of();
        }
        return terms.stream()
                .filter(term -> term != null && !term.isBlank())
                .map(String::trim)
                .collect(Collectors.toList());
    }

    private static String joinQuoted(List<String> terms, String separator) {
        return terms.stream().map(QueryExpressions::quoteIfNeeded).collect(Collectors.joining(separator));
    }
}
