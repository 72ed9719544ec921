package email.assistant.app.analysis;

import email.assistant.app.model.EmailMessage;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Bounded, information-dense excerpts of a message for embedding and analysis prompts.
 */
public final class EmailExcerpts {
    static final int EMBEDDING_PARAGRAPH_CHARS = 500;
    static final int EMBEDDING_TOTAL_CHARS = 1500;

    private static final List<Pattern> KEY_LINE_PATTERNS = List.of(
            Pattern.compile("\\$[\\d,]+(?:\\.\\d{2})?"),
            Pattern.compile("\\b\\d{1,2}/\\d{1,2}/\\d{2,4}\\b"),
            Pattern.compile("\\b(invoice|payment|deadline|urgent|meeting|confirm)\\b", Pattern.CASE_INSENSITIVE));

    private EmailExcerpts() {
    }

    /**
     * Subject, sender and the first paragraph of the body (snippet when the body is not
     * loaded), capped for the embedding model.
     */
    public static String embeddingText(EmailMessage message) {
        List<String> parts = new ArrayList<>();
        if (notBlank(message.getSubject())) {
            parts.add("Subject: " + message.getSubject());
        }
        if (notBlank(message.getSender())) {
            parts.add("From: " + message.getSender());
        }
        if (message.hasBody()) {
            String firstParagraph = message.getBody().split("\n\n", 2)[0];
            parts.add(truncate(firstParagraph, EMBEDDING_PARAGRAPH_CHARS));
        } else if (notBlank(message.getSnippet())) {
            parts.add(message.getSnippet());
        }
        return truncate(String.join("\n", parts), EMBEDDING_TOTAL_CHARS);
    }

    /**
     * Header block followed by the body trimmed to fit {@code maxChars}.
     */
    public static String analysisText(EmailMessage message, String body, int maxChars) {
        String header = "From: " + nullToEmpty(message.getSender()) + "\n"
                + "Subject: " + nullToEmpty(message.getSubject()) + "\n"
                + "---";
        int remaining = Math.max(0, maxChars - header.length() - 50);
        return header + "\n" + intelligentTruncate(body != null ? body : "", remaining);
    }

    /**
     * Keeps the opening lines, then lines carrying amounts, dates or action words, then
     * context from the middle of the text while room remains.
     */
    public static String intelligentTruncate(String text, int maxChars) {
        if (text.length() <= maxChars) {
            return text;
        }
        List<String> lines = text.lines()
                .filter(line -> !line.trim().isEmpty())
                .collect(Collectors.toList());
        if (lines.isEmpty()) {
            return text.substring(0, maxChars);
        }

        StringBuilder result = new StringBuilder();
        int charsUsed = 0;

        // Opening lines get at most 40% of the budget
        for (int i = 0; i < Math.min(3, lines.size()); i++) {
            String line = lines.get(i);
            if (charsUsed + line.length() + 1 <= maxChars * 0.4) {
                result.append(line).append('\n');
                charsUsed += line.length() + 1;
            }
        }

        for (int i = 3; i < lines.size(); i++) {
            String line = lines.get(i);
            if (KEY_LINE_PATTERNS.stream().noneMatch(pattern -> pattern.matcher(line).find())) {
                continue;
            }
            if (charsUsed + line.length() + 1 > maxChars) {
                break;
            }
            result.append(line).append('\n');
            charsUsed += line.length() + 1;
        }

        if (charsUsed < maxChars * 0.8 && lines.size() > 5) {
            for (int i = lines.size() / 2; i < lines.size(); i++) {
                String line = lines.get(i);
                if (charsUsed + line.length() + 1 > maxChars) {
                    break;
                }
                result.append(line).append('\n');
                charsUsed += line.length() + 1;
            }
        }
        return result.toString().trim();
    }

    public static String truncate(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        return text.length() <= maxChars ? text : text.substring(0, maxChars);
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
