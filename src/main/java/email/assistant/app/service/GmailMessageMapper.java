package email.assistant.app.service;

import com.google.api.services.gmail.model.Message;
import com.google.api.services.gmail.model.MessagePart;
import com.google.api.services.gmail.model.MessagePartHeader;
import email.assistant.app.model.EmailMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Base64;
import java.util.regex.Pattern;

/**
 * Converts Gmail API messages into {@link EmailMessage}s.
 */
@Slf4j
@Component
public class GmailMessageMapper {
    private static final Pattern STYLE_OR_SCRIPT = Pattern.compile("(?is)<(style|script)[^>]*>.*?</\\1>");
    private static final Pattern BREAKS = Pattern.compile("(?i)<br\\s*/?>|</p>|</div>|</tr>|</li>");
    private static final Pattern TAGS = Pattern.compile("<[^>]+>");
    private static final Pattern SPACES = Pattern.compile("[ \\t\\x0B\\f\\r]+");
    private static final Pattern BLANK_LINES = Pattern.compile("\\n\\s*\\n+");

    public EmailMessage toEmailMessage(Message message) {
        String from = "";
        String to = "";
        String subject = "";
        String date = null;

        if (message.getPayload() != null && message.getPayload().getHeaders() != null) {
            for (MessagePartHeader header : message.getPayload().getHeaders()) {
                String name = header.getName() != null ? header.getName().toLowerCase() : "";
                String value = header.getValue() != null ? header.getValue() : "";
                switch (name) {
                    case "from":
                        from = value;
                        break;
                    case "to":
                        to = value;
                        break;
                    case "subject":
                        subject = value;
                        break;
                    case "date":
                        date = value;
                        break;
                    default:
                        break;
                }
            }
        }

        EmailMessage.EmailMessageBuilder builder = EmailMessage.builder()
            .id(message.getId())
            .threadId(message.getThreadId())
            .sender(from)
            .subject(subject)
            .snippet(message.getSnippet() != null ? message.getSnippet() : "")
            .receivedAt(receivedAt(message.getInternalDate(), date));
        for (String recipient : to.split(",")) {
            if (!recipient.isBlank()) {
                builder.recipient(recipient.trim());
            }
        }
        if (message.getLabelIds() != null) {
            builder.labels(message.getLabelIds());
        }
        return builder.build();
    }

    /**
     * Body text with text/plain preferred over HTML, falling back to the snippet.
     */
    public String extractBody(Message message) {
        if (message.getPayload() != null) {
            BodyExtractionResult bodyResult = extractBodyFromParts(message.getPayload());
            if (bodyResult.plainTextContent != null && !bodyResult.plainTextContent.isBlank()) {
                return bodyResult.plainTextContent.trim();
            }
            if (bodyResult.htmlContent != null && !bodyResult.htmlContent.isBlank()) {
                return stripHtml(bodyResult.htmlContent);
            }
        }
        return message.getSnippet() != null ? message.getSnippet() : "";
    }

    private static class BodyExtractionResult {
        String htmlContent = null;
        String plainTextContent = null;
    }

    private BodyExtractionResult extractBodyFromParts(MessagePart part) {
        BodyExtractionResult result = new BodyExtractionResult();
        String mimeType = part.getMimeType();

        if (part.getBody() != null && part.getBody().getData() != null
                && ("text/plain".equals(mimeType) || "text/html".equals(mimeType))) {
            String decodedText = decode(part.getBody().getData(), mimeType);
            if (decodedText != null) {
                if ("text/html".equals(mimeType)) {
                    result.htmlContent = decodedText;
                } else {
                    result.plainTextContent = decodedText;
                }
            }
        }

        if (part.getParts() != null) {
            for (MessagePart subPart : part.getParts()) {
                BodyExtractionResult subResult = extractBodyFromParts(subPart);
                if (subResult.htmlContent != null && !subResult.htmlContent.isEmpty()) {
                    result.htmlContent = (result.htmlContent != null ? result.htmlContent + "\n" : "") + subResult.htmlContent;
                }
                if (subResult.plainTextContent != null && !subResult.plainTextContent.isEmpty()) {
                    result.plainTextContent = (result.plainTextContent != null ? result.plainTextContent + "\n" : "") + subResult.plainTextContent;
                }
            }
        }
        return result;
    }

    private String decode(String data, String mimeType) {
        try {
            // Gmail bodies are URL-safe base64
            return new String(Base64.getUrlDecoder().decode(data), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            try {
                String paddedData = data.replace('-', '+').replace('_', '/');
                int remainder = paddedData.length() % 4;
                if (remainder > 0) {
                    paddedData += "=".repeat(4 - remainder);
                }
                return new String(Base64.getDecoder().decode(paddedData), StandardCharsets.UTF_8);
            } catch (IllegalArgumentException e2) {
                log.warn("Error decoding email body part (mimeType: {}): {}", mimeType, e2.getMessage());
                return null;
            }
        }
    }

    static String stripHtml(String html) {
        String text = STYLE_OR_SCRIPT.matcher(html).replaceAll(" ");
        text = BREAKS.matcher(text).replaceAll("\n");
        text = TAGS.matcher(text).replaceAll(" ");
        text = text.replace("&nbsp;", " ")
                   .replace("&lt;", "<")
                   .replace("&gt;", ">")
                   .replace("&quot;", "\"")
                   .replace("&#39;", "'")
                   .replace("&amp;", "&");
        text = SPACES.matcher(text).replaceAll(" ");
        text = BLANK_LINES.matcher(text).replaceAll("\n\n");
        return text.lines().map(String::trim).reduce((a, b) -> a + "\n" + b).orElse("").trim();
    }

    private Instant receivedAt(Long internalDate, String dateHeader) {
        if (internalDate != null) {
            return Instant.ofEpochMilli(internalDate);
        }
        if (dateHeader != null && !dateHeader.isBlank()) {
            try {
                // Strip trailing "(UTC)" style comments
                String cleaned = dateHeader.replaceAll("\\s*\\([^)]*\\)\\s*$", "").trim();
                return ZonedDateTime.parse(cleaned, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
            } catch (DateTimeParseException e) {
                log.debug("Unparseable Date header '{}'", dateHeader);
            }
        }
        return Instant.EPOCH;
    }
}
