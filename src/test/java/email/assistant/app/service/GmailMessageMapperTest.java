package email.assistant.app.service;

import com.google.api.services.gmail.model.Message;
import com.google.api.services.gmail.model.MessagePart;
import com.google.api.services.gmail.model.MessagePartBody;
import com.google.api.services.gmail.model.MessagePartHeader;
import email.assistant.app.model.EmailMessage;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GmailMessageMapperTest {

    private final GmailMessageMapper mapper = new GmailMessageMapper();

    @Test
    void toEmailMessage_ShouldMapHeadersLabelsAndDate() {
        // Given
        Message message = new Message()
                .setId("m1")
                .setThreadId("t1")
                .setSnippet("See attached")
                .setLabelIds(List.of("INBOX", "IMPORTANT"))
                .setPayload(new MessagePart().setHeaders(List.of(
                        header("From", "Alice <alice@acme.com>"),
                        header("To", "bob@acme.com, carol@acme.com"),
                        header("Subject", "Q3 numbers"),
                        header("Date", "Fri, 10 May 2024 12:00:00 +0000 (UTC)"))));

        // When
        EmailMessage email = mapper.toEmailMessage(message);

        // Then
        assertEquals("m1", email.getId());
        assertEquals("t1", email.getThreadId());
        assertEquals("Alice <alice@acme.com>", email.getSender());
        assertEquals(List.of("bob@acme.com", "carol@acme.com"), email.getRecipients());
        assertEquals("Q3 numbers", email.getSubject());
        assertEquals(List.of("INBOX", "IMPORTANT"), email.getLabels());
        assertEquals(Instant.parse("2024-05-10T12:00:00Z"), email.getReceivedAt());
        assertNull(email.getBody());
    }

    @Test
    void toEmailMessage_ShouldPreferInternalDate() {
        // Given
        Message message = new Message().setId("m1").setInternalDate(1_715_342_400_000L)
                .setPayload(new MessagePart().setHeaders(List.of(header("Date", "not a date"))));

        // When / Then
        assertEquals(Instant.ofEpochMilli(1_715_342_400_000L), mapper.toEmailMessage(message).getReceivedAt());
    }

    @Test
    void extractBody_WithPlainAndHtmlParts_ShouldPreferPlainText() {
        // Given
        Message message = new Message().setSnippet("snippet").setPayload(new MessagePart()
                .setMimeType("multipart/alternative")
                .setParts(List.of(
                        part("text/html", "<p>Html body</p>"),
                        part("text/plain", "Plain body\n"))));

        // When / Then
        assertEquals("Plain body", mapper.extractBody(message));
    }

    @Test
    void extractBody_WithHtmlOnly_ShouldStripMarkup() {
        // Given
        Message message = new Message().setPayload(part("text/html",
                "<html><style>p{color:red}</style><p>Hello&nbsp;<b>World</b></p><p>Bye &amp; thanks</p></html>"));

        // When / Then
        assertEquals("Hello World\nBye & thanks", mapper.extractBody(message));
    }

    @Test
    void extractBody_WithoutParts_ShouldUseSnippet() {
        assertEquals("only snippet", mapper.extractBody(new Message().setSnippet("only snippet")));
    }

    private static MessagePartHeader header(String name, String value) {
        return new MessagePartHeader().setName(name).setValue(value);
    }

    private static MessagePart part(String mimeType, String text) {
        String data = Base64.getUrlEncoder().withoutPadding().encodeToString(text.getBytes(StandardCharsets.UTF_8));
        return new MessagePart().setMimeType(mimeType).setBody(new MessagePartBody().setData(data));
    }
}
