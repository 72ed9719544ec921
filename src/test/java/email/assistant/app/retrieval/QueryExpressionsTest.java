package email.assistant.app.retrieval;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class QueryExpressionsTest {

    @Test
    void buildLegacyQuery_WithSingleMustHave_ShouldQuoteMultiWordTerm() {
        // When
        String query = QueryExpressions.buildLegacyQuery(List.of("project x"), List.of(), List.of(), "newer_than:1d");

        // Then
        assertEquals("\"project x\"", query);
    }

    @Test
    void buildLegacyQuery_WithTwoMustHaves_ShouldAndThem() {
        // When
        String query = QueryExpressions.buildLegacyQuery(List.of("invoice", "acme corp"), List.of("march"), List.of(), "");

        // Then
        assertEquals("invoice \"acme corp\" (march)", query);
    }

    @Test
    void buildLegacyQuery_WithThreeMustHaves_ShouldOrThemInParentheses() {
        // When
        String query = QueryExpressions.buildLegacyQuery(List.of("pnr", "flight", "booking"), List.of(), List.of(), "");

        // Then
        assertEquals("(pnr OR flight OR booking)", query);
    }

    @Test
    void buildLegacyQuery_WithoutMustHaves_ShouldOrKeywordsAndNiceToHaves() {
        // When
        String query = QueryExpressions.buildLegacyQuery(List.of(), List.of("receipt"), List.of("order", " "), "");

        // Then
        assertEquals("order OR receipt", query);
    }

    @Test
    void buildLegacyQuery_WithNoTerms_ShouldReturnEmptyQuery() {
        // When
        String query = QueryExpressions.buildLegacyQuery(null, null, null, "after:1700000000");

        // Then
        assertEquals("after:1700000000", query);
    }

    @Test
    void tokenize_ShouldDropStopWordsAndShortTokens() {
        // When
        List<String> tokens = QueryExpressions.tokenize("What is the deadline for Project X? ping bob@acme.io");

        // Then
        assertEquals(List.of("deadline", "project", "ping", "bob@acme.io"), tokens);
    }

    @Test
    void tokenize_WithManyWords_ShouldKeepFifteen() {
        // Given
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < 30; i++) {
            text.append("word").append(i).append(' ');
        }

        // When
        List<String> tokens = QueryExpressions.tokenize(text.toString());

        // Then
        assertEquals(15, tokens.size());
        assertEquals("word0", tokens.get(0));
    }

    @Test
    void tokenBag_ShouldKeepFirstSeenOrderWithoutDuplicates() {
        // When
        Set<String> bag = QueryExpressions.tokenBag("flight booking", List.of("booking reference"), List.of("pnr code"), List.of());

        // Then
        assertEquals(List.of("flight", "booking", "reference", "pnr", "code"), List.copyOf(bag));
    }

    @Test
    void failsafeQuery_WithEmptyBag_ShouldSearchLastTwoDays() {
        assertEquals("newer_than:2d", QueryExpressions.failsafeQuery(Set.of()));
        assertEquals("\"a b\" OR c", QueryExpressions.failsafeQuery(List.of("a b", "c")));
    }

    @Test
    void fallbackKeywords_ShouldKeepLongWordsOnly() {
        // When
        String keywords = QueryExpressions.fallbackKeywords("give me emails about the quarterly budget review");

        // Then
        assertEquals("quarterly budget review", keywords);
    }

    @Test
    void withWindow_ShouldNotStackTimeFilters() {
        assertEquals("invoice after:100", QueryExpressions.withWindow("invoice", "after:100"));
        assertEquals("invoice newer_than:7d", QueryExpressions.withWindow("invoice newer_than:7d", "after:100"));
        assertEquals("invoice", QueryExpressions.withWindow("invoice", null));
    }
}
