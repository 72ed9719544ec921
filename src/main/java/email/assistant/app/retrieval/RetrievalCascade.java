package email.assistant.app.retrieval;

import email.assistant.app.model.EmailMessage;
import email.assistant.app.model.MessageStub;
import email.assistant.app.service.MailboxClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * Runs the refined, legacy and keyword-sweep queries concurrently and unions their hits.
 * The union order follows the branch order, never completion order.
 */
@Slf4j
@Service
public class RetrievalCascade {
    // Fetches submitted at once; fits the retrieval pool's queue
    static final int FETCH_BATCH_SIZE = 16;

    private final SearchQueryRefiner queryRefiner;
    private final Executor retrievalExecutor;

    public RetrievalCascade(SearchQueryRefiner queryRefiner, @Qualifier("retrievalExecutor") Executor retrievalExecutor) {
        this.queryRefiner = queryRefiner;
        this.retrievalExecutor = retrievalExecutor;
    }

    public RetrievalResult retrieve(MailboxClient mailbox, RetrievalRequest request) {
        String window = request.getTimeWindow();
        Set<String> tokenBag = QueryExpressions.tokenBag(
                request.getIntent(), request.getKeywords(), request.getMustHave(), request.getNiceToHave());

        // Branch name -> query; duplicates collapse onto the earlier branch
        Map<String, String> branches = new LinkedHashMap<>();
        addBranch(branches, "refined", queryRefiner.refine(request.getIntent()), window);
        addBranch(branches, "legacy", QueryExpressions.buildLegacyQuery(
                request.getMustHave(), request.getNiceToHave(), request.getKeywords(),
                window != null ? window : QueryExpressions.RECENT_ITEMS), window);
        addBranch(branches, "sweep", QueryExpressions.orJoin(tokenBag), window);

        List<CompletableFuture<List<MessageStub>>> searches = new ArrayList<>();
        for (Map.Entry<String, String> branch : branches.entrySet()) {
            log.info("Running {} query: \"{}\"", branch.getKey(), branch.getValue());
            searches.add(searchAsync(mailbox, branch.getKey(), branch.getValue(), request.getMaxResults()));
        }
        CompletableFuture.allOf(searches.toArray(new CompletableFuture[0])).join();

        Map<String, MessageStub> union = new LinkedHashMap<>();
        for (CompletableFuture<List<MessageStub>> search : searches) {
            for (MessageStub stub : search.join()) {
                union.putIfAbsent(stub.getId(), stub);
            }
        }

        List<String> queriesUsed = new ArrayList<>(branches.values());
        List<EmailMessage> messages = fetchAll(mailbox, new ArrayList<>(union.values()));
        // List.sort is stable, so equal timestamps keep branch order
        messages.sort(Comparator.comparing(EmailMessage::getReceivedAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder())));

        if (!messages.isEmpty()) {
            log.info("Retrieved {} messages using queries {}", messages.size(), queriesUsed);
            return new RetrievalResult(messages, queriesUsed, false);
        }

        String failsafe = QueryExpressions.failsafeQuery(tokenBag);
        log.warn("Union search returned 0 results, trying failsafe query \"{}\"", failsafe);
        queriesUsed.add(failsafe);
        List<MessageStub> stubs = searchAsync(mailbox, "failsafe", failsafe, request.getMaxResults()).join();
        List<EmailMessage> failsafeMessages = fetchAll(mailbox, stubs);
        log.info("Failsafe query returned {} messages", failsafeMessages.size());
        return new RetrievalResult(failsafeMessages, queriesUsed, true);
    }

    private static void addBranch(Map<String, String> branches, String name, String query, String window) {
        if (query == null || query.isBlank()) {
            return;
        }
        String windowed = QueryExpressions.withWindow(query.trim(), window);
        if (!branches.containsValue(windowed)) {
            branches.put(name, windowed);
        }
    }

    private CompletableFuture<List<MessageStub>> searchAsync(MailboxClient mailbox, String branch, String query, int maxResults) {
        return submit(() -> mailbox.search(query, maxResults), List.<MessageStub>of(), branch + " query")
                .exceptionally(ex -> {
                    log.error("{} query failed, continuing without it: {}", branch, ex.getMessage(), ex);
                    return List.of();
                });
    }

    /**
     * Fetches in batches of {@link #FETCH_BATCH_SIZE} so a wide union never floods the pool.
     * A failed or rejected fetch drops that message only.
     */
    private List<EmailMessage> fetchAll(MailboxClient mailbox, List<MessageStub> stubs) {
        List<EmailMessage> messages = new ArrayList<>();
        for (int start = 0; start < stubs.size(); start += FETCH_BATCH_SIZE) {
            List<CompletableFuture<Optional<EmailMessage>>> fetches = new ArrayList<>();
            for (MessageStub stub : stubs.subList(start, Math.min(start + FETCH_BATCH_SIZE, stubs.size()))) {
                fetches.add(submit(() -> mailbox.fetch(stub.getId()), Optional.<EmailMessage>empty(), "fetch of " + stub.getId())
                        .exceptionally(ex -> {
                            log.warn("Fetch of message {} failed: {}", stub.getId(), ex.getMessage());
                            return Optional.empty();
                        }));
            }
            for (CompletableFuture<Optional<EmailMessage>> fetch : fetches) {
                fetch.join().ifPresent(messages::add);
            }
        }
        return messages;
    }

    private <T> CompletableFuture<T> submit(Supplier<T> task, T whenRejected, String description) {
        try {
            return CompletableFuture.supplyAsync(task, retrievalExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("Retrieval pool rejected {}: {}", description, e.getMessage());
            return CompletableFuture.completedFuture(whenRejected);
        }
    }
}
