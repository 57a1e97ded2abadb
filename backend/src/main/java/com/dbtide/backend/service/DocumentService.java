package com.dbtide.backend.service;

import com.dbtide.backend.config.DbtIdeProperties;
import com.dbtide.backend.dto.ContentType;
import com.dbtide.backend.exception.DocumentNotFoundException;
import com.dbtide.backend.syntax.ParseResult;
import com.dbtide.backend.syntax.Parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps the latest parsed snapshot of every open document.
 *
 * <p>Every update reparses the whole text on the parser pool. A newer update for the same uri cancels the
 * parse still running for an older one, and a parse that was overtaken never replaces the published
 * snapshot. Its future completes with a {@link CancellationException} instead. An update whose version is
 * not newer than the one in flight or published fails the same way at once and leaves that one alone.
 */
@Service
public class DocumentService implements DisposableBean {

    private static final Logger logger = LoggerFactory.getLogger(DocumentService.class);

    private record ParseTask(int version, AtomicBoolean cancelled, CompletableFuture<DocumentSnapshot> future) {
    }

    private final DbtIdeProperties properties;
    private final Map<String, DocumentSnapshot> documents = new ConcurrentHashMap<>();
    private final Map<String, ParseTask> inFlight = new ConcurrentHashMap<>();
    private final AtomicLong threadCounter = new AtomicLong(0);
    private final ExecutorService parserExecutor;

    public DocumentService(DbtIdeProperties properties) {
        this.properties = properties;
        this.parserExecutor = Executors.newFixedThreadPool(properties.parserThreads(), runnable -> {
            Thread thread = new Thread(runnable, "document-parser-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @PostConstruct
    public void init() {
        logger.info("DocumentService initialized with {} parser threads", properties.parserThreads());
    }

    @PreDestroy
    @Override
    public void destroy() throws Exception {
        logger.info("Shutting down DocumentService");
        inFlight.values().forEach(task -> task.cancelled().set(true));
        parserExecutor.shutdown();
        try {
            if (!parserExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                parserExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            parserExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("DocumentService shutdown complete");
    }

    public CompletableFuture<DocumentSnapshot> update(String uri, int version, String text, ContentType contentType) {
        if (text.length() > properties.maxSourceCodeLength()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException(
                    "Document exceeds maximum length of " + properties.maxSourceCodeLength() + " characters"));
        }

        ParseTask task = new ParseTask(version, new AtomicBoolean(), new CompletableFuture<>());
        AtomicReference<ParseTask> superseded = new AtomicReference<>();
        ParseTask current = inFlight.compute(uri, (key, running) -> {
            DocumentSnapshot published = documents.get(key);
            if ((running != null && running.version() >= version)
                    || (published != null && published.version() >= version)) {
                return running;
            }
            superseded.set(running);
            return task;
        });

        if (current != task) {
            logger.debug("Ignoring version {} of {}: a newer version is already known", version, uri);
            return CompletableFuture.failedFuture(
                    new CancellationException("Version " + version + " of " + uri + " is stale"));
        }
        ParseTask previous = superseded.get();
        if (previous != null) {
            previous.cancelled().set(true);
            logger.debug("Version {} of {} supersedes in-flight version {}", version, uri, previous.version());
        }

        parserExecutor.execute(() -> parse(uri, text, contentType, task));
        return task.future();
    }

    private void parse(String uri, String text, ContentType contentType, ParseTask task) {
        long startTime = System.currentTimeMillis();
        try {
            ParseResult result = Parser.parse(text, task.cancelled()::get);
            long parseTime = System.currentTimeMillis() - startTime;
            DocumentSnapshot snapshot = DocumentSnapshot.of(uri, task.version(), contentType, text, result, parseTime);

            if (!inFlight.remove(uri, task)) {
                task.future().completeExceptionally(
                        new CancellationException("Version " + task.version() + " of " + uri + " was superseded"));
                return;
            }
            DocumentSnapshot published = documents.merge(uri, snapshot,
                    (existing, candidate) -> existing.version() > candidate.version() ? existing : candidate);
            if (published != snapshot) {
                logger.debug("Ignoring version {} of {}: version {} is already published",
                        task.version(), uri, published.version());
                task.future().completeExceptionally(
                        new CancellationException("Version " + task.version() + " of " + uri + " is stale"));
                return;
            }

            logger.debug("Parsed {} version {} in {}ms with {} errors",
                    uri, task.version(), parseTime, result.errors().size());
            task.future().complete(snapshot);

        } catch (CancellationException e) {
            logger.debug("Parse of {} version {} was cancelled", uri, task.version());
            task.future().completeExceptionally(e);
        } catch (Exception e) {
            inFlight.remove(uri, task);
            logger.error("Failed to parse {} version {}", uri, task.version(), e);
            task.future().completeExceptionally(e);
        }
    }

    public Optional<DocumentSnapshot> find(String uri) {
        return Optional.ofNullable(documents.get(uri));
    }

    public DocumentSnapshot get(String uri) {
        DocumentSnapshot snapshot = documents.get(uri);
        if (snapshot == null) {
            throw new DocumentNotFoundException(uri);
        }
        return snapshot;
    }

    /** @return whether the document was open */
    public boolean close(String uri) {
        ParseTask task = inFlight.remove(uri);
        if (task != null) {
            task.cancelled().set(true);
        }
        boolean removed = documents.remove(uri) != null;
        logger.debug("Closed {} (open: {})", uri, removed);
        return removed;
    }

    public int openDocumentCount() {
        return documents.size();
    }
}
