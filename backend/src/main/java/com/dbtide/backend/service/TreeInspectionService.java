package com.dbtide.backend.service;

import com.dbtide.backend.config.DbtIdeProperties;
import com.dbtide.backend.syntax.Parser;
import com.dbtide.backend.syntax.TreeRenderer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Renders tree dumps within a bounded time.
 *
 * <p>Each successful dump is remembered under its document key, so a request that times out or fails can
 * still hand back the last good dump of the same document. Only the {@value #MAX_REMEMBERED_DUMPS} most
 * recently used documents are remembered.
 */
@Service
public class TreeInspectionService implements DisposableBean {

    private static final Logger logger = LoggerFactory.getLogger(TreeInspectionService.class);

    static final int MAX_REMEMBERED_DUMPS = 64;

    private final DbtIdeProperties properties;
    private final Map<String, String> lastDumps = Collections.synchronizedMap(
            new LinkedHashMap<String, String>(16, 0.75f, true) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, String> eldest) {
                    return size() > MAX_REMEMBERED_DUMPS;
                }
            });
    private final AtomicLong dumpCounter = new AtomicLong(0);
    private final ExecutorService renderExecutor;

    public TreeInspectionService(DbtIdeProperties properties) {
        this.properties = properties;
        this.renderExecutor = Executors.newFixedThreadPool(properties.parserThreads(), runnable -> {
            Thread thread = new Thread(runnable, "tree-dump-" + dumpCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Outcome of one dump request.
     *
     * @param dump     the rendered tree, {@code null} unless the request succeeded
     * @param previous last good dump for the same document key, if any
     */
    public record TreeDump(String dump, boolean timedOut, String error, String previous) {

        static TreeDump success(String dump) {
            return new TreeDump(dump, false, null, null);
        }

        static TreeDump timeout(String error, String previous) {
            return new TreeDump(null, true, error, previous);
        }

        static TreeDump failure(String error, String previous) {
            return new TreeDump(null, false, error, previous);
        }

        public boolean success() {
            return dump != null;
        }
    }

    @PostConstruct
    public void init() {
        logger.info("TreeInspectionService initialized with timeout {}ms", properties.treeDumpTimeoutMs());
    }

    @PreDestroy
    @Override
    public void destroy() throws Exception {
        logger.info("Shutting down TreeInspectionService");
        renderExecutor.shutdownNow();
        try {
            if (!renderExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Tree dump workers did not stop in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /** @param documentKey may be {@code null}, in which case nothing is remembered */
    public TreeDump dump(String source, String documentKey) {
        return dump(source, documentKey, properties.treeDumpTimeoutMs());
    }

    TreeDump dump(String source, String documentKey, long timeoutMs) {
        long startTime = System.currentTimeMillis();
        AtomicBoolean cancelled = new AtomicBoolean();
        CompletableFuture<String> rendering = CompletableFuture.supplyAsync(
                () -> TreeRenderer.render(Parser.parse(source, cancelled::get)), renderExecutor);

        try {
            String dump = rendering.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (documentKey != null) {
                lastDumps.put(documentKey, dump);
            }
            logger.debug("Rendered tree dump of {} characters in {}ms",
                    source.length(), System.currentTimeMillis() - startTime);
            return TreeDump.success(dump);

        } catch (TimeoutException e) {
            cancelled.set(true);
            rendering.cancel(true);
            logger.warn("Tree dump timed out after {}ms", timeoutMs);
            return TreeDump.timeout("Tree dump timed out after " + timeoutMs + "ms",
                    previous(documentKey));

        } catch (ExecutionException e) {
            logger.error("Tree dump failed", e.getCause());
            return TreeDump.failure("Tree dump failed: " + e.getCause().getMessage(), previous(documentKey));

        } catch (InterruptedException e) {
            cancelled.set(true);
            Thread.currentThread().interrupt();
            return TreeDump.failure("Tree dump was interrupted", previous(documentKey));
        }
    }

    public void forget(String documentKey) {
        lastDumps.remove(documentKey);
    }

    private String previous(String documentKey) {
        return documentKey != null ? lastDumps.get(documentKey) : null;
    }
}
