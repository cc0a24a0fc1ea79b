package dev.pekelund.docroute.support;

import java.util.Map;
import java.util.concurrent.Callable;
import org.slf4j.MDC;

/**
 * Utility for populating mapped diagnostic context (MDC) entries so log lines emitted while a
 * document is processed share the same identifiers (document, stage, page group).
 */
public final class PipelineMdc {

    static final String KEY_DOCUMENT = "docroute.document";
    static final String KEY_STAGE = "docroute.stage";
    static final String KEY_GROUP = "docroute.group";

    private PipelineMdc() {
        // Utility class
    }

    public static Context open(String documentName) {
        return new Context(documentName);
    }

    public static void setStage(String stage) {
        putIfHasText(KEY_STAGE, stage);
    }

    public static void setGroup(String group) {
        putIfHasText(KEY_GROUP, group);
    }

    /**
     * Wraps a task so it runs with the caller's MDC entries on whichever thread executes it.
     */
    public static <T> Callable<T> propagate(Callable<T> task) {
        Map<String, String> parent = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            if (parent != null) {
                MDC.setContextMap(parent);
            } else {
                MDC.clear();
            }
            try {
                return task.call();
            } finally {
                restore(previous);
            }
        };
    }

    private static void putIfHasText(String key, String value) {
        if (value != null && !value.isBlank()) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    private static void restore(Map<String, String> previous) {
        if (previous == null) {
            MDC.clear();
        } else {
            MDC.setContextMap(previous);
        }
    }

    public static final class Context implements AutoCloseable {

        private final Map<String, String> previous;

        private Context(String documentName) {
            this.previous = MDC.getCopyOfContextMap();
            putIfHasText(KEY_DOCUMENT, documentName);
        }

        @Override
        public void close() {
            restore(previous);
        }
    }
}
