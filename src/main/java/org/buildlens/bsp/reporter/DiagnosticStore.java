package org.buildlens.bsp.reporter;

import org.buildlens.bsp.protocol.Diagnostic;
import org.buildlens.bsp.protocol.TextDocumentIdentifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Accumulates the diagnostics published for each document during one compilation.
 * <p>
 * Every stored list is immutable and holds the complete set last returned for its
 * document, in arrival order. Updates are lock-free: {@link #append} swaps in a new list
 * with {@link AtomicReference#compareAndSet} and retries on contention, so documents never
 * block each other.
 * <p>
 * The store only grows; there is no removal.
 */
public class DiagnosticStore {

    private final ConcurrentMap<TextDocumentIdentifier, AtomicReference<List<Diagnostic>>> diagnostics =
            new ConcurrentHashMap<>();

    /**
     * Returns the current diagnostics of a document, registering an empty list if the
     * document has not been seen yet. An existing list is never replaced.
     *
     * @param document The document.
     * @return The current, unmodifiable list.
     */
    public List<Diagnostic> ensure(TextDocumentIdentifier document) {
        return slot(document).get();
    }

    /**
     * Appends a diagnostic to the list of a document.
     *
     * @param document   The document.
     * @param diagnostic The diagnostic to add at the end.
     * @return The new complete, unmodifiable list, including {@code diagnostic}.
     */
    public List<Diagnostic> append(TextDocumentIdentifier document, Diagnostic diagnostic) {
        AtomicReference<List<Diagnostic>> slot = slot(document);
        while (true) {
            List<Diagnostic> current = slot.get();
            List<Diagnostic> next = appended(current, diagnostic);
            if (slot.compareAndSet(current, next)) {
                return next;
            }
        }
    }

    /**
     * @param document The document.
     * @return The current diagnostics, or an empty list if the document is unknown.
     */
    public List<Diagnostic> get(TextDocumentIdentifier document) {
        AtomicReference<List<Diagnostic>> slot = diagnostics.get(document);
        return slot != null ? slot.get() : List.of();
    }

    /**
     * @return A snapshot of all documents seen so far.
     */
    public Set<TextDocumentIdentifier> documents() {
        return Set.copyOf(diagnostics.keySet());
    }

    private AtomicReference<List<Diagnostic>> slot(TextDocumentIdentifier document) {
        return diagnostics.computeIfAbsent(document, d -> new AtomicReference<>(List.of()));
    }

    private static List<Diagnostic> appended(List<Diagnostic> current, Diagnostic diagnostic) {
        List<Diagnostic> next = new ArrayList<>(current.size() + 1);
        next.addAll(current);
        next.add(diagnostic);
        return List.copyOf(next);
    }
}
