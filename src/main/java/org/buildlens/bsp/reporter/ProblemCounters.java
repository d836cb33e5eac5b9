package org.buildlens.bsp.reporter;

import org.buildlens.compiler.api.Severity;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-severity problem counts. Each counter is independent; reads are not a consistent
 * snapshot across the three while problems are still being reported.
 */
public class ProblemCounters {

    private final AtomicInteger errors = new AtomicInteger(0);
    private final AtomicInteger warnings = new AtomicInteger(0);
    private final AtomicInteger infos = new AtomicInteger(0);

    public void increment(Severity severity) {
        switch (severity) {
            case ERROR -> errors.incrementAndGet();
            case WARNING -> warnings.incrementAndGet();
            case INFO -> infos.incrementAndGet();
        }
    }

    public int errors() {
        return errors.get();
    }

    public int warnings() {
        return warnings.get();
    }

    public int infos() {
        return infos.get();
    }
}
