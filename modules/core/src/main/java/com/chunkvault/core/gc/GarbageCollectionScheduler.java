package com.chunkvault.core.gc;

import com.chunkvault.core.content.ContentStore;
import com.chunkvault.core.content.GarbageCollectionResult;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import static io.quarkus.scheduler.Scheduled.ConcurrentExecution.SKIP;

/**
 * Periodically removes unreferenced blobs. The interval is {@code chunkvault.gc.interval};
 * {@code off} disables the sweep.
 */
@ApplicationScoped
public class GarbageCollectionScheduler {

    private static final Logger log = Logger.getLogger(GarbageCollectionScheduler.class);

    @Inject
    ContentStore contentStore;

    private volatile GarbageCollectionResult lastResult;

    @Scheduled(every = "${chunkvault.gc.interval:1h}", concurrentExecution = SKIP)
    public void sweep() {
        GarbageCollectionResult result = contentStore.collectGarbage(progress ->
                log.debugf("GC %d/%d (%.0f%%) %s", progress.current(), progress.total(),
                        progress.percentage(), progress.status()));
        lastResult = result;
        if (result.errors().isEmpty()) {
            log.infof("GC removed %d blobs (%d bytes) in %d ms",
                    result.deleted(), result.freedBytes(), result.durationMs());
        } else {
            log.warnf("GC removed %d blobs (%d bytes) in %d ms with %d errors, first: %s",
                    result.deleted(), result.freedBytes(), result.durationMs(),
                    result.errors().size(), result.errors().get(0));
        }
    }

    /** Result of the most recent sweep, {@code null} before the first one. */
    public GarbageCollectionResult lastResult() {
        return lastResult;
    }
}
