package com.myorg.docinsight.service.ranking;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Publishes the current {@link SectionIndex}. Readers take no lock and always see a complete
 * index; rebuilds are serialized and swap the reference only once the new index is built.
 */
@Slf4j
public class IndexHolder {

    private final AtomicReference<SectionIndex> current = new AtomicReference<>(SectionIndex.empty());

    public SectionIndex current() {
        return current.get();
    }

    public synchronized SectionIndex rebuild(Supplier<SectionIndex> builder) {
        SectionIndex next = builder.get();
        SectionIndex previous = current.getAndSet(next);
        log.info("Section index replaced: {} -> {} sections", previous.size(), next.size());
        return next;
    }
}
