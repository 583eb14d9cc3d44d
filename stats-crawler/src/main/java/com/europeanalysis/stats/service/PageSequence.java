package com.europeanalysis.stats.service;

import com.europeanalysis.stats.model.DatasetDescriptor;
import com.europeanalysis.stats.model.RawPage;

import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Pages of one dataset fetch, addressable by index so an interrupted run can
 * restart from the page after the last one it persisted.
 *
 * Iteration is lazy and stops after a page flagged as the last one: either
 * the paging values ran out or the page came back with no records.
 */
public class PageSequence implements Iterable<RawPage> {

    private final SourceClient client;
    private final DatasetDescriptor descriptor;
    private final Map<String, String> overrides;
    private final int pageCount;

    PageSequence(SourceClient client, DatasetDescriptor descriptor, Map<String, String> overrides, int pageCount) {
        this.client = client;
        this.descriptor = descriptor;
        this.overrides = overrides;
        this.pageCount = pageCount;
    }

    public int pageCount() {
        return pageCount;
    }

    public RawPage fetchPage(int pageIndex) {
        if (pageIndex < 0 || pageIndex >= pageCount) {
            throw new IndexOutOfBoundsException("Page " + pageIndex + " outside 0.." + (pageCount - 1)
                    + " for " + descriptor.getId());
        }
        return client.fetchPage(descriptor, overrides, pageIndex, pageCount);
    }

    /** Pages from {@code startPage} on; empty when startPage is past the last page. */
    public Iterator<RawPage> from(int startPage) {
        if (startPage < 0) {
            throw new IllegalArgumentException("startPage must be >= 0, got " + startPage);
        }
        return new Iterator<>() {
            private int next = startPage;
            private boolean done = startPage >= pageCount;

            @Override
            public boolean hasNext() {
                return !done;
            }

            @Override
            public RawPage next() {
                if (done) {
                    throw new NoSuchElementException();
                }
                RawPage page = fetchPage(next++);
                done = page.isLastPage();
                return page;
            }
        };
    }

    @Override
    public Iterator<RawPage> iterator() {
        return from(0);
    }
}
