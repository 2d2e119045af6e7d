package org.cobbzilla.swifts3mirror;

import java.util.Collections;
import java.util.List;

/**
 * Pages through a Swift container with the marker mechanism: each request continues after the
 * last name of the previous page, until a page comes back empty.
 */
public class SwiftKeyLister extends KeyLister {

    private final String container;
    private String marker = null;
    private boolean done = false;

    public SwiftKeyLister(MirrorContext context, String container) {
        super(context);
        this.container = container;
    }

    @Override
    public boolean isDone() { return done; }

    @Override
    public List<KeyObjectSummary> getNextBatch() {
        if (done) return Collections.emptyList();

        final List<KeyObjectSummary> page = context.getSource().listObjects(container, marker);
        if (page.isEmpty()) {
            done = true;
            return page;
        }
        marker = page.get(page.size() - 1).getKey();
        context.getStats().objectsRead.addAndGet(page.size());
        return page;
    }

    @Override
    protected String getName() { return "container '" + container + "'"; }
}
