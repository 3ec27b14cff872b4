package org.genemeta.datapipeline;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import org.genemeta.datapipeline.api.resources.database.dto.PerStudyComponent;
import org.genemeta.datapipeline.api.sources.IStudyComponentSource;

/**
 * Component source backed by a map, for orchestrator tests.
 */
public class InMemoryComponentSource implements IStudyComponentSource {

    private final Map<Integer, List<PerStudyComponent>> components = new HashMap<>();
    private final AtomicInteger fetchCount = new AtomicInteger();

    public synchronized InMemoryComponentSource put(int studyKey, PerStudyComponent... studyComponents) {
        components.put(studyKey, new ArrayList<>(List.of(studyComponents)));
        return this;
    }

    @Override
    public synchronized List<PerStudyComponent> fetchComponents(int studyKey) throws IOException {
        fetchCount.incrementAndGet();
        return List.copyOf(components.getOrDefault(studyKey, List.of()));
    }

    public int getFetchCount() {
        return fetchCount.get();
    }
}
