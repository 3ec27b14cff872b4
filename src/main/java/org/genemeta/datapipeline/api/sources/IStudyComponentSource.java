package org.genemeta.datapipeline.api.sources;

import java.io.IOException;
import java.util.List;

import org.genemeta.datapipeline.api.resources.database.dto.PerStudyComponent;

/**
 * Supplies the already computed per-study estimates of one study.
 * <p>
 * Implemented by the ingestion side; the aggregation engine only consumes the components and
 * never stores them as such.
 */
public interface IStudyComponentSource {

    /**
     * Fetches all components of a study.
     *
     * @param studyKey The study.
     * @return The study's components; empty if the study supplied none.
     * @throws IOException if the components cannot be read.
     */
    List<PerStudyComponent> fetchComponents(int studyKey) throws IOException;
}
