package org.genemeta.datapipeline.services;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import org.genemeta.datapipeline.api.resources.database.IAggregationSession;
import org.genemeta.datapipeline.api.resources.database.MissingDiseaseMappingException;
import org.genemeta.datapipeline.api.resources.database.MultiDiseaseMappingException;
import org.genemeta.datapipeline.api.resources.database.StudyNotFoundException;
import org.genemeta.datapipeline.api.resources.database.dto.StudyContext;
import org.genemeta.datapipeline.api.resources.database.dto.StudyDiseaseMapping;
import org.genemeta.datapipeline.api.resources.database.dto.StudyInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the single disease and the technology a study's evidence is pooled under.
 * <p>
 * The study to disease mapping table is the only source of truth; no other study attribute is
 * consulted. Zero active mappings, or one pointing at an inactive disease, is a
 * {@link MissingDiseaseMappingException}; more than one is a {@link MultiDiseaseMappingException}
 * and is never resolved by picking one.
 */
public class StudyDiseaseResolver {

    private static final Logger log = LoggerFactory.getLogger(StudyDiseaseResolver.class);

    /**
     * Resolves the pooling context of a study at the given time.
     *
     * @param session  Session to read through.
     * @param studyKey The study.
     * @param at       Reference time for the mapping validity window.
     * @return Disease and technology of the study.
     */
    public StudyContext resolve(IAggregationSession session, int studyKey, Instant at)
            throws StudyNotFoundException, MissingDiseaseMappingException, MultiDiseaseMappingException,
            SQLException {
        StudyInfo study = session.findStudy(studyKey).orElseThrow(() -> new StudyNotFoundException(studyKey));

        List<StudyDiseaseMapping> mappings = session.findActiveDiseaseMappings(studyKey, at);
        if (mappings.size() > 1) {
            List<Integer> diseaseKeys = mappings.stream()
                .map(StudyDiseaseMapping::diseaseKey)
                .collect(Collectors.toList());
            throw new MultiDiseaseMappingException(studyKey, diseaseKeys);
        }
        if (mappings.isEmpty()) {
            throw new MissingDiseaseMappingException(studyKey, "no mapping is active at " + at);
        }
        StudyDiseaseMapping mapping = mappings.get(0);
        if (!mapping.diseaseActive()) {
            throw new MissingDiseaseMappingException(studyKey,
                "mapped disease " + mapping.diseaseKey() + " (" + mapping.diseaseLabel() + ") is inactive");
        }

        StudyContext context = new StudyContext(studyKey, mapping.diseaseKey(), mapping.diseaseLabel(),
            study.technology());
        log.debug("Study {} ({}) resolved to disease {} '{}' on {}", studyKey, study.accession(),
            context.diseaseKey(), context.diseaseLabel(), context.technology());
        return context;
    }
}
