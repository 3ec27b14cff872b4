package org.genemeta.datapipeline.services;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.genemeta.datapipeline.api.resources.database.IAggregationSession;
import org.genemeta.datapipeline.api.resources.database.MissingDiseaseMappingException;
import org.genemeta.datapipeline.api.resources.database.MultiDiseaseMappingException;
import org.genemeta.datapipeline.api.resources.database.StudyNotFoundException;
import org.genemeta.datapipeline.api.resources.database.dto.StudyContext;
import org.genemeta.datapipeline.api.resources.database.dto.StudyDiseaseMapping;
import org.genemeta.datapipeline.api.resources.database.dto.StudyInfo;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
class StudyDiseaseResolverTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private IAggregationSession session;

    private final StudyDiseaseResolver resolver = new StudyDiseaseResolver();

    private static StudyDiseaseMapping mapping(int diseaseKey, String label, boolean diseaseActive) {
        return new StudyDiseaseMapping(12, diseaseKey, label, diseaseActive, true, NOW.minusSeconds(60), null);
    }

    @Test
    void resolvesSingleActiveMappingWithTechnology() throws Exception {
        when(session.findStudy(12)).thenReturn(Optional.of(new StudyInfo(12, "GSE12", "MICROARRAY")));
        when(session.findActiveDiseaseMappings(12, NOW)).thenReturn(List.of(mapping(3, "septic_shock", true)));

        StudyContext context = resolver.resolve(session, 12, NOW);

        assertThat(context).isEqualTo(new StudyContext(12, 3, "septic_shock", "MICROARRAY"));
        assertThat(context.sliceKey()).isEqualTo("3/MICROARRAY");
    }

    @Test
    void unknownStudy() throws Exception {
        when(session.findStudy(12)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> resolver.resolve(session, 12, NOW))
            .isInstanceOf(StudyNotFoundException.class);
    }

    @Test
    void noActiveMapping() throws Exception {
        when(session.findStudy(12)).thenReturn(Optional.of(new StudyInfo(12, "GSE12", "RNA_SEQ")));
        when(session.findActiveDiseaseMappings(12, NOW)).thenReturn(List.of());

        assertThatThrownBy(() -> resolver.resolve(session, 12, NOW))
            .isInstanceOf(MissingDiseaseMappingException.class);
    }

    @Test
    void inactiveDiseaseCountsAsMissing() throws Exception {
        when(session.findStudy(12)).thenReturn(Optional.of(new StudyInfo(12, "GSE12", "RNA_SEQ")));
        when(session.findActiveDiseaseMappings(12, NOW)).thenReturn(List.of(mapping(3, "retired_label", false)));

        assertThatThrownBy(() -> resolver.resolve(session, 12, NOW))
            .isInstanceOf(MissingDiseaseMappingException.class)
            .hasMessageContaining("inactive");
    }

    @Test
    void multipleActiveMappings() throws Exception {
        when(session.findStudy(12)).thenReturn(Optional.of(new StudyInfo(12, "GSE12", "RNA_SEQ")));
        when(session.findActiveDiseaseMappings(12, NOW))
            .thenReturn(List.of(mapping(3, "septic_shock", true), mapping(4, "sepsis", true)));

        assertThatThrownBy(() -> resolver.resolve(session, 12, NOW))
            .isInstanceOf(MultiDiseaseMappingException.class)
            .satisfies(e -> assertThat(((MultiDiseaseMappingException) e).getErrorCode())
                .isEqualTo(MultiDiseaseMappingException.ERROR_CODE));
    }
}
