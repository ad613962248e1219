package com.delta.jobingest.ingest.service;

import com.delta.jobingest.config.IngestProperties;
import com.delta.jobingest.ingest.model.RoleRecord;
import com.delta.jobingest.ingest.persistence.PostingJdbcRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RoleClassifierServiceTest {

    @Mock
    private PostingJdbcRepository repository;

    private final Map<String, RoleRecord> stored = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();
    private IngestProperties properties;

    @BeforeEach
    void setUp() {
        properties = new IngestProperties();
        lenient().when(repository.findOrCreateRole(anyString())).thenAnswer(invocation -> {
            String name = invocation.getArgument(0);
            return stored.computeIfAbsent(name, key -> new RoleRecord(ids.incrementAndGet(), key));
        });
    }

    private RoleClassifierService classifier() {
        return new RoleClassifierService(repository, properties, new StoreRetryPolicy(properties));
    }

    @Test
    void normalizesPunctuationCaseAndWhitespace() {
        assertThat(RoleClassifierService.normalize("  Sr. Data--Scientist!! ")).isEqualTo("sr data scientist");
        assertThat(RoleClassifierService.normalize(null)).isEmpty();
        assertThat(RoleClassifierService.titleCase("quantum widget wrangler")).isEqualTo("Quantum Widget Wrangler");
    }

    @Test
    void noisyTitleResolvesToSameCanonicalRoleWithoutGrowth() {
        when(repository.findAllRoles()).thenReturn(List.of());
        RoleClassifierService classifier = classifier();
        int before = classifier.vocabulary().size();

        RoleRecord first = classifier.canonicalize("Sr. Data  Scientist!!");
        RoleRecord second = classifier.canonicalize("Sr. Data  Scientist!!");

        assertThat(first.name()).isEqualTo("Data Scientist");
        assertThat(second).isEqualTo(first);
        assertThat(classifier.vocabulary()).hasSize(before);
    }

    @Test
    void exactMatchIgnoresCaseAndPunctuation() {
        when(repository.findAllRoles()).thenReturn(List.of());
        RoleClassifierService classifier = classifier();

        assertThat(classifier.canonicalize("machine-learning ENGINEER").name()).isEqualTo("Machine Learning Engineer");
        assertThat(classifier.canonicalize("ux designer").name()).isEqualTo("UX Designer");
    }

    @Test
    void longestContainedCanonicalNameWins() {
        properties.getTaxonomy().setSeedRoles(List.of("Engineer", "Data Engineer", "Software Engineer"));
        when(repository.findAllRoles()).thenReturn(List.of());
        RoleClassifierService classifier = classifier();

        assertThat(classifier.canonicalize("Senior Data Engineer II").name()).isEqualTo("Data Engineer");
        assertThat(classifier.canonicalize("Staff Engineer").name()).isEqualTo("Engineer");
    }

    @Test
    void unknownRoleGrowsVocabularyExactlyOnce() {
        when(repository.findAllRoles()).thenReturn(List.of());
        RoleClassifierService classifier = classifier();
        int before = classifier.vocabulary().size();

        RoleRecord first = classifier.canonicalize("Quantum  widget wrangler!");
        RoleRecord second = classifier.canonicalize("QUANTUM WIDGET WRANGLER");

        assertThat(first.name()).isEqualTo("Quantum Widget Wrangler");
        assertThat(second).isEqualTo(first);
        assertThat(classifier.vocabulary()).hasSize(before + 1).contains("Quantum Widget Wrangler");
        verify(repository, times(2)).findOrCreateRole("Quantum Widget Wrangler");
    }

    @Test
    void stopTermsShortAndBlankNamesFallBackToDefault() {
        when(repository.findAllRoles()).thenReturn(List.of());
        RoleClassifierService classifier = classifier();
        int before = classifier.vocabulary().size();

        assertThat(classifier.canonicalize("Job").name()).isEqualTo("Software Engineer");
        assertThat(classifier.canonicalize("  opening!! ").name()).isEqualTo("Software Engineer");
        assertThat(classifier.canonicalize("abc").name()).isEqualTo("Software Engineer");
        assertThat(classifier.canonicalize("   ").name()).isEqualTo("Software Engineer");
        assertThat(classifier.canonicalize(null).name()).isEqualTo("Software Engineer");
        assertThat(classifier.vocabulary()).hasSize(before);
    }

    @Test
    void rolesAlreadyStoredJoinTheVocabulary() {
        when(repository.findAllRoles()).thenReturn(List.of(new RoleRecord(99L, "Prompt Whisperer")));
        stored.put("Prompt Whisperer", new RoleRecord(99L, "Prompt Whisperer"));
        RoleClassifierService classifier = classifier();

        RoleRecord role = classifier.canonicalize("Senior Prompt Whisperer");

        assertThat(role.id()).isEqualTo(99L);
        assertThat(classifier.vocabulary()).contains("Prompt Whisperer");
    }
}
