package com.example.interview.service;

import com.example.interview.model.CompetencyHint;
import com.example.interview.repository.CompetencyHintRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MongoCompetencyRetrieverTest {

    @Mock
    private CompetencyHintRepository repository;

    @InjectMocks
    private MongoCompetencyRetriever retriever;

    @Test
    void hintsAreRankedByKeywordOverlap() {
        CompetencyHint sql = new CompetencyHint("1", "SQL tuning", "Query plans", List.of("data", "sql"));
        CompetencyHint pipelines = new CompetencyHint("2", "Data pipelines", "Batch and stream", List.of("data", "engineer"));
        when(repository.findByTitleContainingIgnoreCase("data engineer")).thenReturn(List.of());
        when(repository.findByKeywordsIn(anyCollection())).thenReturn(List.of(sql, pipelines));

        assertThat(retriever.lookup("Data Engineer"))
                .containsExactly("Data pipelines: Batch and stream", "SQL tuning: Query plans");
    }

    @Test
    void titleAndKeywordMatchesAreMergedOnce() {
        CompetencyHint hint = new CompetencyHint("1", "Backend", null, null);
        when(repository.findByTitleContainingIgnoreCase("backend")).thenReturn(List.of(hint));
        when(repository.findByKeywordsIn(anyCollection())).thenReturn(List.of(hint));

        assertThat(retriever.lookup("backend")).containsExactly("Backend: ");
    }

    @Test
    void lookupsAreCachedPerNormalizedQuery() {
        when(repository.findByTitleContainingIgnoreCase("backend")).thenReturn(List.of());
        when(repository.findByKeywordsIn(anyCollection())).thenReturn(List.of());

        retriever.lookup("Backend");
        retriever.lookup("  backend ");

        verify(repository, times(1)).findByTitleContainingIgnoreCase("backend");
        assertThat(retriever.cacheSize()).isEqualTo(1);
    }

    @Test
    void failuresAreNotCached() {
        when(repository.findByTitleContainingIgnoreCase(anyString()))
                .thenThrow(new DataAccessResourceFailureException("mongo down"));

        assertThat(retriever.lookup("backend")).isEmpty();
        assertThat(retriever.cacheSize()).isZero();
    }

    @Test
    void blankQueryIsNotLookedUp() {
        assertThat(retriever.lookup("  ")).isEmpty();
        verifyNoInteractions(repository);
    }
}
