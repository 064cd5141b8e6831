package com.adlanda.recommender.service;

import com.adlanda.recommender.MutableClock;
import com.adlanda.recommender.entity.FeedbackEvent;
import com.adlanda.recommender.exception.StoreUnavailableException;
import com.adlanda.recommender.model.FeedbackSignal;
import com.adlanda.recommender.repository.FeedbackEventRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FeedbackServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Mock
    private FeedbackEventRepository repository;

    private FeedbackService service() {
        return new FeedbackService(repository, new MutableClock(NOW));
    }

    @Test
    void recordFeedback_storesUnprocessedEvent() {
        boolean stored = service().recordFeedback("u1", "A", FeedbackSignal.SAVED);

        ArgumentCaptor<FeedbackEvent> captor = ArgumentCaptor.forClass(FeedbackEvent.class);
        verify(repository).save(captor.capture());
        FeedbackEvent event = captor.getValue();

        assertThat(stored).isTrue();
        assertThat(event.getUserId()).isEqualTo("u1");
        assertThat(event.getItemId()).isEqualTo("A");
        assertThat(event.getSignal()).isEqualTo(FeedbackSignal.SAVED);
        assertThat(event.getTimestamp()).isEqualTo(NOW);
        assertThat(event.isProcessed()).isFalse();
    }

    @Test
    void recordFeedback_incompleteInput_isDropped() {
        FeedbackService service = service();

        assertThat(service.recordFeedback(" ", "A", FeedbackSignal.CLICKED)).isFalse();
        assertThat(service.recordFeedback("u1", null, FeedbackSignal.CLICKED)).isFalse();
        assertThat(service.recordFeedback("u1", "A", null)).isFalse();
        verify(repository, never()).save(any());
    }

    @Test
    void recordFeedback_storeDown_doesNotThrow() {
        when(repository.save(any(FeedbackEvent.class))).thenThrow(new DataAccessResourceFailureException("db down"));

        assertThat(service().recordFeedback("u1", "A", FeedbackSignal.HELPFUL)).isFalse();
    }

    @Test
    void countPending_storeDown_throwsStoreUnavailable() {
        when(repository.countByProcessedFalse()).thenThrow(new DataAccessResourceFailureException("db down"));

        assertThatThrownBy(() -> service().countPending()).isInstanceOf(StoreUnavailableException.class);
    }
}
