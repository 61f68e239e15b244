package com.libragraph.sift.core.service;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class AbstractManagedServiceTest {

    static class CountingService extends AbstractManagedService {
        final AtomicInteger starts = new AtomicInteger();
        final AtomicInteger stops = new AtomicInteger();
        volatile RuntimeException startFailure;

        @Override
        public String serviceId() {
            return "counting";
        }

        @Override
        protected void doStart() {
            starts.incrementAndGet();
            if (startFailure != null) {
                throw startFailure;
            }
        }

        @Override
        protected void doStop() {
            stops.incrementAndGet();
        }
    }

    @Test
    void startAndStopAreIdempotent() throws Exception {
        CountingService service = new CountingService();
        assertThat(service.state()).isEqualTo(ManagedService.State.STOPPED);

        service.start();
        service.start();
        assertThat(service.isRunning()).isTrue();
        assertThat(service.starts).hasValue(1);

        service.stop();
        service.stop();
        assertThat(service.state()).isEqualTo(ManagedService.State.STOPPED);
        assertThat(service.stops).hasValue(1);
    }

    @Test
    void failedStartIsReportedAndRetryable() throws Exception {
        CountingService service = new CountingService();
        service.startFailure = new IllegalStateException("no parsers");

        assertThatThrownBy(service::start).hasMessage("no parsers");
        assertThat(service.state()).isEqualTo(ManagedService.State.FAILED);
        assertThat(service.failure()).get().extracting(Throwable::getMessage).isEqualTo("no parsers");

        service.startFailure = null;
        service.start();
        assertThat(service.isRunning()).isTrue();
        assertThat(service.failure()).isEmpty();
    }

    @Test
    void sinceMovesWithTransitions() throws Exception {
        CountingService service = new CountingService();
        var created = service.since();

        service.start();

        assertThat(service.since()).isAfterOrEqualTo(created);
    }
}
