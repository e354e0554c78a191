package dev.nova.engine;

import dev.nova.sink.EventReceipt;
import dev.nova.sink.EventSink;
import dev.nova.sink.InMemoryEventSink;
import dev.nova.sink.SinkUnavailableException;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class EventRecorderTest {

    @Test
    void recordsThroughSink() {
        var sink = new InMemoryEventSink(TestTools.CLOCK);
        var recorder = new EventRecorder(sink, Runnable::run);

        Optional<EventReceipt> receipt = recorder.record("PLAN", Map.of("goal", "g")).join();

        assertThat(receipt).isPresent();
        assertThat(receipt.get().id()).isEqualTo(1);
        assertThat(sink.eventTypes()).containsExactly("PLAN");
    }

    @Test
    void sinkFailureIsSwallowedAsEmpty() {
        EventSink broken = new EventSink() {
            @Override
            public EventReceipt record(String eventType, Map<String, Object> details) {
                throw new SinkUnavailableException("connection refused");
            }

            @Override
            public String getName() {
                return "broken";
            }
        };
        var recorder = new EventRecorder(broken, Runnable::run);

        assertThat(recorder.record("PLAN", Map.of()).join()).isEmpty();
    }

    @Test
    void shutDownExecutorDropsEvent() {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        executor.shutdown();
        var sink = new InMemoryEventSink(TestTools.CLOCK);

        Optional<EventReceipt> receipt = new EventRecorder(sink, executor).record("PLAN", Map.of()).join();

        assertThat(receipt).isEmpty();
        assertThat(sink.events()).isEmpty();
    }
}
