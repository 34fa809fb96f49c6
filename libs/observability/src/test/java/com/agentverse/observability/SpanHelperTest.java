package com.agentverse.observability;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link SpanHelper}, collecting spans with {@link InMemorySpanExporter}.
 */
@DisplayName("SpanHelper")
class SpanHelperTest {

    private InMemorySpanExporter exporter;
    private SpanHelper spanHelper;

    @BeforeEach
    void setUp() {
        exporter = InMemorySpanExporter.create();
        SdkTracerProvider provider = SdkTracerProvider.builder()
                .addSpanProcessor(SimpleSpanProcessor.create(exporter))
                .build();
        spanHelper = new SpanHelper(OpenTelemetrySdk.builder()
                .setTracerProvider(provider)
                .build()
                .getTracer("test-tracer"));
    }

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
        exporter.reset();
    }

    @Test
    @DisplayName("should reject a null tracer")
    void rejectsNullTracer() {
        assertThatThrownBy(() -> new SpanHelper(null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should return the work's result and end the span OK")
    void successfulSpan() {
        String result = spanHelper.inSpan("store.getMembership", SpanKind.CLIENT,
                Map.of("group.id", "g-1"), () -> "ok");

        assertThat(result).isEqualTo("ok");
        SpanData span = exporter.getFinishedSpanItems().get(0);
        assertThat(span.getName()).isEqualTo("store.getMembership");
        assertThat(span.getKind()).isEqualTo(SpanKind.CLIENT);
        assertThat(span.getStatus().getStatusCode()).isEqualTo(StatusCode.OK);
        assertThat(span.getAttributes().get(AttributeKey.stringKey("group.id"))).isEqualTo("g-1");
    }

    @Test
    @DisplayName("should attach correlation and subject ids")
    void attachesCorrelation() {
        CorrelationContextHolder.set(new CorrelationContext("corr-9", "alice", null, null));

        spanHelper.inSpan("work", SpanKind.INTERNAL, Map.of(), () -> "done");

        SpanData span = exporter.getFinishedSpanItems().get(0);
        assertThat(span.getAttributes().get(AttributeKey.stringKey("correlation.id"))).isEqualTo("corr-9");
        assertThat(span.getAttributes().get(AttributeKey.stringKey("subject.id"))).isEqualTo("alice");
    }

    @Test
    @DisplayName("should record the exception, mark ERROR and rethrow")
    void recordsFailure() {
        assertThatThrownBy(() -> spanHelper.<String>inSpan("failing", SpanKind.INTERNAL, Map.of(), () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class).hasMessage("boom");

        SpanData span = exporter.getFinishedSpanItems().get(0);
        assertThat(span.getStatus().getStatusCode()).isEqualTo(StatusCode.ERROR);
        assertThat(span.getEvents()).anyMatch(e -> e.getName().equals("exception"));
    }
}
