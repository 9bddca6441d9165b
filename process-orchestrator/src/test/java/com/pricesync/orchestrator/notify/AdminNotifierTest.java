package com.pricesync.orchestrator.notify;

import com.pricesync.orchestrator.config.OrchestratorProperties;
import com.pricesync.orchestrator.model.ChainResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class AdminNotifierTest {

    private NotificationSink sink;
    private OrchestratorProperties properties;
    private AdminNotifier notifier;

    @BeforeEach
    void setUp() {
        sink = mock(NotificationSink.class);
        properties = new OrchestratorProperties();
        properties.getNotify().setAdminIds(List.of("11", "22", "33"));
        notifier = new AdminNotifier(sink, properties);
    }

    @Test
    void failingRecipientDoesNotBlockOthers() {
        doThrow(new IllegalStateException("blocked by user")).when(sink).send(eq("22"), anyString());

        int delivered = notifier.broadcast("hello");

        assertThat(delivered).isEqualTo(2);
        verify(sink).send("11", "hello");
        verify(sink).send("22", "hello");
        verify(sink).send("33", "hello");
    }

    @Test
    void blankAdminIdsAreIgnored() {
        properties.getNotify().setAdminIds(Arrays.asList("", " 44 ", null));

        assertThat(notifier.broadcast("hi")).isEqualTo(1);
        verify(sink).send("44", "hi");
    }

    @Test
    void noAdminsMeansNothingSent() {
        properties.getNotify().setAdminIds(List.of());

        assertThat(notifier.broadcast("hi")).isZero();
        verifyNoInteractions(sink);
    }

    @Test
    void completedChainIsAnnouncedWithSingleLine() {
        ChainResult result = ChainResult.builder()
                .processName("CurrencyInfo")
                .succeeded(true)
                .statusCode(200)
                .logEntry("[200] Parser 'CurrencyInfo': " + "x".repeat(600))
                .logEntry("[200] Table process 'set_delivery_region': done")
                .build();

        assertThat(notifier.scheduledRunText(result)).isEqualTo("[Schedule] Process 'CurrencyInfo' completed.");
    }

    @Test
    void failureSummaryIsCappedAtConfiguredLength() {
        ChainResult result = ChainResult.builder()
                .processName("PackageIdPrice")
                .succeeded(false)
                .statusCode(502)
                .failedStage(ChainResult.Stage.SYNC)
                .logEntry("[502] Table process 'set_final_price': " + "y".repeat(1500))
                .build();

        String text = notifier.scheduledRunText(result);

        String header = "[Schedule] Process 'PackageIdPrice' FAILED.\n\nResult:\n";
        assertThat(text).startsWith(header);
        assertThat(text.substring(header.length())).hasSize(1000 + 3).endsWith("...");
    }

    @Test
    void failureMessageCarriesSummary() {
        ChainResult result = ChainResult.builder()
                .processName("Sale")
                .succeeded(false)
                .statusCode(500)
                .failedStage(ChainResult.Stage.FETCH)
                .logEntry("[500] Parser 'PackageIdSaleInfo': Mock error during parsing")
                .build();

        ArgumentCaptor<String> text = ArgumentCaptor.forClass(String.class);
        notifier.notifyScheduledRun(result);
        verify(sink).send(eq("11"), text.capture());

        assertThat(text.getValue())
                .startsWith("[Schedule] Process 'Sale' FAILED.\n\nResult:\n")
                .contains("Mock error during parsing");
    }

    @Test
    void truncate() {
        assertThat(AdminNotifier.truncate("short", 10)).isEqualTo("short");
        assertThat(AdminNotifier.truncate("abcdefghij", 4)).isEqualTo("abcd...");
        assertThat(AdminNotifier.truncate(null, 4)).isNull();
    }
}
