package com.dpw.fixrunner.transport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.dpw.fixrunner.config.FixRunnerProperties;
import com.dpw.fixrunner.exception.CorrelationTimeoutException;
import com.dpw.fixrunner.model.CorrelationKey;
import java.io.UncheckedIOException;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ReplyCorrelatorTest {

    private static final String SOH = "\u0001";

    private FixRunnerProperties properties;
    private InMemoryRecordStore store;

    @BeforeEach
    void setUp() {
        properties = new FixRunnerProperties();
        properties.getCorrelation().setMaxAttempts(3);
        properties.getCorrelation().setRetryDelay(Duration.ofMillis(20));
        store = new InMemoryRecordStore();
    }

    @Test
    void returnsTheMatchingRecordOnTheFirstAttempt() {
        store.append(String.join(SOH, "35=8", "11=OTHER", "39=0"));
        store.append(String.join(SOH, "35=8", "11=TC1_1", "39=0") + "\r");

        Reply reply = new ReplyCorrelator(properties, store).awaitReply(new CorrelationKey("TC1_1", "8"));

        assertThat(reply.getFields()).containsEntry("11", "TC1_1").containsEntry("39", "0");
        assertThat(reply.getRaw()).doesNotEndWith("\r");
        assertThat(store.getReads()).isEqualTo(1);
    }

    @Test
    void identifierAndTypeMustBothMatch() {
        store.append(String.join(SOH, "35=D", "11=TC1_1"));

        ReplyCorrelator correlator = new ReplyCorrelator(properties, store);

        assertThatThrownBy(() -> correlator.awaitReply(new CorrelationKey("TC1_1", "8")))
                .isInstanceOf(CorrelationTimeoutException.class);
    }

    @Test
    void firstMatchingRecordWins() {
        store.append(String.join(SOH, "35=8", "11=TC1_1", "39=0"));
        store.append(String.join(SOH, "35=8", "11=TC1_1", "39=2"));

        Reply reply = new ReplyCorrelator(properties, store).awaitReply(new CorrelationKey("TC1_1", "8"));

        assertThat(reply.getFields()).containsEntry("39", "0");
    }

    @Test
    void timesOutAfterAllAttemptsAndWaitsBetweenThem() {
        ReplyCorrelator correlator = new ReplyCorrelator(properties, store);
        long start = System.nanoTime();

        assertThatThrownBy(() -> correlator.awaitReply(new CorrelationKey("TC1_1", "8")))
                .isInstanceOf(CorrelationTimeoutException.class)
                .satisfies(e -> assertThat(((CorrelationTimeoutException) e).getAttempts()).isEqualTo(3));

        long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();
        assertThat(elapsedMs).isGreaterThanOrEqualTo(60);
        assertThat(store.getReads()).isEqualTo(3);
    }

    @Test
    void replyAppendedWhileWaitingIsFound() {
        RecordStore lateStore = new RecordStore() {
            private int reads;

            @Override
            public List<String> readRecords() {
                reads++;
                return reads < 2 ? List.of() : List.of(String.join(SOH, "35=8", "11=TC1_1"));
            }
        };

        Reply reply = new ReplyCorrelator(properties, lateStore).awaitReply(new CorrelationKey("TC1_1", "8"));

        assertThat(reply.getFields()).containsEntry("35", "8");
    }

    @Test
    void readFailureCountsAsAMiss() {
        RecordStore failing = () -> {
            throw new UncheckedIOException(new IOException("locked"));
        };

        assertThatThrownBy(() -> new ReplyCorrelator(properties, failing).awaitReply(new CorrelationKey("X", "8")))
                .isInstanceOf(CorrelationTimeoutException.class);
    }
}
