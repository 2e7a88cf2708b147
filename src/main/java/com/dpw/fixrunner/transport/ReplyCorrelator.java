package com.dpw.fixrunner.transport;

import com.dpw.fixrunner.codec.TagCodec;
import com.dpw.fixrunner.config.FixRunnerProperties;
import com.dpw.fixrunner.exception.CorrelationTimeoutException;
import com.dpw.fixrunner.model.CorrelationKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.util.Map;

/**
 * Polls the record store for the reply matching a correlation key.
 *
 * <p>Each attempt waits the configured delay and then scans the whole store from the top,
 * returning the first record whose identifier and type tags both match. After
 * {@code maxAttempts} misses the case times out.</p>
 */
@Slf4j
@Component
public class ReplyCorrelator {

    private final FixRunnerProperties properties;
    private final RecordStore recordStore;

    public ReplyCorrelator(FixRunnerProperties properties, RecordStore recordStore) {
        this.properties = properties;
        this.recordStore = recordStore;
    }

    public Reply awaitReply(CorrelationKey key) {
        int maxAttempts = properties.getCorrelation().getMaxAttempts();
        long delayMs = properties.getCorrelation().getRetryDelay().toMillis();
        String identifierTag = properties.getTags().getIdentifier();
        String typeTag = properties.getTags().getType();

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                Thread.sleep(delayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for {} on attempt {}", key, attempt);
                throw new CorrelationTimeoutException(key, attempt - 1);
            }

            Reply reply = scan(key, identifierTag, typeTag);
            if (reply != null) {
                log.info("Received response for {} on attempt {}: {}", key, attempt,
                        TagCodec.convert(reply.getRaw(), properties.getWireDelimiter(), properties.getFieldDelimiter()));
                return reply;
            }
            log.debug("No response for {} on attempt {}/{}", key, attempt, maxAttempts);
        }

        log.error("No response found for tag {}={} ({}={})", identifierTag, key.getIdentifier(), typeTag, key.getType());
        throw new CorrelationTimeoutException(key, maxAttempts);
    }

    private Reply scan(CorrelationKey key, String identifierTag, String typeTag) {
        try {
            for (String line : recordStore.readRecords()) {
                String record = line.strip();
                Map<String, String> fields = TagCodec.decode(record, properties.getWireDelimiter());
                if (key.getIdentifier().equals(fields.get(identifierTag)) && key.getType().equals(fields.get(typeTag))) {
                    return new Reply(record, fields);
                }
            }
        } catch (UncheckedIOException e) {
            log.warn("Record store read failed while waiting for {}: {}", key, e.getMessage());
        }
        return null;
    }
}
