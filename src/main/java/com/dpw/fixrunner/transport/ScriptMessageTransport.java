package com.dpw.fixrunner.transport;

import com.dpw.fixrunner.config.FixRunnerProperties;
import com.dpw.fixrunner.exception.TransmissionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Sends a message by running the configured script with the message as its only argument.
 */
@Slf4j
@Component
public class ScriptMessageTransport implements MessageTransport {

    private final FixRunnerProperties properties;

    public ScriptMessageTransport(FixRunnerProperties properties) {
        this.properties = properties;
    }

    @Override
    public void send(String encodedMessage) {
        String script = properties.getTransport().getScript();
        log.debug("Invoking {} for outbound message", script);

        Process process;
        try {
            process = new ProcessBuilder(script, encodedMessage)
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .start();
        } catch (IOException e) {
            throw new TransmissionException("Unable to start transport script " + script + ": " + e.getMessage(), e);
        }

        try {
            long timeoutMs = properties.getTransport().getTimeout().toMillis();
            if (!process.waitFor(timeoutMs, TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new TransmissionException("Transport script " + script + " did not finish within " + timeoutMs + "ms");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new TransmissionException("Interrupted while waiting for transport script " + script, e);
        }

        int exitCode = process.exitValue();
        if (exitCode != 0) {
            throw new TransmissionException("Transport script " + script + " exited with code " + exitCode);
        }
    }
}
