package com.deepansh.react.api;

import com.deepansh.react.core.RunCancellation;
import com.deepansh.react.event.AgentEvent;
import com.deepansh.react.event.AgentEventListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Writes run events to an SSE connection, one named event per AgentEvent.
 *
 * A failed send means the client is gone: the run is cancelled so it stops
 * at the next step boundary instead of calling the model for nobody.
 */
@Slf4j
class SseEventSink implements AgentEventListener {

    private final SseEmitter emitter;
    private final RunCancellation cancellation;

    SseEventSink(SseEmitter emitter, RunCancellation cancellation) {
        this.emitter = emitter;
        this.cancellation = cancellation;
    }

    @Override
    public void onEvent(AgentEvent event) {
        try {
            emitter.send(SseEmitter.event()
                    .name(event.getType().wireName())
                    .data(event, MediaType.APPLICATION_JSON));
        } catch (IOException e) {
            cancel(event, e);
            throw new UncheckedIOException(e);
        } catch (IllegalStateException e) {
            // emitter already completed (timeout or client disconnect)
            cancel(event, e);
            throw e;
        }
    }

    private void cancel(AgentEvent event, Exception cause) {
        log.debug("SSE send failed for [{}], cancelling run: {}", event.getType().wireName(), cause.getMessage());
        cancellation.cancel();
    }
}
