package com.example.realtime.gateway.session;

import lombok.Getter;
import org.springframework.http.codec.ServerSentEvent;
import reactor.core.publisher.Sinks;

/**
 * One open SSE stream. The scope can be replaced when the client's sector assignment changes.
 */
public class ClientConnection {

    @Getter
    private final String connectionId;
    private final Sinks.Many<ServerSentEvent<String>> sink;
    private volatile ClientScope scope;

    ClientConnection(String connectionId, ClientScope scope, Sinks.Many<ServerSentEvent<String>> sink) {
        this.connectionId = connectionId;
        this.scope = scope;
        this.sink = sink;
    }

    public ClientScope getScope() {
        return scope;
    }

    void setScope(ClientScope scope) {
        this.scope = scope;
    }

    /**
     * Emissions are serialized per connection; the dispatcher delivers from several threads.
     */
    synchronized Sinks.EmitResult emit(ServerSentEvent<String> event) {
        return sink.tryEmitNext(event);
    }

    synchronized void complete() {
        sink.tryEmitComplete();
    }
}
