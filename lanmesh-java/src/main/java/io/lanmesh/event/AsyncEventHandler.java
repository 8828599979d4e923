package io.lanmesh.event;

import java.util.concurrent.CompletionStage;

/**
 * Handler scheduled as a separate task on the node's event loop. The dispatcher
 * never waits for the returned stage; a failed stage is only logged.
 */
@FunctionalInterface
public interface AsyncEventHandler {

    CompletionStage<?> handle(MeshEvent event);
}
