package io.lanmesh.event;

/**
 * Handler invoked inline, on the dispatching thread, in registration order.
 */
@FunctionalInterface
public interface EventHandler {

    void handle(MeshEvent event) throws Exception;
}
