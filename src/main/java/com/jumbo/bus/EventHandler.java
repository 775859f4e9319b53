package com.jumbo.bus;

import com.jumbo.contract.EventEnvelope;

@FunctionalInterface
public interface EventHandler {

    void handle(EventEnvelope event);
}
