package com.ordermatcher.disruptor;

import com.lmax.disruptor.EventFactory;

/**
 * Factory for pre-allocating EngineCommand instances in the ring buffer.
 */
public class EngineCommandFactory implements EventFactory<EngineCommand> {

    @Override
    public EngineCommand newInstance() {
        return new EngineCommand();
    }
}
