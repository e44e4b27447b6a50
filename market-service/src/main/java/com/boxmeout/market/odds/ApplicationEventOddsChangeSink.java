package com.boxmeout.market.odds;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Republishes odds changes as Spring application events for whatever transport listens to them.
 */
@RequiredArgsConstructor
public class ApplicationEventOddsChangeSink implements OddsChangeSink {

    private final @NonNull ApplicationEventPublisher publisher;

    @Override
    public void publish(OddsChangedEvent event) {
        publisher.publishEvent(event);
    }
}
