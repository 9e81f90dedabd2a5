package br.acquasys.application.port.output;

import br.acquasys.domain.common.HubEvent;

/**
 * Push channel to live dashboard subscribers.
 */
public interface FanoutGateway {

    /**
     * Send the event to every connected subscriber. Never blocks on slow subscribers.
     */
    void broadcast(HubEvent event);

    int subscriberCount();
}
