package com.sources.jobs.client;

import com.sources.jobs.model.ForwardableHeader;

import java.util.List;

/**
 * Publishes resource lifecycle events ({@code Source.create}, {@code Application.destroy}, ...)
 * to downstream consumers.
 */
public interface EventSender {

    /**
     * @param eventType The event name, {@code <ResourceType>.<action>}.
     * @param resource  The resource the event is about; serialized by the sender.
     * @param headers   Tenant headers forwarded with the event.
     * @throws EventSendException if the event could not be published.
     */
    void raiseEvent(String eventType, Object resource, List<ForwardableHeader> headers) throws EventSendException;
}
