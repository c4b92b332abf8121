package com.example.realtime.push;

import java.util.List;

public interface PushGateway {

    /**
     * Sends one batch to the provider.
     *
     * @return one ticket per message, in request order
     * @throws com.example.realtime.service.exception.DeliveryException if the batch as a whole failed
     */
    List<PushTicket> send(List<PushMessage> messages);
}
