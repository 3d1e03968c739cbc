package com.acme.dcm.infrastructure.event;

import com.acme.dcm.domain.model.vmrequest.VmRequestEvent;
import com.acme.sourcing.event.JacksonEventDeserializer;
import io.micronaut.context.annotation.Context;

@Context
public class VmRequestEventDeserializer extends JacksonEventDeserializer<VmRequestEvent> {

    public VmRequestEventDeserializer() {
        super(EventTypeRegistries.vmRequest());
    }
}
