package com.acme.dcm.infrastructure.event;

import com.acme.dcm.domain.model.vm.VmEvent;
import com.acme.sourcing.event.JacksonEventDeserializer;
import io.micronaut.context.annotation.Context;

@Context
public class VmEventDeserializer extends JacksonEventDeserializer<VmEvent> {

    public VmEventDeserializer() {
        super(EventTypeRegistries.vm());
    }
}
