package com.acme.dcm;

import io.micronaut.runtime.Micronaut;

/**
 * DCM Worker - write side for projects, VM requests and VM provisioning. Handles commands against
 * the event log and runs the provisioning process managers on committed events.
 */
public class DcmWorkerApplication {
    public static void main(String[] args) {
        Micronaut.run(DcmWorkerApplication.class, args);
    }
}
