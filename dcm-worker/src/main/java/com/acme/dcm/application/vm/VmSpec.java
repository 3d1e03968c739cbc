package com.acme.dcm.application.vm;

import com.acme.dcm.domain.model.vmrequest.VmSize;

/**
 * What to ask the hypervisor for.
 *
 * @param diskGb target disk size; 0 keeps the template's disk
 */
public record VmSpec(String name, String template, int cpu, int memoryGb, int diskGb) {

    public VmSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("VM name cannot be blank");
        }
        if (template == null || template.isBlank()) {
            throw new IllegalArgumentException("Template cannot be blank");
        }
        if (cpu < 1 || memoryGb < 1 || diskGb < 0) {
            throw new IllegalArgumentException("CPU and memory must be positive, disk must not be negative");
        }
    }

    public static VmSpec of(String name, VmSize size, String template) {
        return new VmSpec(name, template, size.getCpuCores(), size.getMemoryGb(), size.getDiskGb());
    }
}
