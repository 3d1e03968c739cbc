package com.acme.dcm.domain.model.vmrequest;

/**
 * T-shirt sizes offered to requesters.
 */
public enum VmSize {
    S(2, 4, 50),
    M(4, 8, 100),
    L(8, 16, 200),
    XL(16, 32, 500);

    private final int cpuCores;
    private final int memoryGb;
    private final int diskGb;

    VmSize(int cpuCores, int memoryGb, int diskGb) {
        this.cpuCores = cpuCores;
        this.memoryGb = memoryGb;
        this.diskGb = diskGb;
    }

    public int getCpuCores() {
        return cpuCores;
    }

    public int getMemoryGb() {
        return memoryGb;
    }

    public int getDiskGb() {
        return diskGb;
    }
}
