package com.acme.dcm.application.vmrequest;

import java.util.UUID;

public record CreateVmRequestResult(UUID requestId, long version) {}
