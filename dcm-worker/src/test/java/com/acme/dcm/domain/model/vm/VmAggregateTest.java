package com.acme.dcm.domain.model.vm;

import com.acme.dcm.domain.model.InvalidStateException;
import com.acme.dcm.domain.model.vmrequest.VmName;
import com.acme.dcm.domain.model.vmrequest.VmSize;
import com.acme.sourcing.event.EventMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

@DisplayName("VmAggregate")
class VmAggregateTest {

    private UUID requestId;
    private EventMetadata metadata;
    private VmAggregate vm;

    @BeforeEach
    void setUp() {
        requestId = UUID.randomUUID();
        metadata = EventMetadata.create(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID());
        vm = VmAggregate.startProvisioning(
            requestId, UUID.randomUUID(), VmName.of("web-01"), VmSize.L, UUID.randomUUID(), metadata
        );
    }

    @Test
    @DisplayName("id should be derived from the request id")
    void testDeterministicId() {
        assertThat(vm.getId()).isEqualTo(VmAggregate.idForRequest(requestId));
        assertThat(VmAggregate.idForRequest(requestId)).isEqualTo(VmAggregate.idForRequest(requestId));
        assertThat(VmAggregate.idForRequest(UUID.randomUUID())).isNotEqualTo(vm.getId());
    }

    @Test
    @DisplayName("should start PROVISIONING and track the latest stage")
    void testProgress() {
        vm.updateProgress(VmProvisioningStage.CLONING, metadata);
        vm.updateProgress(VmProvisioningStage.POWERING_ON, metadata);

        assertThat(vm.getStatus()).isEqualTo(VmStatus.PROVISIONING);
        assertThat(vm.getStage()).isEqualTo(VmProvisioningStage.POWERING_ON);
        assertThat(vm.getVersion()).isEqualTo(3);
    }

    @Test
    @DisplayName("markProvisioned should record VM details")
    void testProvisioned() {
        vm.markProvisioned("vm-1001", "10.0.0.3", "web-01", null, metadata);

        assertThat(vm.getStatus()).isEqualTo(VmStatus.READY);
        assertThat(vm.getVmwareVmId()).isEqualTo("vm-1001");
        assertThat(vm.getHostname()).isEqualTo("web-01");
    }

    @Test
    @DisplayName("terminal states should reject further changes")
    void testTerminal() {
        vm.markFailed("Clone timed out", "VMWARE_TOOLS_TIMEOUT", metadata);

        assertThat(vm.getStatus()).isEqualTo(VmStatus.FAILED);
        assertThatThrownBy(() -> vm.updateProgress(VmProvisioningStage.READY, metadata))
            .isInstanceOf(InvalidStateException.class);
        assertThatThrownBy(() -> vm.markProvisioned("vm-1", "10.0.0.2", "h", null, metadata))
            .isInstanceOf(InvalidStateException.class);
    }
}
