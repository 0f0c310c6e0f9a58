package org.carball.autoindex.safety;

import org.carball.autoindex.model.telemetry.FieldKey;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class InFlightRegistryTest {

    private final InFlightRegistry registry = new InFlightRegistry();
    private final FieldKey key = new FieldKey("acme", "orders", "status");

    @Test
    void shouldGrantOneLeasePerKey() {
        // When
        Optional<InFlightRegistry.Lease> first = registry.tryAcquire(key);
        Optional<InFlightRegistry.Lease> second = registry.tryAcquire(key);

        // Then
        assertThat(first).isPresent();
        assertThat(second).isEmpty();
        assertThat(registry.isHeld(key)).isTrue();
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void shouldLockOnlyTheExactKey() {
        // Given
        registry.tryAcquire(key);

        // When/Then
        assertThat(registry.tryAcquire(new FieldKey("globex", "orders", "status"))).isPresent();
        assertThat(registry.tryAcquire(new FieldKey("acme", "orders", "region"))).isPresent();
    }

    @Test
    void shouldReleaseOnCloseAndTolerateDoubleClose() {
        // Given
        InFlightRegistry.Lease lease = registry.tryAcquire(key).orElseThrow();

        // When
        lease.close();
        Optional<InFlightRegistry.Lease> again = registry.tryAcquire(key);
        lease.close();

        // Then
        assertThat(again).isPresent();
        assertThat(registry.isHeld(key)).isTrue();
    }

    @Test
    void shouldReleaseInTryWithResources() {
        // When
        try (InFlightRegistry.Lease lease = registry.tryAcquire(key).orElseThrow()) {
            assertThat(lease.getKey()).isEqualTo(key);
        }

        // Then
        assertThat(registry.size()).isZero();
    }
}
