package org.carball.autoindex.catalog;

import org.carball.autoindex.model.tenant.FieldActivationChange;
import org.carball.autoindex.model.tenant.TenantFieldActivation;
import org.carball.autoindex.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryTenantFieldActivationSourceTest {

    private InMemoryTenantFieldActivationSource source;

    @BeforeEach
    void setUp() {
        source = new InMemoryTenantFieldActivationSource(new MutableClock(Instant.parse("2024-03-01T09:00:00Z")));
    }

    @Test
    void shouldReturnEmptyActivationForUnknownTenant() {
        // When
        TenantFieldActivation activation = source.activationFor("ghost");

        // Then
        assertThat(activation.activeFields()).isEmpty();
        assertThat(activation.version()).isZero();
        assertThat(activation.isActive("orders", "status")).isFalse();
    }

    @Test
    void shouldMatchFieldsCaseInsensitively() {
        // Given
        source.enableField("acme", "Orders", "Status");

        // When
        TenantFieldActivation activation = source.activationFor("acme");

        // Then
        assertThat(activation.isActive("orders", "status")).isTrue();
        assertThat(activation.isActive("ORDERS", "STATUS")).isTrue();
        assertThat(source.activationFor("globex").isActive("orders", "status")).isFalse();
    }

    @Test
    void shouldBumpVersionOnlyOnActualChanges() {
        // Given
        source.enableField("acme", "orders", "status");
        source.enableField("acme", "orders", "status");
        source.enableField("acme", "orders", "region");
        source.disableField("acme", "orders", "missing");

        // When
        source.disableField("acme", "orders", "status");

        // Then
        TenantFieldActivation activation = source.activationFor("acme");
        assertThat(activation.version()).isEqualTo(3);
        assertThat(activation.isActive("orders", "status")).isFalse();
        assertThat(activation.isActive("orders", "region")).isTrue();
    }

    @Test
    void shouldListChangesAfterGivenVersion() {
        // Given
        source.enableField("acme", "orders", "status");
        source.enableField("acme", "orders", "region");
        source.enableField("globex", "orders", "status");
        source.disableField("acme", "orders", "status");

        // When
        List<FieldActivationChange> changes = source.changesSince("acme", 1);

        // Then
        assertThat(changes).extracting(FieldActivationChange::field).containsExactly("region", "status");
        assertThat(changes).extracting(FieldActivationChange::enabled).containsExactly(true, false);
        assertThat(changes.get(0).changedAt()).isEqualTo(Instant.parse("2024-03-01T09:00:00Z"));
    }
}
