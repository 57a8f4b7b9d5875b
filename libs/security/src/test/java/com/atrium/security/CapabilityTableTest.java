package com.atrium.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CapabilityTable")
class CapabilityTableTest {

    @Test
    @DisplayName("admin grants")
    void admin() {
        assertThat(CapabilityTable.capabilitiesOf(Role.ADMIN)).containsExactlyInAnyOrder(
                Capability.READ, Capability.CREATE, Capability.UPDATE_ANY, Capability.DELETE_ANY,
                Capability.MANAGE_USERS, Capability.VIEW_AUDIT);
    }

    @Test
    @DisplayName("editor grants")
    void editor() {
        assertThat(CapabilityTable.capabilitiesOf(Role.EDITOR)).containsExactlyInAnyOrder(
                Capability.READ, Capability.CREATE, Capability.UPDATE_OWN, Capability.DELETE_OWN,
                Capability.CREATE_TAG);
    }

    @Test
    @DisplayName("viewer grants")
    void viewer() {
        assertThat(CapabilityTable.capabilitiesOf(Role.VIEWER)).containsExactly(Capability.READ);
    }

    @Test
    @DisplayName("admin holds no owner-scoped capability: its exemption is explicit")
    void adminHasNoOwnerScopedGrant() {
        assertThat(CapabilityTable.capabilitiesOf(Role.ADMIN)).noneMatch(Capability::ownerScoped);
    }

    @Test
    @DisplayName("granted sets are unmodifiable")
    void unmodifiable() {
        assertThatThrownBy(() -> CapabilityTable.capabilitiesOf(Role.VIEWER).add(Capability.CREATE))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
