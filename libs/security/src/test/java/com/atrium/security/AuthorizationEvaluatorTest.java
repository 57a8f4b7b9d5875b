package com.atrium.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.atrium.security.testing.TestPrincipalFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

@DisplayName("AuthorizationEvaluator")
class AuthorizationEvaluatorTest {

    private static final long ALICE = 1L;
    private static final long BOB = 2L;

    @Nested
    @DisplayName("tenant isolation")
    class TenantIsolation {

        @ParameterizedTest(name = "{0} is denied every action on a foreign resource")
        @EnumSource(Role.class)
        void foreignTenantAlwaysDenied(Role role) {
            var principal = TestPrincipalFactory.inTenant(1L, ALICE, role);
            var foreignOwnedBySelf = ResourceMeta.owned(2L, ALICE);

            for (Action action : Action.values()) {
                var decision = AuthorizationEvaluator.authorize(principal, action, foreignOwnedBySelf);
                assertThat(decision.allowed()).as("%s %s", role, action).isFalse();
                assertThat(decision.reason()).isEqualTo(DenyReason.TENANT_MISMATCH);
            }
        }

        @Test
        @DisplayName("tenant check wins over ownership for admin")
        void tenantCheckPrecedesRoleLogic() {
            var admin = TestPrincipalFactory.inTenant(1L, ALICE, Role.ADMIN);

            var decision = AuthorizationEvaluator.authorize(admin, Action.DELETE, ResourceMeta.unowned(9L));

            assertThat(decision).isEqualTo(Decision.deny(DenyReason.TENANT_MISMATCH));
        }
    }

    @Nested
    @DisplayName("editor")
    class Editor {

        @Test
        @DisplayName("may update and delete own resources")
        void ownResources() {
            var editor = TestPrincipalFactory.editor(ALICE);
            var own = TestPrincipalFactory.ownedBy(ALICE);

            assertThat(AuthorizationEvaluator.authorize(editor, Action.UPDATE, own).allowed()).isTrue();
            assertThat(AuthorizationEvaluator.authorize(editor, Action.DELETE, own).allowed()).isTrue();
        }

        @Test
        @DisplayName("is denied update and delete of someone else's resource")
        void othersResources() {
            var editor = TestPrincipalFactory.editor(ALICE);
            var bobs = TestPrincipalFactory.ownedBy(BOB);

            assertThat(AuthorizationEvaluator.authorize(editor, Action.UPDATE, bobs))
                    .isEqualTo(Decision.deny(DenyReason.NOT_OWNER));
            assertThat(AuthorizationEvaluator.authorize(editor, Action.DELETE, bobs))
                    .isEqualTo(Decision.deny(DenyReason.NOT_OWNER));
        }

        @Test
        @DisplayName("owner-scoped capability never matches an unowned resource")
        void unownedResource() {
            var editor = TestPrincipalFactory.editor(ALICE);

            assertThat(AuthorizationEvaluator.authorize(editor, Action.UPDATE, TestPrincipalFactory.tenantResource())
                    .allowed()).isFalse();
        }

        @Test
        @DisplayName("may create projects and tags")
        void create() {
            var editor = TestPrincipalFactory.editor(ALICE);
            var stamped = ResourceMeta.createdBy(editor);

            assertThat(AuthorizationEvaluator.authorize(editor, Action.CREATE, stamped).allowed()).isTrue();
            assertThat(AuthorizationEvaluator.authorize(editor, Action.CREATE_TAG, stamped).allowed()).isTrue();
        }

        @Test
        @DisplayName("may neither manage users nor view the audit trail")
        void adminOnlyActions() {
            var editor = TestPrincipalFactory.editor(ALICE);
            var tenant = TestPrincipalFactory.tenantResource();

            assertThat(AuthorizationEvaluator.authorize(editor, Action.MANAGE_USERS, tenant))
                    .isEqualTo(Decision.deny(DenyReason.MISSING_CAPABILITY));
            assertThat(AuthorizationEvaluator.authorize(editor, Action.VIEW_AUDIT, tenant))
                    .isEqualTo(Decision.deny(DenyReason.MISSING_CAPABILITY));
        }
    }

    @Nested
    @DisplayName("admin")
    class Admin {

        @Test
        @DisplayName("may update and delete any in-tenant resource regardless of owner")
        void anyOwner() {
            var admin = TestPrincipalFactory.admin(ALICE);
            for (var meta : new ResourceMeta[] {
                    TestPrincipalFactory.ownedBy(BOB),
                    TestPrincipalFactory.ownedBy(ALICE),
                    TestPrincipalFactory.tenantResource()}) {
                assertThat(AuthorizationEvaluator.authorize(admin, Action.UPDATE, meta).allowed()).isTrue();
                assertThat(AuthorizationEvaluator.authorize(admin, Action.DELETE, meta).allowed()).isTrue();
            }
        }

        @Test
        @DisplayName("creates tags through the general create capability")
        void createTagViaCreate() {
            var admin = TestPrincipalFactory.admin(ALICE);

            assertThat(CapabilityTable.grants(Role.ADMIN, Capability.CREATE_TAG)).isFalse();
            assertThat(AuthorizationEvaluator.authorize(admin, Action.CREATE_TAG, ResourceMeta.createdBy(admin))
                    .allowed()).isTrue();
        }

        @Test
        @DisplayName("may manage users and view the audit trail")
        void adminOnlyActions() {
            var admin = TestPrincipalFactory.admin(ALICE);
            var tenant = TestPrincipalFactory.tenantResource();

            assertThat(AuthorizationEvaluator.authorize(admin, Action.MANAGE_USERS, tenant).allowed()).isTrue();
            assertThat(AuthorizationEvaluator.authorize(admin, Action.VIEW_AUDIT, tenant).allowed()).isTrue();
        }
    }

    @Nested
    @DisplayName("viewer")
    class Viewer {

        @Test
        @DisplayName("may only read")
        void readOnly() {
            var viewer = TestPrincipalFactory.viewer(ALICE);
            var own = TestPrincipalFactory.ownedBy(ALICE);

            for (Action action : Action.values()) {
                boolean allowed = AuthorizationEvaluator.authorize(viewer, action, own).allowed();
                assertThat(allowed).as(action.name()).isEqualTo(action == Action.READ);
            }
        }

        @ParameterizedTest(name = "viewer denied {0}")
        @EnumSource(value = Action.class, names = {"CREATE", "CREATE_TAG", "UPDATE", "DELETE", "MANAGE_USERS"})
        void mutatingActionsDenied(Action action) {
            var decision = AuthorizationEvaluator.authorize(
                    TestPrincipalFactory.viewer(ALICE), action, TestPrincipalFactory.ownedBy(ALICE));

            assertThat(action.mutating()).isTrue();
            assertThat(decision).isEqualTo(Decision.deny(DenyReason.MISSING_CAPABILITY));
        }
    }

    @Test
    @DisplayName("rejects missing arguments instead of deciding")
    void rejectsNulls() {
        assertThatThrownBy(() -> AuthorizationEvaluator.authorize(null, Action.READ, TestPrincipalFactory.tenantResource()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("every role/action/ownership combination yields a decision")
    void total() {
        for (Role role : Role.values()) {
            var principal = TestPrincipalFactory.inTenant(TestPrincipalFactory.DEFAULT_TENANT, ALICE, role);
            for (Action action : Action.values()) {
                for (var meta : new ResourceMeta[] {
                        TestPrincipalFactory.ownedBy(ALICE),
                        TestPrincipalFactory.ownedBy(BOB),
                        TestPrincipalFactory.tenantResource()}) {
                    assertThat(AuthorizationEvaluator.authorize(principal, action, meta)).isNotNull();
                }
            }
        }
    }
}
