package com.smartcampus.database.resource;

import static org.assertj.core.api.Assertions.assertThat;

import com.smartcampus.database.TestDatabases;
import com.smartcampus.security.Principal;
import com.smartcampus.security.ResourceDescriptor;
import com.smartcampus.security.ResourceKind;
import com.smartcampus.security.Role;
import com.smartcampus.security.policy.PolicyTableHolder;
import com.smartcampus.security.policy.PolicyTableLoader;
import com.smartcampus.security.scope.ScopePredicate;
import com.smartcampus.security.scope.ScopingFilter;
import com.smartcampus.security.testing.TestPrincipals;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

@DisplayName("JdbcResourceDescriptorRepository")
class JdbcResourceDescriptorRepositoryTest {

    private JdbcResourceDescriptorRepository repository;
    private final List<ResourceDescriptor> stored = new ArrayList<>();

    @BeforeEach
    void setUp() {
        repository = new JdbcResourceDescriptorRepository(new JdbcTemplate(TestDatabases.migrated()));
        for (String school : List.of("SCH1", "SCH2")) {
            save(ResourceDescriptor.owned(ResourceKind.ATTENDANCE, school, school + "-att-1", "C1", "S1"));
            save(ResourceDescriptor.owned(ResourceKind.ATTENDANCE, school, school + "-att-2", "C2", "S2"));
            save(ResourceDescriptor.owned(ResourceKind.ATTENDANCE, school, school + "-att-3", "C3"));
            save(ResourceDescriptor.owned(ResourceKind.FEE, school, school + "-fee-1", "S1"));
            save(ResourceDescriptor.owned(ResourceKind.FEE, school, school + "-fee-2", "S2"));
            save(ResourceDescriptor.of(ResourceKind.NOTICE, school, school + "-notice-1"));
        }
    }

    private void save(ResourceDescriptor descriptor) {
        repository.save(descriptor);
        stored.add(descriptor);
    }

    @Nested
    @DisplayName("load()")
    class Load {

        @Test
        @DisplayName("returns the descriptor with all owners")
        void withOwners() {
            assertThat(repository.load(ResourceKind.ATTENDANCE, "SCH1-att-1"))
                    .contains(ResourceDescriptor.owned(ResourceKind.ATTENDANCE, "SCH1", "SCH1-att-1", "C1", "S1"));
        }

        @Test
        @DisplayName("returns a descriptor without owners")
        void withoutOwners() {
            assertThat(repository.load(ResourceKind.NOTICE, "SCH2-notice-1"))
                    .hasValueSatisfying(d -> assertThat(d.ownerRefs()).isEmpty());
        }

        @Test
        @DisplayName("returns empty for an unknown id or the wrong kind")
        void missing() {
            assertThat(repository.load(ResourceKind.FEE, "nope")).isEmpty();
            assertThat(repository.load(ResourceKind.FEE, "SCH1-notice-1")).isEmpty();
        }

        @Test
        @DisplayName("replaces owners on save")
        void replaceOwners() {
            repository.save(ResourceDescriptor.owned(ResourceKind.FEE, "SCH1", "SCH1-fee-1", "S3"));

            assertThat(repository.load(ResourceKind.FEE, "SCH1-fee-1"))
                    .hasValueSatisfying(d -> assertThat(d.ownerRefs()).containsExactly("S3"));
        }
    }

    @Nested
    @DisplayName("findVisible()")
    class FindVisible {

        private final ScopingFilter filter =
                new ScopingFilter(new PolicyTableHolder(PolicyTableLoader.loadDefault()));

        @Test
        @DisplayName("returns only a teacher's class attendance in their school")
        void teacherAttendance() {
            Principal teacher = TestPrincipals.teacher("SCH1", "C1", "C2");

            List<ResourceDescriptor> visible =
                    repository.findVisible(ResourceKind.ATTENDANCE, filter.scopeFor(teacher, ResourceKind.ATTENDANCE));

            assertThat(visible).extracting(ResourceDescriptor::id).containsExactly("SCH1-att-1", "SCH1-att-2");
        }

        @Test
        @DisplayName("returns nothing for a scope that matches nothing")
        void none() {
            assertThat(repository.findVisible(ResourceKind.FEE, ScopePredicate.none(ResourceKind.FEE))).isEmpty();
        }

        @Test
        @DisplayName("returns every school's rows to super_admin")
        void superAdmin() {
            ScopePredicate scope = filter.scopeFor(TestPrincipals.superAdmin(), ResourceKind.NOTICE);

            assertThat(repository.findVisible(ResourceKind.NOTICE, scope))
                    .extracting(ResourceDescriptor::id)
                    .containsExactly("SCH1-notice-1", "SCH2-notice-1");
        }

        @Test
        @DisplayName("agrees with the in-memory predicate for every role")
        void agreesWithPredicate() {
            var principals = new ArrayList<Principal>();
            for (Role role : Role.values()) {
                principals.add(TestPrincipals.of(role, "C1", "S1"));
            }
            principals.add(TestPrincipals.schoolPrincipal("SCH1", "manage_fees"));

            for (Principal principal : principals) {
                for (ResourceKind kind : List.of(ResourceKind.ATTENDANCE, ResourceKind.FEE, ResourceKind.NOTICE)) {
                    ScopePredicate scope = filter.scopeFor(principal, kind);
                    List<ResourceDescriptor> expected = stored.stream()
                            .filter(scope::matches)
                            .toList();

                    assertThat(repository.findVisible(kind, scope))
                            .as("%s %s", principal.role(), kind)
                            .containsExactlyInAnyOrderElementsOf(expected);
                }
            }
        }
    }
}
