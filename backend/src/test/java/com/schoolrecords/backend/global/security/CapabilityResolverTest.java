package com.schoolrecords.backend.global.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import com.schoolrecords.backend.global.error.ProblemException;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CapabilityResolverTest {

    @Test
    @DisplayName("ADMIN is granted every capability")
    void adminHoldsEverything() {
        Capabilities capabilities = CapabilityResolver.resolve(List.of("ADMIN"));

        assertThat(capabilities.asSet()).containsExactlyInAnyOrder(AcademicCapability.values());
    }

    @Test
    @DisplayName("TEACHER may mark attendance and record grades only")
    void teacherHoldsClassroomCapabilities() {
        Capabilities capabilities = CapabilityResolver.resolve(List.of("teacher"));

        assertThat(capabilities.asSet()).containsExactlyInAnyOrder(
                AcademicCapability.MARK_ATTENDANCE,
                AcademicCapability.RECORD_GRADES
        );
        assertThatThrownBy(() -> capabilities.require(AcademicCapability.ENROLL_STUDENTS))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("CAPABILITY_REQUIRED"));
    }

    @Test
    @DisplayName("unknown roles and missing roles grant nothing")
    void unknownRolesGrantNothing() {
        assertThat(CapabilityResolver.resolve(List.of("PARENT")).asSet()).isEmpty();
        assertThat(CapabilityResolver.resolve(null).asSet()).isEmpty();
    }
}
