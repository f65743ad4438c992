package com.schoolrecords.backend.global.security;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps the roles carried by an access token onto record capabilities.
 * ADMIN holds everything, TEACHER may mark attendance and record grades,
 * every other role is read-only.
 */
public final class CapabilityResolver {

    private static final Map<String, Set<AcademicCapability>> CAPABILITIES_BY_ROLE = Map.of(
            "ADMIN", EnumSet.allOf(AcademicCapability.class),
            "TEACHER", EnumSet.of(AcademicCapability.MARK_ATTENDANCE, AcademicCapability.RECORD_GRADES)
    );

    private CapabilityResolver() {
    }

    public static Capabilities resolve(Collection<String> roles) {
        if (roles == null || roles.isEmpty()) {
            return Capabilities.none();
        }
        EnumSet<AcademicCapability> granted = EnumSet.noneOf(AcademicCapability.class);
        for (String role : roles) {
            if (role == null) {
                continue;
            }
            granted.addAll(CAPABILITIES_BY_ROLE.getOrDefault(role.trim().toUpperCase(Locale.ROOT), Set.of()));
        }
        return Capabilities.of(granted);
    }
}
