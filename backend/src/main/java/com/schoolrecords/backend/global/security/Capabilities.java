package com.schoolrecords.backend.global.security;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

import org.springframework.http.HttpStatus;

import com.schoolrecords.backend.global.error.ProblemException;

/**
 * Capabilities granted to the current caller, passed explicitly into privileged
 * service operations.
 */
public final class Capabilities {

    private static final Capabilities NONE = new Capabilities(EnumSet.noneOf(AcademicCapability.class));

    private final Set<AcademicCapability> granted;

    private Capabilities(Set<AcademicCapability> granted) {
        this.granted = granted;
    }

    public static Capabilities none() {
        return NONE;
    }

    public static Capabilities all() {
        return new Capabilities(EnumSet.allOf(AcademicCapability.class));
    }

    public static Capabilities of(AcademicCapability first, AcademicCapability... rest) {
        return new Capabilities(EnumSet.of(first, rest));
    }

    public static Capabilities of(Collection<AcademicCapability> capabilities) {
        if (capabilities.isEmpty()) {
            return NONE;
        }
        return new Capabilities(EnumSet.copyOf(capabilities));
    }

    public boolean has(AcademicCapability capability) {
        return granted.contains(capability);
    }

    public void require(AcademicCapability capability) {
        if (!has(capability)) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "CAPABILITY_REQUIRED",
                    "capability " + capability.name() + " was not granted");
        }
    }

    public Set<AcademicCapability> asSet() {
        return Set.copyOf(granted);
    }

    @Override
    public String toString() {
        return "Capabilities" + granted;
    }
}
