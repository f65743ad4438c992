package com.schoolrecords.backend.global.security;

import java.util.List;

public record JwtAuthenticationPrincipal(String subject, List<String> roles) {
}
