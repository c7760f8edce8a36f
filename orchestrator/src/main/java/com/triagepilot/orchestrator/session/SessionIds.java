package com.triagepilot.orchestrator.session;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * File-system names derived from opaque session ids.
 *
 * Base64url without padding: distinct ids always give distinct names, and
 * the alphabet (A-Z a-z 0-9 - _) never forms a path separator or "..".
 */
public final class SessionIds {

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    private SessionIds() {}

    public static String pathSegment(String sessionId) {
        return ENCODER.encodeToString(sessionId.getBytes(StandardCharsets.UTF_8));
    }
}
