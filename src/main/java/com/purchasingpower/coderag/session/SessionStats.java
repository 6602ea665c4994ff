package com.purchasingpower.coderag.session;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Snapshot of the session registry. Sessions are listed most idle first.
 */
@Value
@Builder
public class SessionStats {

    int totalSessions;

    int maxSessions;

    @Singular
    List<SessionInfo> sessions;

    @Value
    public static class SessionInfo {
        String sessionId;
        double ageHours;
        double idleMinutes;
    }
}
