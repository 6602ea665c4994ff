package com.purchasingpower.coderag.session;

/**
 * Bounded registry of open sessions. The least recently used session is closed
 * once the capacity is exceeded; its persisted data stays and it is reopened on
 * next use.
 */
public interface SessionManager {

    /**
     * Returns the open session, or opens it. Either way it becomes most recently used.
     */
    SessionStore getOrCreate(String sessionId);

    void close(String sessionId);

    void closeAll();

    int size();

    SessionStats stats();
}
