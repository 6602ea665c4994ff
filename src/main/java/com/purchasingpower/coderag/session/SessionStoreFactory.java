package com.purchasingpower.coderag.session;

public interface SessionStoreFactory {

    SessionStore create(String sessionId);
}
