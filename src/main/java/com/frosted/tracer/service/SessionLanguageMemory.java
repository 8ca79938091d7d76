package com.frosted.tracer.service;

import com.frosted.tracer.model.Language;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Last language detected per learner session, used to settle ambiguous snippets the same way
 * as the previous scan. Holds at most {@link #MAX_SESSIONS} sessions; when full, the session
 * used least recently is dropped.
 */
@Component
public class SessionLanguageMemory {
    static final int MAX_SESSIONS = 10_000;

    private final Map<String, Language> lastLanguage;

    public SessionLanguageMemory() {
        this(MAX_SESSIONS);
    }

    SessionLanguageMemory(final int capacity) {
        this.lastLanguage = new LinkedHashMap<String, Language>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Language> eldest) {
                return size() > capacity;
            }
        };
    }

    public synchronized Language get(String sessionId) {
        return sessionId == null ? null : lastLanguage.get(sessionId);
    }

    public synchronized void remember(String sessionId, Language language) {
        if (sessionId == null || language == null) {
            return;
        }
        lastLanguage.put(sessionId, language);
    }

    public synchronized void forget(String sessionId) {
        if (sessionId != null) {
            lastLanguage.remove(sessionId);
        }
    }

    synchronized int size() {
        return lastLanguage.size();
    }
}
