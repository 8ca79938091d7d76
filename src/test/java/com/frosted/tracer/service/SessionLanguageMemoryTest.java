package com.frosted.tracer.service;

import com.frosted.tracer.model.Language;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SessionLanguageMemoryTest {

    @Test
    @DisplayName("A full memory drops only the session used least recently")
    void evictsLeastRecentlyUsedSession() {
        SessionLanguageMemory memory = new SessionLanguageMemory(2);
        memory.remember("a", Language.PYTHON_LIKE);
        memory.remember("b", Language.JAVA_LIKE);
        memory.get("a");

        memory.remember("c", Language.JAVASCRIPT_LIKE);

        assertThat(memory.size()).isEqualTo(2);
        assertThat(memory.get("a")).isEqualTo(Language.PYTHON_LIKE);
        assertThat(memory.get("b")).isNull();
        assertThat(memory.get("c")).isEqualTo(Language.JAVASCRIPT_LIKE);
    }

    @Test
    void rememberingAKnownSessionKeepsTheOthers() {
        SessionLanguageMemory memory = new SessionLanguageMemory(2);
        memory.remember("a", Language.PYTHON_LIKE);
        memory.remember("b", Language.JAVA_LIKE);

        memory.remember("a", Language.JAVASCRIPT_LIKE);

        assertThat(memory.get("a")).isEqualTo(Language.JAVASCRIPT_LIKE);
        assertThat(memory.get("b")).isEqualTo(Language.JAVA_LIKE);
    }

    @Test
    void ignoresMissingSession() {
        SessionLanguageMemory memory = new SessionLanguageMemory();
        memory.remember(null, Language.JAVA_LIKE);
        memory.forget("unknown");

        assertThat(memory.get(null)).isNull();
        assertThat(memory.size()).isZero();
    }
}
