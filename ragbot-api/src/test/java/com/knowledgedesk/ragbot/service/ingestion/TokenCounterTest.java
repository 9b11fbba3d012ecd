package com.knowledgedesk.ragbot.service.ingestion;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TokenCounterTest {

    @Test
    void splitsOnWhitespace() {
        assertThat(TokenCounter.tokenize("  remote   work\tpolicy\n")).containsExactly("remote", "work", "policy");
        assertThat(TokenCounter.count(null)).isZero();
    }

    @Test
    void emitsEachWideCharacterAsItsOwnToken() {
        assertThat(TokenCounter.tokenize("Hello 世界")).containsExactly("Hello", "世", "界");
        assertThat(TokenCounter.count("東京は大きい。")).isEqualTo(7);
    }

    @Test
    void joinOmitsSpacesBetweenWideTokens() {
        assertThat(TokenCounter.join(List.of("Hello", "世", "界"))).isEqualTo("Hello 世界");
        assertThat(TokenCounter.join(List.of("a", "b"))).isEqualTo("a b");
    }
}
