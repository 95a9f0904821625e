package com.crudadmin.backend.modules.auth.infrastructure.crypto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.crudadmin.backend.support.AuthFixtures;

import org.junit.jupiter.api.Test;

class BCryptPasswordHasherTest {

    private final BCryptPasswordHasher hasher = AuthFixtures.fastHasher();

    @Test
    void hashIsSaltedPerCall() {
        String first = hasher.hash("correct horse");
        String second = hasher.hash("correct horse");

        assertThat(first).isNotEqualTo(second).startsWith("$2");
        assertThat(hasher.verify("correct horse", first)).isTrue();
        assertThat(hasher.verify("correct horse", second)).isTrue();
    }

    @Test
    void wrongPasswordDoesNotVerify() {
        String hash = hasher.hash("correct horse");

        assertThat(hasher.verify("battery staple", hash)).isFalse();
    }

    @Test
    void unreadableInputsYieldFalseInsteadOfThrowing() {
        assertThat(hasher.verify("secret", "not-a-bcrypt-hash")).isFalse();
        assertThat(hasher.verify("secret", "")).isFalse();
        assertThat(hasher.verify("secret", null)).isFalse();
        assertThat(hasher.verify(null, hasher.hash("secret"))).isFalse();
    }

    @Test
    void dummyHashIsStableAndMatchesNothingGuessable() {
        assertThat(hasher.dummyHash()).isSameAs(hasher.dummyHash()).startsWith("$2a$04$");
        assertThat(hasher.verify("", hasher.dummyHash())).isFalse();
        assertThat(hasher.verify("password", hasher.dummyHash())).isFalse();
    }

    @Test
    void inputBeyondSeventyTwoBytesIsNeitherHashedNorVerified() {
        String prefix = "\u3042".repeat(24);
        String stored = hasher.hash(prefix);

        assertThat(hasher.verify(prefix, stored)).isTrue();
        assertThat(hasher.verify(prefix + "\u3046", stored)).isFalse();
        assertThat(hasher.verify(prefix + "x", stored)).isFalse();
        assertThatThrownBy(() -> hasher.hash(prefix + "\u3044".repeat(6)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("72 bytes");
    }
}
