package com.crudadmin.backend.global.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.ZoneOffset;

import com.crudadmin.backend.modules.auth.application.AuthErrorKind;
import com.crudadmin.backend.modules.auth.application.AuthException;
import com.crudadmin.backend.modules.auth.application.AuthService;
import com.crudadmin.backend.modules.auth.application.JwtTokenCodec;
import com.crudadmin.backend.modules.auth.domain.NewUser;
import com.crudadmin.backend.modules.auth.domain.UserAccount;
import com.crudadmin.backend.modules.auth.infrastructure.crypto.BCryptPasswordHasher;
import com.crudadmin.backend.support.AuthFixtures;
import com.crudadmin.backend.support.InMemoryCredentialStore;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.security.core.GrantedAuthority;

class AccessGuardTest {

    private InMemoryCredentialStore store;
    private JwtTokenCodec codec;
    private AccessGuard accessGuard;
    private UserAccount alice;
    private UserAccount root;

    @BeforeEach
    void setUp() {
        store = new InMemoryCredentialStore();
        codec = AuthFixtures.tokenCodec();
        BCryptPasswordHasher hasher = AuthFixtures.fastHasher();
        accessGuard = new AccessGuard(new AuthService(store, hasher, codec, AuthFixtures.fixedClock()));
        alice = store.create(new NewUser("alice", hasher.hash("alice-password"), false));
        root = store.create(new NewUser("root", hasher.hash("root-password"), true));
    }

    @Test
    void authenticatedPolicyAdmitsAnyValidUser() {
        AuthenticatedUser user = accessGuard.authorize(requestWithToken(tokenFor(alice)), AccessPolicy.AUTHENTICATED);

        assertThat(user).isEqualTo(new AuthenticatedUser(alice.id(), "alice", false));
        assertThat(user.authorities()).extracting(GrantedAuthority::getAuthority).containsExactly("ROLE_USER");
    }

    @Test
    void adminPolicyRejectsNonAdminWithForbidden() {
        assertKind(() -> accessGuard.authorize(requestWithToken(tokenFor(alice)), AccessPolicy.ADMIN_ONLY),
                AuthErrorKind.FORBIDDEN);
    }

    @Test
    void adminPolicyAdmitsAdmin() {
        AuthenticatedUser user = accessGuard.authorize(requestWithToken(tokenFor(root)), AccessPolicy.ADMIN_ONLY);

        assertThat(user.admin()).isTrue();
        assertThat(user.authorities()).extracting(GrantedAuthority::getAuthority).contains("ROLE_ADMIN");
    }

    @Test
    void missingOrNonBearerHeaderIsMissingCredentials() {
        assertKind(() -> accessGuard.authorize(new MockHttpServletRequest(), AccessPolicy.AUTHENTICATED),
                AuthErrorKind.MISSING_CREDENTIALS);

        MockHttpServletRequest basic = new MockHttpServletRequest();
        basic.addHeader("Authorization", "Basic YWxpY2U6cHc=");
        assertKind(() -> accessGuard.authorize(basic, AccessPolicy.ADMIN_ONLY), AuthErrorKind.MISSING_CREDENTIALS);
    }

    @Test
    void tokenProblemsWinOverCapabilityCheck() {
        assertKind(() -> accessGuard.authorize(requestWithToken("garbage"), AccessPolicy.ADMIN_ONLY),
                AuthErrorKind.TOKEN_MALFORMED);

        Clock earlier = Clock.fixed(AuthFixtures.NOW.minus(AuthFixtures.TTL).minusSeconds(60), ZoneOffset.UTC);
        String stale = codec.issue("alice", earlier.instant()).token();
        assertKind(() -> accessGuard.authorize(requestWithToken(stale), AccessPolicy.ADMIN_ONLY),
                AuthErrorKind.TOKEN_EXPIRED);
    }

    @Test
    void tokenOfDeletedUserIsRejected() {
        String token = tokenFor(alice);
        store.delete(alice.id());

        assertKind(() -> accessGuard.authorize(requestWithToken(token), AccessPolicy.AUTHENTICATED),
                AuthErrorKind.USER_NOT_FOUND);
    }

    private String tokenFor(UserAccount user) {
        return codec.issue(user.username(), AuthFixtures.NOW).token();
    }

    private static MockHttpServletRequest requestWithToken(String token) {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("Authorization", "Bearer " + token);
        return request;
    }

    private static void assertKind(Runnable call, AuthErrorKind expected) {
        assertThatThrownBy(call::run)
                .isInstanceOf(AuthException.class)
                .extracting(ex -> ((AuthException) ex).getKind())
                .isEqualTo(expected);
    }
}
