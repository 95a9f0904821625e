package com.crudadmin.backend.modules.auth.infrastructure.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.when;

import com.crudadmin.backend.modules.auth.application.StoreUnavailableException;
import com.crudadmin.backend.modules.auth.application.UsernameTakenException;
import com.crudadmin.backend.modules.auth.domain.AppUser;
import com.crudadmin.backend.modules.auth.domain.NewUser;
import com.crudadmin.backend.support.AuthFixtures;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.InvalidDataAccessApiUsageException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.transaction.CannotCreateTransactionException;

@ExtendWith(MockitoExtension.class)
class JpaCredentialStoreTest {

    @Mock
    private AppUserRepository appUserRepository;

    private JpaCredentialStore store;

    @BeforeEach
    void setUp() {
        store = new JpaCredentialStore(appUserRepository, AuthFixtures.fixedClock(), 7);
    }

    @Test
    void lostConnectionOnLookupBecomesStoreUnavailable() {
        DataAccessResourceFailureException cause = new DataAccessResourceFailureException("connection refused");
        when(appUserRepository.findByUsername("alice")).thenThrow(cause);

        assertThatThrownBy(() -> store.findByUsername("alice"))
                .isInstanceOf(StoreUnavailableException.class)
                .hasCause(cause)
                .satisfies(ex -> {
                    StoreUnavailableException unavailable = (StoreUnavailableException) ex;
                    assertThat(unavailable.getRetryAfterSeconds()).isEqualTo(7);
                    assertThat(unavailable.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
                    assertThat(unavailable.getCode()).isEqualTo("STORE_UNAVAILABLE");
                });
    }

    @Test
    void transactionThatCannotStartBecomesStoreUnavailable() {
        when(appUserRepository.updateAdminFlag(any(), anyBoolean(), any()))
                .thenThrow(new CannotCreateTransactionException("pool exhausted"));

        assertThatThrownBy(() -> store.updateRole(1L, true))
                .isInstanceOf(StoreUnavailableException.class);
    }

    @Test
    void queryTimeoutBecomesStoreUnavailable() {
        when(appUserRepository.findAll(any(Pageable.class))).thenThrow(new QueryTimeoutException("timed out"));

        assertThatThrownBy(() -> store.findPage(0, 20))
                .isInstanceOf(StoreUnavailableException.class);
    }

    @Test
    void uniqueViolationOnCreateIsUsernameTaken() {
        when(appUserRepository.saveAndFlush(any(AppUser.class)))
                .thenThrow(new DataIntegrityViolationException("users_username_key"));

        assertThatThrownBy(() -> store.create(new NewUser("alice", "$2a$04$hash", false)))
                .isInstanceOf(UsernameTakenException.class);
    }

    @Test
    void nonTransientFailuresPropagateUnchanged() {
        when(appUserRepository.deleteUserById(any())).thenThrow(new InvalidDataAccessApiUsageException("bad call"));

        assertThatThrownBy(() -> store.delete(1L))
                .isInstanceOf(InvalidDataAccessApiUsageException.class);
    }
}
