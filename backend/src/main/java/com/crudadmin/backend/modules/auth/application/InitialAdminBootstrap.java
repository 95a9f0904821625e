package com.crudadmin.backend.modules.auth.application;

import com.crudadmin.backend.modules.auth.domain.NewUser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Creates the configured administrator on start-up when that username does not exist yet.
 * Both services run it; whichever loses the race sees {@link UsernameTakenException} and moves on.
 */
@Component
public class InitialAdminBootstrap implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(InitialAdminBootstrap.class);

    private final CredentialStore credentialStore;
    private final PasswordHasher passwordHasher;
    private final String username;
    private final String password;

    public InitialAdminBootstrap(
            CredentialStore credentialStore,
            PasswordHasher passwordHasher,
            @Value("${app.bootstrap.admin.username:}") String username,
            @Value("${app.bootstrap.admin.password:}") String password
    ) {
        this.credentialStore = credentialStore;
        this.passwordHasher = passwordHasher;
        this.username = username;
        this.password = password;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (username == null || username.isBlank() || password == null || password.isBlank()) {
            log.info("Initial admin bootstrap skipped: no credentials configured");
            return;
        }
        if (credentialStore.findByUsername(username).isPresent()) {
            log.info("Admin user '{}' already exists", username);
            return;
        }
        try {
            credentialStore.create(new NewUser(username, passwordHasher.hash(password), true));
            log.info("Initial admin user '{}' created", username);
        } catch (UsernameTakenException ex) {
            log.info("Admin user '{}' was created concurrently", username);
        }
    }
}
