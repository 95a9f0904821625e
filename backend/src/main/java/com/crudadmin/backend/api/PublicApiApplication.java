package com.crudadmin.backend.api;

import java.util.TimeZone;

import com.crudadmin.backend.global.security.AccessPolicy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

/**
 * Public API: login, current user, self-registration and own password change.
 * Any authenticated user passes the gate.
 */
@SpringBootApplication(scanBasePackages = {
        "com.crudadmin.backend.global",
        "com.crudadmin.backend.health",
        "com.crudadmin.backend.modules.auth",
        "com.crudadmin.backend.modules.user",
        "com.crudadmin.backend.api"
})
public class PublicApiApplication {

    public static void main(String[] args) {
        TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
        SpringApplication.run(PublicApiApplication.class, args);
    }

    @Bean
    public AccessPolicy accessPolicy() {
        return AccessPolicy.AUTHENTICATED;
    }
}
