package com.crudadmin.backend.admin;

import java.util.TimeZone;

import com.crudadmin.backend.global.security.AccessPolicy;

import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.annotation.Bean;

/**
 * Admin service: user management. Every protected route requires the admin flag.
 */
@SpringBootApplication(scanBasePackages = {
        "com.crudadmin.backend.global",
        "com.crudadmin.backend.health",
        "com.crudadmin.backend.modules.auth",
        "com.crudadmin.backend.modules.admin",
        "com.crudadmin.backend.admin"
})
public class AdminServiceApplication {

    public static void main(String[] args) {
        TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
        new SpringApplicationBuilder(AdminServiceApplication.class)
                .profiles("admin")
                .run(args);
    }

    @Bean
    public AccessPolicy accessPolicy() {
        return AccessPolicy.ADMIN_ONLY;
    }
}
