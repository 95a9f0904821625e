package com.crudadmin.backend.global.config;

import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

// Entry points live in leaf packages, so entities and repositories are located explicitly.
@Configuration
@EntityScan(basePackages = "com.crudadmin.backend.modules")
@EnableJpaRepositories(basePackages = "com.crudadmin.backend.modules")
public class JpaConfig {
}
