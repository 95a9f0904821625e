package com.crudadmin.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;

import com.crudadmin.backend.modules.auth.domain.AppUser;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface AppUserRepository extends JpaRepository<AppUser, Long> {

    Optional<AppUser> findByUsername(String username);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("""
            update AppUser u
               set u.admin = :admin,
                   u.updatedAt = :now
             where u.id = :id
            """)
    int updateAdminFlag(@Param("id") Long id, @Param("admin") boolean admin, @Param("now") OffsetDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("""
            update AppUser u
               set u.passwordHash = :passwordHash,
                   u.updatedAt = :now
             where u.id = :id
            """)
    int updatePasswordHash(@Param("id") Long id, @Param("passwordHash") String passwordHash, @Param("now") OffsetDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("delete from AppUser u where u.id = :id")
    int deleteUserById(@Param("id") Long id);
}
