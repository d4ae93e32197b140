package com.tasklane.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.tasklane.backend.modules.auth.domain.Account;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AccountRepository extends JpaRepository<Account, UUID> {

    @Query("select a from Account a where a.loginHandle = lower(:loginHandle)")
    Optional<Account> findByLoginHandleIgnoreCase(@Param("loginHandle") String loginHandle);

    @Query("""
            select case when count(a) > 0 then true else false end
              from Account a
             where a.loginHandle = lower(:loginHandle)
            """)
    boolean existsByLoginHandleIgnoreCase(@Param("loginHandle") String loginHandle);
}
