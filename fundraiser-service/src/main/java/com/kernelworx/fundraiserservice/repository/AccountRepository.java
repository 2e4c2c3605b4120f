package com.kernelworx.fundraiserservice.repository;

import com.kernelworx.fundraiserservice.model.Account;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface AccountRepository extends JpaRepository<Account, String> {

    Optional<Account> findByEmailIgnoreCase(String email);
}
