package com.llamaservice.repository;

import com.llamaservice.entity.StoredCredential;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Credentials keyed by provider name.
 */
@Repository
public interface CredentialRepository extends JpaRepository<StoredCredential, String> {
}
