package com.portfolio.mirror.repo.documents;

import com.portfolio.mirror.enums.CredentialKind;
import com.portfolio.mirror.model.documents.Credential;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface CredentialRepo extends MongoRepository<Credential, String> {

    Optional<Credential> findFirstByPersonNameAndKindAndActiveTrueOrderByCreatedAtDesc(String personName, CredentialKind kind);

    List<Credential> findByPersonNameAndActiveTrue(String personName);
}
