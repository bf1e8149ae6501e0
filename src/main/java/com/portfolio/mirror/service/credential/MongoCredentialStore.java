package com.portfolio.mirror.service.credential;

import com.portfolio.mirror.enums.CredentialKind;
import com.portfolio.mirror.model.documents.Credential;
import com.portfolio.mirror.model.documents.Person;
import com.portfolio.mirror.repo.documents.CredentialRepo;
import com.portfolio.mirror.repo.documents.PersonRepo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoDB-backed CredentialStore. Counter and multi-row updates go through {@link MongoTemplate} so they
 * are applied server side in one statement.
 */
@Slf4j
@RequiredArgsConstructor
public class MongoCredentialStore implements CredentialStore {

    private final CredentialRepo credentialRepo;
    private final PersonRepo personRepo;
    private final MongoTemplate mongo;

    @Override
    public Optional<Credential> findActive(String personName, CredentialKind kind) {
        return credentialRepo.findFirstByPersonNameAndKindAndActiveTrueOrderByCreatedAtDesc(personName, kind);
    }

    @Override
    public List<Credential> findActive(String personName) {
        return credentialRepo.findByPersonNameAndActiveTrue(personName);
    }

    @Override
    public List<Credential> insert(List<Credential> credentials) {
        return credentialRepo.saveAll(credentials);
    }

    @Override
    public void retireActiveExcept(String personName, Collection<String> keepIds, Instant at) {
        Query q = new Query(where("personName").is(personName).and("active").is(true).and("id").nin(keepIds));
        long retired = mongo.updateMulti(q, new Update().set("active", false).set("updatedAt", at), Credential.class)
                .getModifiedCount();
        log.debug("Retired {} credential rows for {}", retired, personName);
    }

    @Override
    public void markUsed(String credentialId, Instant at) {
        mongo.updateFirst(new Query(where("id").is(credentialId)), new Update().set("lastUsed", at), Credential.class);
    }

    @Override
    public void recordFailure(String personName, String message, Instant at) {
        mongo.findAndModify(activeRefresh(personName),
                new Update().inc("errorCount", 1)
                        .set("lastError", message)
                        .set("lastUsed", at)
                        .set("updatedAt", at),
                Credential.class);
    }

    @Override
    public void recordSuccess(String personName, Instant at) {
        mongo.findAndModify(activeRefresh(personName),
                new Update().set("errorCount", 0)
                        .unset("lastError")
                        .set("lastSuccessfulUse", at)
                        .set("updatedAt", at),
                Credential.class);
    }

    @Override
    public void retire(String credentialId, Instant at) {
        mongo.updateFirst(new Query(where("id").is(credentialId)),
                new Update().set("active", false).set("updatedAt", at), Credential.class);
    }

    @Override
    public void deactivateAll(String personName, Instant at) {
        mongo.updateMulti(new Query(where("personName").is(personName)),
                new Update().set("active", false).set("updatedAt", at), Credential.class);
    }

    @Override
    public void purgeInactive(String personName) {
        mongo.remove(new Query(where("personName").is(personName).and("active").is(false)), Credential.class);
    }

    @Override
    public Optional<Person> findPerson(String personName) {
        return personRepo.findByPersonName(personName);
    }

    @Override
    public List<Person> listPersons() {
        return personRepo.findAllByOrderByCreatedAtAsc();
    }

    @Override
    public Person savePerson(Person person) {
        return personRepo.save(person);
    }

    private static Query activeRefresh(String personName) {
        return new Query(where("personName").is(personName)
                .and("kind").is(CredentialKind.REFRESH)
                .and("active").is(true))
                .with(Sort.by(Sort.Direction.DESC, "createdAt"));
    }
}
