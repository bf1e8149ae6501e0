package com.portfolio.mirror.service.credential;

import com.portfolio.mirror.enums.CredentialKind;
import com.portfolio.mirror.model.documents.Credential;
import com.portfolio.mirror.model.documents.Person;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for credentials and the person-health view derived from them.
 *
 * Contracts:
 *  - Token values arrive already encrypted; the store never sees plaintext.
 *  - "Active" lookups return the newest active row of a kind.
 *  - {@link #rotate} stores the new pair before retiring anything, so a failure part way leaves
 *    either the old pair or the complete new pair active, never neither.
 */
public interface CredentialStore {

    Optional<Credential> findActive(String personName, CredentialKind kind);

    List<Credential> findActive(String personName);

    List<Credential> insert(List<Credential> credentials);

    void retireActiveExcept(String personName, Collection<String> keepIds, Instant at);

    default List<Credential> rotate(String personName, Credential access, Credential refresh, Instant at) {
        List<Credential> saved = insert(List.of(access, refresh));
        retireActiveExcept(personName, saved.stream().map(Credential::getId).toList(), at);
        return saved;
    }

    void markUsed(String credentialId, Instant at);

    /**
     * Increments the error counter on the active refresh row and stores the message.
     */
    void recordFailure(String personName, String message, Instant at);

    /**
     * Clears error bookkeeping on the active refresh row.
     */
    void recordSuccess(String personName, Instant at);

    void retire(String credentialId, Instant at);

    void deactivateAll(String personName, Instant at);

    /**
     * Hard-deletes the person's retired rows and keeps the active ones.
     */
    void purgeInactive(String personName);

    // Person health

    Optional<Person> findPerson(String personName);

    List<Person> listPersons();

    Person savePerson(Person person);
}
