package com.portfolio.mirror.service.credential;

import com.portfolio.mirror.enums.CredentialKind;
import com.portfolio.mirror.model.documents.Credential;
import com.portfolio.mirror.model.documents.Person;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of CredentialStore.
 * Intended for local/dev/testing only (single JVM). Rows are copied in and out so callers never share state.
 */
public class InMemoryCredentialStore implements CredentialStore {

    private static final Comparator<Credential> NEWEST_FIRST =
            Comparator.comparing(Credential::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder())).reversed();

    private final ConcurrentMap<String, Credential> credentials = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Person> persons = new ConcurrentHashMap<>();

    @Override
    public Optional<Credential> findActive(String personName, CredentialKind kind) {
        return credentials.values().stream()
                .filter(c -> c.isActive() && c.getKind() == kind && personName.equals(c.getPersonName()))
                .sorted(NEWEST_FIRST)
                .findFirst()
                .map(InMemoryCredentialStore::copy);
    }

    @Override
    public List<Credential> findActive(String personName) {
        return credentials.values().stream()
                .filter(c -> c.isActive() && personName.equals(c.getPersonName()))
                .sorted(NEWEST_FIRST)
                .map(InMemoryCredentialStore::copy)
                .toList();
    }

    @Override
    public synchronized List<Credential> insert(List<Credential> rows) {
        List<Credential> saved = new ArrayList<>(rows.size());
        for (Credential row : rows) {
            Credential stored = copy(row);
            if (stored.getId() == null) {
                stored.setId(UUID.randomUUID().toString());
            }
            credentials.put(stored.getId(), stored);
            saved.add(copy(stored));
        }
        return saved;
    }

    @Override
    public synchronized void retireActiveExcept(String personName, Collection<String> keepIds, Instant at) {
        credentials.values().stream()
                .filter(c -> c.isActive() && personName.equals(c.getPersonName()) && !keepIds.contains(c.getId()))
                .forEach(c -> {
                    c.setActive(false);
                    c.setUpdatedAt(at);
                });
    }

    @Override
    public void markUsed(String credentialId, Instant at) {
        credentials.computeIfPresent(credentialId, (id, c) -> {
            c.setLastUsed(at);
            return c;
        });
    }

    @Override
    public synchronized void recordFailure(String personName, String message, Instant at) {
        activeRefreshRow(personName).ifPresent(c -> {
            c.setErrorCount(c.getErrorCount() + 1);
            c.setLastError(message);
            c.setLastUsed(at);
            c.setUpdatedAt(at);
        });
    }

    @Override
    public synchronized void recordSuccess(String personName, Instant at) {
        activeRefreshRow(personName).ifPresent(c -> {
            c.setErrorCount(0);
            c.setLastError(null);
            c.setLastSuccessfulUse(at);
            c.setUpdatedAt(at);
        });
    }

    @Override
    public void retire(String credentialId, Instant at) {
        credentials.computeIfPresent(credentialId, (id, c) -> {
            c.setActive(false);
            c.setUpdatedAt(at);
            return c;
        });
    }

    @Override
    public synchronized void deactivateAll(String personName, Instant at) {
        credentials.values().stream()
                .filter(c -> personName.equals(c.getPersonName()))
                .forEach(c -> {
                    c.setActive(false);
                    c.setUpdatedAt(at);
                });
    }

    @Override
    public synchronized void purgeInactive(String personName) {
        credentials.values().removeIf(c -> !c.isActive() && personName.equals(c.getPersonName()));
    }

    @Override
    public Optional<Person> findPerson(String personName) {
        return Optional.ofNullable(persons.get(personName)).map(p -> p.toBuilder().build());
    }

    @Override
    public List<Person> listPersons() {
        return persons.values().stream()
                .sorted(Comparator.comparing(Person::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder())))
                .map(p -> p.toBuilder().build())
                .toList();
    }

    @Override
    public Person savePerson(Person person) {
        Person stored = person.toBuilder().build();
        if (stored.getId() == null) {
            stored.setId(UUID.randomUUID().toString());
        }
        persons.put(stored.getPersonName(), stored);
        return stored.toBuilder().build();
    }

    private Optional<Credential> activeRefreshRow(String personName) {
        return credentials.values().stream()
                .filter(c -> c.isActive() && c.getKind() == CredentialKind.REFRESH && personName.equals(c.getPersonName()))
                .sorted(NEWEST_FIRST)
                .findFirst();
    }

    private static Credential copy(Credential c) {
        return c.toBuilder().build();
    }
}
