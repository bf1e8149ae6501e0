package com.portfolio.mirror.service.person;

import com.portfolio.mirror.common.exception.EntityNotFoundException;
import com.portfolio.mirror.common.exception.NoRefreshTokenException;
import com.portfolio.mirror.config.BrokerageConfig;
import com.portfolio.mirror.model.documents.Person;
import com.portfolio.mirror.service.credential.CredentialStore;
import com.portfolio.mirror.service.token.TokenLifecycleManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read side of the person registry plus the choice of whose credentials serve market-data calls.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PersonService {

    private final CredentialStore store;
    private final TokenLifecycleManager tokenManager;
    private final BrokerageConfig config;

    public List<Person> list() {
        return store.listPersons();
    }

    public Person get(String personName) {
        return store.findPerson(personName)
                .orElseThrow(() -> new EntityNotFoundException("Person", personName));
    }

    public void delete(String personName) {
        get(personName);
        tokenManager.deletePersonTokens(personName);
    }

    /**
     * The configured market-data person, else the first active person with a valid token.
     */
    public String findAvailablePerson() {
        String configured = config.getMarketDataPerson();
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        return store.listPersons().stream()
                .filter(p -> p.isActive() && p.isHasValidToken())
                .map(Person::getPersonName)
                .findFirst()
                .orElseThrow(() -> new NoRefreshTokenException("any active person"));
    }
}
