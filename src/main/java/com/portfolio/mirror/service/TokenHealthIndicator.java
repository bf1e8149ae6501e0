package com.portfolio.mirror.service;

import com.portfolio.mirror.model.documents.Person;
import com.portfolio.mirror.service.credential.CredentialStore;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class TokenHealthIndicator implements HealthIndicator {

    private final CredentialStore store;

    @Override
    public Health health() {
        try {
            List<Person> persons = store.listPersons();
            Map<String, Boolean> validTokens = new LinkedHashMap<>();
            for (Person p : persons) {
                if (p.isActive()) {
                    validTokens.put(p.getPersonName(), p.isHasValidToken());
                }
            }
            return Health.up()
                    .withDetail("persons", validTokens.size())
                    .withDetail("has_valid_token", validTokens)
                    .build();
        } catch (Exception e) {
            return Health.down()
                    .withDetail("status", "Credential store not accessible")
                    .withDetail("error", e.getMessage())
                    .build();
        }
    }
}
