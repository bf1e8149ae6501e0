package com.portfolio.mirror.config;

import com.portfolio.mirror.repo.documents.CredentialRepo;
import com.portfolio.mirror.repo.documents.PersonRepo;
import com.portfolio.mirror.service.credential.CredentialStore;
import com.portfolio.mirror.service.credential.InMemoryCredentialStore;
import com.portfolio.mirror.service.credential.MongoCredentialStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

@Configuration
public class CredentialStoreConfig {

    @Bean
    @ConditionalOnProperty(name = "portfolio.credentials.store", havingValue = "mongo", matchIfMissing = true)
    public CredentialStore mongoCredentialStore(CredentialRepo credentialRepo, PersonRepo personRepo, MongoTemplate mongo) {
        return new MongoCredentialStore(credentialRepo, personRepo, mongo);
    }

    @Bean
    @ConditionalOnProperty(name = "portfolio.credentials.store", havingValue = "memory")
    public CredentialStore inMemoryCredentialStore() {
        return new InMemoryCredentialStore();
    }
}
