package com.portfolio.mirror.repo.documents;

import com.portfolio.mirror.model.documents.Person;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PersonRepo extends MongoRepository<Person, String> {

    Optional<Person> findByPersonName(String personName);

    List<Person> findAllByOrderByCreatedAtAsc();
}
