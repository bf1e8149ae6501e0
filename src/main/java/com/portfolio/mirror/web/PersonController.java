package com.portfolio.mirror.web;

import com.portfolio.mirror.common.Result;
import com.portfolio.mirror.common.exception.Http;
import com.portfolio.mirror.service.person.PersonService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/persons")
@RequiredArgsConstructor
public class PersonController {

    private final PersonService persons;

    @GetMapping
    public ResponseEntity<?> list() {
        return Http.from(Result.ok(persons.list()));
    }

    @GetMapping("/{personName}")
    public ResponseEntity<?> get(@PathVariable("personName") String personName) {
        return Http.from(Result.ok(persons.get(personName)));
    }

    @DeleteMapping("/{personName}")
    public ResponseEntity<?> delete(@PathVariable("personName") String personName) {
        persons.delete(personName);
        return Http.from(Result.ok());
    }
}
