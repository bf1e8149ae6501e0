package com.portfolio.mirror.repo.documents;

import com.portfolio.mirror.model.documents.SymbolInfo;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface SymbolInfoRepo extends MongoRepository<SymbolInfo, String> {

    Optional<SymbolInfo> findBySymbol(String symbol);

    List<SymbolInfo> findBySymbolStartingWithOrderBySymbolAsc(String prefix, Pageable page);
}
