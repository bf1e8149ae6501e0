package com.portfolio.mirror.test.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.portfolio.mirror.common.exception.SymbolNotFoundException;
import com.portfolio.mirror.model.documents.SymbolInfo;
import com.portfolio.mirror.repo.documents.SymbolInfoRepo;
import com.portfolio.mirror.service.gateway.BrokerageGatewayClient;
import com.portfolio.mirror.service.market.SymbolService;
import com.portfolio.mirror.service.person.PersonService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SymbolServiceTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Mock
    private SymbolInfoRepo repo;
    @Mock
    private BrokerageGatewayClient gateway;
    @Mock
    private PersonService persons;

    private SymbolService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-03-01T15:00:00Z"), ZoneOffset.UTC);
        service = new SymbolService(repo, gateway, persons, clock);
    }

    @Test
    void knownSymbolIsServedLocally() {
        SymbolInfo aapl = SymbolInfo.builder().symbol("AAPL").symbolId(8049L).build();
        when(repo.findBySymbol("AAPL")).thenReturn(Optional.of(aapl));

        assertThat(service.resolve(" aapl ")).isSameAs(aapl);
        verifyNoInteractions(gateway);
    }

    @Test
    void unknownSymbolIsSearchedUpstreamAndExactMatchPersisted() throws Exception {
        when(repo.findBySymbol("AAPL")).thenReturn(Optional.empty());
        when(persons.findAvailablePerson()).thenReturn("alice");
        when(gateway.searchSymbols("alice", "AAPL")).thenReturn(List.of(
                node("{\"symbol\":\"AAPL.TO\",\"symbolId\":1}"),
                node("{\"symbol\":\"AAPL\",\"symbolId\":8049,\"description\":\"APPLE INC\",\"securityType\":\"Stock\","
                        + "\"listingExchange\":\"NASDAQ\",\"currency\":\"USD\",\"isTradable\":true,\"isQuotable\":true}")));
        when(repo.save(any(SymbolInfo.class))).thenAnswer(inv -> inv.getArgument(0));

        SymbolInfo resolved = service.resolve("AAPL");

        assertThat(resolved.getSymbolId()).isEqualTo(8049L);
        ArgumentCaptor<SymbolInfo> saved = ArgumentCaptor.forClass(SymbolInfo.class);
        verify(repo).save(saved.capture());
        assertThat(saved.getValue().getExchange()).isEqualTo("NASDAQ");
        assertThat(saved.getValue().getCurrency()).isEqualTo("USD");
        assertThat(saved.getValue().getUpdatedAt()).isEqualTo(Instant.parse("2024-03-01T15:00:00Z"));
    }

    @Test
    void noExactMatchFailsWithSymbolNotFound() throws Exception {
        when(repo.findBySymbol("XYZ")).thenReturn(Optional.empty());
        when(persons.findAvailablePerson()).thenReturn("alice");
        when(gateway.searchSymbols("alice", "XYZ")).thenReturn(List.of(node("{\"symbol\":\"XYZW\",\"symbolId\":5}")));

        assertThatThrownBy(() -> service.resolve("XYZ")).isInstanceOf(SymbolNotFoundException.class);
    }

    @Test
    void searchPrefersLocalMatches() {
        SymbolInfo shop = SymbolInfo.builder().symbol("SHOP").symbolId(3L).build();
        when(repo.findBySymbolStartingWithOrderBySymbolAsc(eq("SH"), any(Pageable.class))).thenReturn(List.of(shop));

        assertThat(service.search("sh", 5)).containsExactly(shop);
        verifyNoInteractions(gateway);
    }

    private static JsonNode node(String json) throws Exception {
        return MAPPER.readTree(json);
    }
}
