package com.talentscope.search.embed;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.talentscope.search.resilience.SearchResilienceProperties;
import com.talentscope.search.resilience.SearchResilienceRegistry;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class EmbeddingServiceTest {
    @Mock
    private EmbeddingGateway gateway;

    @Test
    void localModeIsDeterministicAndUnitLength() {
        EmbeddingProperties properties = properties(EmbeddingMode.LOCAL);
        EmbeddingService service = service(properties);

        List<Double> first = service.embed("platform engineer", 100);
        List<Double> again = new LocalHashEmbedder(properties).embed("platform engineer");

        assertEquals(8, first.size());
        assertEquals(again, first);
        double norm = Math.sqrt(first.stream().mapToDouble(value -> value * value).sum());
        assertEquals(1.0, norm, 1e-9);
        verifyNoInteractions(gateway);
    }

    @Test
    void collapsedWhitespaceHitsTheCache() {
        when(gateway.embed(eq("kafka streaming engineer"), any())).thenReturn(List.of(0.5, 0.5));
        EmbeddingService service = service(properties(EmbeddingMode.HTTP));

        service.embed("kafka   streaming\nengineer", 1000);
        List<Double> cached = service.embed(" kafka streaming engineer ", 1000);

        assertEquals(List.of(0.5, 0.5), cached);
        verify(gateway, times(1)).embed(any(), any());
    }

    @Test
    void repeatedGatewayFailuresOpenTheBreaker() {
        when(gateway.embed(any(), any())).thenThrow(new EmbeddingUnavailableException("embed_http_503"));
        EmbeddingService service = service(properties(EmbeddingMode.HTTP));

        for (int i = 0; i < 5; i++) {
            assertThatThrownBy(() -> service.embed("ml engineer", 1000)).hasMessage("embed_http_503");
        }
        assertThatThrownBy(() -> service.embed("ml engineer", 1000)).hasMessage("embed_circuit_open");
        verify(gateway, times(5)).embed(any(), any());
    }

    @Test
    void blankTextIsRejected() {
        EmbeddingService service = service(properties(EmbeddingMode.HTTP));

        assertThatThrownBy(() -> service.embed(" \n ", 1000))
            .isInstanceOf(EmbeddingUnavailableException.class)
            .hasMessage("embed_empty_text");
    }

    private EmbeddingService service(EmbeddingProperties properties) {
        return new EmbeddingService(
            properties,
            gateway,
            new LocalHashEmbedder(properties),
            new EmbeddingCacheService(properties),
            new SearchResilienceRegistry(new SearchResilienceProperties())
        );
    }

    private static EmbeddingProperties properties(EmbeddingMode mode) {
        EmbeddingProperties properties = new EmbeddingProperties();
        properties.setMode(mode);
        properties.setDimensions(8);
        return properties;
    }
}
