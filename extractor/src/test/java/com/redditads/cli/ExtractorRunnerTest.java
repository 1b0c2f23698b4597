package com.redditads.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.redditads.catalog.Catalog;
import com.redditads.catalog.CatalogDiscovery;
import com.redditads.catalog.CatalogEntry;
import com.redditads.catalog.CatalogLoader;
import com.redditads.config.TapConfig;
import com.redditads.config.TapConfigLoader;
import com.redditads.domain.SyncState;
import com.redditads.ingestion.sync.StreamSyncSummary;
import com.redditads.ingestion.sync.SyncOrchestrator;
import com.redditads.state.StateReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExtractorRunnerTest {

    @Mock private CatalogDiscovery catalogDiscovery;
    @Mock private CatalogLoader catalogLoader;
    @Mock private TapConfigLoader configLoader;
    @Mock private StateReader stateReader;
    @Mock private SyncOrchestrator orchestrator;

    private final ObjectMapper mapper = new ObjectMapper();
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private ExtractorRunner runner;

    @BeforeEach
    void setUp() {
        runner = new ExtractorRunner(catalogDiscovery, catalogLoader, configLoader, stateReader, orchestrator,
                mapper, new PrintStream(out, true, StandardCharsets.UTF_8));
    }

    @Test
    void discoverPrintsCatalogAndSyncsNothing() throws Exception {
        when(catalogDiscovery.discover()).thenReturn(new Catalog(List.of(
                new CatalogEntry("campaigns", "campaigns", mapper.createObjectNode(), List.of("id"), List.of()))));

        runner.run(new DefaultApplicationArguments("--discover"));

        JsonNode printed = mapper.readTree(out.toString(StandardCharsets.UTF_8));
        assertThat(printed.path("streams").get(0).path("tap_stream_id").asText()).isEqualTo("campaigns");
        verifyNoInteractions(configLoader, orchestrator);
    }

    @Test
    void syncWiresConfigStateAndCatalog() {
        TapConfig config = new TapConfig();
        SyncState state = SyncState.empty();
        List<CatalogEntry> selected = List.of();
        when(configLoader.load(Path.of("config.json"))).thenReturn(config);
        when(stateReader.read(Path.of("state.json"))).thenReturn(state);
        when(catalogLoader.selectedStreams(Path.of("catalog.json"))).thenReturn(selected);
        when(orchestrator.sync(config, state, selected))
                .thenReturn(List.of(new StreamSyncSummary("campaigns", 5, 1, null)));

        runner.run(new DefaultApplicationArguments(
                "--config=config.json", "--state=state.json", "--catalog=catalog.json"));

        verify(orchestrator).sync(config, state, selected);
        assertThat(out.size()).isZero();
    }

    @Test
    void acceptsSpaceSeparatedOptionValues() {
        TapConfig config = new TapConfig();
        SyncState state = SyncState.empty();
        when(configLoader.load(Path.of("config.json"))).thenReturn(config);
        when(stateReader.read(Path.of("state.json"))).thenReturn(state);
        when(catalogLoader.selectedStreams(Path.of("catalog.json"))).thenReturn(List.of());
        when(orchestrator.sync(config, state, List.of())).thenReturn(List.of());

        runner.run(new DefaultApplicationArguments(
                "--config", "config.json", "--state", "state.json", "--catalog", "catalog.json"));

        verify(orchestrator).sync(config, state, List.of());
    }

    @Test
    void optionFollowedByAnotherOptionHasNoValue() {
        DefaultApplicationArguments args = new DefaultApplicationArguments("--state", "--config=config.json");

        assertThat(ExtractorRunner.optionalPath(args, ExtractorRunner.STATE)).isNull();
        assertThat(ExtractorRunner.optionalPath(args, ExtractorRunner.CONFIG)).isEqualTo(Path.of("config.json"));
    }

    @Test
    void stateAndCatalogAreOptional() {
        TapConfig config = new TapConfig();
        when(configLoader.load(Path.of("config.json"))).thenReturn(config);
        when(stateReader.read(isNull())).thenReturn(SyncState.empty());
        when(catalogLoader.selectedStreams(isNull())).thenReturn(List.of());
        when(orchestrator.sync(any(), any(), any())).thenReturn(List.of());

        runner.run(new DefaultApplicationArguments("--config=config.json"));

        verify(stateReader).read(null);
        verify(catalogLoader).selectedStreams(null);
    }

    @Test
    void missingConfigIsRejected() {
        assertThatThrownBy(() -> runner.run(new DefaultApplicationArguments("--state=state.json")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("--config");
        verifyNoInteractions(orchestrator, stateReader);
    }
}
