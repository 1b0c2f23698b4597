package com.redditads.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
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
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Command line entry: {@code --discover} prints the catalog, otherwise syncs with
 * {@code --config <file>} and optional {@code --state <file>} and {@code --catalog <file>}.
 * Each option also accepts the {@code --option=<file>} form.
 */
@Component
@Slf4j
public class ExtractorRunner implements ApplicationRunner {

    static final String DISCOVER = "discover";
    static final String CONFIG = "config";
    static final String STATE = "state";
    static final String CATALOG = "catalog";

    private final CatalogDiscovery catalogDiscovery;
    private final CatalogLoader catalogLoader;
    private final TapConfigLoader configLoader;
    private final StateReader stateReader;
    private final SyncOrchestrator orchestrator;
    private final ObjectMapper objectMapper;
    private final PrintStream messageOutput;

    public ExtractorRunner(CatalogDiscovery catalogDiscovery, CatalogLoader catalogLoader, TapConfigLoader configLoader,
                           StateReader stateReader, SyncOrchestrator orchestrator, ObjectMapper objectMapper,
                           PrintStream messageOutput) {
        this.catalogDiscovery = catalogDiscovery;
        this.catalogLoader = catalogLoader;
        this.configLoader = configLoader;
        this.stateReader = stateReader;
        this.orchestrator = orchestrator;
        this.objectMapper = objectMapper;
        this.messageOutput = messageOutput;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (args.containsOption(DISCOVER)) {
            printCatalog(catalogDiscovery.discover());
            return;
        }
        Path configPath = optionalPath(args, CONFIG);
        if (configPath == null) {
            throw new IllegalArgumentException("--config <file> is required unless --discover is given");
        }
        TapConfig config = configLoader.load(configPath);
        SyncState state = stateReader.read(optionalPath(args, STATE));
        List<CatalogEntry> selected = catalogLoader.selectedStreams(optionalPath(args, CATALOG));

        List<StreamSyncSummary> summaries = orchestrator.sync(config, state, selected);
        long records = summaries.stream().mapToLong(StreamSyncSummary::recordsEmitted).sum();
        log.info("Sync finished: {} streams, {} records", summaries.size(), records);
    }

    private void printCatalog(Catalog catalog) {
        try {
            messageOutput.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(catalog));
            messageOutput.flush();
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Could not serialize catalog", e);
        }
    }

    /**
     * Value of {@code --option=<file>} or of the {@code --option <file>} form Singer runners use.
     */
    static Path optionalPath(ApplicationArguments args, String option) {
        List<String> values = args.getOptionValues(option);
        if (values != null && !values.isEmpty() && !values.get(0).isBlank()) {
            return Path.of(values.get(0));
        }
        String[] source = args.getSourceArgs();
        for (int i = 0; i < source.length - 1; i++) {
            if (source[i].equals("--" + option) && !source[i + 1].startsWith("--")) {
                return Path.of(source[i + 1]);
            }
        }
        return null;
    }
}
