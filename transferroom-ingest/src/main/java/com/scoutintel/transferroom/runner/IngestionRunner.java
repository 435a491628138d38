package com.scoutintel.transferroom.runner;

import com.scoutintel.transferroom.config.TransferRoomProperties;
import com.scoutintel.transferroom.output.SchemaInitializer;
import com.scoutintel.transferroom.service.IngestionPipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Runs one sync on startup: schema first, then competitions, then players.
 *
 * Competitions go first so players can resolve their competition_id. A failure is
 * rethrown after its run has been recorded, which makes the process exit non-zero.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class IngestionRunner implements ApplicationRunner {

    private final IngestionPipeline pipeline;
    private final SchemaInitializer schemaInitializer;
    private final TransferRoomProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        RunOptions options = RunOptions.from(args, properties.getRun());

        log.info("==========================================");
        log.info("TransferRoom ingest starting");
        log.info("  competitions: {}, players: {}, player ceiling: {}",
                options.competitions(), options.players(),
                options.maxPlayers() == null ? "none" : options.maxPlayers());
        log.info("==========================================");

        if (properties.getSchema().isInitialize()) {
            schemaInitializer.ensureSchema();
        }

        if (options.competitions()) {
            pipeline.ingestCompetitions();
        }
        if (options.players()) {
            pipeline.ingestPlayers(options.maxPlayers());
        }

        log.info("TransferRoom ingest finished");
    }
}
