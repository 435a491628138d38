package com.scoutintel.transferroom.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scoutintel.transferroom.config.TransferRoomProperties;
import com.scoutintel.transferroom.exception.IngestionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Supplies the raw competition list for a competitions sync.
 *
 * By default this is a JSON array in a local seed file (a plain path, or a
 * {@code classpath:} location). With competitions-source=API it is fetched from
 * GET /competitions instead.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CompetitionSeedLoader {

    private final TransferRoomApiClient apiClient;
    private final ObjectMapper objectMapper;
    private final TransferRoomProperties properties;

    public List<JsonNode> load(TransferRoomSession session) {
        TransferRoomProperties.Ingest ingest = properties.getIngest();
        if (ingest.getCompetitionsSource() == TransferRoomProperties.Ingest.CompetitionsSource.API) {
            return apiClient.fetchCompetitions(session);
        }
        return loadFile(ingest.getCompetitionsFile());
    }

    List<JsonNode> loadFile(String location) {
        Resource resource = location.startsWith(ResourceLoader.CLASSPATH_URL_PREFIX)
                ? new ClassPathResource(location.substring(ResourceLoader.CLASSPATH_URL_PREFIX.length()))
                : new FileSystemResource(location);

        log.info("Loading competitions from {}", location);
        JsonNode root;
        try (InputStream in = resource.getInputStream()) {
            root = objectMapper.readTree(in);
        } catch (IOException e) {
            throw new IngestionException("Could not read competitions file " + location, e);
        }
        if (root == null || !root.isArray()) {
            throw new IngestionException("Competitions file " + location + " does not contain a JSON array");
        }

        List<JsonNode> competitions = new ArrayList<>(root.size());
        root.forEach(competitions::add);
        log.info("Loaded {} competitions", competitions.size());
        return competitions;
    }
}
