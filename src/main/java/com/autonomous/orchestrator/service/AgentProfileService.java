package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.config.OrchestratorProperties;
import com.autonomous.orchestrator.model.AgentProfile;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.File;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Loads agent profiles, one YAML file per agent, from the configured directory.
 */
@Slf4j
@Service
public class AgentProfileService {

    private final ObjectMapper yamlMapper;
    private final Map<String, AgentProfile> profiles = new LinkedHashMap<>();
    private String profilePath;

    public AgentProfileService(OrchestratorProperties properties) {
        this.profilePath = properties.getAgents().getProfilePath();
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.yamlMapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
    }

    public void setProfilePath(String path) {
        this.profilePath = path;
    }

    @PostConstruct
    public synchronized void loadProfiles() {
        profiles.clear();
        File profileDir = new File(profilePath);

        if (!profileDir.exists() || !profileDir.isDirectory()) {
            log.info("Agent profile directory not found: {}", profilePath);
            return;
        }

        File[] yamlFiles = profileDir.listFiles((dir, name) -> name.endsWith(".yaml") || name.endsWith(".yml"));
        if (yamlFiles == null) {
            return;
        }
        Arrays.sort(yamlFiles, Comparator.comparing(File::getName));

        for (File file : yamlFiles) {
            try {
                AgentProfile profile = yamlMapper.readValue(file, AgentProfile.class);
                if (profile.getName() == null || profile.getName().isBlank()) {
                    log.warn("Skipping agent profile without a name: {}", file.getName());
                    continue;
                }
                profiles.put(profile.getName(), profile);
                log.info("Loaded agent profile: {}", profile.getName());
            } catch (Exception e) {
                log.error("Failed to load agent profile from {}: {}", file.getName(), e.getMessage());
            }
        }
    }

    public synchronized Optional<AgentProfile> getProfile(String name) {
        return Optional.ofNullable(profiles.get(name));
    }

    public synchronized List<AgentProfile> getAllProfiles() {
        return List.copyOf(profiles.values());
    }
}
