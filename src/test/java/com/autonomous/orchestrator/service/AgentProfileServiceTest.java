package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.config.OrchestratorProperties;
import com.autonomous.orchestrator.model.AgentProfile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.FileWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class AgentProfileServiceTest {

    private AgentProfileService profileService;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        profileService = new AgentProfileService(new OrchestratorProperties());
        profileService.setProfilePath(tempDir.toString());
    }

    @Test
    void shouldLoadProfileFromYaml() throws Exception {
        write("research.yaml",
            "name: research_agent_1\n"
                + "description: Finds and summarizes sources\n"
                + "capabilities:\n"
                + "  - web_search\n"
                + "  - report_generation\n"
                + "max_concurrent_tasks: 2\n");

        profileService.loadProfiles();
        Optional<AgentProfile> profile = profileService.getProfile("research_agent_1");

        assertTrue(profile.isPresent());
        assertEquals(List.of("web_search", "report_generation"), profile.get().getCapabilities());
        assertEquals(2, profile.get().getMaxConcurrentTasks());
        assertEquals("simulated", profile.get().getHandler());
    }

    @Test
    void shouldApplyDefaults() throws Exception {
        write("minimal.yml", "name: minimal\n");

        profileService.loadProfiles();
        AgentProfile profile = profileService.getProfile("minimal").orElseThrow();

        assertEquals(1, profile.getMaxConcurrentTasks());
        assertTrue(profile.getCapabilities().isEmpty());
    }

    @Test
    void shouldSkipBrokenAndNamelessProfiles() throws Exception {
        write("a-valid.yaml", "name: valid\n");
        write("b-broken.yaml", "name: [unclosed\n");
        write("c-nameless.yaml", "description: nobody\n");
        write("notes.txt", "name: ignored\n");

        profileService.loadProfiles();

        assertEquals(1, profileService.getAllProfiles().size());
        assertTrue(profileService.getProfile("valid").isPresent());
        assertTrue(profileService.getProfile("ignored").isEmpty());
    }

    @Test
    void shouldReturnNothingForMissingDirectory() {
        profileService.setProfilePath(tempDir.resolve("absent").toString());

        profileService.loadProfiles();

        assertTrue(profileService.getAllProfiles().isEmpty());
    }

    @Test
    void shouldReplaceProfilesOnReload() throws Exception {
        write("first.yaml", "name: first\n");
        profileService.loadProfiles();
        assertTrue(tempDir.resolve("first.yaml").toFile().delete());
        write("second.yaml", "name: second\n");

        profileService.loadProfiles();

        assertTrue(profileService.getProfile("first").isEmpty());
        assertTrue(profileService.getProfile("second").isPresent());
    }

    private void write(String fileName, String content) throws Exception {
        File file = tempDir.resolve(fileName).toFile();
        try (FileWriter writer = new FileWriter(file)) {
            writer.write(content);
        }
    }
}
