package com.prospect.linkedin.manager;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.prospect.linkedin.exception.ConfigurationException;
import com.prospect.linkedin.model.profile.UserAgentProfile;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

@Component
@Slf4j
public class ProfileManager {

    static final String DEVICES_RESOURCE = "static/devices.json";

    private final List<UserAgentProfile> profiles = new ArrayList<>();
    private final Random random;

    public ProfileManager() {
        this(new Random());
    }

    ProfileManager(Random random) {
        this.random = random;
    }

    @PostConstruct
    void init() {
        try (InputStream inputStream = getClass().getClassLoader().getResourceAsStream(DEVICES_RESOURCE)) {
            if (inputStream == null) {
                throw new ConfigurationException(DEVICES_RESOURCE + " not found in classpath");
            }

            List<UserAgentProfile> deviceList = new ObjectMapper()
                    .readValue(inputStream, new TypeReference<List<UserAgentProfile>>() {});
            if (deviceList.isEmpty()) {
                throw new ConfigurationException(DEVICES_RESOURCE + " contains no fingerprint presets");
            }
            profiles.addAll(deviceList);

            log.info("Loaded {} fingerprint presets", deviceList.size());
        } catch (IOException e) {
            throw new ConfigurationException("Fingerprint preset initialization failed", e);
        }
    }

    /**
     * A uniformly random preset. Each scrape gets its own draw.
     */
    public UserAgentProfile randomProfile() {
        if (profiles.isEmpty()) {
            throw new ConfigurationException("No fingerprint presets loaded");
        }
        UserAgentProfile profile = profiles.get(random.nextInt(profiles.size()));
        log.debug("Selected fingerprint {} ({}x{})", profile.getId(),
                profile.getViewport().getWidth(), profile.getViewport().getHeight());
        return profile;
    }

    public List<UserAgentProfile> getProfiles() {
        return Collections.unmodifiableList(profiles);
    }
}
