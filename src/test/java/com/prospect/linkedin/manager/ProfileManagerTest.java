package com.prospect.linkedin.manager;

import com.prospect.linkedin.exception.ConfigurationException;
import com.prospect.linkedin.model.profile.UserAgentProfile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProfileManagerTest {

    private ProfileManager profileManager;

    @BeforeEach
    void setUp() {
        profileManager = new ProfileManager(new Random(3));
        profileManager.init();
    }

    @Test
    void loadsEveryPreset() {
        assertThat(profileManager.getProfiles())
                .extracting(UserAgentProfile::getId)
                .containsExactlyInAnyOrder("win-chrome-1080", "mac-chrome-1440", "mac13-chrome-1536",
                        "win-edge-1366", "win-chrome-1440p");
    }

    @Test
    void presetsAreComplete() {
        assertThat(profileManager.getProfiles()).allSatisfy(p -> {
            assertThat(p.getUserAgent()).startsWith("Mozilla/5.0");
            assertThat(p.getViewport().getWidth()).isGreaterThanOrEqualTo(1280);
            assertThat(p.getLocale()).isEqualTo("en-US");
            assertThat(p.getTimeZone()).isNotBlank();
            assertThat(p.getLanguages()).isNotEmpty();
            assertThat(p.getPlugins()).isNotEmpty();
        });
    }

    @Test
    void randomDrawsCoverSeveralPresets() {
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            seen.add(profileManager.randomProfile().getId());
        }
        assertThat(seen).hasSizeGreaterThan(1);
    }

    @Test
    void drawingBeforeLoadingFails() {
        assertThatThrownBy(() -> new ProfileManager().randomProfile())
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void presetListIsReadOnly() {
        assertThatThrownBy(() -> profileManager.getProfiles().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
