package com.prospect.linkedin.model.profile;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Desktop browser fingerprint applied to a fresh context: UA, viewport, locale, hardware and headers.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class UserAgentProfile {
    private String id;
    private String userAgent;
    private Viewport viewport;
    private String platform;
    private String locale;
    private String timeZone;
    private List<String> languages;
    private Integer hardwareConcurrency;
    private Integer deviceMemory;
    private String webglVendor;
    private String webglRenderer;
    private List<Plugin> plugins;
    private Map<String, String> headers;

    public Map<String, String> headersOrEmpty() {
        return headers != null ? headers : new HashMap<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Viewport {
        private Integer width;
        private Integer height;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Plugin {
        private String name;
        private String filename;
        private String description;
    }
}
