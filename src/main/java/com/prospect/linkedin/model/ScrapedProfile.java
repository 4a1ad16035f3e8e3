package com.prospect.linkedin.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScrapedProfile {
    private String name;
    private String title;
    private String company;
    private String location;
    private String bio;
    @Builder.Default
    private List<ProfileExperience> experience = new ArrayList<>();
    @Builder.Default
    private List<ProfileEducation> education = new ArrayList<>();
    @Builder.Default
    private List<ProfileCertification> certifications = new ArrayList<>();
    private String profileUrl;
    private String platform;
    private Instant scrapedAt;
    private List<String> missingFields;
    private boolean needsManualReview;
}
