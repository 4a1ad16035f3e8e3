package com.prospect.linkedin.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfileExperience {
    private String title;
    private String company;
    private String startDate;
    // "Present" for a current role
    private String endDate;
    private String duration;
    private String location;
    private String description;
}
