package com.prospect.linkedin.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfileEducation {
    private String school;
    private String degree;
    private String field;
    private String startYear;
    private String endYear;
}
