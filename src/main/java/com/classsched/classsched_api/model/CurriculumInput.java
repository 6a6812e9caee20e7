package com.classsched.classsched_api.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CurriculumInput {
    private String curriculumId;
    private String courseId;
    private boolean required;
}
