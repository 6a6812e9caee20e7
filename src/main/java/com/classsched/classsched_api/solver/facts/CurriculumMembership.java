package com.classsched.classsched_api.solver.facts;

import lombok.Value;

@Value
public class CurriculumMembership {
    String curriculumId;
    String courseId;
    boolean required;
}
