package com.classsched.classsched_api.solver.facts;

import lombok.Value;

@Value
public class Course {
    String id;
    int numClasses;
    boolean doubleClass;
    boolean undergrad;
    // 0 when the course has no ideal semester
    int idealSemester;
}
