package com.classsched.classsched_api.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CourseInput {
    private String courseId;
    private int numClasses;
    private int idealSemester;
    private boolean undergrad;
    // Classes must take two consecutive periods of one day
    private boolean doubleClass;
}
