package com.classsched.classsched_api.model;

import java.util.ArrayList;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The whole fact set of one scheduling problem, as produced by the ingestion
 * side. Transient, never persisted.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TimetableInput {
    private List<CourseInput> courses = new ArrayList<>();
    private List<TeacherInput> teachers = new ArrayList<>();
    private List<WorkloadInput> workload = new ArrayList<>();
    private List<CurriculumInput> curricula = new ArrayList<>();
    private List<JointInput> joints = new ArrayList<>();
}
