package com.classsched.classsched_api.model;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One course offering. Listing several courses makes them joint: they are
 * taught together and share every meeting slot.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class WorkloadInput {
    private List<String> courseIds;
    private List<String> teacherIds;
    private String offeringGroup;
    // Labels such as "morning", "afternoon", "night" or "integral"; empty means morning and afternoon
    private List<String> partsOfDay;
    private List<SlotInput> fixedSlots;
    private String courseName;
}
