package com.classsched.classsched_api.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Explicit pairing of two offerings that must be scheduled together.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class JointInput {
    private String courseA;
    private String groupA;
    private String courseB;
    private String groupB;
}
