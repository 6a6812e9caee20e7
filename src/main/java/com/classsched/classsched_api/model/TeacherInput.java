package com.classsched.classsched_api.model;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TeacherInput {
    // Plain id or e-mail address; only the part before '@' is kept
    private String teacherId;
    // null means available in every slot
    private List<SlotInput> available;
    private List<SlotInput> preferred;
}
