package com.classsched.classsched_api.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A (weekday, period) pair as sent by clients. Weekday 0 is Monday.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SlotInput {
    private int weekday;
    private int period;
}
