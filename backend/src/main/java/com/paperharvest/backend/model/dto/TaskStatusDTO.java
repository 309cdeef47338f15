package com.paperharvest.backend.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for background run status responses
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TaskStatusDTO {
    private String taskId;
    private String status; // RUNNING, CANCELLING, COMPLETED, FAILED
    private String phase;
    private String startedAt;
    private String completedAt;
    private String error;
    private Object summary;
}
