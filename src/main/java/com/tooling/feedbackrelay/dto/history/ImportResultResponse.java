package com.tooling.feedbackrelay.dto.history;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ImportResultResponse {
    private int imported;
    private int totalSessions;
}
