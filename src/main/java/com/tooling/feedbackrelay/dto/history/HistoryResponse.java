package com.tooling.feedbackrelay.dto.history;

import com.tooling.feedbackrelay.model.history.HistoryEntry;
import com.tooling.feedbackrelay.model.history.HistoryStats;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class HistoryResponse {
    private List<HistoryEntry> sessions; // newest first
    private HistoryStats stats;
    private String privacyLevel;
}
