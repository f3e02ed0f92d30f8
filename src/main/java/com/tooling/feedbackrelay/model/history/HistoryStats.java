package com.tooling.feedbackrelay.model.history;

import lombok.Value;

@Value
public class HistoryStats {
    int todayCount;
    long averageDurationMillis;
    int totalSessions;
}
