package com.tooling.feedbackrelay.utils;

import org.apache.commons.lang3.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;

public final class RelayUtils {

    private static final int PREVIEW_LENGTH = 50;

    private RelayUtils() {
    }

    /**
     * Shortens agent summaries and feedback text for log lines.
     */
    public static String preview(String text) {
        if (StringUtils.isEmpty(text)) {
            return "";
        }
        String singleLine = StringUtils.normalizeSpace(text);
        if (singleLine.length() <= PREVIEW_LENGTH) {
            return singleLine;
        }
        return singleLine.substring(0, PREVIEW_LENGTH - 3) + "...";
    }

    public static Instant startOfToday(Clock clock) {
        return LocalDate.now(clock).atStartOfDay(clock.getZone()).toInstant();
    }

    public static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
