package com.tooling.feedbackrelay.integration;

import lombok.extern.slf4j.Slf4j;

/**
 * Used when no desktop shell is wired in: tells whoever reads the log where to go.
 */
@Slf4j
public class LoggingSurfaceLauncher implements SurfaceLauncher {

    @Override
    public void open(String url) {
        log.info("Feedback requested, open {} to respond", url);
    }
}
