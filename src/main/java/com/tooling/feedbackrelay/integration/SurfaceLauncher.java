package com.tooling.feedbackrelay.integration;

/**
 * Opens something a human can answer in: a browser tab, a desktop window.
 */
public interface SurfaceLauncher {

    void open(String url);
}
