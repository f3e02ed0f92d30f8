package com.tooling.feedbackrelay.client;

public interface TransportFactory {

    SessionChangeNotifier push();

    SessionChangeNotifier poll();
}
