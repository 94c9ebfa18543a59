package com.example.llmexplorer.graph;

import com.example.llmexplorer.fingerprint.StateFingerprint;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 导航循环检测：最近 window 个目的地只落在很少几个界面上，且期间没发现新界面
 */
public class LoopDetector {

    private final int window;
    private final int maxDistinct;
    private final Deque<Arrival> arrivals = new ArrayDeque<>();

    public LoopDetector(int window, int maxDistinct) {
        if (window < 2) {
            throw new IllegalArgumentException("loop window must be >= 2");
        }
        this.window = window;
        this.maxDistinct = Math.max(1, maxDistinct);
    }

    public void record(StateFingerprint destination, boolean newNode) {
        arrivals.addLast(new Arrival(destination, newNode));
        while (arrivals.size() > window) {
            arrivals.removeFirst();
        }
    }

    public boolean isLooping() {
        if (arrivals.size() < window) {
            return false;
        }
        if (arrivals.stream().anyMatch(Arrival::newNode)) {
            return false;
        }
        return loopFingerprints().size() <= maxDistinct;
    }

    public Set<StateFingerprint> loopFingerprints() {
        Set<StateFingerprint> distinct = new LinkedHashSet<>();
        for (Arrival arrival : arrivals) {
            distinct.add(arrival.fingerprint());
        }
        return distinct;
    }

    public void reset() {
        arrivals.clear();
    }

    private static class Arrival {
        private final StateFingerprint fingerprint;
        private final boolean newNode;

        Arrival(StateFingerprint fingerprint, boolean newNode) {
            this.fingerprint = fingerprint;
            this.newNode = newNode;
        }

        StateFingerprint fingerprint() {
            return fingerprint;
        }

        boolean newNode() {
            return newNode;
        }
    }
}
