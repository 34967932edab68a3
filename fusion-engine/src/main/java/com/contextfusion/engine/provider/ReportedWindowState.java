package com.contextfusion.engine.provider;

import com.contextfusion.common.model.WindowInfo;
import com.contextfusion.common.text.GroupNameExtractor;

import java.util.List;
import java.util.Objects;

/**
 * Holds the last window snapshot posted by the desktop agent and serves it through both
 * window ports. Only windows that belong to the source application are enumerated; null
 * entries in a posted list are dropped.
 */
public class ReportedWindowState implements ForegroundWindowProvider, WindowEnumerator {

    private record Snapshot(String foregroundTitle, String foregroundProcess, List<WindowInfo> windows) {}

    private final String applicationName;
    private volatile Snapshot snapshot = new Snapshot(null, null, List.of());

    public ReportedWindowState(String applicationName) {
        this.applicationName = applicationName;
    }

    public void update(String foregroundTitle, String foregroundProcess, List<WindowInfo> windows) {
        List<WindowInfo> sourceWindows = windows == null ? List.of() : windows.stream()
            .filter(Objects::nonNull)
            .filter(w -> GroupNameExtractor.isSourceWindow(w.title(), w.processName(), applicationName))
            .toList();
        snapshot = new Snapshot(foregroundTitle, foregroundProcess, sourceWindows);
    }

    @Override
    public String activeTitle() {
        return snapshot.foregroundTitle();
    }

    @Override
    public String activeProcessName() {
        return snapshot.foregroundProcess();
    }

    @Override
    public List<WindowInfo> currentWindows() {
        return snapshot.windows();
    }
}
