package com.contextfusion.engine.provider;

import com.contextfusion.common.model.WindowInfo;

import java.util.List;

/**
 * Port listing the source application's open windows.
 */
public interface WindowEnumerator {

    /**
     * @return the source application's windows; never {@code null}
     */
    List<WindowInfo> currentWindows();
}
