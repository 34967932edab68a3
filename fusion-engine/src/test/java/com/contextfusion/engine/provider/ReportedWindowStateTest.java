package com.contextfusion.engine.provider;

import com.contextfusion.common.model.WindowInfo;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReportedWindowStateTest {

    private final ReportedWindowState state = new ReportedWindowState("Telegram");

    @Test
    @DisplayName("only source-application windows are enumerated")
    void filtersOtherApplications() {
        state.update("Books – Telegram", "Telegram", List.of(
            new WindowInfo("1", "Books – Telegram", "Telegram", true),
            new WindowInfo("2", "Docs - Chrome", "chrome", false)));

        assertEquals(List.of("1"), state.currentWindows().stream().map(WindowInfo::id).toList());
        assertEquals("Books – Telegram", state.activeTitle());
        assertEquals("Telegram", state.activeProcessName());
    }

    @Test
    @DisplayName("null list entries are dropped instead of failing the update")
    void nullEntries() {
        WindowInfo books = new WindowInfo("1", "Books – Telegram", "Telegram", false);

        state.update(null, null, Arrays.asList(null, books, null));

        assertEquals(List.of(books), state.currentWindows());
    }

    @Test
    @DisplayName("a missing list clears the enumerated windows")
    void nullList() {
        state.update(null, null, List.of(new WindowInfo("1", "Books – Telegram", "Telegram", false)));
        state.update(null, null, null);

        assertTrue(state.currentWindows().isEmpty());
    }
}
