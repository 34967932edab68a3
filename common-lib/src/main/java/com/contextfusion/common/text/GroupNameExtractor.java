package com.contextfusion.common.text;

import com.contextfusion.common.model.ContextSignal;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Pure text function mapping a raw source-application window title to a group name.
 *
 * <h3>Steps (in order)</h3>
 * <ol>
 *   <li>Strip a leading unread-count marker: {@code "(12) Name"} → {@code "Name"}.</li>
 *   <li>Strip a trailing message-count marker: {@code "Name – (3082)"} → {@code "Name"}.</li>
 *   <li>Strip any remaining trailing count: {@code "Name (5)"} → {@code "Name"}.</li>
 *   <li>Strip a trailing application suffix: {@code "Name – Telegram"} → {@code "Name"}.</li>
 *   <li>Drop decoration: everything outside Arabic script blocks, ASCII letters and digits,
 *       whitespace, {@code - _ .}</li>
 *   <li>Collapse whitespace and trim spaces, hyphens, underscores and dots at both ends.</li>
 * </ol>
 * Returns {@link ContextSignal#UNSORTED} when nothing remains or the remainder is the bare
 * application name.
 *
 * <p>Shared by the foreground signal and the background window tracker so both produce
 * identical names for the same title. Stateless and thread-safe.
 */
public final class GroupNameExtractor {

    public static final String DEFAULT_APPLICATION = "Telegram";

    private static final String DASHES = "[\\u2013\\u2014-]";

    private static final Pattern UNREAD_PREFIX       = Pattern.compile("^\\(\\d+\\)\\s*");
    private static final Pattern MESSAGE_COUNT       = Pattern.compile("\\s*" + DASHES + "\\s*\\(\\d+\\)$");
    private static final Pattern TRAILING_COUNT      = Pattern.compile("\\s*\\(\\d+\\)$");
    private static final Pattern DECORATION          = Pattern.compile(
        "[^\\u0600-\\u06FF\\u0750-\\u077F\\uFB50-\\uFDFF\\uFE70-\\uFEFFa-zA-Z0-9\\s\\-_.]+");
    private static final Pattern WHITESPACE          = Pattern.compile("\\s+");
    private static final Pattern EDGE_PUNCTUATION    = Pattern.compile("^[ \\-_.]+|[ \\-_.]+$");

    private static final Map<String, Pattern> APPLICATION_SUFFIXES = new ConcurrentHashMap<>();

    private GroupNameExtractor() {}

    public static String extract(String windowTitle) {
        return extract(windowTitle, DEFAULT_APPLICATION);
    }

    public static String extract(String windowTitle, String applicationName) {
        if (windowTitle == null || windowTitle.isBlank()) {
            return ContextSignal.UNSORTED;
        }

        String title = windowTitle.trim();
        title = UNREAD_PREFIX.matcher(title).replaceFirst("");
        title = MESSAGE_COUNT.matcher(title).replaceFirst("");
        title = TRAILING_COUNT.matcher(title).replaceFirst("");
        title = applicationSuffix(applicationName).matcher(title).replaceFirst("");
        title = DECORATION.matcher(title).replaceAll("");
        title = WHITESPACE.matcher(title).replaceAll(" ").trim();
        title = EDGE_PUNCTUATION.matcher(title).replaceAll("");

        if (title.isBlank() || title.equalsIgnoreCase(applicationName)) {
            return ContextSignal.UNSORTED;
        }
        return title;
    }

    /**
     * Returns {@code true} when the title/process pair belongs to the source application.
     *
     * <p>The process name is checked first ({@code Telegram} or {@code Telegram.exe}); otherwise
     * the title must end with a dash-separated application suffix or be the bare application name.
     * A plain substring match is not enough: {@code "TelegramOrganizer - IDE"} is not a hit.
     */
    public static boolean isSourceWindow(String windowTitle, String processName, String applicationName) {
        if (windowTitle == null || windowTitle.isBlank()) {
            return false;
        }
        if (processName != null
                && (processName.equalsIgnoreCase(applicationName)
                    || processName.equalsIgnoreCase(applicationName + ".exe"))) {
            return true;
        }
        String title = windowTitle.trim();
        String lowerTitle = title.toLowerCase(Locale.ROOT);
        String lowerApp = applicationName.toLowerCase(Locale.ROOT);
        return lowerTitle.endsWith(" - " + lowerApp)
            || lowerTitle.endsWith(" – " + lowerApp)
            || lowerTitle.endsWith(" — " + lowerApp)
            || title.equalsIgnoreCase(applicationName);
    }

    private static Pattern applicationSuffix(String applicationName) {
        return APPLICATION_SUFFIXES.computeIfAbsent(applicationName, app ->
            Pattern.compile("\\s*" + DASHES + "\\s*" + Pattern.quote(app) + "$", Pattern.CASE_INSENSITIVE));
    }
}
