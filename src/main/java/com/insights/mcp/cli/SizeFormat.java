package com.insights.mcp.cli;

import java.util.Locale;

/**
 * Human-readable sizes: below 1 MB as KB, otherwise MB, two decimals.
 */
final class SizeFormat {

    private SizeFormat() {}

    static String formatMb(double mb) {
        if (mb < 1) {
            return String.format(Locale.ROOT, "%.2f KB", mb * 1024);
        }
        return String.format(Locale.ROOT, "%.2f MB", mb);
    }
}
