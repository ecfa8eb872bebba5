package com.insighthub.report.application.command;

import java.util.List;

/**
 * One report section as supplied by the caller.
 *
 * @param title          heading, may be blank
 * @param startOnNewPage {@code true} to begin the section on a fresh page
 * @param blocks         content blocks in order
 */
public record SectionCommand(
        String title,
        Boolean startOnNewPage,
        List<BlockCommand> blocks
) {
}
