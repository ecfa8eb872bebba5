package com.insighthub.report.domain.model;

import java.util.List;

/**
 * Titled group of content blocks, placed in order.
 *
 * @param title           heading drawn before the blocks; blank draws no heading
 * @param blocks          content in placement order
 * @param startOnNewPage  whether the section must begin on a fresh page
 */
public record Section(String title, List<ContentBlock> blocks, boolean startOnNewPage) {

    public Section {
        title = title == null ? "" : title;
        if (blocks == null) {
            throw new IllegalArgumentException("Section blocks are required.");
        }
        for (ContentBlock block : blocks) {
            if (block == null) {
                throw new IllegalArgumentException("Section '" + title + "' contains a null block.");
            }
        }
        blocks = List.copyOf(blocks);
    }

    public static Section of(String title, List<ContentBlock> blocks) {
        return new Section(title, blocks, false);
    }

    public boolean hasTitle() {
        return !title.isBlank();
    }
}
