package com.insighthub.report.domain.model;

/**
 * Where one unit of content ended up: the page it landed on and the top-left corner of its slot.
 *
 * @param pageNumber   1-based physical page number
 * @param sectionIndex zero-based section index
 * @param blockIndex   zero-based block index inside the section, {@code -1} for the section title
 * @param rowIndex     zero-based data row index for table rows, {@code -1} otherwise
 * @param part         what was placed
 * @param x            left edge of the slot
 * @param y            top edge of the slot (cursor position before placement)
 * @param height       height consumed
 */
public record BlockPlacement(
        int pageNumber,
        int sectionIndex,
        int blockIndex,
        int rowIndex,
        Part part,
        float x,
        float y,
        float height
) {

    public enum Part {
        SECTION_TITLE,
        BLOCK,
        TABLE_HEADER,
        TABLE_ROW
    }
}
