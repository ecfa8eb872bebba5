package com.insighthub.report.domain.model;

/**
 * Forces the following content onto a new page. Has no effect on a page nothing was placed on.
 */
public record PageBreakBlock() implements ContentBlock {

    public static final PageBreakBlock INSTANCE = new PageBreakBlock();

    @Override
    public BlockKind kind() {
        return BlockKind.PAGE_BREAK;
    }

    @Override
    public float height() {
        return 0f;
    }
}
