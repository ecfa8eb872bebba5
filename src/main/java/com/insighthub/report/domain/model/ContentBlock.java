package com.insighthub.report.domain.model;

/**
 * One placeable unit of report content.
 * Every block reports the vertical space it needs up front; the layout engine never measures
 * text or decodes images to find out.
 */
public interface ContentBlock {

    /**
     * @return variant of this block
     */
    BlockKind kind();

    /**
     * @return total height in points this block consumes when placed in one piece
     */
    float height();
}
