package com.insighthub.report.domain.exception;

/**
 * Raised when a content block cannot fit on a page even immediately after a page break.
 * Rendering stops at the offending block; the partially drawn artifact must not be used.
 */
public class BlockTooLargeException extends DomainException {

    private final int sectionIndex;
    private final String sectionTitle;
    private final int blockIndex;
    private final float blockHeight;
    private final float usableHeight;

	/**
	 * Creates the exception and records where rendering stopped.
	 *
	 * @param sectionIndex zero-based index of the section being placed
	 * @param sectionTitle title of that section, may be blank
	 * @param blockIndex   zero-based index of the block inside the section
	 * @param blockHeight  height the block (or its smallest unsplittable part) requires
	 * @param usableHeight height available between the top and bottom margins
	 */
    public BlockTooLargeException(int sectionIndex, String sectionTitle, int blockIndex,
                                  float blockHeight, float usableHeight) {
        super("Block " + blockIndex + " of section " + sectionIndex
                + (sectionTitle != null && !sectionTitle.isBlank() ? " (" + sectionTitle + ")" : "")
                + " needs " + blockHeight + "pt but a page only offers " + usableHeight + "pt.");
        this.sectionIndex = sectionIndex;
        this.sectionTitle = sectionTitle;
        this.blockIndex = blockIndex;
        this.blockHeight = blockHeight;
        this.usableHeight = usableHeight;
    }

    public int getSectionIndex() {
        return sectionIndex;
    }

    public String getSectionTitle() {
        return sectionTitle;
    }

    public int getBlockIndex() {
        return blockIndex;
    }

    public float getBlockHeight() {
        return blockHeight;
    }

    public float getUsableHeight() {
        return usableHeight;
    }
}
