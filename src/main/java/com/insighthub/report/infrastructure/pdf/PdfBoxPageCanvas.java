package com.insighthub.report.infrastructure.pdf;

import com.insighthub.report.domain.layout.PageCanvas;
import com.insighthub.report.domain.model.ImageSource;
import com.insighthub.report.domain.model.ReportMetadata;
import com.insighthub.report.domain.model.RgbColor;
import com.insighthub.report.domain.model.Style;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.graphics.image.JPEGFactory;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * {@link PageCanvas} backed by an in-memory PDFBox {@link PDDocument}.
 * <p>
 * Each page gets its own content stream, opened in {@link #startPage(float, float)} and closed in
 * {@link #finalizePage()}. Pages are only written to the output stream by {@link #finish()}, so a
 * render that fails half way never leaves a truncated PDF behind. The output stream itself
 * belongs to the caller; {@link #close()} releases the PDFBox document only.
 */
public class PdfBoxPageCanvas implements PageCanvas {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxPageCanvas.class);

    private final PDDocument document = new PDDocument();
    private final OutputStream output;
    private final ReportMetadata metadata;
    private final PdfBoxMetadataWriter metadataWriter;
    private final PdfFonts fonts = new PdfFonts();
    private final Map<Path, PDImageXObject> images = new HashMap<>();

    private PDPageContentStream contentStream;
    private Style style;
    private PDFont font;
    private boolean finished;

	/**
	 * Creates a canvas writing to the given stream on {@link #finish()}.
	 *
	 * @param output         destination of the finished PDF
	 * @param metadata       document properties stored in the file
	 * @param metadataWriter helper copying the properties into PDFBox structures
	 */
    public PdfBoxPageCanvas(OutputStream output, ReportMetadata metadata, PdfBoxMetadataWriter metadataWriter) {
        if (output == null) {
            throw new IllegalArgumentException("Output stream is required.");
        }
        this.output = output;
        this.metadata = metadata == null ? ReportMetadata.empty() : metadata;
        this.metadataWriter = metadataWriter == null ? new PdfBoxMetadataWriter() : metadataWriter;
    }

    public PdfBoxPageCanvas(OutputStream output) {
        this(output, ReportMetadata.empty(), new PdfBoxMetadataWriter());
    }

    @Override
    public void startPage(float width, float height) throws IOException {
        if (finished) {
            throw new IllegalStateException("Canvas already finished.");
        }
        if (contentStream != null) {
            throw new IllegalStateException("Previous page was not finalized.");
        }
        PDPage page = new PDPage(new PDRectangle(width, height));
        document.addPage(page);
        contentStream = new PDPageContentStream(document, page);
        style = null;
        font = null;
    }

    @Override
    public void applyStyle(Style newStyle) {
        requirePage();
        font = fonts.resolve(newStyle.fontName());
        style = newStyle;
    }

    @Override
    public void drawText(float x, float y, String text) throws IOException {
        requireStyle();
        String printable = printable(text);
        if (printable.isEmpty()) {
            return;
        }
        contentStream.beginText();
        contentStream.setFont(font, style.fontSize());
        setFillColor(style.color());
        contentStream.newLineAtOffset(x, y);
        contentStream.showText(printable);
        contentStream.endText();
    }

    @Override
    public void drawCenteredText(float centerX, float y, String text) throws IOException {
        requireStyle();
        String printable = printable(text);
        float width = font.getStringWidth(printable) / 1000f * style.fontSize();
        drawText(centerX - width / 2f, y, printable);
    }

    @Override
    public boolean drawImage(ImageSource source, float x, float y, float width, float height) throws IOException {
        requirePage();
        Path path = source.path();
        if (!Files.isRegularFile(path)) {
            return false;
        }
        PDImageXObject image = images.get(path);
        if (image == null) {
            image = loadImage(path);
            images.put(path, image);
        }
        contentStream.drawImage(image, x, y, width, height);
        return true;
    }

    @Override
    public void drawLine(float x1, float y1, float x2, float y2, RgbColor color, float lineWidth) throws IOException {
        requirePage();
        contentStream.saveGraphicsState();
        setStrokeColor(color);
        contentStream.setLineWidth(lineWidth);
        contentStream.moveTo(x1, y1);
        contentStream.lineTo(x2, y2);
        contentStream.stroke();
        contentStream.restoreGraphicsState();
    }

    @Override
    public void fillRectangle(float x, float y, float width, float height, RgbColor color) throws IOException {
        requirePage();
        contentStream.saveGraphicsState();
        setFillColor(color);
        contentStream.addRect(x, y, width, height);
        contentStream.fill();
        contentStream.restoreGraphicsState();
    }

    @Override
    public void strokeRectangle(float x, float y, float width, float height, RgbColor color, float lineWidth)
            throws IOException {
        requirePage();
        contentStream.saveGraphicsState();
        setStrokeColor(color);
        contentStream.setLineWidth(lineWidth);
        contentStream.addRect(x, y, width, height);
        contentStream.stroke();
        contentStream.restoreGraphicsState();
    }

    @Override
    public void finalizePage() throws IOException {
        requirePage();
        try {
            contentStream.close();
        } finally {
            contentStream = null;
            style = null;
            font = null;
        }
    }

    @Override
    public void finish() throws IOException {
        if (contentStream != null) {
            throw new IllegalStateException("Last page was not finalized.");
        }
        if (finished) {
            return;
        }
        metadataWriter.write(document, metadata);
        document.save(output);
        output.flush();
        finished = true;
        log.debug("Wrote PDF with {} page(s)", document.getNumberOfPages());
    }

    @Override
    public void close() throws IOException {
        try {
            if (contentStream != null) {
                contentStream.close();
            }
        } finally {
            contentStream = null;
            document.close();
        }
    }

    public int getPageCount() {
        return document.getNumberOfPages();
    }

    public boolean isFinished() {
        return finished;
    }

    /**
     * Replaces characters the current font cannot encode, since PDFBox rejects the whole string
     * otherwise.
     *
     * @param text raw text
     * @return text safe to pass to {@link PDPageContentStream#showText(String)}
     * @throws IOException when the font program cannot be read
     */
    private String printable(String text) throws IOException {
        if (text == null || text.isEmpty()) {
            return "";
        }
        try {
            font.encode(text);
            return text;
        } catch (IllegalArgumentException ex) {
            StringBuilder builder = new StringBuilder(text.length());
            int offset = 0;
            while (offset < text.length()) {
                int codePoint = text.codePointAt(offset);
                String character = new String(Character.toChars(codePoint));
                try {
                    font.encode(character);
                    builder.append(character);
                } catch (IllegalArgumentException unsupported) {
                    builder.append('?');
                }
                offset += Character.charCount(codePoint);
            }
            log.warn("Replaced characters unsupported by {} in '{}'", font.getName(), text);
            return builder.toString();
        }
    }

    /**
     * Decodes an image file into a PDF image. JPEG data is embedded as is, every other format
     * is decoded with ImageIO and stored losslessly.
     *
     * @param path existing image file
     * @return embeddable image
     * @throws IOException when the file cannot be decoded
     */
    private PDImageXObject loadImage(Path path) throws IOException {
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        try {
            if (fileName.endsWith(".jpg") || fileName.endsWith(".jpeg")) {
                try (InputStream input = Files.newInputStream(path)) {
                    return JPEGFactory.createFromStream(document, input);
                }
            }
            BufferedImage decoded = ImageIO.read(path.toFile());
            if (decoded == null) {
                throw new IOException("Unreadable image: " + path);
            }
            return LosslessFactory.createFromImage(document, decoded);
        } catch (IllegalArgumentException ex) {
            throw new IOException("Unsupported image format: " + path, ex);
        }
    }

    private void setFillColor(RgbColor color) throws IOException {
        contentStream.setNonStrokingColor(color.red() / 255f, color.green() / 255f, color.blue() / 255f);
    }

    private void setStrokeColor(RgbColor color) throws IOException {
        contentStream.setStrokingColor(color.red() / 255f, color.green() / 255f, color.blue() / 255f);
    }

    private void requirePage() {
        if (contentStream == null) {
            throw new IllegalStateException("No page is open.");
        }
    }

    private void requireStyle() {
        requirePage();
        if (style == null) {
            throw new IllegalStateException("No style applied on the current page.");
        }
    }
}
