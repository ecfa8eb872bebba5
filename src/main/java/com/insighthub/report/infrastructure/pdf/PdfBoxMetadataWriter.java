package com.insighthub.report.infrastructure.pdf;

import com.insighthub.report.domain.model.ReportMetadata;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentCatalog;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.common.PDMetadata;
import org.apache.xmpbox.XMPMetadata;
import org.apache.xmpbox.schema.DublinCoreSchema;
import org.apache.xmpbox.schema.XMPBasicSchema;
import org.apache.xmpbox.xml.XmpSerializer;
import org.springframework.stereotype.Service;

import javax.xml.transform.TransformerException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Clock;
import java.util.Calendar;
import java.util.GregorianCalendar;

/**
 * Infrastructure service that writes {@link ReportMetadata} into a PDFBox document, both as the
 * legacy info dictionary and as an XMP packet on the document catalog.
 */
@Service
public class PdfBoxMetadataWriter {

    static final String PRODUCER = "Insight Hub report layout";

    private final Clock clock;

    public PdfBoxMetadataWriter() {
        this(Clock.systemDefaultZone());
    }

    PdfBoxMetadataWriter(Clock clock) {
        this.clock = clock;
    }

    /**
     * Copies the metadata into the document.
     *
     * @param document document about to be saved
     * @param metadata report properties; {@code null} fields are left unset
     * @throws IOException when the XMP packet cannot be serialized or attached
     */
    public void write(PDDocument document, ReportMetadata metadata) throws IOException {
        if (document == null || metadata == null) {
            return;
        }
        Calendar now = GregorianCalendar.from(clock.instant().atZone(clock.getZone()));
        writeInfo(document.getDocumentInformation(), metadata, now);
        writeXmp(document, document.getDocumentCatalog(), metadata, now);
    }

    private void writeInfo(PDDocumentInformation info, ReportMetadata metadata, Calendar now) {
        info.setTitle(metadata.title());
        info.setAuthor(metadata.author());
        info.setSubject(metadata.subject());
        info.setCreator(metadata.creator());
        info.setProducer(PRODUCER);
        info.setCreationDate(now);
        info.setModificationDate(now);
    }

    /**
     * Builds the XMP packet with Dublin Core and XMP basic schemas.
     *
     * @param document owning document, needed to create the metadata stream
     * @param catalog  catalog the metadata stream is attached to
     * @param metadata report properties
     * @param now      creation timestamp
     * @throws IOException when serialization fails
     */
    private void writeXmp(PDDocument document, PDDocumentCatalog catalog, ReportMetadata metadata, Calendar now)
            throws IOException {
        XMPMetadata xmp = XMPMetadata.createXMPMetadata();

        DublinCoreSchema dc = xmp.createAndAddDublinCoreSchema();
        if (hasText(metadata.title())) {
            dc.setTitle(metadata.title());
        }
        if (hasText(metadata.author())) {
            dc.addCreator(metadata.author());
        }
        if (hasText(metadata.subject())) {
            dc.addDescription(null, metadata.subject());
        }

        XMPBasicSchema basic = xmp.createAndAddXMPBasicSchema();
        basic.setCreateDate(now);
        basic.setMetadataDate(now);
        if (hasText(metadata.creator())) {
            basic.setCreatorTool(metadata.creator());
        }

        ByteArrayOutputStream packet = new ByteArrayOutputStream();
        try {
            new XmpSerializer().serialize(xmp, packet, true);
        } catch (TransformerException ex) {
            throw new IOException("Unable to serialize XMP metadata", ex);
        }
        PDMetadata pdMetadata = new PDMetadata(document);
        pdMetadata.importXMPMetadata(packet.toByteArray());
        catalog.setMetadata(pdMetadata);
    }

    private boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
