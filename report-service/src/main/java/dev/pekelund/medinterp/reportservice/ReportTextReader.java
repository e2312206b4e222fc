package dev.pekelund.medinterp.reportservice;

import dev.pekelund.medinterp.model.ReportText;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;

/**
 * Recovers text from uploaded reports that carry a text layer (PDF or plain text) and scores how
 * readable it is. Scanned images have no text layer and are rejected.
 */
public class ReportTextReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReportTextReader.class);

    public ReportText read(byte[] content, String fileName, String contentType) {
        if (content == null || content.length == 0) {
            throw new ReportReadException("Uploaded report is empty");
        }
        String text;
        if (isPdf(content, fileName, contentType)) {
            text = readPdf(content, fileName);
        } else if (isPlainText(fileName, contentType)) {
            text = new String(content, StandardCharsets.UTF_8);
        } else {
            throw new ReportReadException("Unsupported report type '" + contentType + "' for " + fileName
                + "; only PDF and plain text uploads can be read");
        }

        double quality = TextQualityEstimator.qualityOf(text);
        double confidence = TextQualityEstimator.confidenceFor(quality);
        LOGGER.info("Read {} characters from {} (quality {}, confidence {})", text.length(), fileName,
            String.format(Locale.ROOT, "%.2f", quality), confidence);
        return new ReportText(text, quality, confidence);
    }

    private String readPdf(byte[] content, String fileName) {
        try (PDDocument document = PDDocument.load(content)) {
            if (document.isEncrypted()) {
                throw new ReportReadException("Encrypted PDF reports are not supported: " + fileName);
            }
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            String text = stripper.getText(document);
            LOGGER.debug("Extracted text layer from {} page(s) of {}", document.getNumberOfPages(), fileName);
            return text != null ? text : "";
        } catch (ReportReadException ex) {
            throw ex;
        } catch (IOException | RuntimeException ex) {
            // malformed documents also surface as unchecked parser errors
            throw new ReportReadException("Failed to read PDF report " + fileName, ex);
        }
    }

    private static boolean isPdf(byte[] content, String fileName, String contentType) {
        if (MediaType.APPLICATION_PDF_VALUE.equalsIgnoreCase(contentType)) {
            return true;
        }
        if (StringUtils.hasText(fileName) && fileName.toLowerCase(Locale.ROOT).endsWith(".pdf")) {
            return true;
        }
        return content.length >= 5 && content[0] == '%' && content[1] == 'P' && content[2] == 'D' && content[3] == 'F'
            && content[4] == '-';
    }

    private static boolean isPlainText(String fileName, String contentType) {
        if (StringUtils.hasText(contentType) && contentType.toLowerCase(Locale.ROOT).startsWith("text/")) {
            return true;
        }
        return StringUtils.hasText(fileName) && fileName.toLowerCase(Locale.ROOT).endsWith(".txt");
    }
}
