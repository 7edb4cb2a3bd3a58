package com.eyelevel.pdftoolkit.service.document;

import com.eyelevel.pdftoolkit.config.ToolkitProcessingConfig;
import com.eyelevel.pdftoolkit.exception.DocumentLoadException;
import com.eyelevel.pdftoolkit.exception.FileProtectedException;
import com.eyelevel.pdftoolkit.exception.OperationException;
import com.eyelevel.pdftoolkit.model.DocumentMetadata;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.cos.COSDictionary;
import org.apache.pdfbox.multipdf.PDFMergerUtility;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.pdmodel.graphics.image.JPEGFactory;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Structural PDF operations on top of Apache PDFBox.
 *
 * <p>Documents returned by this adapter are owned by the caller, who must close them. Documents
 * produced by {@link #merge(List)} and {@link #extractPages(PDDocument, List)} share objects with
 * their sources, so the sources must stay open until the result has been saved.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PdfDocumentAdapter {

    private static final Set<String> JPEG_TYPES = Set.of("image/jpeg", "image/jpg");
    private static final String PNG_TYPE = "image/png";

    private final ToolkitProcessingConfig config;

    /**
     * Parses PDF bytes.
     *
     * @throws FileProtectedException if the document requires a password.
     * @throws DocumentLoadException  if the bytes are not a readable PDF.
     */
    public PDDocument load(byte[] content) {
        try {
            return Loader.loadPDF(content);
        } catch (InvalidPasswordException e) {
            throw new FileProtectedException("PDF is password protected", e);
        } catch (IOException e) {
            throw new DocumentLoadException("Corrupted or not a valid PDF", e);
        }
    }

    /**
     * Appends every page of every source, in list order, to a new document.
     */
    public PDDocument merge(List<PDDocument> sources) {
        PDDocument merged = new PDDocument();
        PDFMergerUtility merger = new PDFMergerUtility();
        try {
            for (PDDocument source : sources) {
                merger.appendDocument(merged, source);
            }
            return merged;
        } catch (IOException e) {
            closeQuietly(merged);
            throw new OperationException("Failed to merge documents.", e);
        }
    }

    /**
     * Builds a document from the given pages of {@code source}, in the given order.
     *
     * @param zeroBasedIndices Page indices; duplicates produce independent copies of the page.
     */
    public PDDocument extractPages(PDDocument source, List<Integer> zeroBasedIndices) {
        PDDocument result = new PDDocument();
        try {
            for (int index : zeroBasedIndices) {
                PDPage original = source.getPage(index);
                PDPage copy = new PDPage(new COSDictionary(original.getCOSObject()));
                PDPage imported = result.importPage(copy);
                imported.setResources(original.getResources());
                imported.setMediaBox(original.getMediaBox());
                imported.setCropBox(original.getCropBox());
                imported.setRotation(original.getRotation());
            }
            return result;
        } catch (IOException | RuntimeException e) {
            closeQuietly(result);
            throw new OperationException("Failed to extract pages.", e);
        }
    }

    /**
     * Appends a page holding the given raster image at its native pixel size.
     *
     * @return {@code false} when the media type is unsupported or the image cannot be decoded.
     */
    public boolean embedRasterPage(PDDocument document, byte[] imageBytes, String mediaType) {
        String type = mediaType == null ? "" : mediaType.toLowerCase(Locale.ROOT);
        try {
            PDImageXObject image;
            if (JPEG_TYPES.contains(type)) {
                image = JPEGFactory.createFromByteArray(document, imageBytes);
            } else if (PNG_TYPE.equals(type)) {
                BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(imageBytes));
                if (decoded == null) {
                    log.warn("Skipping PNG image that could not be decoded.");
                    return false;
                }
                image = LosslessFactory.createFromImage(document, decoded);
            } else {
                log.warn("Skipping unsupported image type '{}'.", mediaType);
                return false;
            }

            PDRectangle size = new PDRectangle(image.getWidth(), image.getHeight());
            PDPage page = new PDPage(size);
            document.addPage(page);
            try (PDPageContentStream contentStream = new PDPageContentStream(document, page)) {
                contentStream.drawImage(image, 0, 0, size.getWidth(), size.getHeight());
            }
            return true;
        } catch (IOException | RuntimeException e) {
            log.warn("Skipping image of type '{}' that could not be embedded: {}", mediaType, e.getMessage());
            return false;
        }
    }

    /**
     * Adds a rotation delta to the listed pages. Keys are 1-based page numbers; pages outside the
     * document are ignored.
     */
    public void rotate(PDDocument document, Map<Integer, Integer> rotations) {
        int pageCount = document.getNumberOfPages();
        rotations.forEach((pageNumber, delta) -> {
            if (pageNumber < 1 || pageNumber > pageCount) {
                log.debug("Ignoring rotation for page {} of a {}-page document.", pageNumber, pageCount);
                return;
            }
            PDPage page = document.getPage(pageNumber - 1);
            page.setRotation(Math.floorMod(page.getRotation() + Math.floorMod(delta, 360), 360));
        });
    }

    /**
     * Overwrites the non-blank fields of the document information and stamps the producer.
     */
    public void setMetadata(PDDocument document, DocumentMetadata metadata) {
        PDDocumentInformation info = document.getDocumentInformation();
        if (StringUtils.hasText(metadata.getTitle())) {
            info.setTitle(metadata.getTitle());
        }
        if (StringUtils.hasText(metadata.getAuthor())) {
            info.setAuthor(metadata.getAuthor());
        }
        if (StringUtils.hasText(metadata.getSubject())) {
            info.setSubject(metadata.getSubject());
        }
        if (StringUtils.hasText(metadata.getKeywords())) {
            info.setKeywords(normalizeKeywords(metadata.getKeywords()));
        }
        info.setProducer(config.getProducer());
        document.setDocumentInformation(info);
    }

    /**
     * Loads and re-serializes a document, letting PDFBox drop unused objects and compress the rest.
     */
    public byte[] resave(byte[] content) {
        try (PDDocument document = load(content)) {
            return save(document);
        } catch (IOException e) {
            throw new OperationException("Failed to rewrite document.", e);
        }
    }

    public boolean isEncrypted(PDDocument document) {
        return document.isEncrypted();
    }

    public int pageCount(PDDocument document) {
        return document.getNumberOfPages();
    }

    public byte[] save(PDDocument document) {
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            document.save(out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new OperationException("Failed to save document.", e);
        }
    }

    static String normalizeKeywords(String keywords) {
        return Arrays.stream(keywords.split(","))
                     .map(String::trim)
                     .filter(keyword -> !keyword.isEmpty())
                     .collect(Collectors.joining(" "));
    }

    private void closeQuietly(PDDocument document) {
        try {
            document.close();
        } catch (IOException e) {
            log.warn("Failed to close partially built document: {}", e.getMessage());
        }
    }
}
