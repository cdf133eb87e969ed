package at.totenbilder.search.service;

import at.totenbilder.search.common.convention.errorcode.SearchErrorCode;
import at.totenbilder.search.common.convention.exception.ClientException;
import at.totenbilder.search.config.ImageSearchProperties;
import org.apache.tika.Tika;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.parser.ocr.TesseractOCRConfig;
import org.apache.tika.sax.BodyContentHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.xml.sax.SAXException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Image content handling with Apache Tika: content type check and optional OCR
 * of the printed text on the memorial card.
 */
@Service
public class ImageContentProcessor {

    private static final Logger log = LoggerFactory.getLogger(ImageContentProcessor.class);

    private final ImageSearchProperties properties;
    private final Tika typeDetector = new Tika();

    public ImageContentProcessor(ImageSearchProperties properties) {
        this.properties = properties;
    }

    /**
     * Checks the magic bytes of the object, the file extension is not trusted.
     *
     * @throws ClientException IMAGE_UNREADABLE when the content is not an image
     */
    public void requireImage(String key, byte[] content) {
        if (content == null || content.length == 0) {
            throw new ClientException("Object " + key + " is empty", SearchErrorCode.IMAGE_UNREADABLE);
        }
        String mediaType = typeDetector.detect(content);
        if (mediaType == null || !mediaType.startsWith("image/")) {
            throw new ClientException("Object " + key + " is not an image (" + mediaType + ")",
                SearchErrorCode.IMAGE_UNREADABLE);
        }
    }

    /**
     * Runs Tesseract over the image.
     *
     * @return recognised text, null when OCR is disabled, found nothing or failed
     */
    public String extractText(String key, byte[] content) {
        if (!properties.getOcr().isEnabled()) {
            return null;
        }
        try (InputStream stream = new ByteArrayInputStream(content)) {
            String text = performTextExtraction(stream);
            return text.isBlank() ? null : text.trim();
        } catch (IOException | TikaException | SAXException e) {
            log.warn("OCR failed for {}: {}", key, e.getMessage());
            return null;
        }
    }

    private String performTextExtraction(InputStream stream)
            throws IOException, TikaException, SAXException {
        BodyContentHandler contentHandler = new BodyContentHandler(-1);
        Metadata imageMetadata = new Metadata();
        ParseContext parseContext = new ParseContext();
        TesseractOCRConfig ocrConfig = new TesseractOCRConfig();
        ocrConfig.setLanguage(properties.getOcr().getLanguage());
        parseContext.set(TesseractOCRConfig.class, ocrConfig);
        AutoDetectParser imageParser = new AutoDetectParser();

        imageParser.parse(stream, contentHandler, imageMetadata, parseContext);
        return contentHandler.toString();
    }
}
