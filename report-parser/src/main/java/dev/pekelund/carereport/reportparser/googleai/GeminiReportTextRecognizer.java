package dev.pekelund.carereport.reportparser.googleai;

import dev.pekelund.carereport.extraction.MalformedExtractionException;
import dev.pekelund.carereport.extraction.ReportFormat;
import dev.pekelund.carereport.extraction.ReportSource;
import dev.pekelund.carereport.extraction.ReportTextRecognizer;
import dev.pekelund.carereport.extraction.TransientExtractionException;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Transcribes photographed daily sheets by sending the image inline to Gemini.
 */
public class GeminiReportTextRecognizer implements ReportTextRecognizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(GeminiReportTextRecognizer.class);

    static final String TRANSCRIPTION_PROMPT = """
        The attached image is a photographed daycare daily report sheet.
        Transcribe every line of handwritten or printed text exactly as written, top to bottom.
        Keep times, amounts and units as they appear. Do not summarise, translate or correct anything.
        Return only the transcribed text. If the image contains no legible text, return an empty response.
        """;

    private final GeminiClient geminiClient;
    private final GoogleAiGeminiChatOptions chatOptions;

    public GeminiReportTextRecognizer(GeminiClient geminiClient, GoogleAiGeminiChatOptions chatOptions) {
        this.geminiClient = geminiClient;
        this.chatOptions = chatOptions;
    }

    @Override
    public String recognize(ReportSource source) {
        if (source.format() != ReportFormat.IMAGE) {
            throw new IllegalArgumentException("Only image reports need text recognition, got " + source.format());
        }
        String mimeType = resolveMimeType(source);
        LOGGER.info("Transcribing report image '{}' ({} bytes, {})", source.fileName(), source.size(), mimeType);
        try {
            String text = geminiClient.generateContent(TRANSCRIPTION_PROMPT,
                new GeminiClient.InlineData(mimeType, source.content()), chatOptions);
            return text != null ? text.trim() : "";
        } catch (GeminiClientException ex) {
            if (ex.isTransientFailure()) {
                throw new TransientExtractionException("Text recognition unavailable: " + ex.getMessage(), ex);
            }
            throw new MalformedExtractionException("Text recognition failed: " + ex.getMessage(), ex);
        }
    }

    static String resolveMimeType(ReportSource source) {
        String contentType = source.contentType();
        if (StringUtils.hasText(contentType) && contentType.toLowerCase(Locale.ROOT).startsWith("image/")) {
            return contentType.toLowerCase(Locale.ROOT);
        }
        String extension = StringUtils.getFilenameExtension(source.fileName());
        if (extension == null) {
            return "image/jpeg";
        }
        return switch (extension.toLowerCase(Locale.ROOT)) {
            case "png" -> "image/png";
            case "heic" -> "image/heic";
            case "webp" -> "image/webp";
            default -> "image/jpeg";
        };
    }
}
