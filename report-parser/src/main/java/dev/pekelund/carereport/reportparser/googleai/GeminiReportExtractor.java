package dev.pekelund.carereport.reportparser.googleai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pekelund.carereport.events.CandidateEvent;
import dev.pekelund.carereport.events.EventKind;
import dev.pekelund.carereport.extraction.MalformedExtractionException;
import dev.pekelund.carereport.extraction.ReportExtractor;
import dev.pekelund.carereport.extraction.ReportFormat;
import dev.pekelund.carereport.extraction.ReportSource;
import dev.pekelund.carereport.extraction.ReportTextRecognizer;
import dev.pekelund.carereport.extraction.TransientExtractionException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Extracts candidate events from daily reports with Gemini. Images are transcribed first, text and CSV
 * reports are sent as they are.
 */
public class GeminiReportExtractor implements ReportExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(GeminiReportExtractor.class);

    private static final String JSON_MIME_TYPE = "application/json";

    private static final List<DateTimeFormatter> TIME_FORMATS = List.of(
        DateTimeFormatter.ofPattern("H:mm", Locale.ROOT),
        DateTimeFormatter.ofPattern("H:mm:ss", Locale.ROOT),
        new DateTimeFormatterBuilder().parseCaseInsensitive().appendPattern("h:mm[ ]a").toFormatter(Locale.ENGLISH)
    );

    private static final String FORMAT_INSTRUCTIONS = """
        Return a JSON ARRAY of events. Each event is an object with the following fields:
        {
          "type": "sleep" | "bottle" | "nursing" | "solid" | "diaper" | "activity" | "other",
          "startTime": string ("HH:mm", 24-hour clock),
          "endTime": string|null ("HH:mm", 24-hour clock, only for events with a duration such as sleep),
          "quantity": string|null (amount with its unit as written, e.g. "4 oz" or "15 min"),
          "details": string|null,
          "isWet": boolean|null (diapers only),
          "isDirty": boolean|null (diapers only)
        }
        Example:
        [
          {"type": "sleep", "startTime": "12:30", "endTime": "14:00", "quantity": null, "details": "Nap in crib"},
          {"type": "bottle", "startTime": "15:15", "endTime": null, "quantity": "4 oz", "details": null},
          {"type": "diaper", "startTime": "16:00", "isWet": true, "isDirty": false, "details": null}
        ]
        Return an empty array when the report describes no events.
        Do not add code fences or commentary; return only the JSON array.
        """;

    private final GeminiClient geminiClient;
    private final ReportTextRecognizer textRecognizer;
    private final ObjectMapper objectMapper;
    private final GoogleAiGeminiChatOptions chatOptions;

    public GeminiReportExtractor(GeminiClient geminiClient, ReportTextRecognizer textRecognizer,
        ObjectMapper objectMapper, GoogleAiGeminiChatOptions chatOptions) {
        this.geminiClient = geminiClient;
        this.textRecognizer = textRecognizer;
        this.objectMapper = objectMapper;
        this.chatOptions = (chatOptions != null ? chatOptions : GoogleAiGeminiChatOptions.builder().build())
            .merge(GoogleAiGeminiChatOptions.builder().responseMimeType(JSON_MIME_TYPE).build());
    }

    @Override
    public List<CandidateEvent> extract(ReportSource source) {
        LOGGER.info("Extracting events from {}", source);
        String reportText = readReportText(source);
        if (!StringUtils.hasText(reportText)) {
            throw new MalformedExtractionException(source.format() == ReportFormat.IMAGE
                ? "No text detected in image"
                : "Report file is empty");
        }

        String prompt = buildPrompt(reportText, source);
        String response;
        try {
            response = geminiClient.generateContent(prompt, chatOptions);
        } catch (GeminiClientException ex) {
            if (ex.isTransientFailure()) {
                throw new TransientExtractionException("Event extraction unavailable: " + ex.getMessage(), ex);
            }
            throw new MalformedExtractionException("Event extraction failed: " + ex.getMessage(), ex);
        }
        if (!StringUtils.hasText(response)) {
            throw new MalformedExtractionException("Gemini returned an empty response");
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Gemini raw response: {}", response);
        }

        List<CandidateEvent> candidates = toCandidates(parseEvents(sanitiseResponse(response)), source);
        LOGGER.info("Extracted {} candidate events from '{}'", candidates.size(), source.fileName());
        return candidates;
    }

    private String readReportText(ReportSource source) {
        if (source.format() == ReportFormat.IMAGE) {
            return textRecognizer.recognize(source);
        }
        try {
            String text = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(source.content()))
                .toString();
            return !text.isEmpty() && text.charAt(0) == '\uFEFF' ? text.substring(1) : text;
        } catch (CharacterCodingException ex) {
            throw new MalformedExtractionException("Report file '" + source.fileName() + "' is not valid UTF-8 text",
                ex);
        }
    }

    private String buildPrompt(String reportText, ReportSource source) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("You are an assistant parsing a daycare daily report about a young child.\n");
        prompt.append("Extract every caregiving event (sleep, feeding, diaper change, activity) from the text below.\n");
        prompt.append("CURRENT DATE: ").append(DateTimeFormatter.ISO_LOCAL_DATE.format(source.reportDate())).append('\n');
        if (source.format() == ReportFormat.CSV) {
            prompt.append("The text is a CSV export; the first row may contain column names.\n");
        }
        prompt.append(FORMAT_INSTRUCTIONS).append('\n');
        prompt.append("TEXT TO PARSE:\n");
        prompt.append("<report>\n").append(reportText.trim()).append("\n</report>");
        return prompt.toString();
    }

    String sanitiseResponse(String response) {
        String trimmed = response.trim();
        if (trimmed.startsWith("```") && trimmed.endsWith("```") && trimmed.length() >= 6) {
            int firstBreak = trimmed.indexOf('\n');
            if (firstBreak > 0) {
                trimmed = trimmed.substring(firstBreak + 1, trimmed.length() - 3).trim();
            } else {
                trimmed = trimmed.substring(3, trimmed.length() - 3).trim();
            }
            LOGGER.debug("Removed Markdown code fences from Gemini response");
        }
        if (trimmed.length() >= 2 && trimmed.startsWith("`") && trimmed.endsWith("`")) {
            trimmed = trimmed.substring(1, trimmed.length() - 1).trim();
        }
        return trimmed;
    }

    private List<ExtractedEvent> parseEvents(String response) {
        JsonNode root;
        try {
            root = objectMapper.readTree(response);
        } catch (JsonProcessingException ex) {
            LOGGER.error("Failed to parse Gemini response. Payload begins with: {}", preview(response));
            throw new MalformedExtractionException("Gemini returned a response that is not valid JSON", ex);
        }
        if (root == null || !root.isArray()) {
            LOGGER.error("Gemini response is not a JSON array. Payload begins with: {}", preview(response));
            throw new MalformedExtractionException("Gemini returned a response that is not a JSON array of events");
        }

        List<ExtractedEvent> events = new ArrayList<>(root.size());
        for (int i = 0; i < root.size(); i++) {
            JsonNode element = root.get(i);
            if (!element.isObject()) {
                LOGGER.warn("Skipping event #{} because it is not a JSON object", i);
                continue;
            }
            try {
                events.add(objectMapper.treeToValue(element, ExtractedEvent.class));
            } catch (JsonProcessingException ex) {
                LOGGER.warn("Skipping event #{} that does not match the event structure: {}", i, ex.getOriginalMessage());
            }
        }
        return events;
    }

    private List<CandidateEvent> toCandidates(List<ExtractedEvent> events, ReportSource source) {
        List<CandidateEvent> candidates = new ArrayList<>(events.size());
        for (ExtractedEvent event : events) {
            LocalTime start = parseTime(event.startTime());
            if (start == null) {
                LOGGER.warn("Dropping extracted {} event with unreadable start time '{}'", event.type(),
                    event.startTime());
                continue;
            }
            LocalTime end = null;
            if (StringUtils.hasText(event.endTime())) {
                end = parseTime(event.endTime());
                if (end == null) {
                    LOGGER.warn("Dropping extracted {} event with unreadable end time '{}'", event.type(),
                        event.endTime());
                    continue;
                }
            }

            EventKind kind = EventKind.fromExtractedType(event.type());
            Instant startInstant = atReportDate(source.reportDate(), start, source.zone());
            Instant endInstant = null;
            if (end != null) {
                if (end.equals(start)) {
                    LOGGER.debug("Ignoring end time equal to start time {} for {} event", start, kind);
                } else {
                    LocalDate endDate = end.isBefore(start) ? source.reportDate().plusDays(1) : source.reportDate();
                    endInstant = atReportDate(endDate, end, source.zone());
                }
            }

            CandidateEvent.Builder builder = CandidateEvent.builder(kind, startInstant)
                .endTime(endInstant)
                .quantityText(StringUtils.hasText(event.quantity()) ? event.quantity().trim() : null)
                .details(event.details());
            if (kind == EventKind.DIAPER) {
                builder.wet(Boolean.TRUE.equals(event.isWet())).dirty(Boolean.TRUE.equals(event.isDirty()));
            }
            try {
                candidates.add(builder.build());
            } catch (IllegalArgumentException ex) {
                // local times can collapse across a daylight saving change
                LOGGER.warn("Dropping extracted {} event with inconsistent times: {}", kind, ex.getMessage());
            }
        }
        return candidates;
    }

    static LocalTime parseTime(String value) {
        if (!StringUtils.hasText(value)) {
            return null;
        }
        String trimmed = value.trim();
        for (DateTimeFormatter format : TIME_FORMATS) {
            try {
                return LocalTime.parse(trimmed, format);
            } catch (DateTimeParseException ex) {
                LOGGER.trace("Time '{}' does not match {}", trimmed, format);
            }
        }
        return null;
    }

    private static Instant atReportDate(LocalDate date, LocalTime time, ZoneId zone) {
        return ZonedDateTime.of(date, time, zone).toInstant();
    }

    private String preview(String response) {
        if (response == null) {
            return "<null>";
        }
        int max = Math.min(response.length(), 256);
        return response.substring(0, max);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ExtractedEvent(
        String type,
        String startTime,
        String endTime,
        String quantity,
        String details,
        @JsonProperty("isWet") Boolean isWet,
        @JsonProperty("isDirty") Boolean isDirty
    ) { }
}
