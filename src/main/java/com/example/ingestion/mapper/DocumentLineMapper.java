package com.example.ingestion.mapper;

import com.example.ingestion.client.ClientModels.PageLines;
import com.example.ingestion.domain.entity.DocumentLine;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts the lines of one extracted page into {@link DocumentLine} rows.
 * <p>
 * Line numbers follow the position in the extraction output, so lines skipped
 * for having no text leave gaps.
 */
@Component
public class DocumentLineMapper {

    private static final Set<String> MATH_TYPES = Set.of("math", "formula");
    private static final Set<String> HEADER_TYPES = Set.of("header", "title");
    private static final List<String> REGION_KEYS = List.of("top_left_x", "top_left_y", "width", "height");

    public List<DocumentLine> toLines(Long documentId, PageLines page) {
        var lines = page.getLines();
        if (lines == null || lines.isEmpty()) {
            return List.of();
        }

        var result = new ArrayList<DocumentLine>(lines.size());
        var lineNumber = 0;
        for (var raw : lines) {
            lineNumber++;
            if (raw == null) {
                continue;
            }
            var text = raw.get("text") instanceof String value ? value.strip() : "";
            if (text.isEmpty()) {
                continue;
            }

            var handwritten = Boolean.TRUE.equals(raw.get("is_handwritten"));
            result.add(DocumentLine.builder()
                    .documentId(documentId)
                    .pageNumber(page.getPage())
                    .lineNumber(lineNumber)
                    .text(text)
                    .lineType(lineType(raw.get("type")))
                    .fontSize(raw.get("font_size") instanceof Number size ? size.intValue() : null)
                    .printed(!handwritten)
                    .handwritten(handwritten)
                    .confidence(raw.get("confidence") instanceof Number confidence ? confidence.doubleValue() : null)
                    .region(region(raw))
                    .rawMetadata(new LinkedHashMap<>(raw))
                    .build());
        }
        return result;
    }

    static String lineType(Object rawType) {
        var type = rawType instanceof String value ? value : DocumentLine.TYPE_TEXT;
        if (MATH_TYPES.contains(type)) {
            return DocumentLine.TYPE_MATH;
        }
        if (HEADER_TYPES.contains(type)) {
            return DocumentLine.TYPE_SECTION_HEADER;
        }
        return DocumentLine.TYPE_TEXT;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> region(Map<String, Object> raw) {
        if (raw.get("region") instanceof Map<?, ?> region) {
            return new LinkedHashMap<>((Map<String, Object>) region);
        }
        if (!raw.keySet().containsAll(REGION_KEYS)) {
            return null;
        }
        var region = new LinkedHashMap<String, Object>();
        REGION_KEYS.forEach(key -> region.put(key, raw.get(key)));
        return region;
    }
}
