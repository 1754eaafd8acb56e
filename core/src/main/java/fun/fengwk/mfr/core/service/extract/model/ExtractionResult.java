package fun.fengwk.mfr.core.service.extract.model;

import java.util.List;

/**
 * Extracted post body.
 *
 * @param text   assembled annotated text
 * @param images absolute image urls in document order
 * @param tags   inline tag strings in document order
 * @author fengwk
 */
public record ExtractionResult(String text, List<String> images, List<String> tags) {

    /**
     * Text returned when the body cannot be extracted at all.
     */
    public static final String FAILED_TEXT = "内容解析失败";

    public ExtractionResult {
        text = text == null ? "" : text;
        images = images == null ? List.of() : List.copyOf(images);
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static ExtractionResult failed() {
        return new ExtractionResult(FAILED_TEXT, List.of(), List.of());
    }

    public boolean isFailed() {
        return FAILED_TEXT.equals(text) && images.isEmpty() && tags.isEmpty();
    }

}
