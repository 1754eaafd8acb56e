package fun.fengwk.mfr.core.service.extract.parser;

import fun.fengwk.mfr.core.service.extract.model.NodeRule;
import fun.fengwk.mfr.core.service.extract.support.MarkupTexts;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Maps a markup node to its handling rule.
 *
 * @author fengwk
 */
@Component
public class TagClassifier {

    private static final List<String> SKIPPED_TAG_FRAGMENTS = List.of("script", "style", "noscript");

    public NodeRule classify(Element element) {
        String tag = element.normalName();
        return switch (tag) {
            case "img" -> NodeRule.IMAGE;
            case "a" -> NodeRule.LINK;
            case "iframe" -> NodeRule.EMBEDDED_FRAME;
            case "h1", "h2", "h3", "h4", "h5", "h6" -> NodeRule.HEADING;
            case "blockquote" -> NodeRule.QUOTATION;
            case "br" -> NodeRule.LINE_BREAK;
            case "span" -> NodeRule.INLINE_CONTAINER;
            case "div" -> NodeRule.BLOCK_CONTAINER;
            case "strong", "b" -> NodeRule.BOLD;
            case "em", "i" -> NodeRule.ITALIC;
            case "p" -> MarkupTexts.hasLeadingText(element) ? NodeRule.PARAGRAPH : NodeRule.TRANSPARENT;
            default -> isSkippedTag(tag) ? NodeRule.SKIPPED : NodeRule.TRANSPARENT;
        };
    }

    private boolean isSkippedTag(String tag) {
        for (String fragment : SKIPPED_TAG_FRAGMENTS) {
            if (tag.contains(fragment)) {
                return true;
            }
        }
        return false;
    }

}
