package fun.fengwk.mfr.core.service.extract.support;

import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;

import java.util.StringJoiner;

/**
 * Text helpers over jsoup nodes.
 *
 * @author fengwk
 */
public final class MarkupTexts {

    private MarkupTexts() {
    }

    /**
     * Text that precedes the first non-text child of the element.
     */
    public static String leadingText(Element element) {
        StringBuilder builder = new StringBuilder();
        for (Node child : element.childNodes()) {
            if (!(child instanceof TextNode textNode)) {
                break;
            }
            builder.append(textNode.getWholeText());
        }
        return builder.toString();
    }

    public static boolean hasLeadingText(Element element) {
        return !trim(leadingText(element)).isEmpty();
    }

    /**
     * All descendant text nodes, each trimmed, joined by single spaces.
     */
    public static String flattenText(Element element) {
        StringJoiner joiner = new StringJoiner(" ");
        NodeTraversor.traverse((node, depth) -> {
            if (node instanceof TextNode textNode) {
                String text = trim(textNode.getWholeText());
                if (!text.isEmpty()) {
                    joiner.add(text);
                }
            }
        }, element);
        return joiner.toString();
    }

    /**
     * Trims whitespace including no-break and ideographic spaces.
     */
    public static String trim(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        int start = 0;
        int end = text.length();
        while (start < end && isBlankChar(text.charAt(start))) {
            start++;
        }
        while (end > start && isBlankChar(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(start, end);
    }

    private static boolean isBlankChar(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }

}
