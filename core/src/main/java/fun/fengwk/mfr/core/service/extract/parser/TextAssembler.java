package fun.fengwk.mfr.core.service.extract.parser;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Joins extracted fragments into the final post text.
 *
 * @author fengwk
 */
@Component
public class TextAssembler {

    private static final Pattern BLANK_LINES_PATTERN = Pattern.compile("\\n\\s*\\n");
    private static final Pattern HORIZONTAL_SPACE_PATTERN = Pattern.compile("[ \\t]+");

    public String assemble(List<String> fragments) {
        if (fragments == null || fragments.isEmpty()) {
            return "";
        }
        return normalize(String.join(" ", fragments));
    }

    /**
     * Collapses blank line runs to one blank line and horizontal space runs to one space.
     */
    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String normalized = BLANK_LINES_PATTERN.matcher(text).replaceAll("\n\n");
        normalized = HORIZONTAL_SPACE_PATTERN.matcher(normalized).replaceAll(" ");
        return normalized.strip();
    }

}
